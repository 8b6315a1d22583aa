/*
 * Copyright 2015 Jive Software.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.jivesoftware.os.stash.collection.store;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.jivesoftware.os.stash.collection.store.tree.AvlTree;
import com.jivesoftware.os.stash.io.IBA;
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.KeyStrategy;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A map iterated in key order. Values sit in a flat map under {@code prefix ++ 'v'} and the keys are kept in an
 * {@link AvlTree} under {@code prefix ++ 'n'} and {@code prefix ++ 'r'}.
 *
 * @param <K>
 * @param <V>
 * @author jonathan.colt
 */
public class OrderedMap<K, V> implements KeyValueCollection<K, V> {

    private final byte[] prefix;
    private final LookupMap<K, V> values;
    private final AvlTree<K> tree;
    private final Comparator<K> comparator;

    public OrderedMap(KeyValueStorage storage,
        byte[] prefix,
        Marshaller<K> keyMarshaller,
        Marshaller<V> valueMarshaller,
        Comparator<K> comparator) {
        this(storage, CollectionConfig.newBuilder(prefix).build(), keyMarshaller, valueMarshaller, comparator);
    }

    public OrderedMap(KeyValueStorage storage,
        CollectionConfig config,
        Marshaller<K> keyMarshaller,
        Marshaller<V> valueMarshaller,
        Comparator<K> comparator) {
        this.prefix = config.getPrefix();
        this.values = new LookupMap<>(storage, config.nested((byte) 'v'), KeyStrategy.SHA256, keyMarshaller, valueMarshaller);
        this.tree = new AvlTree<>(storage, config, keyMarshaller, comparator);
        this.comparator = comparator;
    }

    @Override
    public V get(K key) {
        return values.get(key);
    }

    @Override
    public Map.Entry<K, V> getEntry(K key) {
        V value = values.get(key);
        return value == null ? null : Maps.immutableEntry(key, value);
    }

    @Override
    public V getForUpdate(K key) {
        return values.getForUpdate(key);
    }

    /**
     * Replacing the value of a present key leaves the tree alone.
     */
    @Override
    public V insert(K key, V value) {
        Preconditions.checkNotNull(value, "value");
        V previous = values.set(key, value);
        if (previous == null) {
            tree.insert(key);
        }
        return previous;
    }

    @Override
    public V set(K key, V value) {
        return value == null ? remove(key) : insert(key, value);
    }

    @Override
    public V remove(K key) {
        V previous = values.remove(key);
        if (previous != null && !tree.remove(key)) {
            throw new InconsistentStateException("Key has a value but is missing from the tree in " + new IBA(prefix));
        }
        return previous;
    }

    @Override
    public Map.Entry<K, V> removeEntry(K key) {
        V previous = remove(key);
        return previous == null ? null : Maps.immutableEntry(key, previous);
    }

    @Override
    public boolean containsKey(K key) {
        return values.containsKey(key);
    }

    @Override
    public int size() {
        return tree.size();
    }

    @Override
    public boolean isEmpty() {
        return tree.isEmpty();
    }

    @Override
    public void clear() {
        drain();
    }

    /**
     * Ascending.
     */
    @Override
    public List<Map.Entry<K, V>> drain() {
        List<Map.Entry<K, V>> drained = Lists.newArrayList(this);
        for (Map.Entry<K, V> entry : drained) {
            values.put(entry.getKey(), null);
        }
        tree.clear();
        return drained;
    }

    public K firstKey() {
        return tree.min();
    }

    public K lastKey() {
        return tree.max();
    }

    public Map.Entry<K, V> firstEntry() {
        return entry(tree.min());
    }

    public Map.Entry<K, V> lastEntry() {
        return entry(tree.max());
    }

    public K floorKey(K key) {
        return tree.floor(key);
    }

    public K ceilingKey(K key) {
        return tree.ceiling(key);
    }

    public K lowerKey(K key) {
        return tree.lower(key);
    }

    public K higherKey(K key) {
        return tree.higher(key);
    }

    public Map.Entry<K, V> floorEntry(K key) {
        return entry(tree.floor(key));
    }

    public Map.Entry<K, V> ceilingEntry(K key) {
        return entry(tree.ceiling(key));
    }

    /**
     * Ascending.
     */
    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return range(null, true, null, true).iterator();
    }

    @Override
    public Iterator<Map.Entry<K, V>> descendingIterator() {
        return new AbstractIterator<Map.Entry<K, V>>() {
            private K last = null;
            private boolean started = false;

            @Override
            protected Map.Entry<K, V> computeNext() {
                K next = started ? tree.lower(last) : tree.max();
                started = true;
                if (next == null) {
                    return endOfData();
                }
                last = next;
                return entry(next);
            }
        };
    }

    /**
     * Entries between two bounds in ascending order. A null bound is unbounded.
     */
    public Iterable<Map.Entry<K, V>> range(final K from, final boolean fromInclusive, final K to, final boolean toInclusive) {
        return () -> new AbstractIterator<Map.Entry<K, V>>() {
            private K last = null;
            private boolean started = false;

            @Override
            protected Map.Entry<K, V> computeNext() {
                K next;
                if (!started) {
                    started = true;
                    if (from == null) {
                        next = tree.min();
                    } else {
                        next = fromInclusive ? tree.ceiling(from) : tree.higher(from);
                    }
                } else {
                    next = tree.higher(last);
                }
                if (next == null || to != null && pastEnd(next)) {
                    return endOfData();
                }
                last = next;
                return entry(next);
            }

            private boolean pastEnd(K key) {
                int c = comparator.compare(key, to);
                return toInclusive ? c > 0 : c >= 0;
            }
        };
    }

    @Override
    public Iterable<K> keys() {
        return Iterables.transform(this, Map.Entry::getKey);
    }

    @Override
    public Iterable<V> values() {
        return Iterables.transform(this, Map.Entry::getValue);
    }

    @Override
    public boolean stream(EntryStream<K, V> stream) {
        for (Map.Entry<K, V> entry : this) {
            if (!stream.stream(entry.getKey(), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean streamKeys(KeyStream<K> stream) {
        for (K key : keys()) {
            if (!stream.stream(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws InconsistentStateException if the tree is malformed
     */
    public void checkInvariants() {
        tree.checkInvariants();
    }

    @Override
    public void flush() {
        values.flush();
        tree.flush();
    }

    private Map.Entry<K, V> entry(K key) {
        if (key == null) {
            return null;
        }
        V value = values.get(key);
        if (value == null) {
            throw new InconsistentStateException("Key is in the tree but has no value in " + new IBA(prefix));
        }
        return Maps.immutableEntry(key, value);
    }
}
