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
import com.google.common.collect.Iterables;
import com.google.common.collect.Iterators;
import com.google.common.collect.Maps;
import com.jivesoftware.os.stash.io.IBA;
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.KeyStrategy;
import com.jivesoftware.os.stash.io.MarshallException;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.primative.IntMarshaller;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * A map that can be iterated. Keys map to stable indices in a {@link FreeList} of entries, the index of a key never
 * changes while the key is present.
 *
 * Layout: key to index under {@code prefix ++ 'i'}, entries under {@code prefix ++ 'e'}. Keys are hashed with
 * {@link KeyStrategy#SHA256} unless configured otherwise. Iteration order is unspecified.
 *
 * @param <K>
 * @param <V>
 * @author jonathan.colt
 */
public class IterableMap<K, V> implements KeyValueCollection<K, V> {

    private final byte[] prefix;
    private final LookupMap<K, Integer> index;
    private final FreeList<Map.Entry<K, V>> entries;

    public IterableMap(KeyValueStorage storage, byte[] prefix, Marshaller<K> keyMarshaller, Marshaller<V> valueMarshaller) {
        this(storage, CollectionConfig.newBuilder(prefix).build(), keyMarshaller, valueMarshaller);
    }

    public IterableMap(KeyValueStorage storage, CollectionConfig config, Marshaller<K> keyMarshaller, Marshaller<V> valueMarshaller) {
        this.prefix = config.getPrefix();
        this.index = new LookupMap<>(storage, config.nested((byte) 'i'), KeyStrategy.SHA256, keyMarshaller, IntMarshaller.INSTANCE);
        this.entries = new FreeList<>(storage, config.nested((byte) 'e'), new EntryMarshaller<>(keyMarshaller, valueMarshaller));
    }

    @Override
    public V get(K key) {
        Integer i = index.get(key);
        if (i == null) {
            return null;
        }
        return entry(i).getValue();
    }

    @Override
    public Map.Entry<K, V> getEntry(K key) {
        Integer i = index.get(key);
        if (i == null) {
            return null;
        }
        Map.Entry<K, V> entry = entry(i);
        return Maps.immutableEntry(entry.getKey(), entry.getValue());
    }

    @Override
    public V getForUpdate(K key) {
        Integer i = index.get(key);
        if (i == null) {
            return null;
        }
        entry(i);
        return entries.getForUpdate(i).getValue();
    }

    /**
     * A present key keeps its index, an absent one is given a new index.
     */
    @Override
    public V insert(K key, V value) {
        Preconditions.checkNotNull(value, "value");
        Integer i = index.get(key);
        if (i != null) {
            return entries.replace(i, new AbstractMap.SimpleEntry<>(key, value)).getValue();
        }
        index.put(key, entries.allocate(new AbstractMap.SimpleEntry<>(key, value)));
        return null;
    }

    @Override
    public V set(K key, V value) {
        return value == null ? remove(key) : insert(key, value);
    }

    @Override
    public V remove(K key) {
        Map.Entry<K, V> removed = removeEntry(key);
        return removed == null ? null : removed.getValue();
    }

    @Override
    public Map.Entry<K, V> removeEntry(K key) {
        Integer i = index.get(key);
        if (i == null) {
            return null;
        }
        Map.Entry<K, V> entry = entry(i);
        index.put(key, null);
        entries.free(i);
        return Maps.immutableEntry(entry.getKey(), entry.getValue());
    }

    @Override
    public boolean containsKey(K key) {
        return index.containsKey(key);
    }

    /**
     * @return the stable index of {@code key} or -1 when absent
     */
    public int indexOf(K key) {
        Integer i = index.get(key);
        return i == null ? -1 : i;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public void clear() {
        drain();
    }

    @Override
    public List<Map.Entry<K, V>> drain() {
        List<Map.Entry<K, V>> drained = new ArrayList<>(entries.size());
        for (Map.Entry<K, V> entry : entries.drain()) {
            index.put(entry.getKey(), null);
            drained.add(Maps.immutableEntry(entry.getKey(), entry.getValue()));
        }
        return drained;
    }

    /**
     * Moves entries down into the holes left by removals so the entry list is dense again. Moved keys are
     * re-indexed, so indices handed out by {@link #indexOf(Object)} before this call are stale afterwards.
     *
     * @return how many entries moved
     */
    public int defrag() {
        return entries.defrag((entry, from, to) -> index.put(entry.getKey(), to));
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return Iterators.transform(entries.iterator(), slotted -> Maps.immutableEntry(slotted.value().getKey(), slotted.value().getValue()));
    }

    @Override
    public Iterator<Map.Entry<K, V>> descendingIterator() {
        return Iterators.transform(entries.descendingIterator(),
            slotted -> Maps.immutableEntry(slotted.value().getKey(), slotted.value().getValue()));
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
     * Walks every entry and checks that its key maps back to its index.
     *
     * @throws InconsistentStateException on the first violation
     */
    public void checkInvariants() {
        int count = 0;
        Iterator<FreeList.Slotted<Map.Entry<K, V>>> iterator = entries.iterator();
        while (iterator.hasNext()) {
            FreeList.Slotted<Map.Entry<K, V>> slotted = iterator.next();
            Integer i = index.get(slotted.value().getKey());
            if (i == null || i != slotted.index()) {
                throw new InconsistentStateException("Entry at " + slotted.index() + " is indexed at " + i + " in " + new IBA(prefix));
            }
            count++;
        }
        if (count != entries.size()) {
            throw new InconsistentStateException("Found " + count + " entries but expected " + entries.size() + " in " + new IBA(prefix));
        }
    }

    @Override
    public void flush() {
        index.flush();
        entries.flush();
    }

    private Map.Entry<K, V> entry(int i) {
        Map.Entry<K, V> entry = entries.get(i);
        if (entry == null) {
            throw new InconsistentStateException("Key is indexed at " + i + " but nothing is stored there in " + new IBA(prefix));
        }
        return entry;
    }

    private static final class EntryMarshaller<K, V> implements Marshaller<Map.Entry<K, V>> {

        private final Marshaller<K> keyMarshaller;
        private final Marshaller<V> valueMarshaller;

        EntryMarshaller(Marshaller<K> keyMarshaller, Marshaller<V> valueMarshaller) {
            this.keyMarshaller = keyMarshaller;
            this.valueMarshaller = valueMarshaller;
        }

        @Override
        public byte[] valueBytes(Map.Entry<K, V> entry) {
            return StashIO.lengthPrefixed(keyMarshaller.valueBytes(entry.getKey()), valueMarshaller.valueBytes(entry.getValue()));
        }

        @Override
        public Map.Entry<K, V> bytesValue(byte[] bytes) {
            byte[][] split = StashIO.splitLengthPrefixed(bytes);
            K key = keyMarshaller.bytesValue(split[0]);
            V value = valueMarshaller.bytesValue(split[1]);
            if (key == null || value == null) {
                throw new MarshallException("Entry decoded to a null key or value");
            }
            return new AbstractMap.SimpleEntry<>(key, value);
        }
    }
}
