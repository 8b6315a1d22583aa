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
import com.jivesoftware.os.stash.io.IBA;
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.KeyStrategy;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;
import com.jivesoftware.os.stash.io.primative.IntMarshaller;
import java.util.Iterator;
import java.util.List;

/**
 * A set that can be iterated, laid out like {@link IterableMap}: element to index under {@code prefix ++ 'i'},
 * elements under {@code prefix ++ 'e'}.
 *
 * The set algebra methods return lazy views, they read both sets as they are iterated.
 *
 * @param <T>
 */
public class IterableSet<T> implements WriteBack, Iterable<T> {

    private final byte[] prefix;
    private final LookupMap<T, Integer> index;
    private final FreeList<T> elements;

    public IterableSet(KeyValueStorage storage, byte[] prefix, Marshaller<T> marshaller) {
        this(storage, CollectionConfig.newBuilder(prefix).build(), marshaller);
    }

    public IterableSet(KeyValueStorage storage, CollectionConfig config, Marshaller<T> marshaller) {
        this.prefix = config.getPrefix();
        this.index = new LookupMap<>(storage, config.nested((byte) 'i'), KeyStrategy.SHA256, marshaller, IntMarshaller.INSTANCE);
        this.elements = new FreeList<>(storage, config.nested((byte) 'e'), marshaller);
    }

    public boolean contains(T value) {
        return index.containsKey(value);
    }

    /**
     * @return true if the value was not already present
     */
    public boolean insert(T value) {
        Preconditions.checkNotNull(value, "value");
        if (index.get(value) != null) {
            return false;
        }
        index.put(value, elements.allocate(value));
        return true;
    }

    /**
     * @return true if the value was present
     */
    public boolean remove(T value) {
        Integer i = index.get(value);
        if (i == null) {
            return false;
        }
        index.put(value, null);
        if (elements.free(i) == null) {
            throw new InconsistentStateException("Value is indexed at " + i + " but nothing is stored there in " + new IBA(prefix));
        }
        return true;
    }

    /**
     * @return the stable index of {@code value} or -1 when absent
     */
    public int indexOf(T value) {
        Integer i = index.get(value);
        return i == null ? -1 : i;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public void clear() {
        drain();
    }

    /**
     * Empties the set, returning what it held in iteration order.
     */
    public List<T> drain() {
        List<T> drained = elements.drain();
        for (T value : drained) {
            index.put(value, null);
        }
        return drained;
    }

    /**
     * Moves elements down into the holes left by removals. Indices handed out before this call are stale afterwards.
     *
     * @return how many elements moved
     */
    public int defrag() {
        return elements.defrag((value, from, to) -> index.put(value, to));
    }

    @Override
    public Iterator<T> iterator() {
        return Iterators.transform(elements.iterator(), FreeList.Slotted::value);
    }

    public Iterator<T> descendingIterator() {
        return Iterators.transform(elements.descendingIterator(), FreeList.Slotted::value);
    }

    /**
     * Everything in this set followed by what is only in {@code other}.
     */
    public Iterable<T> union(IterableSet<T> other) {
        return Iterables.concat(this, difference(other, this));
    }

    public Iterable<T> intersection(IterableSet<T> other) {
        return Iterables.filter(this, other::contains);
    }

    public Iterable<T> difference(IterableSet<T> other) {
        return difference(this, other);
    }

    public Iterable<T> symmetricDifference(IterableSet<T> other) {
        return Iterables.concat(difference(this, other), difference(other, this));
    }

    public boolean isSubset(IterableSet<T> other) {
        return size() <= other.size() && Iterables.all(this, other::contains);
    }

    public boolean isSuperset(IterableSet<T> other) {
        return other.isSubset(this);
    }

    public boolean isDisjoint(IterableSet<T> other) {
        return !Iterables.any(this, other::contains);
    }

    /**
     * @throws InconsistentStateException if an element does not map back to its index
     */
    public void checkInvariants() {
        int count = 0;
        Iterator<FreeList.Slotted<T>> iterator = elements.iterator();
        while (iterator.hasNext()) {
            FreeList.Slotted<T> slotted = iterator.next();
            Integer i = index.get(slotted.value());
            if (i == null || i != slotted.index()) {
                throw new InconsistentStateException("Element at " + slotted.index() + " is indexed at " + i + " in " + new IBA(prefix));
            }
            count++;
        }
        if (count != elements.size()) {
            throw new InconsistentStateException("Found " + count + " elements but expected " + elements.size() + " in " + new IBA(prefix));
        }
    }

    @Override
    public void flush() {
        index.flush();
        elements.flush();
    }

    private static <E> Iterable<E> difference(IterableSet<E> a, IterableSet<E> b) {
        return Iterables.filter(a, value -> !b.contains(value));
    }
}
