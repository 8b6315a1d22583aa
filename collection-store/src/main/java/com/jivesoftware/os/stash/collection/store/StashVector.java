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
import com.jivesoftware.os.stash.io.IBA;
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;
import com.jivesoftware.os.stash.io.primative.IntMarshaller;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Growable array with one storage key per element plus a length cell under {@code prefix ++ 'l'}.
 *
 * @param <T>
 * @author jonathan.colt
 */
public class StashVector<T> implements WriteBack, Iterable<T> {

    private final byte[] prefix;
    private final LazyOption<Integer> length;
    private final IndexMap<T> values;

    public StashVector(KeyValueStorage storage, byte[] prefix, Marshaller<T> marshaller) {
        this(storage, CollectionConfig.newBuilder(prefix).build(), marshaller);
    }

    public StashVector(KeyValueStorage storage, CollectionConfig config, Marshaller<T> marshaller) {
        this.prefix = config.getPrefix();
        this.length = new LazyOption<>(storage, StashIO.concat(prefix, new byte[] { 'l' }), IntMarshaller.INSTANCE);
        this.values = new IndexMap<>(storage, prefix, marshaller);
    }

    public int size() {
        Integer size = length.get();
        return size == null ? 0 : size;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void push(T value) {
        Preconditions.checkNotNull(value, "value");
        int size = size();
        Preconditions.checkState(size < Integer.MAX_VALUE, "Vector is full");
        values.set(size, value);
        length.set(size + 1);
    }

    /**
     * @return the last element or null when empty
     */
    public T pop() {
        int size = size();
        if (size == 0) {
            return null;
        }
        T value = required(size - 1, values.remove(size - 1));
        length.set(size - 1);
        return value;
    }

    /**
     * @return the element or null when {@code index} is out of range
     */
    public T get(int index) {
        if (index < 0 || index >= size()) {
            return null;
        }
        return required(index, values.get(index));
    }

    public T getForUpdate(int index) {
        if (index < 0 || index >= size()) {
            return null;
        }
        return required(index, values.getForUpdate(index));
    }

    public void set(int index, T value) {
        Preconditions.checkNotNull(value, "value");
        checkIndex(index);
        values.set(index, value);
    }

    /**
     * @return the element that was at {@code index}
     */
    public T replace(int index, T value) {
        Preconditions.checkNotNull(value, "value");
        checkIndex(index);
        return required(index, values.insert(index, value));
    }

    /**
     * Removes the element at {@code index} by moving the last element into its place.
     */
    public T swapRemove(int index) {
        checkIndex(index);
        int last = size() - 1;
        if (index == last) {
            return pop();
        }
        T moved = required(last, values.remove(last));
        T removed = required(index, values.insert(index, moved));
        length.set(last);
        return removed;
    }

    public void swap(int a, int b) {
        checkIndex(a);
        checkIndex(b);
        values.swap(a, b);
    }

    /**
     * Removes {@code [from, to)} and returns the removed elements in index order. Draining a suffix pops from the
     * tail, draining from the middle moves every later element down.
     */
    public List<T> drain(int from, int to) {
        int size = size();
        if (from < 0 || to > size || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") out of bounds for size " + size);
        }
        int count = to - from;
        List<T> drained = new ArrayList<>(count);
        if (to == size) {
            for (int i = 0; i < count; i++) {
                drained.add(pop());
            }
            Collections.reverse(drained);
            return drained;
        }
        for (int i = from; i < to; i++) {
            drained.add(required(i, values.get(i)));
        }
        for (int i = to; i < size; i++) {
            values.set(i - count, required(i, values.get(i)));
        }
        for (int i = size - count; i < size; i++) {
            values.set(i, null);
        }
        length.set(size - count);
        return drained;
    }

    /**
     * Every element is removed from storage on the next flush.
     */
    public void clear() {
        int size = size();
        for (int i = 0; i < size; i++) {
            values.set(i, null);
        }
        length.set(0);
    }

    public void extend(Iterable<? extends T> elements) {
        for (T element : elements) {
            push(element);
        }
    }

    @Override
    public Iterator<T> iterator() {
        return new AbstractIterator<T>() {
            private int index = 0;

            @Override
            protected T computeNext() {
                if (index >= size()) {
                    return endOfData();
                }
                return get(index++);
            }
        };
    }

    public Iterator<T> descendingIterator() {
        return new AbstractIterator<T>() {
            private int index = size() - 1;

            @Override
            protected T computeNext() {
                if (index < 0) {
                    return endOfData();
                }
                return get(index--);
            }
        };
    }

    public boolean stream(ValueStream<T> stream) {
        int size = size();
        for (int i = 0; i < size; i++) {
            if (!stream.stream(i, get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void flush() {
        values.flush();
        length.flush();
    }

    private void checkIndex(int index) {
        int size = size();
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + size);
        }
    }

    private T required(int index, T value) {
        if (value == null) {
            throw new InconsistentStateException("No element stored at index " + index + " of vector " + new IBA(prefix));
        }
        return value;
    }

    public interface ValueStream<T> {

        boolean stream(int index, T value);
    }
}
