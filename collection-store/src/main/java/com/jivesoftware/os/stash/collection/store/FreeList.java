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
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.MarshallException;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out indices that stay valid until they are freed. Freed slots are chained into a free list and reused before
 * the backing vector grows.
 *
 * Layout: the slots live in a {@link StashVector} under {@code prefix ++ 'v'}, the free list head and the occupied
 * count under {@code prefix ++ 'm'}.
 *
 * @param <T>
 * @author jonathan.colt
 */
public class FreeList<T> implements WriteBack {

    private static final Logger LOG = LoggerFactory.getLogger(FreeList.class);

    private static final int NONE = -1;

    private final LazyOption<Meta> meta;
    private final StashVector<Slot<T>> slots;

    public FreeList(KeyValueStorage storage, byte[] prefix, Marshaller<T> marshaller) {
        this(storage, CollectionConfig.newBuilder(prefix).build(), marshaller);
    }

    public FreeList(KeyValueStorage storage, CollectionConfig config, Marshaller<T> marshaller) {
        this.meta = new LazyOption<>(storage, StashIO.concat(config.getPrefix(), new byte[] { 'm' }), MetaMarshaller.INSTANCE);
        this.slots = new StashVector<>(storage, config.nested((byte) 'v'), new SlotMarshaller<>(marshaller));
    }

    /**
     * @return the index now holding {@code value}
     */
    public int allocate(T value) {
        Preconditions.checkNotNull(value, "value");
        Meta m = meta();
        if (m.firstFree != NONE) {
            int index = m.firstFree;
            Slot<T> slot = slots.get(index);
            if (slot == null || slot.occupied) {
                throw new InconsistentStateException("Free list head " + index + " is not a vacant slot");
            }
            slots.set(index, Slot.occupied(value));
            meta.set(new Meta(slot.nextFree, m.occupied + 1));
            return index;
        }
        int index = slots.size();
        slots.push(Slot.occupied(value));
        meta.set(new Meta(NONE, m.occupied + 1));
        return index;
    }

    /**
     * @return the value or null if {@code index} is vacant or was never allocated
     */
    public T get(int index) {
        Slot<T> slot = slots.get(index);
        return slot != null && slot.occupied ? slot.value : null;
    }

    public T getForUpdate(int index) {
        Slot<T> slot = slots.get(index);
        if (slot == null || !slot.occupied) {
            return null;
        }
        return slots.getForUpdate(index).value;
    }

    /**
     * @return the previous value
     * @throws IndexOutOfBoundsException if {@code index} is not occupied
     */
    public T replace(int index, T value) {
        Preconditions.checkNotNull(value, "value");
        Slot<T> slot = slots.get(index);
        if (slot == null || !slot.occupied) {
            throw new IndexOutOfBoundsException("Index " + index + " is not occupied");
        }
        slots.set(index, Slot.occupied(value));
        return slot.value;
    }

    /**
     * @return the freed value or null if {@code index} was not occupied
     */
    public T free(int index) {
        Slot<T> slot = slots.get(index);
        if (slot == null || !slot.occupied) {
            return null;
        }
        Meta m = meta();
        slots.set(index, Slot.<T>vacant(m.firstFree));
        meta.set(new Meta(index, m.occupied - 1));
        return slot.value;
    }

    public int size() {
        return meta().occupied;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        slots.clear();
        meta.set(new Meta(NONE, 0));
    }

    /**
     * Empties the list, returning what it held in index order.
     */
    public List<T> drain() {
        List<T> drained = new ArrayList<>(size());
        for (Slot<T> slot : slots) {
            if (slot.occupied) {
                drained.add(slot.value);
            }
        }
        clear();
        return drained;
    }

    /**
     * Slides every occupied slot down over the vacant ones, keeping their relative order, then truncates the backing
     * vector and empties the free list. {@code relocation} hears about each value that changed index.
     *
     * @return how many values moved
     */
    public int defrag(Relocation<T> relocation) {
        int size = slots.size();
        int occupied = 0;
        int moved = 0;
        for (int i = 0; i < size; i++) {
            Slot<T> slot = slots.get(i);
            if (slot == null || !slot.occupied) {
                continue;
            }
            if (i != occupied) {
                slots.set(occupied, slot);
                relocation.relocated(slot.value, i, occupied);
                moved++;
            }
            occupied++;
        }
        if (occupied != size()) {
            throw new InconsistentStateException("Found " + occupied + " occupied slots but expected " + size());
        }
        slots.drain(occupied, size);
        meta.set(new Meta(NONE, occupied));
        LOG.debug("Defragmented free list, moved {} values and released {} slots.", moved, size - occupied);
        return moved;
    }

    /**
     * Occupied slots in index order. Freeing any index other than the one just returned is safe while iterating.
     */
    public Iterator<Slotted<T>> iterator() {
        return new AbstractIterator<Slotted<T>>() {
            private int index = 0;

            @Override
            protected Slotted<T> computeNext() {
                while (index < slots.size()) {
                    int i = index++;
                    Slot<T> slot = slots.get(i);
                    if (slot != null && slot.occupied) {
                        return new Slotted<>(i, slot.value);
                    }
                }
                return endOfData();
            }
        };
    }

    public Iterator<Slotted<T>> descendingIterator() {
        return new AbstractIterator<Slotted<T>>() {
            private int index = slots.size() - 1;

            @Override
            protected Slotted<T> computeNext() {
                while (index >= 0) {
                    int i = index--;
                    Slot<T> slot = slots.get(i);
                    if (slot != null && slot.occupied) {
                        return new Slotted<>(i, slot.value);
                    }
                }
                return endOfData();
            }
        };
    }

    @Override
    public void flush() {
        slots.flush();
        meta.flush();
    }

    private Meta meta() {
        Meta m = meta.get();
        return m == null ? Meta.EMPTY : m;
    }

    /**
     * Told where a value went during {@link #defrag(Relocation)}.
     */
    public interface Relocation<T> {

        void relocated(T value, int from, int to);
    }

    /**
     * An occupied index and its value.
     */
    public static final class Slotted<T> {

        private final int index;
        private final T value;

        Slotted(int index, T value) {
            this.index = index;
            this.value = value;
        }

        public int index() {
            return index;
        }

        public T value() {
            return value;
        }

        @Override
        public String toString() {
            return index + "=" + value;
        }
    }

    private static final class Slot<T> {

        private final boolean occupied;
        private final T value;
        private final int nextFree;

        private Slot(boolean occupied, T value, int nextFree) {
            this.occupied = occupied;
            this.value = value;
            this.nextFree = nextFree;
        }

        static <T> Slot<T> occupied(T value) {
            return new Slot<>(true, value, NONE);
        }

        static <T> Slot<T> vacant(int nextFree) {
            return new Slot<>(false, null, nextFree);
        }
    }

    private static final class SlotMarshaller<T> implements Marshaller<Slot<T>> {

        private static final byte VACANT = 0;
        private static final byte OCCUPIED = 1;

        private final Marshaller<T> marshaller;

        SlotMarshaller(Marshaller<T> marshaller) {
            this.marshaller = marshaller;
        }

        @Override
        public byte[] valueBytes(Slot<T> slot) {
            if (slot.occupied) {
                return StashIO.concat(new byte[] { OCCUPIED }, marshaller.valueBytes(slot.value));
            }
            return StashIO.concat(new byte[] { VACANT }, StashIO.intBytes(slot.nextFree));
        }

        @Override
        public Slot<T> bytesValue(byte[] bytes) {
            if (bytes.length == 0) {
                throw new MarshallException("Empty slot");
            }
            if (bytes[0] == OCCUPIED) {
                return Slot.occupied(marshaller.bytesValue(Arrays.copyOfRange(bytes, 1, bytes.length)));
            } else if (bytes[0] == VACANT && bytes.length == 5) {
                return Slot.vacant(StashIO.bytesInt(bytes, 1));
            }
            throw new MarshallException("Malformed slot tag:" + bytes[0] + " length:" + bytes.length);
        }
    }

    private static final class Meta {

        static final Meta EMPTY = new Meta(NONE, 0);

        private final int firstFree;
        private final int occupied;

        Meta(int firstFree, int occupied) {
            this.firstFree = firstFree;
            this.occupied = occupied;
        }
    }

    private static final class MetaMarshaller implements Marshaller<Meta> {

        static final MetaMarshaller INSTANCE = new MetaMarshaller();

        @Override
        public byte[] valueBytes(Meta meta) {
            byte[] bytes = new byte[8];
            StashIO.intBytes(meta.firstFree, bytes, 0);
            StashIO.intBytes(meta.occupied, bytes, 4);
            return bytes;
        }

        @Override
        public Meta bytesValue(byte[] bytes) {
            if (bytes.length != 8) {
                throw new MarshallException("Expected 8 bytes of free list metadata but got " + bytes.length);
            }
            return new Meta(StashIO.bytesInt(bytes, 0), StashIO.bytesInt(bytes, 4));
        }
    }
}
