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

import com.jivesoftware.os.stash.io.CacheEntry;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cached values addressed by index, stored under {@code prefix ++ littleEndian(index)}. Knows nothing about length.
 *
 * @param <T>
 */
class IndexMap<T> implements WriteBack {

    private static final Logger LOG = LoggerFactory.getLogger(IndexMap.class);

    private final KeyValueStorage storage;
    private final byte[] prefix;
    private final Marshaller<T> marshaller;
    private final Map<Integer, CacheEntry<T>> cache = new HashMap<>();

    IndexMap(KeyValueStorage storage, byte[] prefix, Marshaller<T> marshaller) {
        this.storage = storage;
        this.prefix = prefix;
        this.marshaller = marshaller;
    }

    T get(int index) {
        return load(index).value();
    }

    T getForUpdate(int index) {
        return load(index).valueForUpdate();
    }

    /**
     * Blind write, null removes.
     */
    void set(int index, T value) {
        CacheEntry<T> entry = cache.get(index);
        if (entry != null) {
            entry.replace(value);
        } else {
            cache.put(index, CacheEntry.modified(value));
        }
    }

    /**
     * @return the previous value
     */
    T insert(int index, T value) {
        return load(index).replace(value);
    }

    T remove(int index) {
        return load(index).replace(null);
    }

    void swap(int a, int b) {
        if (a == b) {
            return;
        }
        CacheEntry<T> ea = load(a);
        CacheEntry<T> eb = load(b);
        T va = ea.valueForUpdate();
        ea.replace(eb.valueForUpdate());
        eb.replace(va);
    }

    @Override
    public void flush() {
        int writes = 0;
        int removes = 0;
        for (Map.Entry<Integer, CacheEntry<T>> e : cache.entrySet()) {
            CacheEntry<T> entry = e.getValue();
            if (entry.isModified()) {
                T value = entry.value();
                if (value == null) {
                    storage.remove(storageKey(e.getKey()));
                    removes++;
                } else {
                    storage.write(storageKey(e.getKey()), marshaller.valueBytes(value));
                    writes++;
                }
                entry.markCached();
            }
        }
        if (writes > 0 || removes > 0) {
            LOG.trace("Flushed index map writes:{} removes:{}", writes, removes);
        }
    }

    private CacheEntry<T> load(int index) {
        CacheEntry<T> entry = cache.get(index);
        if (entry == null) {
            byte[] storageKey = storageKey(index);
            entry = CacheEntry.cached(Decoding.decode(marshaller, storageKey, storage.read(storageKey)));
            cache.put(index, entry);
        }
        return entry;
    }

    private byte[] storageKey(int index) {
        return StashIO.concat(prefix, StashIO.littleEndianIntBytes(index));
    }
}
