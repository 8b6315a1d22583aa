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
import com.jivesoftware.os.stash.io.CacheEntry;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;

/**
 * A single value under a fixed storage key that may be absent. Loaded on first access, written or removed on
 * flush.
 *
 * @param <T>
 */
public class LazyOption<T> implements WriteBack {

    private final KeyValueStorage storage;
    private final byte[] storageKey;
    private final Marshaller<T> marshaller;
    private CacheEntry<T> entry;

    public LazyOption(KeyValueStorage storage, byte[] storageKey, Marshaller<T> marshaller) {
        this.storage = Preconditions.checkNotNull(storage, "storage");
        this.storageKey = storageKey.clone();
        this.marshaller = Preconditions.checkNotNull(marshaller, "marshaller");
    }

    /**
     * @return the value or null when absent
     */
    public T get() {
        return load().value();
    }

    public T getForUpdate() {
        return load().valueForUpdate();
    }

    public boolean isPresent() {
        return get() != null;
    }

    /**
     * Overwrites without loading, null empties the cell.
     */
    public void set(T value) {
        if (entry == null) {
            entry = CacheEntry.modified(value);
        } else {
            entry.replace(value);
        }
    }

    /**
     * @return the previous value
     */
    public T replace(T value) {
        return load().replace(value);
    }

    /**
     * @return the previous value, the cell is empty afterwards
     */
    public T take() {
        return load().replace(null);
    }

    public boolean remove() {
        return take() != null;
    }

    @Override
    public void flush() {
        if (entry != null && entry.isModified()) {
            T value = entry.value();
            if (value == null) {
                storage.remove(storageKey);
            } else {
                storage.write(storageKey, marshaller.valueBytes(value));
            }
            entry.markCached();
        }
    }

    private CacheEntry<T> load() {
        if (entry == null) {
            entry = CacheEntry.cached(Decoding.decode(marshaller, storageKey, storage.read(storageKey)));
        }
        return entry;
    }
}
