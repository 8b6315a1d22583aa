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
import com.jivesoftware.os.stash.io.IBA;
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;

/**
 * A single value under a fixed storage key that must be there. Nothing is read until the value is asked for and
 * nothing is written until it is flushed.
 *
 * @param <T>
 */
public class Lazy<T> implements WriteBack {

    private final KeyValueStorage storage;
    private final byte[] storageKey;
    private final Marshaller<T> marshaller;
    private CacheEntry<T> entry;

    public Lazy(KeyValueStorage storage, byte[] storageKey, Marshaller<T> marshaller) {
        this.storage = Preconditions.checkNotNull(storage, "storage");
        this.storageKey = storageKey.clone();
        this.marshaller = Preconditions.checkNotNull(marshaller, "marshaller");
    }

    /**
     * Starts out holding {@code value}, which is written on flush whatever storage holds.
     */
    public Lazy(KeyValueStorage storage, byte[] storageKey, Marshaller<T> marshaller, T value) {
        this(storage, storageKey, marshaller);
        this.entry = CacheEntry.modified(Preconditions.checkNotNull(value, "value"));
    }

    /**
     * @throws InconsistentStateException if nothing is stored under the key
     */
    public T get() {
        return load().value();
    }

    public T getForUpdate() {
        return load().valueForUpdate();
    }

    public void set(T value) {
        Preconditions.checkNotNull(value, "value");
        if (entry == null) {
            entry = CacheEntry.modified(value);
        } else {
            entry.replace(value);
        }
    }

    @Override
    public void flush() {
        if (entry != null && entry.isModified()) {
            storage.write(storageKey, marshaller.valueBytes(entry.value()));
            entry.markCached();
        }
    }

    private CacheEntry<T> load() {
        if (entry == null) {
            T value = Decoding.decode(marshaller, storageKey, storage.read(storageKey));
            if (value == null) {
                throw new InconsistentStateException("No value stored under " + new IBA(storageKey));
            }
            entry = CacheEntry.cached(value);
        }
        return entry;
    }
}
