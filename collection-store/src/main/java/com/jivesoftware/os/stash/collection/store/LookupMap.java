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
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalCause;
import com.jivesoftware.os.stash.io.CacheEntry;
import com.jivesoftware.os.stash.io.IBA;
import com.jivesoftware.os.stash.io.KeyStrategy;
import com.jivesoftware.os.stash.io.api.KeyValueContext;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.KeyValueTransaction;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flat map over a point storage. Every key touched is cached together with whether it changed, changes reach
 * storage on {@link #flush()}. Keys cannot be enumerated. Values go in and come out through
 * {@link Marshaller#copy(Object)}, only {@link #getForUpdate(Object)} hands out the cached instance.
 *
 * A bounded cache (see {@link CollectionConfig#getMaxCachedEntries()}) writes back modified entries as they are
 * evicted, so a value obtained from {@link #getForUpdate(Object)} must be finished with before other keys are
 * touched.
 *
 * @param <K>
 * @param <V>
 * @author jonathan.colt
 */
public class LookupMap<K, V> implements WriteBack {

    private static final Logger LOG = LoggerFactory.getLogger(LookupMap.class);

    private final KeyValueStorage storage;
    private final byte[] prefix;
    private final KeyStrategy keyStrategy;
    private final Marshaller<K> keyMarshaller;
    private final Marshaller<V> valueMarshaller;
    private final Cache<IBA, Cached<V>> cache;

    public LookupMap(KeyValueStorage storage, byte[] prefix, Marshaller<K> keyMarshaller, Marshaller<V> valueMarshaller) {
        this(storage, CollectionConfig.newBuilder(prefix).build(), keyMarshaller, valueMarshaller);
    }

    public LookupMap(KeyValueStorage storage, CollectionConfig config, Marshaller<K> keyMarshaller, Marshaller<V> valueMarshaller) {
        this(storage, config, KeyStrategy.IDENTITY, keyMarshaller, valueMarshaller);
    }

    LookupMap(KeyValueStorage storage,
        CollectionConfig config,
        KeyStrategy defaultStrategy,
        Marshaller<K> keyMarshaller,
        Marshaller<V> valueMarshaller) {
        this.storage = Preconditions.checkNotNull(storage, "storage");
        this.prefix = config.getPrefix();
        this.keyStrategy = config.getKeyStrategy(defaultStrategy);
        this.keyMarshaller = Preconditions.checkNotNull(keyMarshaller, "keyMarshaller");
        this.valueMarshaller = Preconditions.checkNotNull(valueMarshaller, "valueMarshaller");

        int maxCachedEntries = config.getMaxCachedEntries();
        if (maxCachedEntries > 0) {
            this.cache = CacheBuilder.newBuilder()
                .concurrencyLevel(1)
                .maximumSize(maxCachedEntries)
                .<IBA, Cached<V>>removalListener(notification -> {
                    if (notification.getCause() == RemovalCause.SIZE) {
                        writeBack(notification.getValue());
                    }
                })
                .build();
        } else {
            this.cache = CacheBuilder.newBuilder().concurrencyLevel(1).build();
        }
    }

    public byte[] getPrefix() {
        return prefix.clone();
    }

    public KeyStrategy getKeyStrategy() {
        return keyStrategy;
    }

    /**
     * @return the value or null if the key is absent
     */
    public V get(K key) {
        return valueMarshaller.copy(load(key).entry.value());
    }

    /**
     * The returned value may be mutated in place, it is written back on the next flush.
     */
    public V getForUpdate(K key) {
        return load(key).entry.valueForUpdate();
    }

    /**
     * @param value null removes the key
     * @return the previous value
     */
    public V set(K key, V value) {
        return load(key).entry.replace(valueMarshaller.copy(value));
    }

    public V insert(K key, V value) {
        Preconditions.checkNotNull(value, "value");
        return set(key, value);
    }

    public V remove(K key) {
        return set(key, null);
    }

    /**
     * Like {@link #set(Object, Object)} without reading the previous value from storage.
     */
    public void put(K key, V value) {
        byte[] keyBytes = keyMarshaller.valueBytes(key);
        IBA cacheKey = new IBA(keyBytes);
        V copy = valueMarshaller.copy(value);
        Cached<V> cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            cached.entry.replace(copy);
        } else {
            cache.put(cacheKey, new Cached<>(keyStrategy.toStorageKey(prefix, keyBytes), CacheEntry.modified(copy)));
        }
    }

    /**
     * Answers from the cache when it can, otherwise asks storage whether the key exists without fetching the value.
     */
    public boolean containsKey(K key) {
        byte[] keyBytes = keyMarshaller.valueBytes(key);
        IBA cacheKey = new IBA(keyBytes);
        Cached<V> cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            return cached.entry.value() != null;
        }
        byte[] storageKey = keyStrategy.toStorageKey(prefix, keyBytes);
        boolean has = storage.has(storageKey);
        if (!has) {
            cache.put(cacheKey, new Cached<>(storageKey, CacheEntry.<V>cached(null)));
        }
        return has;
    }

    public <R> R execute(K key, KeyValueTransaction<V, R> keyValueTransaction) {
        final CacheEntry<V> entry = load(key).entry;
        return keyValueTransaction.commit(new KeyValueContext<V>() {
            @Override
            public V get() {
                return valueMarshaller.copy(entry.value());
            }

            @Override
            public V getForUpdate() {
                return entry.valueForUpdate();
            }

            @Override
            public void set(V value) {
                entry.replace(valueMarshaller.copy(value));
            }

            @Override
            public void remove() {
                entry.replace(null);
            }
        });
    }

    public int cachedCount() {
        return (int) cache.size();
    }

    @Override
    public void flush() {
        int written = 0;
        for (Cached<V> cached : cache.asMap().values()) {
            if (writeBack(cached)) {
                written++;
            }
        }
        if (written > 0) {
            LOG.trace("Flushed {} of {} cached entries.", written, cache.size());
        }
    }

    private boolean writeBack(Cached<V> cached) {
        if (!cached.entry.isModified()) {
            return false;
        }
        V value = cached.entry.value();
        if (value == null) {
            storage.remove(cached.storageKey);
        } else {
            storage.write(cached.storageKey, valueMarshaller.valueBytes(value));
        }
        cached.entry.markCached();
        return true;
    }

    private Cached<V> load(K key) {
        byte[] keyBytes = keyMarshaller.valueBytes(key);
        IBA cacheKey = new IBA(keyBytes);
        Cached<V> cached = cache.getIfPresent(cacheKey);
        if (cached == null) {
            byte[] storageKey = keyStrategy.toStorageKey(prefix, keyBytes);
            V value = Decoding.decode(valueMarshaller, storageKey, storage.read(storageKey));
            cached = new Cached<>(storageKey, CacheEntry.cached(value));
            cache.put(cacheKey, cached);
        }
        return cached;
    }

    private static final class Cached<V> {

        private final byte[] storageKey;
        private final CacheEntry<V> entry;

        private Cached(byte[] storageKey, CacheEntry<V> entry) {
            this.storageKey = storageKey;
            this.entry = entry;
        }
    }
}
