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
package com.jivesoftware.os.stash.io;

import com.google.common.base.Preconditions;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap backed storage. A positive {@code maxBytes} caps the sum of key and value lengths held.
 *
 * @author jonathan.colt
 */
public class MemoryKeyValueStorage implements KeyValueStorage {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryKeyValueStorage.class);

    private final Map<IBA, byte[]> store = new HashMap<>();
    private final long maxBytes;
    private long usedBytes;

    public MemoryKeyValueStorage() {
        this(-1);
    }

    public MemoryKeyValueStorage(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    @Override
    public byte[] read(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        byte[] value = store.get(new IBA(key));
        return value == null ? null : value.clone();
    }

    @Override
    public void write(byte[] key, byte[] value) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        IBA iba = new IBA(key);
        byte[] existing = store.get(iba);
        long delta = existing == null ? key.length + value.length : value.length - existing.length;
        if (maxBytes > 0 && usedBytes + delta > maxBytes) {
            LOG.warn("Storage quota of {} bytes exhausted. used:{} requested:{}", maxBytes, usedBytes, delta);
            throw new StorageExhaustedException("Writing " + delta + " bytes would exceed the quota of " + maxBytes
                + " bytes, " + usedBytes + " bytes are in use");
        }
        store.put(iba, value.clone());
        usedBytes += delta;
    }

    @Override
    public boolean remove(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        byte[] removed = store.remove(new IBA(key));
        if (removed != null) {
            usedBytes -= key.length + removed.length;
            return true;
        }
        return false;
    }

    @Override
    public boolean has(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        return store.containsKey(new IBA(key));
    }

    public int size() {
        return store.size();
    }

    public List<IBA> keys() {
        return new ArrayList<>(store.keySet());
    }

    public long usedBytes() {
        return usedBytes;
    }
}
