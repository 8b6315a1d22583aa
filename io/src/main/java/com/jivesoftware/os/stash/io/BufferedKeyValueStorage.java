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

import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Holds writes and removes in front of a backing storage until they are committed or discarded. Reads see
 * pending changes first. Removes are kept as tombstones so a committed remove reaches the backing storage.
 *
 * @author jonathan.colt
 */
public class BufferedKeyValueStorage implements KeyValueStorage {

    private static final byte[] TOMBSTONE = new byte[0];

    private final KeyValueStorage backing;
    private final Map<IBA, byte[]> pending = new LinkedHashMap<>();

    public BufferedKeyValueStorage(KeyValueStorage backing) {
        this.backing = backing;
    }

    @Override
    public byte[] read(byte[] key) {
        byte[] value = pending.get(new IBA(key));
        if (value == TOMBSTONE) {
            return null;
        } else if (value != null) {
            return value.clone();
        }
        return backing.read(key);
    }

    @Override
    public void write(byte[] key, byte[] value) {
        pending.put(new IBA(key), value.clone());
    }

    @Override
    public boolean remove(byte[] key) {
        boolean had = has(key);
        pending.put(new IBA(key), TOMBSTONE);
        return had;
    }

    @Override
    public boolean has(byte[] key) {
        byte[] value = pending.get(new IBA(key));
        if (value == TOMBSTONE) {
            return false;
        } else if (value != null) {
            return true;
        }
        return backing.has(key);
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Applies pending changes to the backing storage in the order they were first made.
     */
    public void commit() {
        for (Map.Entry<IBA, byte[]> e : pending.entrySet()) {
            if (e.getValue() == TOMBSTONE) {
                backing.remove(e.getKey().getBytes());
            } else {
                backing.write(e.getKey().getBytes(), e.getValue());
            }
        }
        pending.clear();
    }

    public void discard() {
        pending.clear();
    }
}
