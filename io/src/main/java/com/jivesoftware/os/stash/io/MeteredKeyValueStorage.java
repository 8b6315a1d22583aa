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
import org.apache.commons.lang.mutable.MutableLong;

/**
 * Counts every call that reaches the wrapped storage.
 */
public class MeteredKeyValueStorage implements KeyValueStorage {

    private final KeyValueStorage backing;
    private final MutableLong reads = new MutableLong();
    private final MutableLong writes = new MutableLong();
    private final MutableLong removes = new MutableLong();
    private final MutableLong hases = new MutableLong();

    public MeteredKeyValueStorage(KeyValueStorage backing) {
        this.backing = backing;
    }

    @Override
    public byte[] read(byte[] key) {
        reads.increment();
        return backing.read(key);
    }

    @Override
    public void write(byte[] key, byte[] value) {
        writes.increment();
        backing.write(key, value);
    }

    @Override
    public boolean remove(byte[] key) {
        removes.increment();
        return backing.remove(key);
    }

    @Override
    public boolean has(byte[] key) {
        hases.increment();
        return backing.has(key);
    }

    public long reads() {
        return reads.longValue();
    }

    public long writes() {
        return writes.longValue();
    }

    public long removes() {
        return removes.longValue();
    }

    public long hases() {
        return hases.longValue();
    }

    public long total() {
        return reads.longValue() + writes.longValue() + removes.longValue() + hases.longValue();
    }

    public void reset() {
        reads.setValue(0);
        writes.setValue(0);
        removes.setValue(0);
        hases.setValue(0);
    }

    @Override
    public String toString() {
        return "MeteredKeyValueStorage{"
            + "reads=" + reads
            + ", writes=" + writes
            + ", removes=" + removes
            + ", hases=" + hases
            + '}';
    }
}
