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

import com.jivesoftware.os.stash.io.KeyStrategy;
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.Marshaller;
import com.jivesoftware.os.stash.io.api.WriteBack;
import com.jivesoftware.os.stash.io.primative.BytesMarshaller;

/**
 * Flat set, a {@link LookupMap} whose values are empty. Elements are hashed with {@link KeyStrategy#SHA256} unless
 * configured otherwise.
 *
 * @param <T>
 */
public class LookupSet<T> implements WriteBack {

    private static final byte[] PRESENT = new byte[0];

    private final LookupMap<T, byte[]> map;

    public LookupSet(KeyValueStorage storage, byte[] prefix, Marshaller<T> marshaller) {
        this(storage, CollectionConfig.newBuilder(prefix).build(), marshaller);
    }

    public LookupSet(KeyValueStorage storage, CollectionConfig config, Marshaller<T> marshaller) {
        this.map = new LookupMap<>(storage, config, KeyStrategy.SHA256, marshaller, BytesMarshaller.INSTANCE);
    }

    public boolean contains(T value) {
        return map.containsKey(value);
    }

    /**
     * @return true if the value was not already present
     */
    public boolean insert(T value) {
        return map.set(value, PRESENT) == null;
    }

    /**
     * @return true if the value was present
     */
    public boolean remove(T value) {
        return map.remove(value) != null;
    }

    @Override
    public void flush() {
        map.flush();
    }
}
