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
package com.jivesoftware.os.stash.io.api;

/**
 * Point access to a flat key value byte store. There is no iteration and no range query, every call
 * is charged individually by whoever hosts the store.
 *
 * Implementations signal a store that cannot satisfy a call with a
 * {@link com.jivesoftware.os.stash.io.StorageExhaustedException}.
 *
 * @author jonathan.colt
 */
public interface KeyValueStorage {

    /**
     * @param key storage key
     * @return the stored bytes or null if the key is absent
     */
    byte[] read(byte[] key);

    void write(byte[] key, byte[] value);

    /**
     * @param key storage key
     * @return true if a value was present
     */
    boolean remove(byte[] key);

    boolean has(byte[] key);
}
