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

/**
 * A value loaded from (or destined for) one storage key, together with whether it still matches storage.
 * A null value means the key is absent.
 *
 * @param <V>
 */
public class CacheEntry<V> {

    private V value;
    private EntryState state;

    private CacheEntry(V value, EntryState state) {
        this.value = value;
        this.state = state;
    }

    public static <V> CacheEntry<V> cached(V value) {
        return new CacheEntry<>(value, EntryState.CACHED);
    }

    public static <V> CacheEntry<V> modified(V value) {
        return new CacheEntry<>(value, EntryState.MODIFIED);
    }

    public V value() {
        return value;
    }

    /**
     * Marks the entry modified whether or not the caller ends up changing the value.
     */
    public V valueForUpdate() {
        state = EntryState.MODIFIED;
        return value;
    }

    /**
     * @return the previous value
     */
    public V replace(V newValue) {
        V old = value;
        value = newValue;
        if (old != null || newValue != null) {
            state = EntryState.MODIFIED;
        }
        return old;
    }

    public boolean isModified() {
        return state == EntryState.MODIFIED;
    }

    public void markCached() {
        state = EntryState.CACHED;
    }

    @Override
    public String toString() {
        return "CacheEntry{" + "value=" + value + ", state=" + state + '}';
    }
}
