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
 * View of a single cached entry handed to a {@link KeyValueTransaction}. Nothing reaches storage until the
 * owning collection is flushed.
 *
 * @param <V>
 */
public interface KeyValueContext<V> {

    /**
     * @return the current value, loading it on first touch, or null when absent
     */
    V get();

    /**
     * Like {@link #get()} but marks the entry modified so in place changes to the returned value get written.
     */
    V getForUpdate();

    /**
     * @param value the new value, null removes
     */
    void set(V value);

    void remove();
}
