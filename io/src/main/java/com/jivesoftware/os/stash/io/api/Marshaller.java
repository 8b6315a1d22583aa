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
 * Turns values into bytes and back. Both directions throw
 * {@link com.jivesoftware.os.stash.io.MarshallException} when they cannot do their job.
 *
 * @param <T>
 * @author jonathan.colt
 */
public interface Marshaller<T> {

    byte[] valueBytes(T value);

    T bytesValue(byte[] bytes);

    /**
     * Collections hand out and keep copies made here. Values that cannot change in place are returned as they are.
     *
     * @param value may be null
     */
    default T copy(T value) {
        return value;
    }
}
