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
 * Something that holds modified state in memory until it is flushed. Closing flushes.
 *
 * @author jonathan.colt
 */
public interface WriteBack extends AutoCloseable {

    /**
     * Writes every modified entry to storage. Entries stay cached.
     */
    void flush();

    @Override
    default void close() {
        flush();
    }
}
