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
 * The storage cannot satisfy a read or write, typically because a quota was hit. Not retryable within the
 * same call.
 *
 * @author jonathan.colt
 */
public class StorageExhaustedException extends StashException {

    public StorageExhaustedException(String message) {
        super(message);
    }

    public StorageExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
