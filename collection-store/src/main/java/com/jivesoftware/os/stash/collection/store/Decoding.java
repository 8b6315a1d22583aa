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

import com.jivesoftware.os.stash.io.IBA;
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.MarshallException;
import com.jivesoftware.os.stash.io.api.Marshaller;

/**
 * Bytes that came back from storage were written by us, so failing to decode them means storage is corrupt.
 */
final class Decoding {

    private Decoding() {
    }

    static <T> T decode(Marshaller<T> marshaller, byte[] storageKey, byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        try {
            return marshaller.bytesValue(bytes);
        } catch (MarshallException x) {
            throw new InconsistentStateException("Failed to decode value stored under " + new IBA(storageKey), x);
        }
    }
}
