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

import java.util.Arrays;

/**
 * Immutable byte array wrapper with value semantics so byte keys can live in hash maps. The bytes are copied in and
 * out so a caller reusing its buffer cannot move a key that is already in a map.
 */
public class IBA {

    private final byte[] bytes;

    public IBA(byte[] bytes) {
        this.bytes = bytes == null ? null : bytes.clone();
    }

    public byte[] getBytes() {
        return bytes == null ? null : bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        IBA iba = (IBA) o;
        return Arrays.equals(bytes, iba.bytes);
    }

    @Override
    public int hashCode() {
        return bytes != null ? Arrays.hashCode(bytes) : 0;
    }

    @Override
    public String toString() {
        return "IBA{"
            + bytesToString()
            + '}';
    }

    private String bytesToString() {
        if (bytes == null) {
            return "null";
        } else if (bytes.length == 4) {
            return String.valueOf(StashIO.bytesInt(bytes));
        } else if (bytes.length == 8) {
            return String.valueOf(StashIO.bytesLong(bytes));
        } else {
            return "bytes=" + Arrays.toString(bytes);
        }
    }
}
