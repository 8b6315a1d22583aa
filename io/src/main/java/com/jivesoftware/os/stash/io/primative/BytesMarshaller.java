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
package com.jivesoftware.os.stash.io.primative;

import com.jivesoftware.os.stash.io.api.Marshaller;

/**
 * Copies in both directions, the caller never shares an array with a cache.
 */
public class BytesMarshaller implements Marshaller<byte[]> {

    public static final BytesMarshaller INSTANCE = new BytesMarshaller();

    @Override
    public byte[] valueBytes(byte[] value) {
        return value.clone();
    }

    @Override
    public byte[] bytesValue(byte[] bytes) {
        return bytes.clone();
    }

    @Override
    public byte[] copy(byte[] value) {
        return value == null ? null : value.clone();
    }
}
