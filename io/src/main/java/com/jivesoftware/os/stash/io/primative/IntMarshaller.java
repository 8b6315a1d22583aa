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

import com.jivesoftware.os.stash.io.MarshallException;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.api.Marshaller;

/**
 *
 * @author jonathan.colt
 */
public class IntMarshaller implements Marshaller<Integer> {

    public static final IntMarshaller INSTANCE = new IntMarshaller();

    @Override
    public byte[] valueBytes(Integer value) {
        return StashIO.intBytes(value);
    }

    @Override
    public Integer bytesValue(byte[] bytes) {
        if (bytes.length != 4) {
            throw new MarshallException("Expected 4 bytes for an int but got " + bytes.length);
        }
        return StashIO.bytesInt(bytes);
    }
}
