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
package com.jivesoftware.os.stash.collection.store.tree;

import com.jivesoftware.os.stash.io.MarshallException;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.api.Marshaller;

/**
 * [len(key)][key][left][right][height]
 *
 * @param <K>
 */
class AvlNodeMarshaller<K> implements Marshaller<AvlNode<K>> {

    private final Marshaller<K> keyMarshaller;

    AvlNodeMarshaller(Marshaller<K> keyMarshaller) {
        this.keyMarshaller = keyMarshaller;
    }

    @Override
    public byte[] valueBytes(AvlNode<K> node) {
        byte[] links = new byte[12];
        StashIO.intBytes(node.left, links, 0);
        StashIO.intBytes(node.right, links, 4);
        StashIO.intBytes(node.height, links, 8);
        return StashIO.lengthPrefixed(keyMarshaller.valueBytes(node.key), links);
    }

    @Override
    public AvlNode<K> bytesValue(byte[] bytes) {
        byte[][] split = StashIO.splitLengthPrefixed(bytes);
        byte[] links = split[1];
        if (links.length != 12) {
            throw new MarshallException("Expected 12 bytes of node links but got " + links.length);
        }
        return new AvlNode<>(keyMarshaller.bytesValue(split[0]),
            StashIO.bytesInt(links, 0),
            StashIO.bytesInt(links, 4),
            StashIO.bytesInt(links, 8));
    }
}
