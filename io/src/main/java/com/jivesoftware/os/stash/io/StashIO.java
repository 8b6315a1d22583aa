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

import com.google.common.base.Preconditions;

/**
 * Byte helpers shared by the marshallers and the storage key layouts.
 *
 * @author jonathan.colt
 */
public class StashIO {

    private StashIO() {
    }

    /**
     *
     * @param v
     * @return
     */
    public static byte[] intBytes(int v) {
        return intBytes(v, new byte[4], 0);
    }

    /**
     *
     * @param v
     * @param _bytes
     * @param _offset
     * @return
     */
    public static byte[] intBytes(int v, byte[] _bytes, int _offset) {
        _bytes[_offset + 0] = (byte) (v >>> 24);
        _bytes[_offset + 1] = (byte) (v >>> 16);
        _bytes[_offset + 2] = (byte) (v >>> 8);
        _bytes[_offset + 3] = (byte) v;
        return _bytes;
    }

    public static int bytesInt(byte[] _bytes) {
        return bytesInt(_bytes, 0);
    }

    public static int bytesInt(byte[] bytes, int _offset) {
        int v = 0;
        v |= (bytes[_offset + 0] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 1] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 2] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 3] & 0xFF);
        return v;
    }

    /**
     * Little endian, used where an index is appended to a storage prefix.
     *
     * @param v
     * @return
     */
    public static byte[] littleEndianIntBytes(int v) {
        byte[] bytes = new byte[4];
        bytes[0] = (byte) v;
        bytes[1] = (byte) (v >>> 8);
        bytes[2] = (byte) (v >>> 16);
        bytes[3] = (byte) (v >>> 24);
        return bytes;
    }

    public static int littleEndianBytesInt(byte[] bytes, int _offset) {
        int v = 0;
        v |= (bytes[_offset + 3] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 2] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 1] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 0] & 0xFF);
        return v;
    }

    public static byte[] longBytes(long _v) {
        return longBytes(_v, new byte[8], 0);
    }

    /**
     *
     * @param v
     * @param _bytes
     * @param _offset
     * @return
     */
    public static byte[] longBytes(long v, byte[] _bytes, int _offset) {
        _bytes[_offset + 0] = (byte) (v >>> 56);
        _bytes[_offset + 1] = (byte) (v >>> 48);
        _bytes[_offset + 2] = (byte) (v >>> 40);
        _bytes[_offset + 3] = (byte) (v >>> 32);
        _bytes[_offset + 4] = (byte) (v >>> 24);
        _bytes[_offset + 5] = (byte) (v >>> 16);
        _bytes[_offset + 6] = (byte) (v >>> 8);
        _bytes[_offset + 7] = (byte) v;
        return _bytes;
    }

    public static long bytesLong(byte[] _bytes) {
        return bytesLong(_bytes, 0);
    }

    public static long bytesLong(byte[] bytes, int _offset) {
        long v = 0;
        v |= (bytes[_offset + 0] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 1] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 2] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 3] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 4] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 5] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 6] & 0xFF);
        v <<= 8;
        v |= (bytes[_offset + 7] & 0xFF);
        return v;
    }

    public static byte[] concat(byte[]... parts) {
        int length = 0;
        for (byte[] part : parts) {
            length += part.length;
        }
        byte[] bytes = new byte[length];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, bytes, offset, part.length);
            offset += part.length;
        }
        return bytes;
    }

    /**
     * Frames {@code head} with a four byte length so that {@code tail} can follow it unframed.
     *
     * @param head
     * @param tail
     * @return [len(head)][head][tail]
     */
    public static byte[] lengthPrefixed(byte[] head, byte[] tail) {
        byte[] bytes = new byte[4 + head.length + tail.length];
        intBytes(head.length, bytes, 0);
        System.arraycopy(head, 0, bytes, 4, head.length);
        System.arraycopy(tail, 0, bytes, 4 + head.length, tail.length);
        return bytes;
    }

    /**
     * Inverse of {@link #lengthPrefixed(byte[], byte[])}.
     *
     * @param bytes
     * @return {head, tail}
     * @throws MarshallException if the frame is truncated
     */
    public static byte[][] splitLengthPrefixed(byte[] bytes) {
        Preconditions.checkNotNull(bytes);
        if (bytes.length < 4) {
            throw new MarshallException("Frame too short:" + bytes.length);
        }
        int headLength = bytesInt(bytes, 0);
        if (headLength < 0 || headLength > bytes.length - 4) {
            throw new MarshallException("Frame declares " + headLength + " head bytes but only " + (bytes.length - 4) + " remain");
        }
        byte[] head = new byte[headLength];
        System.arraycopy(bytes, 4, head, 0, headLength);
        byte[] tail = new byte[bytes.length - 4 - headLength];
        System.arraycopy(bytes, 4 + headLength, tail, 0, tail.length);
        return new byte[][] { head, tail };
    }
}
