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

import com.google.common.hash.Hashing;
import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * How a collection turns its prefix and an encoded logical key into the key it hands to storage. A collection
 * keeps one strategy for its whole lifetime, switching strategies orphans everything already stored.
 *
 * Digest collisions are not detected.
 */
public enum KeyStrategy {

    /**
     * prefix ++ key. Keeps raw keys visible in storage.
     */
    IDENTITY {
        @Override
        public byte[] toStorageKey(byte[] prefix, byte[] encodedKey) {
            return StashIO.concat(prefix, encodedKey);
        }
    },
    /**
     * prefix ++ sha256(prefix ++ key).
     */
    SHA256 {
        @Override
        public byte[] toStorageKey(byte[] prefix, byte[] encodedKey) {
            byte[] digest = Hashing.sha256().newHasher()
                .putBytes(prefix)
                .putBytes(encodedKey)
                .hash()
                .asBytes();
            return StashIO.concat(prefix, digest);
        }
    },
    /**
     * prefix ++ keccak256(prefix ++ key), original Keccak padding rather than NIST SHA3.
     */
    KECCAK256 {
        @Override
        public byte[] toStorageKey(byte[] prefix, byte[] encodedKey) {
            KeccakDigest keccak = new KeccakDigest(256);
            keccak.update(prefix, 0, prefix.length);
            keccak.update(encodedKey, 0, encodedKey.length);
            byte[] digest = new byte[keccak.getDigestSize()];
            keccak.doFinal(digest, 0);
            return StashIO.concat(prefix, digest);
        }
    };

    public abstract byte[] toStorageKey(byte[] prefix, byte[] encodedKey);
}
