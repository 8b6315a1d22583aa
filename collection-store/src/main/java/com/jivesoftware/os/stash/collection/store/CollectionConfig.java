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

import com.google.common.base.Preconditions;
import com.jivesoftware.os.stash.io.KeyStrategy;
import com.jivesoftware.os.stash.io.StashIO;
import java.util.Arrays;

/**
 * Where a collection keeps its data and how it names its storage keys.
 *
 * @author jonathan.colt
 */
final public class CollectionConfig {

    private final byte[] prefix;
    private final KeyStrategy keyStrategy;
    private final int maxCachedEntries;

    private CollectionConfig(byte[] prefix, KeyStrategy keyStrategy, int maxCachedEntries) {
        this.prefix = prefix;
        this.keyStrategy = keyStrategy;
        this.maxCachedEntries = maxCachedEntries;
    }

    public byte[] getPrefix() {
        return prefix.clone();
    }

    /**
     * @return the configured strategy or null when the collection should pick its own
     */
    public KeyStrategy getKeyStrategy() {
        return keyStrategy;
    }

    public KeyStrategy getKeyStrategy(KeyStrategy defaultStrategy) {
        return keyStrategy != null ? keyStrategy : defaultStrategy;
    }

    /**
     * @return the most entries a flat map keeps cached, zero or less means unbounded
     */
    public int getMaxCachedEntries() {
        return maxCachedEntries;
    }

    /**
     * Same settings under {@code prefix ++ suffix}. Composite collections give each of their parts its own suffix.
     */
    public CollectionConfig nested(byte suffix) {
        return new CollectionConfig(StashIO.concat(prefix, new byte[] { suffix }), keyStrategy, maxCachedEntries);
    }

    @Override
    public String toString() {
        return "CollectionConfig{"
            + "prefix=" + Arrays.toString(prefix)
            + ", keyStrategy=" + keyStrategy
            + ", maxCachedEntries=" + maxCachedEntries
            + '}';
    }

    public static Builder newBuilder(byte[] prefix) {
        return new Builder(prefix);
    }

    final public static class Builder {

        private final byte[] prefix;
        private KeyStrategy keyStrategy = null;
        private int maxCachedEntries = -1;

        private Builder(byte[] prefix) {
            this.prefix = prefix;
        }

        public Builder setKeyStrategy(KeyStrategy keyStrategy) {
            this.keyStrategy = keyStrategy;
            return this;
        }

        public Builder setMaxCachedEntries(int maxCachedEntries) {
            this.maxCachedEntries = maxCachedEntries;
            return this;
        }

        public CollectionConfig build() {
            Preconditions.checkNotNull(prefix, "prefix");
            return new CollectionConfig(prefix.clone(), keyStrategy, maxCachedEntries);
        }
    }
}
