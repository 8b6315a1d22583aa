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

import com.jivesoftware.os.stash.io.api.KeyValueContext;
import com.jivesoftware.os.stash.io.api.KeyValueTransaction;
import com.jivesoftware.os.stash.io.api.WriteBack;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Maps whose keys can be enumerated. Null values are not stored, setting a key to null removes it.
 *
 * @param <K>
 * @param <V>
 */
public interface KeyValueCollection<K, V> extends WriteBack, Iterable<Map.Entry<K, V>> {

    V get(K key);

    /**
     * @return the key as stored together with its value, or null when absent
     */
    Map.Entry<K, V> getEntry(K key);

    V getForUpdate(K key);

    /**
     * @return the previous value
     */
    V insert(K key, V value);

    V set(K key, V value);

    V remove(K key);

    /**
     * Like {@link #remove(Object)} but hands back the stored key as well.
     */
    Map.Entry<K, V> removeEntry(K key);

    boolean containsKey(K key);

    int size();

    boolean isEmpty();

    void clear();

    /**
     * Empties the collection, returning every entry it held in iteration order.
     */
    List<Map.Entry<K, V>> drain();

    /**
     * Runs {@code transaction} against the entry for {@code key}. Setting a value through the context inserts or
     * replaces, setting null or removing takes the key out.
     */
    default <R> R execute(final K key, KeyValueTransaction<V, R> transaction) {
        return transaction.commit(new KeyValueContext<V>() {
            @Override
            public V get() {
                return KeyValueCollection.this.get(key);
            }

            @Override
            public V getForUpdate() {
                return KeyValueCollection.this.getForUpdate(key);
            }

            @Override
            public void set(V value) {
                KeyValueCollection.this.set(key, value);
            }

            @Override
            public void remove() {
                KeyValueCollection.this.remove(key);
            }
        });
    }

    Iterator<Map.Entry<K, V>> descendingIterator();

    Iterable<K> keys();

    Iterable<V> values();

    boolean stream(EntryStream<K, V> stream);

    boolean streamKeys(KeyStream<K> stream);

    interface EntryStream<K, V> {

        boolean stream(K key, V value);
    }

    interface KeyStream<K> {

        boolean stream(K key);
    }
}
