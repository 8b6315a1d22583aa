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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.jivesoftware.os.stash.io.MemoryKeyValueStorage;
import com.jivesoftware.os.stash.io.StorageCall;
import com.jivesoftware.os.stash.io.StorageExhaustedException;
import com.jivesoftware.os.stash.io.primative.LongMarshaller;
import com.jivesoftware.os.stash.io.primative.StringMarshaller;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 *
 */
public class StorageCallCollectionsNGTest {

    private static final byte[] BALANCES = { 'b' };
    private static final byte[] HISTORY = { 'h' };

    @Test
    public void testCollectionsAreFlushedAndCommitted() throws Exception {
        MemoryKeyValueStorage storage = new MemoryKeyValueStorage();
        Integer count = StorageCall.execute(storage, call -> {
            LookupMap<String, Long> balances = call.register(
                new LookupMap<>(call.storage(), BALANCES, StringMarshaller.INSTANCE, LongMarshaller.INSTANCE));
            StashVector<String> history = call.register(new StashVector<>(call.storage(), HISTORY, StringMarshaller.INSTANCE));
            balances.insert("alice", 10L);
            history.push("credit alice 10");
            return history.size();
        });
        Assert.assertEquals(count, Integer.valueOf(1));

        LookupMap<String, Long> balances = new LookupMap<>(storage, BALANCES, StringMarshaller.INSTANCE, LongMarshaller.INSTANCE);
        Assert.assertEquals(balances.get("alice"), Long.valueOf(10));
        Assert.assertEquals(Lists.newArrayList(new StashVector<>(storage, HISTORY, StringMarshaller.INSTANCE)),
            ImmutableList.of("credit alice 10"));
    }

    @Test
    public void testAbortedCallLeavesStorageUntouched() throws Exception {
        MemoryKeyValueStorage storage = new MemoryKeyValueStorage();
        OrderedMap<Long, String> seeded = new OrderedMap<>(storage, HISTORY, LongMarshaller.INSTANCE, StringMarshaller.INSTANCE,
            Ordering.natural());
        seeded.insert(1L, "one");
        seeded.flush();
        int before = storage.size();

        try {
            StorageCall.execute(storage, call -> {
                OrderedMap<Long, String> map = call.register(new OrderedMap<>(call.storage(), HISTORY, LongMarshaller.INSTANCE,
                    StringMarshaller.INSTANCE, Ordering.natural()));
                map.insert(2L, "two");
                map.remove(1L);
                map.flush();
                throw new IllegalArgumentException("rejected");
            });
            Assert.fail();
        } catch (IllegalArgumentException x) {
            Assert.assertEquals(x.getMessage(), "rejected");
        }

        Assert.assertEquals(storage.size(), before);
        OrderedMap<Long, String> reopened = new OrderedMap<>(storage, HISTORY, LongMarshaller.INSTANCE, StringMarshaller.INSTANCE,
            Ordering.natural());
        Assert.assertEquals(Lists.newArrayList(reopened.keys()), ImmutableList.of(1L));
    }

    @Test(expectedExceptions = StorageExhaustedException.class)
    public void testExhaustedStorageAbortsCommit() throws Exception {
        MemoryKeyValueStorage storage = new MemoryKeyValueStorage(16);
        StorageCall.execute(storage, call -> {
            IterableMap<String, String> map = call.register(
                new IterableMap<>(call.storage(), BALANCES, StringMarshaller.INSTANCE, StringMarshaller.INSTANCE));
            map.insert("key", "a value that does not fit");
            return null;
        });
    }
}
