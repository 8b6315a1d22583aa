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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.KeyStrategy;
import com.jivesoftware.os.stash.io.MemoryKeyValueStorage;
import com.jivesoftware.os.stash.io.primative.IntMarshaller;
import com.jivesoftware.os.stash.io.primative.LongMarshaller;
import com.jivesoftware.os.stash.io.primative.StringMarshaller;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 *
 * @author jonathan.colt
 */
public class IterableMapNGTest {

    private static final byte[] PREFIX = { 'i', 'm' };

    private MemoryKeyValueStorage storage;

    @BeforeMethod
    public void setUp() {
        storage = new MemoryKeyValueStorage();
    }

    private IterableMap<Long, Long> longs() {
        return new IterableMap<>(storage, PREFIX, LongMarshaller.INSTANCE, LongMarshaller.INSTANCE);
    }

    private IterableMap<String, String> strings() {
        return new IterableMap<>(storage, PREFIX, StringMarshaller.INSTANCE, StringMarshaller.INSTANCE);
    }

    @Test
    public void testRemoveEvensAcrossReopens() throws Exception {
        IterableMap<Long, Long> map = longs();
        for (long i = 1; i <= 1000; i++) {
            Assert.assertNull(map.insert(i, i * 10));
        }
        map.flush();

        IterableMap<Long, Long> reopened = longs();
        Assert.assertEquals(reopened.size(), 1000);
        for (long i = 2; i <= 1000; i += 2) {
            Assert.assertEquals(reopened.remove(i), Long.valueOf(i * 10));
        }
        reopened.flush();

        IterableMap<Long, Long> last = longs();
        Assert.assertEquals(last.size(), 500);
        Set<Long> keys = Sets.newHashSet(last.keys());
        Assert.assertEquals(keys.size(), 500);
        for (Map.Entry<Long, Long> entry : last) {
            Assert.assertEquals(entry.getKey() % 2, 1L);
            Assert.assertEquals(entry.getValue(), Long.valueOf(entry.getKey() * 10));
        }
        Assert.assertNull(last.get(2L));
        Assert.assertEquals(last.get(999L), Long.valueOf(9990));
        last.checkInvariants();
    }

    @Test
    public void testIndexIsStableAcrossValueUpdates() throws Exception {
        IterableMap<String, String> map = strings();
        map.insert("a", "1");
        map.insert("b", "2");
        int index = map.indexOf("b");
        Assert.assertEquals(map.insert("b", "3"), "2");
        Assert.assertEquals(map.indexOf("b"), index);
        Assert.assertEquals(map.get("b"), "3");
        Assert.assertEquals(map.indexOf("missing"), -1);
    }

    @Test
    public void testFreedIndexIsReused() throws Exception {
        IterableMap<String, String> map = strings();
        map.insert("a", "1");
        map.insert("b", "2");
        map.insert("c", "3");
        int freed = map.indexOf("b");
        Assert.assertEquals(map.set("b", null), "2");
        Assert.assertFalse(map.containsKey("b"));
        map.insert("d", "4");
        Assert.assertEquals(map.indexOf("d"), freed);
        map.checkInvariants();
    }

    @Test
    public void testIterationBothWays() throws Exception {
        IterableMap<String, String> map = strings();
        map.insert("a", "1");
        map.insert("b", "2");
        map.insert("c", "3");
        map.remove("a");

        List<String> forward = new ArrayList<>();
        map.iterator().forEachRemaining(entry -> forward.add(entry.getKey()));
        List<String> backward = Lists.reverse(forward);
        List<String> descending = new ArrayList<>();
        map.descendingIterator().forEachRemaining(entry -> descending.add(entry.getKey()));
        Assert.assertEquals(descending, backward);
        Assert.assertEquals(ImmutableSet.copyOf(forward), ImmutableSet.of("b", "c"));
        Assert.assertEquals(ImmutableSet.copyOf(map.values()), ImmutableSet.of("2", "3"));

        List<String> streamed = new ArrayList<>();
        Assert.assertFalse(map.stream((key, value) -> {
            streamed.add(key);
            return false;
        }));
        Assert.assertEquals(streamed.size(), 1);
        Assert.assertTrue(map.streamKeys(key -> true));
    }

    @Test
    public void testClear() throws Exception {
        IterableMap<String, String> map = strings();
        map.insert("a", "1");
        map.insert("b", "2");
        map.flush();
        map.clear();
        Assert.assertTrue(map.isEmpty());
        Assert.assertFalse(map.containsKey("a"));
        map.flush();
        Assert.assertTrue(strings().isEmpty());
        Assert.assertNull(strings().get("a"));
    }

    @Test
    public void testConfiguredStrategy() throws Exception {
        CollectionConfig config = CollectionConfig.newBuilder(PREFIX).setKeyStrategy(KeyStrategy.IDENTITY).build();
        IterableMap<String, String> map = new IterableMap<>(storage, config, StringMarshaller.INSTANCE, StringMarshaller.INSTANCE);
        map.insert("a", "1");
        map.flush();
        Assert.assertTrue(storage.has(new byte[] { 'i', 'm', 'i', 'a' }));
        Assert.assertNull(strings().get("a"));
    }

    @Test(expectedExceptions = InconsistentStateException.class)
    public void testBrokenBijectionIsDetected() throws Exception {
        IterableMap<String, String> map = strings();
        map.insert("a", "1");
        map.flush();
        LookupMap<String, Integer> index = new LookupMap<>(storage, CollectionConfig.newBuilder(PREFIX).build().nested((byte) 'i'),
            KeyStrategy.SHA256, StringMarshaller.INSTANCE, IntMarshaller.INSTANCE);
        index.set("a", 7);
        index.flush();
        strings().get("a");
    }

    @Test
    public void testEntryOperations() throws Exception {
        IterableMap<String, String> map = strings();
        Assert.assertNull(map.getEntry("a"));
        map.insert("a", "1");
        Assert.assertEquals(map.getEntry("a"), Maps.immutableEntry("a", "1"));

        String previous = map.execute("a", context -> {
            String value = context.get();
            context.set(value + "1");
            return value;
        });
        Assert.assertEquals(previous, "1");
        Assert.assertEquals(map.get("a"), "11");

        Boolean inserted = map.execute("b", context -> {
            if (context.get() == null) {
                context.set("2");
                return true;
            }
            return false;
        });
        Assert.assertTrue(inserted);
        Assert.assertEquals(map.get("b"), "2");

        map.execute("a", context -> {
            context.remove();
            return null;
        });
        Assert.assertFalse(map.containsKey("a"));
        Assert.assertEquals(map.removeEntry("b"), Maps.immutableEntry("b", "2"));
        Assert.assertNull(map.removeEntry("b"));
        Assert.assertTrue(map.isEmpty());
        map.checkInvariants();
    }

    @Test
    public void testDrain() throws Exception {
        IterableMap<Long, Long> map = longs();
        for (long i = 0; i < 4; i++) {
            map.insert(i, i * 10);
        }
        map.remove(1L);
        map.flush();

        List<Map.Entry<Long, Long>> drained = map.drain();
        Assert.assertEquals(drained, ImmutableList.of(Maps.immutableEntry(0L, 0L), Maps.immutableEntry(2L, 20L), Maps.immutableEntry(3L, 30L)));
        Assert.assertTrue(map.isEmpty());
        Assert.assertFalse(map.containsKey(2L));
        map.flush();

        IterableMap<Long, Long> reopened = longs();
        Assert.assertTrue(reopened.isEmpty());
        Assert.assertNull(reopened.get(3L));
    }

    @Test
    public void testDefrag() throws Exception {
        IterableMap<Long, Long> map = longs();
        for (long i = 0; i < 8; i++) {
            map.insert(i, i * 10);
        }
        map.remove(1L);
        map.remove(3L);
        map.remove(4L);

        Assert.assertEquals(map.defrag(), 4);
        map.checkInvariants();
        Assert.assertEquals(map.size(), 5);
        Assert.assertEquals(map.indexOf(0L), 0);
        Assert.assertEquals(map.indexOf(2L), 1);
        Assert.assertEquals(map.indexOf(7L), 4);
        for (long key : new long[] { 0, 2, 5, 6, 7 }) {
            Assert.assertEquals(map.get(key), Long.valueOf(key * 10));
        }
        Assert.assertNull(map.get(3L));
        map.flush();

        IterableMap<Long, Long> reopened = longs();
        reopened.checkInvariants();
        Assert.assertEquals(Lists.newArrayList(reopened.keys()), ImmutableList.of(0L, 2L, 5L, 6L, 7L));
        reopened.insert(9L, 90L);
        Assert.assertEquals(reopened.indexOf(9L), 5);
        Assert.assertEquals(reopened.defrag(), 0);
    }
}
