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
import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.MemoryKeyValueStorage;
import com.jivesoftware.os.stash.io.MeteredKeyValueStorage;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.primative.StringMarshaller;
import java.util.ArrayList;
import java.util.List;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 *
 */
public class StashVectorNGTest {

    private static final byte[] PREFIX = { 'v' };

    private MemoryKeyValueStorage memory;
    private MeteredKeyValueStorage storage;

    @BeforeMethod
    public void setUp() {
        memory = new MemoryKeyValueStorage();
        storage = new MeteredKeyValueStorage(memory);
    }

    private StashVector<String> vector() {
        return new StashVector<>(storage, PREFIX, StringMarshaller.INSTANCE);
    }

    private StashVector<String> vector(String... values) {
        StashVector<String> vector = vector();
        vector.extend(ImmutableList.copyOf(values));
        return vector;
    }

    @Test
    public void testPushPopGet() throws Exception {
        StashVector<String> vector = vector();
        Assert.assertTrue(vector.isEmpty());
        Assert.assertNull(vector.pop());
        vector.push("a");
        vector.push("b");
        Assert.assertEquals(vector.size(), 2);
        Assert.assertEquals(vector.get(0), "a");
        Assert.assertEquals(vector.get(1), "b");
        Assert.assertNull(vector.get(2));
        Assert.assertNull(vector.get(-1));
        Assert.assertEquals(vector.pop(), "b");
        Assert.assertEquals(vector.size(), 1);
    }

    @Test
    public void testSwapRemove() throws Exception {
        StashVector<String> vector = vector("a", "b", "c", "d");
        Assert.assertEquals(vector.swapRemove(1), "b");
        Assert.assertEquals(Lists.newArrayList(vector), ImmutableList.of("a", "d", "c"));
        Assert.assertEquals(vector.swapRemove(2), "c");
        Assert.assertEquals(Lists.newArrayList(vector), ImmutableList.of("a", "d"));
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testSwapRemoveOutOfBounds() throws Exception {
        vector("a").swapRemove(1);
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testSetOutOfBounds() throws Exception {
        vector("a").set(1, "b");
    }

    @Test
    public void testReplaceAndSwap() throws Exception {
        StashVector<String> vector = vector("a", "b", "c");
        Assert.assertEquals(vector.replace(0, "z"), "a");
        vector.swap(0, 2);
        Assert.assertEquals(Lists.newArrayList(vector), ImmutableList.of("c", "b", "z"));
        Assert.assertEquals(Lists.newArrayList(vector.descendingIterator()), ImmutableList.of("z", "b", "c"));
    }

    @Test
    public void testDrainSuffix() throws Exception {
        StashVector<String> vector = vector("a", "b", "c", "d");
        Assert.assertEquals(vector.drain(2, 4), ImmutableList.of("c", "d"));
        Assert.assertEquals(Lists.newArrayList(vector), ImmutableList.of("a", "b"));
        Assert.assertEquals(vector.drain(1, 1), ImmutableList.of());
    }

    @Test
    public void testDrainInterior() throws Exception {
        StashVector<String> vector = vector("a", "b", "c", "d", "e");
        vector.flush();
        Assert.assertEquals(vector.drain(1, 3), ImmutableList.of("b", "c"));
        Assert.assertEquals(Lists.newArrayList(vector), ImmutableList.of("a", "d", "e"));
        vector.flush();
        Assert.assertEquals(memory.size(), 4);
        Assert.assertEquals(Lists.newArrayList(vector()), ImmutableList.of("a", "d", "e"));
    }

    @Test(expectedExceptions = IndexOutOfBoundsException.class)
    public void testDrainOutOfBounds() throws Exception {
        vector("a", "b").drain(1, 3);
    }

    @Test
    public void testClearRemovesEveryElementAtFlush() throws Exception {
        vector("a", "b", "c", "d", "e").flush();
        storage.reset();

        StashVector<String> vector = vector();
        vector.clear();
        Assert.assertTrue(vector.isEmpty());
        Assert.assertEquals(storage.removes(), 0);
        vector.flush();
        Assert.assertEquals(storage.removes(), 5);
        Assert.assertEquals(storage.writes(), 1);
        Assert.assertEquals(memory.size(), 1);
        Assert.assertTrue(vector().isEmpty());
    }

    @Test
    public void testPersistsAcrossInstances() throws Exception {
        StashVector<String> vector = vector("a", "b");
        vector.close();
        Assert.assertTrue(memory.has(StashIO.concat(PREFIX, StashIO.littleEndianIntBytes(1))));
        Assert.assertEquals(memory.read(StashIO.concat(PREFIX, new byte[] { 'l' })), StashIO.intBytes(2));

        StashVector<String> reopened = vector();
        Assert.assertEquals(reopened.size(), 2);
        List<String> streamed = new ArrayList<>();
        Assert.assertFalse(reopened.stream((index, value) -> {
            streamed.add(index + value);
            return false;
        }));
        Assert.assertEquals(streamed, ImmutableList.of("0a"));
    }

    @Test(expectedExceptions = InconsistentStateException.class)
    public void testMissingElementIsInconsistent() throws Exception {
        vector("a", "b").flush();
        memory.remove(StashIO.concat(PREFIX, StashIO.littleEndianIntBytes(0)));
        vector().get(0);
    }
}
