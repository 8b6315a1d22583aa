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

import com.jivesoftware.os.stash.io.InconsistentStateException;
import com.jivesoftware.os.stash.io.MemoryKeyValueStorage;
import com.jivesoftware.os.stash.io.MeteredKeyValueStorage;
import com.jivesoftware.os.stash.io.StashIO;
import com.jivesoftware.os.stash.io.primative.LongMarshaller;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 *
 */
public class LazyNGTest {

    private static final byte[] KEY = { 'c' };

    private MemoryKeyValueStorage memory;
    private MeteredKeyValueStorage storage;

    @BeforeMethod
    public void setUp() {
        memory = new MemoryKeyValueStorage();
        storage = new MeteredKeyValueStorage(memory);
    }

    @Test
    public void testSingleLoadAndSingleWrite() throws Exception {
        memory.write(KEY, StashIO.longBytes(5L));
        Lazy<Long> lazy = new Lazy<>(storage, KEY, LongMarshaller.INSTANCE);
        Assert.assertEquals(storage.total(), 0);
        Assert.assertEquals(lazy.get(), Long.valueOf(5));
        Assert.assertEquals(lazy.get(), Long.valueOf(5));
        Assert.assertEquals(storage.reads(), 1);

        lazy.flush();
        Assert.assertEquals(storage.writes(), 0);

        lazy.set(6L);
        lazy.flush();
        lazy.flush();
        Assert.assertEquals(storage.writes(), 1);
        Assert.assertEquals(memory.read(KEY), StashIO.longBytes(6L));
    }

    @Test
    public void testInitialValueIsWrittenWithoutLoading() throws Exception {
        Lazy<Long> lazy = new Lazy<>(storage, KEY, LongMarshaller.INSTANCE, 3L);
        Assert.assertEquals(lazy.get(), Long.valueOf(3));
        lazy.close();
        Assert.assertEquals(storage.reads(), 0);
        Assert.assertEquals(storage.writes(), 1);
    }

    @Test(expectedExceptions = InconsistentStateException.class)
    public void testAbsentLazyIsInconsistent() throws Exception {
        new Lazy<>(storage, KEY, LongMarshaller.INSTANCE).get();
    }

    @Test(expectedExceptions = InconsistentStateException.class)
    public void testUndecodableLazyOption() throws Exception {
        memory.write(KEY, new byte[] { 1 });
        new LazyOption<>(storage, KEY, LongMarshaller.INSTANCE).get();
    }

    @Test
    public void testLazyOption() throws Exception {
        LazyOption<Long> option = new LazyOption<>(storage, KEY, LongMarshaller.INSTANCE);
        Assert.assertFalse(option.isPresent());
        Assert.assertNull(option.replace(1L));
        option.flush();
        Assert.assertEquals(memory.read(KEY), StashIO.longBytes(1L));

        LazyOption<Long> reopened = new LazyOption<>(storage, KEY, LongMarshaller.INSTANCE);
        Assert.assertEquals(reopened.take(), Long.valueOf(1));
        Assert.assertNull(reopened.get());
        Assert.assertFalse(reopened.remove());
        reopened.flush();
        Assert.assertFalse(memory.has(KEY));
    }

    @Test
    public void testBlindSetOfNothingRemoves() throws Exception {
        memory.write(KEY, StashIO.longBytes(1L));
        LazyOption<Long> option = new LazyOption<>(storage, KEY, LongMarshaller.INSTANCE);
        option.set(null);
        option.flush();
        Assert.assertEquals(storage.reads(), 0);
        Assert.assertFalse(memory.has(KEY));
    }
}
