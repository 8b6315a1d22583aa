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

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 *
 */
public class MemoryKeyValueStorageNGTest {

    @Test
    public void testPointOperations() throws Exception {
        MemoryKeyValueStorage storage = new MemoryKeyValueStorage();
        byte[] key = { 1, 2 };
        Assert.assertNull(storage.read(key));
        Assert.assertFalse(storage.has(key));

        storage.write(key, new byte[] { 3 });
        Assert.assertTrue(storage.has(key));
        Assert.assertEquals(storage.read(key), new byte[] { 3 });
        Assert.assertEquals(storage.size(), 1);
        Assert.assertEquals(storage.usedBytes(), 3);

        Assert.assertTrue(storage.remove(key));
        Assert.assertFalse(storage.remove(key));
        Assert.assertEquals(storage.usedBytes(), 0);
    }

    @Test
    public void testQuota() throws Exception {
        MemoryKeyValueStorage storage = new MemoryKeyValueStorage(10);
        storage.write(new byte[] { 1 }, new byte[8]);
        storage.write(new byte[] { 1 }, new byte[9]);
        try {
            storage.write(new byte[] { 2 }, new byte[1]);
            Assert.fail();
        } catch (StorageExhaustedException x) {
            // expected
        }
        Assert.assertFalse(storage.has(new byte[] { 2 }));
        Assert.assertEquals(storage.usedBytes(), 10);
    }

    @Test
    public void testMetered() throws Exception {
        MeteredKeyValueStorage storage = new MeteredKeyValueStorage(new MemoryKeyValueStorage());
        storage.write(new byte[] { 1 }, new byte[] { 1 });
        storage.read(new byte[] { 1 });
        storage.read(new byte[] { 2 });
        storage.has(new byte[] { 1 });
        storage.remove(new byte[] { 1 });
        Assert.assertEquals(storage.writes(), 1);
        Assert.assertEquals(storage.reads(), 2);
        Assert.assertEquals(storage.hases(), 1);
        Assert.assertEquals(storage.removes(), 1);
        Assert.assertEquals(storage.total(), 5);
        storage.reset();
        Assert.assertEquals(storage.total(), 0);
    }

    @Test
    public void testBufferedCommitAndDiscard() throws Exception {
        MemoryKeyValueStorage backing = new MemoryKeyValueStorage();
        backing.write(new byte[] { 9 }, new byte[] { 9 });

        BufferedKeyValueStorage buffered = new BufferedKeyValueStorage(backing);
        buffered.write(new byte[] { 1 }, new byte[] { 1 });
        Assert.assertTrue(buffered.remove(new byte[] { 9 }));
        Assert.assertFalse(buffered.has(new byte[] { 9 }));
        Assert.assertNull(buffered.read(new byte[] { 9 }));
        Assert.assertEquals(buffered.read(new byte[] { 1 }), new byte[] { 1 });
        Assert.assertTrue(backing.has(new byte[] { 9 }));
        Assert.assertFalse(backing.has(new byte[] { 1 }));

        buffered.discard();
        Assert.assertTrue(buffered.has(new byte[] { 9 }));
        Assert.assertFalse(buffered.has(new byte[] { 1 }));

        buffered.write(new byte[] { 1 }, new byte[] { 1 });
        buffered.remove(new byte[] { 9 });
        buffered.commit();
        Assert.assertEquals(backing.read(new byte[] { 1 }), new byte[] { 1 });
        Assert.assertFalse(backing.has(new byte[] { 9 }));
        Assert.assertEquals(buffered.pendingCount(), 0);
    }
}
