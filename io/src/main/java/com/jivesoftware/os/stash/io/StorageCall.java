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
import com.jivesoftware.os.stash.io.api.KeyValueStorage;
import com.jivesoftware.os.stash.io.api.WriteBack;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One logical call against a storage. Collections built on {@link #storage()} and passed to
 * {@link #register(WriteBack)} are flushed when the body returns, and everything they wrote is committed to the
 * backing storage in one go. A body that throws leaves the backing storage untouched. A backing storage that fails
 * part way through the commit keeps what it already accepted, undoing that is up to the host.
 *
 * <pre>
 * Long total = StorageCall.execute(storage, call -&gt; {
 *     LookupMap&lt;String, Long&gt; balances = call.register(new LookupMap&lt;&gt;(call.storage(), prefix, keys, values));
 *     ...
 * });
 * </pre>
 *
 * @author jonathan.colt
 */
public class StorageCall {

    private static final Logger LOG = LoggerFactory.getLogger(StorageCall.class);

    private final BufferedKeyValueStorage buffered;
    private final List<WriteBack> registered = new ArrayList<>();

    private StorageCall(KeyValueStorage backing) {
        this.buffered = new BufferedKeyValueStorage(backing);
    }

    public KeyValueStorage storage() {
        return buffered;
    }

    public <W extends WriteBack> W register(W writeBack) {
        registered.add(Preconditions.checkNotNull(writeBack));
        return writeBack;
    }

    public static <R> R execute(KeyValueStorage storage, CallTransaction<R> transaction) throws Exception {
        StorageCall call = new StorageCall(storage);
        R result;
        try {
            result = transaction.commit(call);
            for (WriteBack writeBack : call.registered) {
                writeBack.flush();
            }
            LOG.debug("Committing {} storage changes from {} collections.", call.buffered.pendingCount(), call.registered.size());
            call.buffered.commit();
        } catch (Exception | Error x) {
            LOG.warn("Call aborted, discarding {} pending storage changes.", call.buffered.pendingCount());
            call.buffered.discard();
            throw x;
        }
        return result;
    }
}
