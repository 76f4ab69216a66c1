/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.docsync.plugins.sync;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import org.docsync.api.ContentException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic task expiring sync runs stuck in {@code syncing}. Meant to be
 * scheduled at a fixed rate.
 */
public class SyncWatchdog implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SyncWatchdog.class);

    private final GitSyncEngine engine;

    private final long timeoutMillis;

    public SyncWatchdog(@NotNull GitSyncEngine engine, long timeoutMillis) {
        checkArgument(timeoutMillis > 0, "timeout must be positive: %s", timeoutMillis);
        this.engine = checkNotNull(engine);
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public void run() {
        try {
            List<String> expired = engine.expireSyncs(timeoutMillis);
            if (!expired.isEmpty()) {
                LOG.info("Expired {} stuck sync run(s)", expired.size());
            }
        } catch (ContentException e) {
            // exceptions would cancel further executions
            LOG.error("Failed to expire stuck sync runs", e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while expiring stuck sync runs", e);
        }
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public String toString() {
        return "SyncWatchdog[timeout=" + timeoutMillis + " ms]";
    }
}
