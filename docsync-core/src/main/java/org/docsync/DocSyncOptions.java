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

package org.docsync;

import static com.google.common.base.Preconditions.checkArgument;

import org.docsync.commons.properties.SystemPropertySupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tuning options of a {@link DocSync} repository. Defaults are read from
 * system properties when the options are created.
 */
public class DocSyncOptions {

    private static final Logger LOG = LoggerFactory.getLogger(DocSyncOptions.class);

    public static final String SYNC_TIMEOUT = "docsync.sync.timeoutMillis";

    public static final String WATCHDOG_INTERVAL = "docsync.sync.watchdogIntervalMillis";

    public static final String GIT_MAX_ATTEMPTS = "docsync.git.maxAttempts";

    public static final String GIT_INITIAL_BACKOFF = "docsync.git.initialBackoffMillis";

    public static final String GIT_MAX_BACKOFF = "docsync.git.maxBackoffMillis";

    public static final String MERGE_LOCK_TIMEOUT = "docsync.merge.lockTimeoutMillis";

    public static final String REQUIRED_APPROVALS = "docsync.review.requiredApprovals";

    private long syncTimeoutMillis = SystemPropertySupplier.create(SYNC_TIMEOUT, 15 * 60 * 1000L)
            .loggingTo(LOG).validateWith(v -> v > 0).get();

    private long watchdogIntervalMillis = SystemPropertySupplier.create(WATCHDOG_INTERVAL, 60 * 1000L)
            .loggingTo(LOG).validateWith(v -> v > 0).get();

    private int gitMaxAttempts = SystemPropertySupplier.create(GIT_MAX_ATTEMPTS, 5)
            .loggingTo(LOG).validateWith(v -> v > 0).get();

    private long gitInitialBackoffMillis = SystemPropertySupplier.create(GIT_INITIAL_BACKOFF, 200L)
            .loggingTo(LOG).validateWith(v -> v >= 0).get();

    private long gitMaxBackoffMillis = SystemPropertySupplier.create(GIT_MAX_BACKOFF, 10000L)
            .loggingTo(LOG).validateWith(v -> v >= 0).get();

    private long mergeLockTimeoutMillis = SystemPropertySupplier.create(MERGE_LOCK_TIMEOUT, 30000L)
            .loggingTo(LOG).validateWith(v -> v >= 0).get();

    private int requiredApprovals = SystemPropertySupplier.create(REQUIRED_APPROVALS, 1)
            .loggingTo(LOG).validateWith(v -> v >= 0).get();

    /**
     * Time after which a running sync is expired by the watchdog.
     */
    public long getSyncTimeoutMillis() {
        return syncTimeoutMillis;
    }

    public DocSyncOptions setSyncTimeoutMillis(long syncTimeoutMillis) {
        checkArgument(syncTimeoutMillis > 0, "syncTimeoutMillis must be positive: %s", syncTimeoutMillis);
        this.syncTimeoutMillis = syncTimeoutMillis;
        return this;
    }

    public long getWatchdogIntervalMillis() {
        return watchdogIntervalMillis;
    }

    public DocSyncOptions setWatchdogIntervalMillis(long watchdogIntervalMillis) {
        checkArgument(watchdogIntervalMillis > 0, "watchdogIntervalMillis must be positive: %s",
                watchdogIntervalMillis);
        this.watchdogIntervalMillis = watchdogIntervalMillis;
        return this;
    }

    public int getGitMaxAttempts() {
        return gitMaxAttempts;
    }

    public DocSyncOptions setGitMaxAttempts(int gitMaxAttempts) {
        checkArgument(gitMaxAttempts > 0, "gitMaxAttempts must be positive: %s", gitMaxAttempts);
        this.gitMaxAttempts = gitMaxAttempts;
        return this;
    }

    public long getGitInitialBackoffMillis() {
        return gitInitialBackoffMillis;
    }

    public long getGitMaxBackoffMillis() {
        return gitMaxBackoffMillis;
    }

    /**
     * Sets the wait after the first failed repository call and the upper
     * bound of the doubling waits after it.
     */
    public DocSyncOptions setGitBackoffMillis(long initial, long maximum) {
        checkArgument(initial >= 0 && maximum >= initial, "Invalid backoff %s..%s", initial, maximum);
        this.gitInitialBackoffMillis = initial;
        this.gitMaxBackoffMillis = maximum;
        return this;
    }

    public long getMergeLockTimeoutMillis() {
        return mergeLockTimeoutMillis;
    }

    public DocSyncOptions setMergeLockTimeoutMillis(long mergeLockTimeoutMillis) {
        checkArgument(mergeLockTimeoutMillis >= 0, "mergeLockTimeoutMillis must not be negative: %s",
                mergeLockTimeoutMillis);
        this.mergeLockTimeoutMillis = mergeLockTimeoutMillis;
        return this;
    }

    /**
     * Approvals a change request needs in spaces without a review policy.
     */
    public int getRequiredApprovals() {
        return requiredApprovals;
    }

    public DocSyncOptions setRequiredApprovals(int requiredApprovals) {
        checkArgument(requiredApprovals >= 0, "requiredApprovals must not be negative: %s", requiredApprovals);
        this.requiredApprovals = requiredApprovals;
        return this;
    }

    @Override
    public String toString() {
        return "DocSyncOptions{syncTimeout=" + syncTimeoutMillis
                + ", watchdogInterval=" + watchdogIntervalMillis
                + ", gitMaxAttempts=" + gitMaxAttempts
                + ", gitBackoff=" + gitInitialBackoffMillis + ".." + gitMaxBackoffMillis
                + ", mergeLockTimeout=" + mergeLockTimeoutMillis
                + ", requiredApprovals=" + requiredApprovals + "}";
    }
}
