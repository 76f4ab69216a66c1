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
import static org.docsync.api.ContentException.EXTERNAL;
import static org.docsync.api.ContentException.INTERNAL;

import java.util.Random;

import org.docsync.api.ContentException;
import org.docsync.spi.git.GitRepositoryException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the repository, retrying calls that fail because the repository is
 * unavailable with exponential backoff. Failures that remain after the last
 * attempt, and all other repository failures, become {@code External}
 * content exceptions with the repository exception as cause.
 */
public class Retries {

    private static final Logger LOG = LoggerFactory.getLogger(Retries.class);

    private static final Random RANDOM = new Random();

    /**
     * A single repository call.
     */
    public interface GitCall<T> {

        T call() throws GitRepositoryException;
    }

    private final int maxAttempts;

    private final long initialBackoff;

    private final long maximumBackoff;

    /**
     * @param maxAttempts    number of attempts, at least one
     * @param initialBackoff wait after the first failed attempt in milliseconds
     * @param maximumBackoff upper bound of a single wait in milliseconds
     */
    public Retries(int maxAttempts, long initialBackoff, long maximumBackoff) {
        checkArgument(maxAttempts > 0, "maxAttempts must be positive: %s", maxAttempts);
        checkArgument(initialBackoff >= 0 && maximumBackoff >= initialBackoff,
                "Invalid backoff %s..%s", initialBackoff, maximumBackoff);
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maximumBackoff = maximumBackoff;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs the call.
     *
     * @param description what the call does, for log and error messages
     * @throws ContentException External if the call failed, Internal if the
     *         thread was interrupted while waiting
     */
    public <T> T call(@NotNull String description, @NotNull GitCall<T> call) throws ContentException {
        long backoff = initialBackoff;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.call();
            } catch (GitRepositoryException e) {
                if (!e.isRetriable() || attempt >= maxAttempts) {
                    throw new ContentException(EXTERNAL, 1, "Failed to " + description + " after "
                            + attempt + " attempt(s): " + e.getMessage(), e);
                }
                LOG.warn("Attempt {} to {} failed, retrying in {} ms: {}",
                        attempt, description, backoff, e.getMessage());
            }
            try {
                Thread.sleep(backoff + RANDOM.nextInt((int) Math.min(Integer.MAX_VALUE, backoff / 2 + 1)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContentException(INTERNAL, 1, "Interrupted while waiting to " + description, e);
            }
            backoff = Math.min(backoff * 2, maximumBackoff);
        }
    }

    @Override
    public String toString() {
        return "Retries[" + maxAttempts + " attempts, " + initialBackoff + ".." + maximumBackoff + " ms]";
    }
}
