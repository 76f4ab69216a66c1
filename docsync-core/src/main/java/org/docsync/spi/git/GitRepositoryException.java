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

package org.docsync.spi.git;

import org.jetbrains.annotations.NotNull;

/**
 * Failure of a {@link GitRepository} call.
 */
public class GitRepositoryException extends Exception {

    private static final long serialVersionUID = -2087443018420557115L;

    public enum Reason {

        /** The repository can not be reached. Calls may be retried. */
        UNAVAILABLE,

        /** The repository refused the request, e.g. a commit on a moved branch. */
        REJECTED,

        /** Unknown branch, commit or repository. */
        NOT_FOUND
    }

    private final Reason reason;

    public GitRepositoryException(@NotNull Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GitRepositoryException(@NotNull Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    @NotNull
    public Reason getReason() {
        return reason;
    }

    public boolean isRetriable() {
        return reason == Reason.UNAVAILABLE;
    }
}
