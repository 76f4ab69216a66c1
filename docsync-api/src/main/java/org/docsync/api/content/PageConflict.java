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

package org.docsync.api.content;

import org.jetbrains.annotations.Nullable;

/**
 * Both sides of an unresolved three-way conflict on a page. A {@code null}
 * side means the page does not exist on that side (it was deleted).
 */
public final class PageConflict {

    private final PageContent base;
    private final PageContent local;
    private final PageContent remote;
    private final String remoteCommitSha;
    private final long detectedAt;

    public PageConflict(@Nullable PageContent base, @Nullable PageContent local,
                        @Nullable PageContent remote, @Nullable String remoteCommitSha,
                        long detectedAt) {
        this.base = base;
        this.local = local;
        this.remote = remote;
        this.remoteCommitSha = remoteCommitSha;
        this.detectedAt = detectedAt;
    }

    @Nullable
    public PageContent getBase() {
        return base;
    }

    @Nullable
    public PageContent getLocal() {
        return local;
    }

    @Nullable
    public PageContent getRemote() {
        return remote;
    }

    @Nullable
    public String getRemoteCommitSha() {
        return remoteCommitSha;
    }

    public long getDetectedAt() {
        return detectedAt;
    }
}
