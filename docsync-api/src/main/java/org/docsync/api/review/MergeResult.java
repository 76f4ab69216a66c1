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

package org.docsync.api.review;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

public final class MergeResult {

    private final String changeRequestId;

    private final String mergedCommitId;

    private final ImmutableList<String> affectedPageIds;

    public MergeResult(@NotNull String changeRequestId, @NotNull String mergedCommitId,
                       @NotNull List<String> affectedPageIds) {
        this.changeRequestId = changeRequestId;
        this.mergedCommitId = mergedCommitId;
        this.affectedPageIds = ImmutableList.copyOf(affectedPageIds);
    }

    public String getChangeRequestId() {
        return changeRequestId;
    }

    /**
     * Sha of the merge commit.
     */
    public String getMergedCommitId() {
        return mergedCommitId;
    }

    public ImmutableList<String> getAffectedPageIds() {
        return affectedPageIds;
    }
}
