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

package org.docsync.api.sync;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A push notification from the repository: the branch that moved and the
 * commits it references, oldest first.
 */
public final class WebhookEvent {

    private final String deliveryId;

    private final String branch;

    private final ImmutableList<String> commitShas;

    public WebhookEvent(@Nullable String deliveryId, @NotNull String branch, @NotNull List<String> commitShas) {
        this.deliveryId = deliveryId;
        this.branch = checkNotNull(branch);
        this.commitShas = ImmutableList.copyOf(commitShas);
    }

    @Nullable
    public String getDeliveryId() {
        return deliveryId;
    }

    @NotNull
    public String getBranch() {
        return branch;
    }

    @NotNull
    public ImmutableList<String> getCommitShas() {
        return commitShas;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("deliveryId", deliveryId)
                .add("branch", branch)
                .add("commits", commitShas)
                .toString();
    }
}
