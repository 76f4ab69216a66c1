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

/**
 * Per space review requirements. With zero required approvals a submitted
 * change request can be merged without review.
 */
public final class ReviewPolicy {

    private final String spaceId;

    private final int requiredApprovals;

    public ReviewPolicy(String spaceId, int requiredApprovals) {
        if (requiredApprovals < 0) {
            throw new IllegalArgumentException("requiredApprovals must be >= 0: " + requiredApprovals);
        }
        this.spaceId = spaceId;
        this.requiredApprovals = requiredApprovals;
    }

    public String getSpaceId() {
        return spaceId;
    }

    public int getRequiredApprovals() {
        return requiredApprovals;
    }
}
