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

package org.docsync.spi.security;

import static com.google.common.base.Preconditions.checkNotNull;

import org.jetbrains.annotations.NotNull;

public final class PageResource extends ResourceRef {

    private final String spaceId;

    private final String pageId;

    public PageResource(@NotNull String spaceId, @NotNull String pageId) {
        this.spaceId = checkNotNull(spaceId);
        this.pageId = checkNotNull(pageId);
    }

    @NotNull
    @Override
    public String getSpaceId() {
        return spaceId;
    }

    @NotNull
    public String getPageId() {
        return pageId;
    }

    @Override
    public <R> R accept(@NotNull Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "page " + pageId;
    }
}
