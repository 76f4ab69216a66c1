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

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A depth bounded view of the page hierarchy. The root of a whole space
 * tree has no page.
 */
public final class PageTree {

    private final Page page;

    private final ImmutableList<PageTree> children;

    private final boolean truncated;

    public PageTree(@Nullable Page page, @NotNull List<PageTree> children, boolean truncated) {
        this.page = page;
        this.children = ImmutableList.copyOf(children);
        this.truncated = truncated;
    }

    @Nullable
    public Page getPage() {
        return page;
    }

    @NotNull
    public ImmutableList<PageTree> getChildren() {
        return children;
    }

    /**
     * Whether children were left out because of the depth bound.
     */
    public boolean isTruncated() {
        return truncated;
    }
}
