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

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

public final class BreadcrumbItem {

    private final String pageId;
    private final String title;
    private final String path;

    public BreadcrumbItem(@NotNull String pageId, @NotNull String title, @NotNull String path) {
        this.pageId = pageId;
        this.title = title;
        this.path = path;
    }

    public String getPageId() {
        return pageId;
    }

    public String getTitle() {
        return title;
    }

    public String getPath() {
        return path;
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof BreadcrumbItem)) {
            return false;
        }
        BreadcrumbItem that = (BreadcrumbItem) other;
        return pageId.equals(that.pageId) && title.equals(that.title) && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pageId, title, path);
    }

    @Override
    public String toString() {
        return path + " (" + title + ")";
    }
}
