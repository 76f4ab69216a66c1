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

package org.docsync.plugins.tree;

import static org.docsync.api.ContentException.VALIDATION;

import java.util.regex.Pattern;

import org.docsync.api.ContentException;
import org.docsync.api.PageManager;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Rules for page slugs and titles.
 */
public final class PageNames {

    private static final Pattern SLUG = Pattern.compile("^[a-z0-9]+(?:-[a-z0-9]+)*$");

    private PageNames() {
    }

    public static boolean isValidSlug(@Nullable String slug) {
        return slug != null && slug.length() <= PageManager.MAX_SLUG_LENGTH && SLUG.matcher(slug).matches();
    }

    public static void checkSlug(@Nullable String slug) throws ContentException {
        if (!isValidSlug(slug)) {
            throw new ContentException(VALIDATION, 20, "Invalid slug '" + slug
                    + "': lower case letters, digits and single dashes, at most "
                    + PageManager.MAX_SLUG_LENGTH + " characters");
        }
    }

    public static void checkTitle(@Nullable String title) throws ContentException {
        if (title == null || title.trim().isEmpty() || title.length() > PageManager.MAX_TITLE_LENGTH) {
            throw new ContentException(VALIDATION, 21, "Title must have 1 to "
                    + PageManager.MAX_TITLE_LENGTH + " characters");
        }
    }

    /**
     * Derives a title from a slug: {@code getting-started} becomes
     * {@code Getting Started}.
     */
    @NotNull
    public static String titleOf(@NotNull String slug) {
        StringBuilder buff = new StringBuilder(slug.length());
        boolean upper = true;
        for (int i = 0; i < slug.length(); i++) {
            char c = slug.charAt(i);
            if (c == '-') {
                buff.append(' ');
                upper = true;
            } else {
                buff.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return buff.toString();
    }

    /**
     * Appends a suffix to a slug, shortening the slug if the result would be
     * too long.
     */
    @NotNull
    public static String withSuffix(@NotNull String slug, @NotNull String suffix) {
        int max = PageManager.MAX_SLUG_LENGTH - suffix.length();
        String base = slug.length() > max ? slug.substring(0, max) : slug;
        while (base.endsWith("-")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + suffix;
    }
}
