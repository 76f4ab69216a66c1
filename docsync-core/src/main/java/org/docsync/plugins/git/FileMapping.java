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

package org.docsync.plugins.git;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.commons.PathUtils;
import org.docsync.plugins.tree.PageNames;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Maps page paths to repository files and back: the page {@code /guide/setup}
 * of a binding with root path {@code ./docs} lives in
 * {@code docs/guide/setup.md}.
 */
public class FileMapping {

    public static final String DEFAULT_EXTENSION = ".md";

    public static final List<String> EXTENSIONS = ImmutableList.of(".md", ".mdx");

    private final String root;

    private final FilePatterns includes;

    private final FilePatterns excludes;

    public FileMapping(@NotNull GitSyncConfig config) {
        this(config.getRootPath(), config.getIncludePatterns(), config.getExcludePatterns());
    }

    public FileMapping(@NotNull String rootPath, @NotNull List<String> includePatterns,
                       @NotNull List<String> excludePatterns) {
        this.root = normalizeRoot(rootPath);
        this.includes = new FilePatterns(includePatterns);
        this.excludes = new FilePatterns(excludePatterns);
    }

    /**
     * Normalizes a root path: {@code ./docs/} becomes {@code docs}, {@code .}
     * and {@code /} become the empty path.
     */
    @NotNull
    public static String normalizeRoot(@NotNull String rootPath) {
        String root = rootPath.trim();
        while (root.startsWith("./")) {
            root = root.substring(2);
        }
        if (root.equals(".")) {
            root = "";
        }
        String normalized = PathUtils.concatRelativePaths(root);
        return normalized == null ? "" : normalized;
    }

    @NotNull
    public String getRoot() {
        return root;
    }

    /**
     * The file of a page.
     */
    @NotNull
    public String toFilePath(@NotNull String pagePath) {
        checkArgument(PathUtils.isAbsolute(pagePath) && !PathUtils.denotesRoot(pagePath),
                "Not a page path: %s", pagePath);
        return PathUtils.concatRelativePaths(root, pagePath + DEFAULT_EXTENSION);
    }

    /**
     * The page path of a file, or {@code null} if the file is outside the
     * root, has no known extension or an element is not a valid slug.
     */
    @Nullable
    public String toPagePath(@NotNull String filePath) {
        String relative = relativeToRoot(filePath);
        if (relative == null) {
            return null;
        }
        String stripped = null;
        for (String extension : EXTENSIONS) {
            if (relative.endsWith(extension) && relative.length() > extension.length()) {
                stripped = relative.substring(0, relative.length() - extension.length());
                break;
            }
        }
        if (stripped == null || !PathUtils.isValid(stripped)) {
            return null;
        }
        for (String element : PathUtils.elements(stripped)) {
            if (!PageNames.isValidSlug(element)) {
                return null;
            }
        }
        return "/" + stripped;
    }

    /**
     * Whether the file is mapped to a page and passes the include and exclude
     * patterns. Patterns apply to the path relative to the root.
     */
    public boolean isSynced(@NotNull String filePath) {
        String relative = relativeToRoot(filePath);
        if (relative == null || toPagePath(filePath) == null) {
            return false;
        }
        return (includes.isEmpty() || includes.matches(relative)) && !excludes.matches(relative);
    }

    @Nullable
    private String relativeToRoot(String filePath) {
        if (filePath.isEmpty() || !PathUtils.isValid(filePath) || PathUtils.isAbsolute(filePath)) {
            return null;
        }
        if (root.isEmpty()) {
            return filePath;
        }
        return PathUtils.isAncestor(root, filePath) ? PathUtils.relativize(root, filePath) : null;
    }
}
