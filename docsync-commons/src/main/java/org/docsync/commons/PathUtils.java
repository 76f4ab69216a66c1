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

package org.docsync.commons;

import java.util.Iterator;
import java.util.NoSuchElementException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Utility methods to work with the slash separated paths used for pages
 * ({@code /guide/setup}) and for files in a repository ({@code docs/guide/setup.md}).
 * <p>
 * Page paths are absolute. Repository file paths are relative. Apart from the
 * root path ("/") no path may end with a slash and no element may be empty.
 */
public final class PathUtils {

    public static final String ROOT_PATH = "/";
    public static final String ROOT_NAME = "";

    private PathUtils() {
        // utility class
    }

    /**
     * Whether the path is the root path ("/").
     *
     * @param path the path
     * @return whether this is the root
     */
    public static boolean denotesRoot(String path) {
        assert isValid(path) : "Invalid path [" + path + "]";

        return ROOT_PATH.equals(path);
    }

    /**
     * Whether the path is absolute (starts with a slash) or not.
     *
     * @param path the path
     * @return true if it starts with a slash
     */
    public static boolean isAbsolute(String path) {
        assert isValid(path) : "Invalid path [" + path + "]";

        return isAbsolutePath(path);
    }

    private static boolean isAbsolutePath(String path) {
        return !path.isEmpty() && path.charAt(0) == '/';
    }

    /**
     * Get the parent of a path. The parent of the root path ("/") is the root
     * path, the parent of a single element relative path is the empty path.
     *
     * @param path the path
     * @return the parent path
     */
    @NotNull
    public static String getParentPath(String path) {
        validate(path);

        if (path.isEmpty() || ROOT_PATH.equals(path)) {
            return path;
        }
        int pos = path.lastIndexOf('/');
        if (pos > 0) {
            return path.substring(0, pos);
        } else if (pos == 0) {
            return ROOT_PATH;
        }
        return "";
    }

    /**
     * Get the last element of the (absolute or relative) path. The name of the
     * root path ("/") and of the empty path ("") is the empty string.
     *
     * @param path the complete path
     * @return the last element
     */
    @NotNull
    public static String getName(String path) {
        validate(path);

        if (path.isEmpty() || ROOT_PATH.equals(path)) {
            return ROOT_NAME;
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * Returns an {@code Iterable} for the path elements. The root path ("/") and the
     * empty path ("") have zero elements.
     *
     * @param path the path
     * @return an Iterable for the path elements
     */
    @NotNull
    public static Iterable<String> elements(final String path) {
        assert isValid(path) : "Invalid path [" + path + "]";

        return new Iterable<String>() {
            @Override
            public Iterator<String> iterator() {
                return new Iterator<String>() {
                    int pos = isAbsolutePath(path) ? 1 : 0;
                    String next;

                    @Override
                    public boolean hasNext() {
                        if (next == null) {
                            if (pos >= path.length()) {
                                return false;
                            }
                            int i = path.indexOf('/', pos);
                            if (i < 0) {
                                next = path.substring(pos);
                                pos = path.length();
                            } else {
                                next = path.substring(pos, i);
                                pos = i + 1;
                            }
                        }
                        return true;
                    }

                    @Override
                    public String next() {
                        if (hasNext()) {
                            String result = next;
                            next = null;
                            return result;
                        }
                        throw new NoSuchElementException();
                    }
                };
            }
        };
    }

    /**
     * Concatenate path elements.
     *
     * @param parentPath the parent path
     * @param subPath    the relative path to append
     * @return the concatenated path
     * @throws IllegalArgumentException if {@code subPath} is absolute
     */
    @NotNull
    public static String concat(String parentPath, String subPath) {
        assert isValid(parentPath) : "Invalid parent path [" + parentPath + "]";
        assert isValid(subPath) : "Invalid sub path [" + subPath + "]";

        if (parentPath.isEmpty()) {
            return subPath;
        } else if (subPath.isEmpty()) {
            return parentPath;
        } else if (isAbsolutePath(subPath)) {
            throw new IllegalArgumentException("Cannot append absolute path " + subPath);
        }
        StringBuilder buff = new StringBuilder(parentPath.length() + subPath.length() + 1);
        buff.append(parentPath);
        if (!ROOT_PATH.equals(parentPath)) {
            buff.append('/');
        }
        buff.append(subPath);
        return buff.toString();
    }

    /**
     * Relative path concatenation. Leading and trailing slashes of the
     * individual parts are dropped, empty parts are ignored.
     *
     * @param relativePaths relative paths
     * @return the concatenated path or {@code null} if the resulting path is empty.
     */
    @Nullable
    public static String concatRelativePaths(String... relativePaths) {
        StringBuilder result = new StringBuilder();
        for (String path : relativePaths) {
            if (path != null && !path.isEmpty()) {
                int i0 = 0;
                int i1 = path.length();
                while (i0 < i1 && path.charAt(i0) == '/') {
                    i0++;
                }
                while (i1 > i0 && path.charAt(i1 - 1) == '/') {
                    i1--;
                }
                if (i1 > i0) {
                    if (result.length() > 0) {
                        result.append('/');
                    }
                    result.append(path, i0, i1);
                }
            }
        }
        return result.length() == 0 ? null : result.toString();
    }

    /**
     * Check if a path is a (direct or indirect) ancestor of another path.
     *
     * @param ancestor the ancestor path
     * @param path     the potential offspring path
     * @return true if the path is an offspring of the ancestor
     */
    public static boolean isAncestor(String ancestor, String path) {
        assert isValid(ancestor) : "Invalid parent path [" + ancestor + "]";
        assert isValid(path) : "Invalid path [" + path + "]";

        if (ancestor.isEmpty() || path.isEmpty()) {
            return false;
        }
        if (ROOT_PATH.equals(ancestor)) {
            return !ROOT_PATH.equals(path) && isAbsolutePath(path);
        }
        return path.startsWith(ancestor + "/");
    }

    /**
     * Relativize a path wrt. a parent path such that
     * {@code relativize(parentPath, concat(parentPath, path)) == path}
     * holds.
     *
     * @param parentPath parent path
     * @param path       path to relativize
     * @return relativized path
     * @throws IllegalArgumentException if {@code path} is not below {@code parentPath}
     */
    @NotNull
    public static String relativize(String parentPath, String path) {
        assert isValid(parentPath) : "Invalid parent path [" + parentPath + "]";
        assert isValid(path) : "Invalid path [" + path + "]";

        if (parentPath.equals(path)) {
            return "";
        }
        if (parentPath.isEmpty()) {
            return path;
        }
        String prefix = ROOT_PATH.equals(parentPath)
                ? parentPath
                : parentPath + '/';
        if (path.startsWith(prefix)) {
            return path.substring(prefix.length());
        }
        throw new IllegalArgumentException("Cannot relativize " + path + " wrt. " + parentPath);
    }

    /**
     * Check if the path is valid, and throw an IllegalArgumentException if not.
     *
     * @param path the path
     * @see #isValid(String)
     */
    public static void validate(String path) {
        if (path.isEmpty() || ROOT_PATH.equals(path)) {
            return;
        } else if (path.charAt(path.length() - 1) == '/') {
            throw new IllegalArgumentException("Path may not end with '/': " + path);
        } else if (path.contains("//")) {
            throw new IllegalArgumentException("Path may not contain '//': " + path);
        }
    }

    /**
     * Check if the path is valid. A valid path is absolute (starts with a '/')
     * or relative (doesn't start with '/'), and contains none or more elements.
     * A path may not end with '/', except for the root path. Elements must be
     * at least one character long.
     *
     * @param path the path
     * @return {@code true} iff the path is valid.
     */
    public static boolean isValid(String path) {
        if (path.isEmpty() || ROOT_PATH.equals(path)) {
            return true;
        }
        return path.charAt(path.length() - 1) != '/' && !path.contains("//");
    }

}
