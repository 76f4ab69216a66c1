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

import java.util.List;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

/**
 * Glob patterns over slash separated relative paths. {@code *} matches within
 * one path element, {@code ?} matches one character of an element and
 * {@code **} matches any number of elements ({@code **}{@code /} also matches
 * none).
 */
public final class FilePatterns {

    private final ImmutableList<Pattern> patterns;

    public FilePatterns(@NotNull List<String> globs) {
        ImmutableList.Builder<Pattern> builder = ImmutableList.builder();
        for (String glob : globs) {
            builder.add(compile(glob));
        }
        this.patterns = builder.build();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    /**
     * Whether any of the patterns matches the path.
     */
    public boolean matches(@NotNull String path) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(path).matches()) {
                return true;
            }
        }
        return false;
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    if (i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                        regex.append("(?:.*/)?");
                        i += 3;
                    } else {
                        regex.append(".*");
                        i += 2;
                    }
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString());
    }
}
