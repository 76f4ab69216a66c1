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

package org.docsync.plugins.review;

import static com.google.common.collect.Lists.newArrayList;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.PageContent;
import org.docsync.api.review.BlockDiff;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Computes block level differences between two versions of a page. Siblings
 * are aligned by their longest common subsequence. Unaligned blocks of the
 * same type in the same gap are paired up: if only their children differ the
 * comparison continues one level down, otherwise the pair is reported as
 * modified.
 */
public final class BlockDiffer {

    private BlockDiffer() {
    }

    @NotNull
    public static List<BlockDiff> diff(@Nullable PageContent before, @Nullable PageContent after) {
        List<BlockDiff> diffs = newArrayList();
        diff(before == null ? Collections.<ContentBlock>emptyList() : before.getBlocks(),
                after == null ? Collections.<ContentBlock>emptyList() : after.getBlocks(),
                "", diffs);
        return diffs;
    }

    private static void diff(List<ContentBlock> before, List<ContentBlock> after, String prefix,
                             List<BlockDiff> diffs) {
        int n = before.size();
        int m = after.size();
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                lcs[i][j] = before.get(i).equals(after.get(j))
                        ? lcs[i + 1][j + 1] + 1
                        : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
            }
        }
        int i = 0;
        int j = 0;
        int gapI = 0;
        int gapJ = 0;
        while (i < n && j < m) {
            if (before.get(i).equals(after.get(j))) {
                gap(before, gapI, i, after, gapJ, j, prefix, diffs);
                i++;
                j++;
                gapI = i;
                gapJ = j;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                i++;
            } else {
                j++;
            }
        }
        gap(before, gapI, n, after, gapJ, m, prefix, diffs);
    }

    private static void gap(List<ContentBlock> before, int fromI, int toI, List<ContentBlock> after,
                            int fromJ, int toJ, String prefix, List<BlockDiff> diffs) {
        int i = fromI;
        int j = fromJ;
        while (i < toI && j < toJ) {
            ContentBlock b = before.get(i);
            ContentBlock a = after.get(j);
            if (b.getType() != a.getType()) {
                break;
            }
            if (sameExceptChildren(b, a)) {
                diff(b.getChildren(), a.getChildren(), location(prefix, j) + "/", diffs);
            } else {
                diffs.add(new BlockDiff(BlockDiff.Kind.MODIFIED, location(prefix, j), b, a));
            }
            i++;
            j++;
        }
        for (; i < toI; i++) {
            diffs.add(new BlockDiff(BlockDiff.Kind.REMOVED, location(prefix, i), before.get(i), null));
        }
        for (; j < toJ; j++) {
            diffs.add(new BlockDiff(BlockDiff.Kind.ADDED, location(prefix, j), null, after.get(j)));
        }
    }

    private static boolean sameExceptChildren(ContentBlock a, ContentBlock b) {
        return a.getText().equals(b.getText())
                && a.getAttributes().equals(b.getAttributes())
                && Objects.equals(a.getReusableBlockId(), b.getReusableBlockId());
    }

    private static String location(String prefix, int index) {
        return prefix + index;
    }
}
