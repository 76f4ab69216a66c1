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

package org.docsync.plugins.commit;

import java.util.Objects;

import org.docsync.api.content.PageContent;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Decides how to combine a local and a remote change of the same page
 * relative to their common base. A {@code null} content means the page does
 * not exist on that side.
 * <p>
 * Changes are never merged on block level: if both sides changed the page
 * in different ways the outcome is a {@link Outcome#CONFLICT} which has to be
 * resolved explicitly.
 */
public final class ThreeWayMerge {

    public enum Outcome {

        /**
         * Only the remote side changed. The result is the remote content.
         */
        FAST_FORWARD,

        /**
         * Only the local side changed. The result is the local content.
         */
        KEEP_LOCAL,

        /**
         * Both sides are equal, whether changed or not.
         */
        UNCHANGED,

        /**
         * Both sides changed differently. There is no result.
         */
        CONFLICT
    }

    private final Outcome outcome;

    private final PageContent result;

    private ThreeWayMerge(Outcome outcome, PageContent result) {
        this.outcome = outcome;
        this.result = result;
    }

    @NotNull
    public static ThreeWayMerge merge(@Nullable PageContent base, @Nullable PageContent local,
                                      @Nullable PageContent remote) {
        if (Objects.equals(local, remote)) {
            return new ThreeWayMerge(Outcome.UNCHANGED, local);
        } else if (Objects.equals(local, base)) {
            return new ThreeWayMerge(Outcome.FAST_FORWARD, remote);
        } else if (Objects.equals(remote, base)) {
            return new ThreeWayMerge(Outcome.KEEP_LOCAL, local);
        } else {
            return new ThreeWayMerge(Outcome.CONFLICT, null);
        }
    }

    @NotNull
    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isConflict() {
        return outcome == Outcome.CONFLICT;
    }

    /**
     * The merged content, {@code null} for a conflict or if the page does
     * not exist after the merge.
     */
    @Nullable
    public PageContent getResult() {
        return result;
    }

    @Override
    public String toString() {
        return outcome.toString();
    }
}
