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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.PageContent;
import org.docsync.plugins.commit.ThreeWayMerge.Outcome;
import org.junit.Test;

public class ThreeWayMergeTest {

    private static final PageContent BASE = PageContent.of("Page", ContentBlock.paragraph("base"));

    private static final PageContent LOCAL = PageContent.of("Page", ContentBlock.paragraph("local"));

    private static final PageContent REMOTE = PageContent.of("Page", ContentBlock.paragraph("remote"));

    @Test
    public void onlyRemoteChanged() {
        ThreeWayMerge merge = ThreeWayMerge.merge(BASE, BASE, REMOTE);
        assertEquals(Outcome.FAST_FORWARD, merge.getOutcome());
        assertSame(REMOTE, merge.getResult());
    }

    @Test
    public void onlyLocalChanged() {
        ThreeWayMerge merge = ThreeWayMerge.merge(BASE, LOCAL, BASE);
        assertEquals(Outcome.KEEP_LOCAL, merge.getOutcome());
        assertSame(LOCAL, merge.getResult());
    }

    @Test
    public void sameChangeOnBothSides() {
        ThreeWayMerge merge = ThreeWayMerge.merge(BASE, REMOTE,
                PageContent.of("Page", ContentBlock.paragraph("remote")));
        assertEquals(Outcome.UNCHANGED, merge.getOutcome());
        assertFalse(merge.isConflict());
        assertEquals(Outcome.UNCHANGED, ThreeWayMerge.merge(BASE, BASE, BASE).getOutcome());
    }

    @Test
    public void differentChanges() {
        ThreeWayMerge merge = ThreeWayMerge.merge(BASE, LOCAL, REMOTE);
        assertTrue(merge.isConflict());
        assertNull(merge.getResult());
    }

    @Test
    public void titleChangeCounts() {
        ThreeWayMerge merge = ThreeWayMerge.merge(BASE, BASE.withTitle("Renamed"), REMOTE);
        assertTrue(merge.isConflict());
    }

    @Test
    public void absentPages() {
        // created remotely
        assertEquals(Outcome.FAST_FORWARD, ThreeWayMerge.merge(null, null, REMOTE).getOutcome());
        // created on both sides with different content
        assertTrue(ThreeWayMerge.merge(null, LOCAL, REMOTE).isConflict());
        // deleted remotely
        ThreeWayMerge deleted = ThreeWayMerge.merge(BASE, BASE, null);
        assertEquals(Outcome.FAST_FORWARD, deleted.getOutcome());
        assertNull(deleted.getResult());
        // deleted remotely, edited locally
        assertTrue(ThreeWayMerge.merge(BASE, LOCAL, null).isConflict());
        // deleted on both sides
        assertEquals(Outcome.UNCHANGED, ThreeWayMerge.merge(BASE, null, null).getOutcome());
    }
}
