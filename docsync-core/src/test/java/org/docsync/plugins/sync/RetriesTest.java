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

package org.docsync.plugins.sync;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.docsync.api.ContentException;
import org.docsync.plugins.memory.MemoryGitRepository;
import org.docsync.spi.git.CommitFile;
import org.docsync.spi.git.GitRepositoryException;
import org.docsync.spi.git.GitRepositoryException.Reason;
import org.docsync.spi.git.RemoteCommit;
import org.junit.Before;
import org.junit.Test;

public class RetriesTest {

    private final Retries retries = new Retries(3, 0, 0);

    private MemoryGitRepository repository;

    @Before
    public void setUp() {
        repository = new MemoryGitRepository();
        repository.commit("main", ImmutableMap.of("docs/a.md", "# A\n"), "initial");
    }

    @Test
    public void retriesUnavailableRepository() throws ContentException {
        repository.failNext(2, Reason.UNAVAILABLE);
        List<RemoteCommit> commits = retries.call("fetch", () -> repository.fetchCommits("main", null));
        assertEquals(1, commits.size());
        assertEquals(3, repository.getCallCount());
    }

    @Test
    public void givesUpAfterMaxAttempts() {
        repository.failNext(3, Reason.UNAVAILABLE);
        try {
            retries.call("fetch", () -> repository.fetchCommits("main", null));
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isExternal());
            assertEquals(1, e.getCode());
            assertTrue(e.getCause() instanceof GitRepositoryException);
        }
        assertEquals(3, repository.getCallCount());
    }

    @Test
    public void rejectionsAreNotRetried() {
        try {
            retries.call("commit", () -> repository.createCommit("main", "0000",
                    ImmutableList.of(CommitFile.write("docs/a.md", "# B\n")), "msg", "bob"));
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isExternal());
            assertEquals(Reason.REJECTED, ((GitRepositoryException) e.getCause()).getReason());
        }
        assertEquals(1, repository.getCallCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void atLeastOneAttempt() {
        new Retries(0, 0, 0);
    }
}
