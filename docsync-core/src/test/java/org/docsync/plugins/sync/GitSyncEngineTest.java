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

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.MoreExecutors;
import org.docsync.api.ContentException;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.ResolutionChoice;
import org.docsync.api.sync.CommitResult;
import org.docsync.api.sync.GitBranch;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncDirection;
import org.docsync.api.sync.SyncHistory;
import org.docsync.api.sync.SyncOperation;
import org.docsync.api.sync.SyncStatus;
import org.docsync.api.sync.WebhookEvent;
import org.docsync.plugins.commit.PageConflictManager;
import org.docsync.plugins.git.MarkdownSerializer;
import org.docsync.plugins.memory.MemoryContentStore;
import org.docsync.plugins.memory.MemoryGitRepository;
import org.docsync.plugins.tree.PageTreeManager;
import org.docsync.spi.git.GitRepositoryException.Reason;
import org.docsync.spi.security.AccessControl;
import org.docsync.stats.Clock;
import org.junit.Before;
import org.junit.Test;

public class GitSyncEngineTest {

    private static final String SPACE = "docs";

    private static final String USER = "erin";

    private static final String INTRO = "# Intro\n\nWelcome.\n";

    private static final String SETUP = "# Setup\n\nInstall it.\n";

    private MemoryContentStore store;

    private MemoryGitRepository repository;

    private Clock.Virtual clock;

    private PageTreeManager pages;

    @Before
    public void setUp() {
        store = new MemoryContentStore();
        clock = new Clock.Virtual();
        repository = new MemoryGitRepository(clock);
        pages = new PageTreeManager(store, clock, AccessControl.OPEN);
    }

    private GitSyncEngine engine(ExecutorService executor) {
        return new GitSyncEngine(store, config -> repository, clock, AccessControl.OPEN, executor,
                new Retries(3, 0, 0));
    }

    private GitSyncEngine engine() {
        return engine(MoreExecutors.newDirectExecutorService());
    }

    @Test
    public void fullPull() throws ContentException {
        String head = repository.commit("main", ImmutableMap.of(
                "docs/intro.md", INTRO,
                "docs/guide/setup.md", SETUP,
                "README.md", "# Readme\n"), "initial");
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);

        SyncHistory history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PULL, USER));
        assertEquals(SyncStatus.SUCCESS, history.getStatus());
        assertEquals(SyncOperation.FULL_SYNC, history.getOperation());
        assertNull(history.getStartCommit());
        assertEquals(head, history.getEndCommit());
        assertEquals(2, history.getFilesProcessed());
        assertEquals(2, history.getPagesCreated());
        assertEquals("/guide", history.getMetadata().get(PullSync.CREATED_FOLDERS));
        assertTrue(history.getErrors().isEmpty());

        Page intro = pages.getPageByPath(SPACE, "/intro");
        assertEquals(0, intro.getDepth());
        assertEquals("Intro", intro.getTitle());
        assertEquals("docs/intro.md", intro.getSyncedPath());
        Page setup = pages.getPageByPath(SPACE, "/guide/setup");
        assertEquals(1, setup.getDepth());
        Page guide = pages.getPageByPath(SPACE, "/guide");
        assertEquals(guide.getId(), setup.getParentId());
        assertNull(guide.getSyncedPath());
        assertEquals(PageContent.of("Setup", ContentBlock.heading(1, "Setup"), ContentBlock.paragraph("Install it.")),
                pages.getContent(setup.getId()));

        GitSyncConfig synced = engine.getSyncConfig(config.getId());
        assertEquals(SyncStatus.SUCCESS, synced.getSyncStatus());
        assertEquals(head, synced.getLastSyncCommit());
        assertNull(synced.getActiveSyncId());
        List<GitCommitRecord> commits = engine.getCommits(config.getId());
        assertEquals(1, commits.size());
        assertEquals(SyncDirection.PULL, commits.get(0).getDirection());
        assertEquals(asList("README.md", "docs/guide/setup.md", "docs/intro.md"),
                ImmutableList.sortedCopyOf(commits.get(0).getFilesChanged()));
    }

    @Test
    public void incrementalPull() throws ContentException {
        repository.commit("main", ImmutableMap.of("docs/intro.md", INTRO, "docs/guide/setup.md", SETUP), "initial");
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        engine.triggerSync(config.getId(), SyncDirection.PULL, USER);
        Page setup = pages.getPageByPath(SPACE, "/guide/setup");

        Map<String, String> files = Maps.newHashMap();
        files.put("docs/intro.md", "# Intro\n\nWelcome back.\n");
        files.put("docs/guide/setup.md", null);
        String head = repository.commit("main", files, "second");

        SyncHistory history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PULL, USER));
        assertEquals(SyncOperation.INCREMENTAL, history.getOperation());
        assertEquals(SyncStatus.SUCCESS, history.getStatus());
        assertEquals(1, history.getPagesUpdated());
        assertEquals(1, history.getPagesDeleted());
        assertEquals(head, history.getEndCommit());
        assertEquals(PageContent.of("Intro", ContentBlock.heading(1, "Intro"), ContentBlock.paragraph("Welcome back.")),
                pages.getContent(pages.getPageByPath(SPACE, "/intro").getId()));
        try {
            pages.getPage(setup.getId());
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isNotFound());
        }

        // nothing new
        history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PULL, USER));
        assertEquals(0, history.getFilesProcessed());
        assertEquals(head, history.getEndCommit());
    }

    @Test
    public void conflictingEdits() throws ContentException {
        repository.commit("main", ImmutableMap.of("docs/intro.md", INTRO), "initial");
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        engine.triggerSync(config.getId(), SyncDirection.PULL, USER);
        Page intro = pages.getPageByPath(SPACE, "/intro");
        pages.updateContent(intro.getId(),
                PageContent.of("Intro", ContentBlock.heading(1, "Intro"), ContentBlock.paragraph("Local.")), null, USER);
        String head = repository.commit("main", ImmutableMap.of("docs/intro.md", "# Intro\n\nRemote.\n"), "remote");

        SyncHistory history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PULL, USER));
        assertEquals(SyncStatus.CONFLICT, history.getStatus());
        assertEquals(asList("/intro"), history.getConflicts());
        assertEquals(SyncStatus.CONFLICT, engine.getSyncConfig(config.getId()).getSyncStatus());
        Page conflicted = pages.getPage(intro.getId());
        assertTrue(conflicted.hasConflict());
        assertEquals(head, conflicted.getConflict().getRemoteCommitSha());

        // pushing leaves the page out
        String push = engine.triggerSync(config.getId(), SyncDirection.PUSH, USER);
        assertEquals(asList("/intro"), engine.getSyncHistory(push).getConflicts());
        assertEquals(head, repository.getHead("main"));

        new PageConflictManager(store, clock, AccessControl.OPEN)
                .resolveConflict(intro.getId(), ResolutionChoice.TAKE_REMOTE, null, USER);
        assertEquals(SyncStatus.SUCCESS, engine.getSyncConfig(config.getId()).getSyncStatus());
        assertEquals(PageContent.of("Intro", ContentBlock.heading(1, "Intro"), ContentBlock.paragraph("Remote.")),
                pages.getContent(intro.getId()));
    }

    @Test
    public void push() throws ContentException {
        MarkdownSerializer serializer = new MarkdownSerializer();
        PageContent intro = PageContent.of("Intro", ContentBlock.paragraph("Welcome."));
        repository.commit("main", ImmutableMap.of("docs/intro.md", serializer.serialize(intro)), "initial");
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        engine.triggerSync(config.getId(), SyncDirection.PULL, USER);

        Page faq = pages.createPage(SPACE, null, "faq", "FAQ", USER);
        PageContent content = PageContent.of("FAQ", ContentBlock.heading(2, "Why?"));
        pages.updateContent(faq.getId(), content, null, USER);

        SyncHistory history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PUSH, USER));
        assertEquals(SyncStatus.SUCCESS, history.getStatus());
        assertEquals(1, history.getFilesProcessed());
        assertEquals(1, history.getPagesCreated());
        String head = repository.getHead("main");
        assertEquals(head, history.getEndCommit());
        assertEquals(serializer.serialize(content), repository.getFiles("main").get("docs/faq.md"));
        assertEquals("docs/faq.md", pages.getPage(faq.getId()).getSyncedPath());
        assertEquals(head, engine.getSyncConfig(config.getId()).getLastSyncCommit());
        for (GitBranch branch : engine.getBranches(config.getId())) {
            assertEquals(head, branch.getHeadCommit());
        }

        pages.deletePage(faq.getId(), USER);
        history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PUSH, USER));
        assertEquals(1, history.getPagesDeleted());
        assertFalse(repository.getFiles("main").containsKey("docs/faq.md"));
        assertTrue(repository.getFiles("main").containsKey("docs/intro.md"));
    }

    @Test
    public void pushNeedsPull() throws ContentException {
        repository.commit("main", ImmutableMap.of("docs/intro.md", INTRO), "initial");
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        engine.triggerSync(config.getId(), SyncDirection.PULL, USER);
        String head = repository.commit("main", ImmutableMap.of("docs/other.md", "# Other\n"), "elsewhere");

        SyncHistory history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PUSH, USER));
        assertEquals(SyncStatus.ERROR, history.getStatus());
        assertEquals(1, history.getErrors().size());
        GitSyncConfig failed = engine.getSyncConfig(config.getId());
        assertEquals(SyncStatus.ERROR, failed.getSyncStatus());
        assertTrue(failed.getLastError().contains("not pulled"));
        assertEquals(head, repository.getHead("main"));

        // a failed run does not block the next one
        engine.triggerSync(config.getId(), SyncDirection.PULL, USER);
        assertEquals(SyncStatus.SUCCESS, engine.getSyncConfig(config.getId()).getSyncStatus());
        assertNull(engine.getSyncConfig(config.getId()).getLastError());
    }

    @Test
    public void pushToEmptyRepository() throws ContentException {
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        Page page = pages.createPage(SPACE, null, "start", "Start", USER);
        pages.updateContent(page.getId(), PageContent.of("Start", ContentBlock.paragraph("Hello")), null, USER);

        SyncHistory history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PUSH, USER));
        assertEquals(SyncStatus.SUCCESS, history.getStatus());
        assertTrue(repository.getFiles("main").containsKey("docs/start.md"));
    }

    @Test
    public void oneRunAtATime() throws ContentException {
        repository.commit("main", ImmutableMap.of("docs/intro.md", INTRO), "initial");
        QueuedExecutor executor = new QueuedExecutor();
        GitSyncEngine engine = engine(executor);
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);

        String first = engine.triggerSync(config.getId(), SyncDirection.PULL, USER);
        GitSyncConfig running = engine.getSyncConfig(config.getId());
        assertEquals(SyncStatus.SYNCING, running.getSyncStatus());
        assertEquals(first, running.getActiveSyncId());
        try {
            engine.triggerSync(config.getId(), SyncDirection.PUSH, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
            assertEquals(40, e.getCode());
        }
        assertEquals(1, engine.getSyncHistories(config.getId()).size());

        executor.runAll();
        assertEquals(SyncStatus.SUCCESS, engine.getSyncHistory(first).getStatus());
        engine.triggerSync(config.getId(), SyncDirection.PUSH, USER);
        assertEquals(2, engine.getSyncHistories(config.getId()).size());
    }

    @Test
    public void watchdogExpiresStuckRuns() throws ContentException {
        repository.commit("main", ImmutableMap.of("docs/intro.md", INTRO), "initial");
        QueuedExecutor executor = new QueuedExecutor();
        GitSyncEngine engine = engine(executor);
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        String stuck = engine.triggerSync(config.getId(), SyncDirection.PULL, USER);
        SyncWatchdog watchdog = new SyncWatchdog(engine, TimeUnit.MINUTES.toMillis(15));

        clock.advance(10, TimeUnit.MINUTES);
        watchdog.run();
        assertEquals(SyncStatus.SYNCING, engine.getSyncConfig(config.getId()).getSyncStatus());

        clock.advance(10, TimeUnit.MINUTES);
        watchdog.run();
        GitSyncConfig expired = engine.getSyncConfig(config.getId());
        assertEquals(SyncStatus.ERROR, expired.getSyncStatus());
        assertNull(expired.getActiveSyncId());
        assertTrue(expired.getLastError().contains("timed out"));
        SyncHistory history = engine.getSyncHistory(stuck);
        assertEquals(SyncStatus.ERROR, history.getStatus());
        assertNotNull(history.getCompletedAt());

        // the expired run does not apply anything
        executor.runAll();
        assertTrue(pages.getChildren(SPACE, null).isEmpty());
        assertEquals(SyncStatus.ERROR, engine.getSyncHistory(stuck).getStatus());

        String next = engine.triggerSync(config.getId(), SyncDirection.PULL, USER);
        executor.runAll();
        assertEquals(SyncStatus.SUCCESS, engine.getSyncHistory(next).getStatus());
    }

    @Test
    public void webhooks() throws ContentException {
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        String head = repository.commit("main", ImmutableMap.of("docs/intro.md", INTRO), "initial");
        WebhookEvent event = new WebhookEvent("delivery-1", "main", asList(head));

        String historyId = engine.handleWebhook(config.getId(), event);
        SyncHistory history = engine.getSyncHistory(historyId);
        assertEquals(SyncOperation.WEBHOOK, history.getOperation());
        assertEquals(SyncStatus.SUCCESS, history.getStatus());
        assertEquals("webhook:delivery-1", history.getTriggeredBy());
        assertEquals(1, history.getPagesCreated());
        List<GitCommitRecord> commits = engine.getCommits(config.getId());
        assertEquals(1, commits.size());
        assertEquals(CommitResult.SUCCESS, commits.get(0).getResult());
        assertEquals("initial", commits.get(0).getMessage());

        // redelivery
        assertEquals(historyId, engine.handleWebhook(config.getId(), event));
        assertEquals(1, engine.getSyncHistories(config.getId()).size());

        try {
            engine.handleWebhook(config.getId(), new WebhookEvent("delivery-2", "feature", asList(head)));
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isValidation());
            assertEquals(43, e.getCode());
        }
        try {
            engine.handleWebhook(config.getId(), new WebhookEvent(null, "main", ImmutableList.<String>of()));
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(44, e.getCode());
        }
    }

    @Test
    public void webhookCommitsInAnyOrder() throws ContentException {
        repository.commit("main", ImmutableMap.of("docs/intro.md", INTRO), "initial");
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        engine.triggerSync(config.getId(), SyncDirection.PULL, USER);

        String c1 = repository.commit("main", ImmutableMap.of("docs/intro.md", "# Intro\n\nOne.\n"), "one");
        String c2 = repository.commit("main", ImmutableMap.of("docs/intro.md", "# Intro\n\nTwo.\n"), "two");
        WebhookEvent event = new WebhookEvent("delivery-1", "main", asList(c2, c1));
        String historyId = engine.handleWebhook(config.getId(), event);

        assertEquals(SyncStatus.SUCCESS, engine.getSyncHistory(historyId).getStatus());
        assertEquals(c2, engine.getSyncHistory(historyId).getEndCommit());
        assertEquals(c2, engine.getSyncConfig(config.getId()).getLastSyncCommit());
        assertEquals(PageContent.of("Intro", ContentBlock.heading(1, "Intro"), ContentBlock.paragraph("Two.")),
                pages.getContent(pages.getPageByPath(SPACE, "/intro").getId()));
        Map<String, GitCommitRecord> records = Maps.newHashMap();
        for (GitCommitRecord record : engine.getCommits(config.getId())) {
            records.put(record.getSha(), record);
        }
        assertEquals(CommitResult.SUCCESS, records.get(c1).getResult());
        assertEquals(CommitResult.SUCCESS, records.get(c2).getResult());

        assertEquals(historyId, engine.handleWebhook(config.getId(),
                new WebhookEvent("delivery-2", "main", asList(c2))));

        String unknown = "0000000000000000000000000000000000000000";
        engine.handleWebhook(config.getId(), new WebhookEvent("delivery-3", "main", asList(unknown)));
        records.clear();
        for (GitCommitRecord record : engine.getCommits(config.getId())) {
            records.put(record.getSha(), record);
        }
        assertEquals(CommitResult.FAILED, records.get(unknown).getResult());
        assertEquals(c2, engine.getSyncConfig(config.getId()).getLastSyncCommit());
    }

    @Test
    public void retriesUnavailableRepository() throws ContentException {
        repository.commit("main", ImmutableMap.of("docs/intro.md", INTRO), "initial");
        GitSyncEngine engine = engine();
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);

        repository.failNext(2, Reason.UNAVAILABLE);
        SyncHistory history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PULL, USER));
        assertEquals(SyncStatus.SUCCESS, history.getStatus());

        repository.commit("main", ImmutableMap.of("docs/intro.md", "# Intro\n\nChanged.\n"), "change");
        repository.failNext(10, Reason.UNAVAILABLE);
        history = engine.getSyncHistory(engine.triggerSync(config.getId(), SyncDirection.PULL, USER));
        assertEquals(SyncStatus.ERROR, history.getStatus());
        assertEquals(SyncStatus.ERROR, engine.getSyncConfig(config.getId()).getSyncStatus());
    }

    @Test
    public void configuration() throws ContentException {
        GitSyncEngine engine = engine();
        try {
            engine.createSyncConfig(SPACE, " ", USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(40, e.getCode());
        }
        GitSyncConfig config = engine.createSyncConfig(SPACE, "memory:docs", USER);
        assertEquals("main", config.getDefaultBranch());
        assertEquals(SyncStatus.IDLE, config.getSyncStatus());
        assertEquals(config.getId(), engine.getSyncConfigForSpace(SPACE).getId());
        try {
            engine.createSyncConfig(SPACE, "memory:other", USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isConflict());
        }
        try {
            engine.getSyncConfigForSpace("unbound");
            fail("expected ContentException");
        } catch (ContentException e) {
            assertTrue(e.isNotFound());
            assertEquals(41, e.getCode());
        }
        try {
            engine.getSyncHistory("missing");
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(42, e.getCode());
        }

        config.setDefaultBranch("develop");
        config.setRootPath("content");
        GitSyncConfig updated = engine.updateSyncConfig(config, USER);
        assertEquals("develop", updated.getDefaultBranch());
        assertEquals("content", updated.getRootPath());
        for (GitBranch branch : engine.getBranches(config.getId())) {
            assertEquals("develop".equals(branch.getName()), branch.isDefaultBranch());
        }
        config.setCommitMessageTemplate("");
        try {
            engine.updateSyncConfig(config, USER);
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(41, e.getCode());
        }
        assertEquals("feature", engine.addBranch(config.getId(), "feature").getName());
        assertEquals(3, engine.getBranches(config.getId()).size());

        GitSyncConfig hooked = engine.registerWebhook(config.getId(), "https://docs.example.com/hook", USER);
        assertTrue(hooked.isWebhookActive());
        assertEquals(40, hooked.getWebhookSecret().length());
        assertEquals("https://docs.example.com/hook", repository.getWebhooks().get(hooked.getWebhookId()));
    }

    /**
     * Runs submitted tasks only when asked to.
     */
    private static final class QueuedExecutor extends AbstractExecutorService {

        private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<Runnable>();

        void runAll() {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                task.run();
            }
        }

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        @Override
        public void shutdown() {
        }

        @Override
        public List<Runnable> shutdownNow() {
            return ImmutableList.of();
        }

        @Override
        public boolean isShutdown() {
            return false;
        }

        @Override
        public boolean isTerminated() {
            return false;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return true;
        }
    }
}
