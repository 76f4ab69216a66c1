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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.Lists.newArrayList;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.docsync.api.ContentException.CONFLICT;
import static org.docsync.api.ContentException.FORBIDDEN;
import static org.docsync.api.ContentException.INTERNAL;
import static org.docsync.api.ContentException.NOT_FOUND;
import static org.docsync.api.ContentException.VALIDATION;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

import com.google.common.base.Joiner;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.util.concurrent.Striped;
import org.docsync.api.ChangeRequestManager;
import org.docsync.api.ContentException;
import org.docsync.api.content.Page;
import org.docsync.api.content.PageContent;
import org.docsync.api.content.ResolutionChoice;
import org.docsync.api.review.ChangeRequest;
import org.docsync.api.review.ChangeRequestAction;
import org.docsync.api.review.ChangeRequestChange;
import org.docsync.api.review.ChangeRequestComment;
import org.docsync.api.review.ChangeRequestStatus;
import org.docsync.api.review.ChangeType;
import org.docsync.api.review.MergeResult;
import org.docsync.api.review.Review;
import org.docsync.api.review.ReviewPolicy;
import org.docsync.api.review.ReviewStatus;
import org.docsync.api.sync.CommitResult;
import org.docsync.api.sync.GitBranch;
import org.docsync.api.sync.GitCommitRecord;
import org.docsync.api.sync.GitSyncConfig;
import org.docsync.api.sync.SyncDirection;
import org.docsync.plugins.commit.ThreeWayMerge;
import org.docsync.plugins.git.FileMapping;
import org.docsync.plugins.git.MarkdownSerializer;
import org.docsync.plugins.sync.Retries;
import org.docsync.plugins.tree.PageHierarchy;
import org.docsync.plugins.tree.PageNames;
import org.docsync.plugins.version.VersionedContent;
import org.docsync.spi.git.CommitFile;
import org.docsync.spi.git.GitRepository;
import org.docsync.spi.git.GitRepositoryProvider;
import org.docsync.spi.git.RemoteCommit;
import org.docsync.spi.security.AccessControl;
import org.docsync.spi.security.ChangeRequestResource;
import org.docsync.spi.security.PageResource;
import org.docsync.spi.security.Permission;
import org.docsync.spi.security.SpaceResource;
import org.docsync.spi.store.ContentStore;
import org.docsync.spi.store.StoreSession;
import org.docsync.stats.Clock;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChangeRequestManager} keeping proposed page changes apart from the
 * pages until the request is merged.
 * <p>
 * A merge holds an exclusive lock per space and target branch. Under the
 * lock every change is checked three-way against the current page (base is
 * the content the change was proposed against, local the page, remote the
 * proposal). If the space is bound to a repository the merge commit is
 * created next; only then are all changes applied, together with the new
 * status of the request, in a single store write. A merge commit whose
 * changes can not be applied after all, because a page changed in between,
 * is reverted in the repository.
 */
public class ChangeRequestWorkflow implements ChangeRequestManager {

    private static final Logger LOG = LoggerFactory.getLogger(ChangeRequestWorkflow.class);

    private static final String SUMMARY = "{summary}";

    private final ContentStore store;

    private final GitRepositoryProvider repositories;

    private final Clock clock;

    private final AccessControl.Checker access;

    private final Retries retries;

    private final int defaultRequiredApprovals;

    private final long lockTimeoutMillis;

    private final Striped<Lock> mergeLocks = Striped.lazyWeakLock(64);

    private final MarkdownSerializer serializer = new MarkdownSerializer();

    public ChangeRequestWorkflow(@NotNull ContentStore store, @NotNull GitRepositoryProvider repositories,
                                 @NotNull Clock clock, @NotNull AccessControl accessControl,
                                 @NotNull Retries retries, int defaultRequiredApprovals, long lockTimeoutMillis) {
        checkArgument(defaultRequiredApprovals >= 0, "defaultRequiredApprovals must not be negative: %s",
                defaultRequiredApprovals);
        this.store = checkNotNull(store);
        this.repositories = checkNotNull(repositories);
        this.clock = checkNotNull(clock);
        this.access = new AccessControl.Checker(checkNotNull(accessControl));
        this.retries = checkNotNull(retries);
        this.defaultRequiredApprovals = defaultRequiredApprovals;
        this.lockTimeoutMillis = lockTimeoutMillis;
    }

    //---------------------------------------------------< change requests >---

    @NotNull
    @Override
    public ChangeRequest createChangeRequest(@NotNull final String spaceId, @NotNull final String title,
                                             @NotNull final String sourceBranch, @NotNull final String targetBranch,
                                             @NotNull final String actorId) throws ContentException {
        if (isBlank(title)) {
            throw new ContentException(VALIDATION, 50, "Change request title must not be empty");
        }
        if (isBlank(sourceBranch) || isBlank(targetBranch)) {
            throw new ContentException(VALIDATION, 51, "Source and target branch must not be empty");
        }
        access.check(actorId, new SpaceResource(spaceId), Permission.WRITE);
        ChangeRequest created = store.write((StoreSession session) -> {
            long now = clock.getTime();
            ChangeRequest cr = new ChangeRequest();
            cr.setId(session.newId());
            cr.setSpaceId(spaceId);
            cr.setTitle(title.trim());
            cr.setSourceBranch(sourceBranch);
            cr.setTargetBranch(targetBranch);
            cr.setCreatedBy(actorId);
            cr.setCreatedAt(now);
            cr.setUpdatedAt(now);
            session.putChangeRequest(cr);
            return cr;
        });
        LOG.info("Created change request {} '{}' in space {}", created.getId(), created.getTitle(), spaceId);
        return created;
    }

    @NotNull
    @Override
    public ChangeRequest getChangeRequest(@NotNull final String changeRequestId) throws ContentException {
        return store.read((StoreSession session) -> readable(session, changeRequestId, null));
    }

    @NotNull
    @Override
    public List<ChangeRequest> getChangeRequests(@NotNull final String spaceId) throws ContentException {
        return store.read((StoreSession session) -> session.getChangeRequests(spaceId));
    }

    @NotNull
    @Override
    public ChangeRequest addReviewer(@NotNull final String changeRequestId, @NotNull final String reviewerId,
                                     @NotNull final String actorId) throws ContentException {
        return store.write((StoreSession session) -> {
            ChangeRequest cr = getChangeRequest(session, changeRequestId);
            access.check(actorId, resourceOf(cr), Permission.WRITE);
            if (reviewerId.equals(cr.getCreatedBy())) {
                throw new ContentException(VALIDATION, 52, "The creator of change request " + cr.getId()
                        + " can not review it");
            }
            if (isClosed(cr)) {
                throw new ContentException(FORBIDDEN, 54, "Change request " + cr.getId() + " is "
                        + cr.getStatus());
            }
            if (cr.getReviewers().contains(reviewerId)) {
                return cr;
            }
            addReviewer(cr, reviewerId);
            if (session.getReview(cr.getId(), reviewerId) == null) {
                Review review = new Review();
                review.setId(session.newId());
                review.setChangeRequestId(cr.getId());
                review.setReviewerId(reviewerId);
                session.putReview(review);
            }
            cr.setUpdatedAt(clock.getTime());
            session.putChangeRequest(cr);
            return cr;
        });
    }

    //---------------------------------------------------------< proposals >---

    @NotNull
    @Override
    public ChangeRequestChange proposeUpdate(@NotNull final String changeRequestId, @NotNull final String pageId,
                                             @NotNull final PageContent content, @NotNull final String actorId)
            throws ContentException {
        PageNames.checkTitle(content.getTitle());
        return store.write((StoreSession session) -> {
            ChangeRequest cr = editable(session, changeRequestId);
            Page page = pageOf(session, cr, pageId);
            access.check(actorId, new PageResource(cr.getSpaceId(), pageId), Permission.WRITE);
            ChangeRequestChange change = findChange(session, cr.getId(), pageId);
            if (change == null) {
                change = newChange(session, cr, actorId);
                change.setPageId(pageId);
                change.setBefore(VersionedContent.read(session, page));
            }
            change.setChangeType(ChangeType.UPDATE);
            change.setAfter(content);
            return putChange(session, cr, change);
        });
    }

    @NotNull
    @Override
    public ChangeRequestChange proposePage(@NotNull final String changeRequestId, @Nullable final String parentId,
                                           @NotNull final String slug, @NotNull final PageContent content,
                                           @NotNull final String actorId) throws ContentException {
        PageNames.checkSlug(slug);
        PageNames.checkTitle(content.getTitle());
        return store.write((StoreSession session) -> {
            ChangeRequest cr = editable(session, changeRequestId);
            access.check(actorId, new SpaceResource(cr.getSpaceId()), Permission.WRITE);
            Page parent = parentId == null ? null : pageOf(session, cr, parentId);
            PageHierarchy.childDepth(parent);
            String path = PageHierarchy.pathOf(parent, slug);
            if (session.getPageByPath(cr.getSpaceId(), path) != null) {
                throw new ContentException(CONFLICT, 50, "Path " + path + " already exists in space "
                        + cr.getSpaceId());
            }
            ChangeRequestChange change = null;
            for (ChangeRequestChange c : session.getChanges(cr.getId())) {
                if (c.getChangeType() == ChangeType.CREATE && c.getPageId() == null
                        && Objects.equals(parentId, c.getParentId()) && slug.equals(c.getSlug())) {
                    change = c;
                }
            }
            if (change == null) {
                change = newChange(session, cr, actorId);
                change.setChangeType(ChangeType.CREATE);
                change.setParentId(parentId);
                change.setSlug(slug);
            }
            change.setAfter(content);
            return putChange(session, cr, change);
        });
    }

    @NotNull
    @Override
    public ChangeRequestChange proposeDeletion(@NotNull final String changeRequestId, @NotNull final String pageId,
                                               @NotNull final String actorId) throws ContentException {
        return store.write((StoreSession session) -> {
            ChangeRequest cr = editable(session, changeRequestId);
            Page page = pageOf(session, cr, pageId);
            access.check(actorId, new PageResource(cr.getSpaceId(), pageId), Permission.WRITE);
            ChangeRequestChange change = findChange(session, cr.getId(), pageId);
            if (change == null) {
                change = newChange(session, cr, actorId);
                change.setPageId(pageId);
                change.setBefore(VersionedContent.read(session, page));
            }
            change.setChangeType(ChangeType.DELETE);
            change.setAfter(null);
            return putChange(session, cr, change);
        });
    }

    @NotNull
    @Override
    public List<ChangeRequestChange> getChanges(@NotNull final String changeRequestId) throws ContentException {
        return store.read((StoreSession session) -> {
            getChangeRequest(session, changeRequestId);
            return session.getChanges(changeRequestId);
        });
    }

    //-------------------------------------------------------< transitions >---

    @NotNull
    @Override
    public ChangeRequest transitionChangeRequest(@NotNull String changeRequestId,
                                                 @NotNull ChangeRequestAction action,
                                                 @NotNull String actorId) throws ContentException {
        return transitionChangeRequest(changeRequestId, action, actorId, null);
    }

    @NotNull
    @Override
    public ChangeRequest transitionChangeRequest(@NotNull final String changeRequestId,
                                                 @NotNull final ChangeRequestAction action,
                                                 @NotNull final String actorId, @Nullable final String body)
            throws ContentException {
        checkNotNull(action);
        final ChangeRequestStatus[] from = new ChangeRequestStatus[1];
        ChangeRequest result = store.write((StoreSession session) -> {
            ChangeRequest cr = getChangeRequest(session, changeRequestId);
            access.check(actorId, resourceOf(cr), ReviewTransitions.roleOf(action) == ReviewTransitions.Role.CREATOR
                    ? Permission.WRITE : Permission.READ);
            ReviewTransitions.check(cr, action, actorId);
            from[0] = cr.getStatus();
            long now = clock.getTime();
            switch (action) {
                case APPROVE:
                    review(session, cr, actorId, ReviewStatus.APPROVED, body, now);
                    break;
                case REJECT:
                    review(session, cr, actorId, ReviewStatus.CHANGES_REQUESTED, body, now);
                    break;
                case COMMENT:
                    review(session, cr, actorId, ReviewStatus.COMMENTED, body, now);
                    break;
                case REOPEN:
                    for (Review review : session.getReviews(cr.getId())) {
                        review.setStatus(ReviewStatus.PENDING);
                        review.setSubmittedAt(null);
                        session.putReview(review);
                    }
                    break;
                default:
                    break;
            }
            List<String> approvers = newArrayList();
            for (Review review : session.getReviews(cr.getId())) {
                if (review.getStatus() == ReviewStatus.APPROVED) {
                    approvers.add(review.getReviewerId());
                }
            }
            cr.setApprovers(approvers);
            cr.setStatus(ReviewTransitions.next(cr.getStatus(), action, approvers.size(),
                    requiredApprovals(session, cr.getSpaceId())));
            cr.setUpdatedAt(now);
            session.putChangeRequest(cr);
            return cr;
        });
        LOG.info("Change request {} {} by {}: {} -> {}", changeRequestId, action, actorId, from[0],
                result.getStatus());
        return result;
    }

    /**
     * Records the decision of a reviewer. A comment does not replace an
     * earlier approval or change request of the same reviewer.
     */
    private static void review(StoreSession session, ChangeRequest cr, String reviewerId, ReviewStatus status,
                               String body, long now) throws ContentException {
        Review review = session.getReview(cr.getId(), reviewerId);
        if (review == null) {
            review = new Review();
            review.setId(session.newId());
            review.setChangeRequestId(cr.getId());
            review.setReviewerId(reviewerId);
        }
        boolean decided = review.getStatus() == ReviewStatus.APPROVED
                || review.getStatus() == ReviewStatus.CHANGES_REQUESTED;
        if (status != ReviewStatus.COMMENTED || !decided) {
            review.setStatus(status);
        }
        if (body != null) {
            review.setBody(body);
        }
        review.setSubmittedAt(now);
        session.putReview(review);
    }

    @NotNull
    @Override
    public List<Review> getReviews(@NotNull final String changeRequestId) throws ContentException {
        return store.read((StoreSession session) -> {
            getChangeRequest(session, changeRequestId);
            return session.getReviews(changeRequestId);
        });
    }

    //---------------------------------------------------------< conflicts >---

    @NotNull
    @Override
    public List<ChangeRequestChange> refreshConflicts(@NotNull final String changeRequestId)
            throws ContentException {
        return store.write((StoreSession session) -> {
            ChangeRequest cr = getChangeRequest(session, changeRequestId);
            if (cr.getStatus() == ChangeRequestStatus.MERGED) {
                return newArrayList();
            }
            return markConflicts(session, cr);
        });
    }

    /**
     * Compares every change with its target page and stores the outcome on
     * the change.
     *
     * @return the changes in conflict
     */
    private List<ChangeRequestChange> markConflicts(StoreSession session, ChangeRequest cr)
            throws ContentException {
        List<ChangeRequestChange> conflicts = newArrayList();
        for (ChangeRequestChange change : session.getChanges(cr.getId())) {
            PageContent current = targetContent(session, cr, change);
            boolean conflict = ThreeWayMerge.merge(change.getBefore(), current, change.getAfter()).isConflict();
            if (conflict) {
                change.setConflict(true);
                change.setConflictContent(current);
                session.putChange(change);
                conflicts.add(change);
            } else if (change.isConflict()) {
                change.setConflict(false);
                change.setConflictContent(null);
                session.putChange(change);
            }
        }
        return conflicts;
    }

    @NotNull
    @Override
    public ChangeRequestChange resolveChangeConflict(@NotNull final String changeRequestId,
                                                     @NotNull final String changeId,
                                                     @NotNull final ResolutionChoice choice,
                                                     @Nullable final PageContent content,
                                                     @NotNull final String actorId) throws ContentException {
        checkNotNull(choice);
        ChangeRequestChange resolved = store.write((StoreSession session) -> {
            ChangeRequest cr = getChangeRequest(session, changeRequestId);
            access.check(actorId, resourceOf(cr), Permission.WRITE);
            if (isClosed(cr)) {
                throw new ContentException(FORBIDDEN, 54, "Change request " + cr.getId() + " is "
                        + cr.getStatus());
            }
            ChangeRequestChange change = session.getChange(changeId);
            if (change == null || !change.getChangeRequestId().equals(cr.getId())) {
                throw new ContentException(NOT_FOUND, 52, "Change " + changeId + " not found in change request "
                        + cr.getId());
            }
            if (!change.isConflict()) {
                throw new ContentException(VALIDATION, 53, "Change " + changeId + " has no conflict");
            }
            PageContent current = change.getConflictContent();
            switch (choice) {
                case KEEP_LOCAL:
                    change.setAfter(current);
                    break;
                case TAKE_REMOTE:
                    break;
                case MERGED:
                    if (content == null) {
                        throw new ContentException(VALIDATION, 54, "Merged content is required");
                    }
                    PageNames.checkTitle(content.getTitle());
                    change.setAfter(content);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown choice " + choice);
            }
            // the target content becomes the new base of the change
            change.setBefore(current);
            change.setConflict(false);
            change.setConflictContent(null);
            if (change.getAfter() == null) {
                change.setChangeType(ChangeType.DELETE);
            } else if (change.getChangeType() == ChangeType.DELETE) {
                change.setChangeType(ChangeType.UPDATE);
            }
            return putChange(session, cr, change);
        });
        LOG.info("Resolved conflict of change {} in change request {} ({})", changeId, changeRequestId, choice);
        return resolved;
    }

    //-------------------------------------------------------------< merge >---

    @NotNull
    @Override
    public MergeResult mergeChangeRequest(@NotNull final String changeRequestId, @NotNull final String actorId)
            throws ContentException {
        ChangeRequest cr = getChangeRequest(changeRequestId);
        access.check(actorId, resourceOf(cr), Permission.MERGE);
        checkMergeable(cr, getReviewPolicy(cr.getSpaceId()).getRequiredApprovals());

        Lock lock = mergeLocks.get(cr.getSpaceId() + '@' + cr.getTargetBranch());
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMillis, MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ContentException(INTERNAL, 50, "Interrupted while waiting to merge " + changeRequestId, e);
        }
        if (!acquired) {
            throw new ContentException(CONFLICT, 51, "Branch " + cr.getTargetBranch() + " of space "
                    + cr.getSpaceId() + " is locked by another merge");
        }
        try {
            return merge(changeRequestId, actorId);
        } finally {
            lock.unlock();
        }
    }

    private MergeResult merge(final String changeRequestId, final String actorId) throws ContentException {
        final MergePlan plan = store.write((StoreSession session) -> plan(session, changeRequestId));
        if (!plan.conflicts.isEmpty()) {
            throw new ContentException(CONFLICT, 52, "Change request " + changeRequestId
                    + " conflicts with " + Joiner.on(", ").join(plan.conflicts));
        }

        final String sha;
        final String message;
        GitRepository repository = null;
        if (plan.config != null && !plan.files.isEmpty()) {
            repository = retries.call("resolve repository " + plan.config.getRepositoryUrl(),
                    () -> repositories.getRepository(plan.config));
            final GitRepository target = repository;
            final String branch = plan.cr.getTargetBranch();
            final String expectedHead = plan.branch == null ? null : plan.branch.getHeadCommit();
            message = plan.config.getCommitMessageTemplate()
                    .replace(SUMMARY, "merge change request '" + plan.cr.getTitle() + "'");
            sha = retries.call("commit to " + branch,
                    () -> target.createCommit(branch, expectedHead, plan.files, message, actorId));
            LOG.info("Created merge commit {} on {} for change request {}", sha, branch, changeRequestId);
        } else {
            sha = contentHash(plan);
            message = null;
        }

        try {
            MergeResult result = store.write((StoreSession session) -> apply(session, plan, sha, message, actorId));
            LOG.info("Merged change request {} as {}: {} page(s)", changeRequestId, sha,
                    result.getAffectedPageIds().size());
            return result;
        } catch (ContentException e) {
            if (repository != null) {
                revert(repository, plan, sha, actorId, e);
            }
            throw e;
        }
    }

    /**
     * Undoes a merge commit whose changes could not be applied to the pages,
     * by committing the previous content of its files on top of it.
     */
    private void revert(final GitRepository repository, final MergePlan plan, final String sha,
                        final String actorId, ContentException cause) {
        final String branch = plan.cr.getTargetBranch();
        try {
            final String previousHead = plan.branch == null || plan.branch.getHeadCommit() == null
                    ? parentOf(repository, branch, sha) : plan.branch.getHeadCommit();
            final List<CommitFile> files = newArrayList();
            for (final CommitFile file : plan.files) {
                String previous = previousHead == null ? null : retries.call("read " + file.getPath(),
                        () -> repository.getFileContents(file.getPath(), previousHead));
                files.add(previous == null ? CommitFile.delete(file.getPath())
                        : CommitFile.write(file.getPath(), previous));
            }
            final String message = plan.config.getCommitMessageTemplate()
                    .replace(SUMMARY, "revert merge of change request '" + plan.cr.getTitle() + "'");
            String reverted = retries.call("revert " + sha + " on " + branch,
                    () -> repository.createCommit(branch, sha, files, message, actorId));
            LOG.warn("Change request {} could not be applied ({}), reverted merge commit {} with {}",
                    plan.cr.getId(), cause.getMessage(), sha, reverted);
        } catch (ContentException e) {
            LOG.error("Merge commit {} of change request {} was created but not applied and could not be reverted",
                    sha, plan.cr.getId(), e);
            cause.addSuppressed(e);
        }
    }

    @Nullable
    private String parentOf(final GitRepository repository, final String branch, String sha)
            throws ContentException {
        List<RemoteCommit> commits = retries.call("fetch " + branch, () -> repository.fetchCommits(branch, null));
        for (RemoteCommit commit : commits) {
            if (commit.getSha().equals(sha)) {
                return commit.getParentSha();
            }
        }
        return null;
    }

    /**
     * Checks the request under the merge lock: persists the conflict markers
     * of all changes and collects the files of the merge commit.
     */
    private MergePlan plan(StoreSession session, String changeRequestId) throws ContentException {
        ChangeRequest cr = getChangeRequest(session, changeRequestId);
        checkMergeable(cr, requiredApprovals(session, cr.getSpaceId()));
        MergePlan plan = new MergePlan(cr);
        for (ChangeRequestChange change : session.getChanges(cr.getId())) {
            plan.changeIds.add(change.getId());
        }
        for (ChangeRequestChange change : markConflicts(session, cr)) {
            plan.conflicts.add(describe(session, cr, change));
        }
        if (!plan.conflicts.isEmpty()) {
            return plan;
        }
        for (ChangeRequestChange change : session.getChanges(cr.getId())) {
            checkApplicable(session, cr, change);
        }
        GitSyncConfig config = session.getSyncConfigForSpace(cr.getSpaceId());
        if (config == null) {
            return plan;
        }
        plan.config = config;
        plan.branch = session.getBranch(config.getId(), cr.getTargetBranch());
        FileMapping mapping = new FileMapping(config);
        for (ChangeRequestChange change : session.getChanges(cr.getId())) {
            PageContent current = targetContent(session, cr, change);
            if (ThreeWayMerge.merge(change.getBefore(), current, change.getAfter()).getOutcome()
                    != ThreeWayMerge.Outcome.FAST_FORWARD) {
                continue;
            }
            String path = checkTargetPath(session, cr, change);
            Page page = change.getPageId() == null ? null : session.getPage(change.getPageId());
            String synced = page == null ? null : page.getSyncedPath();
            if (change.getAfter() == null) {
                if (synced != null) {
                    plan.files.add(CommitFile.delete(synced));
                    plan.syncedFiles.put(path, null);
                }
                continue;
            }
            String file = mapping.toFilePath(path);
            if (!mapping.isSynced(file)) {
                continue;
            }
            if (synced != null && !synced.equals(file)) {
                plan.files.add(CommitFile.delete(synced));
            }
            plan.files.add(CommitFile.write(file, serializer.serialize(change.getAfter())));
            plan.syncedFiles.put(path, file);
        }
        return plan;
    }

    /**
     * Fails the way {@link #applyChange} would, before anything is committed.
     */
    private static void checkApplicable(StoreSession session, ChangeRequest cr, ChangeRequestChange change)
            throws ContentException {
        PageContent current = targetContent(session, cr, change);
        if (ThreeWayMerge.merge(change.getBefore(), current, change.getAfter()).getOutcome()
                != ThreeWayMerge.Outcome.FAST_FORWARD) {
            return;
        }
        if (change.getPageId() != null) {
            if (session.getPage(change.getPageId()) == null) {
                throw new ContentException(NOT_FOUND, 51, "Page " + change.getPageId() + " not found");
            }
            return;
        }
        String path = checkTargetPath(session, cr, change);
        if (session.getPageByPath(cr.getSpaceId(), path) == null) {
            PageHierarchy.childDepth(change.getParentId() == null ? null : session.getPage(change.getParentId()));
        }
    }

    private MergeResult apply(StoreSession session, MergePlan plan, String sha, @Nullable String message,
                              String actorId) throws ContentException {
        ChangeRequest cr = getChangeRequest(session, plan.cr.getId());
        if (cr.getStatus() == ChangeRequestStatus.MERGED) {
            throw new ContentException(CONFLICT, 53, "Change request " + cr.getId() + " is already merged");
        }
        long now = clock.getTimeMonotonic();
        String summary = "Merged change request '" + cr.getTitle() + "'";
        List<String> affected = newArrayList();
        List<Page> applied = newArrayList();
        for (ChangeRequestChange change : session.getChanges(cr.getId())) {
            PageContent current = targetContent(session, cr, change);
            ThreeWayMerge merge = ThreeWayMerge.merge(change.getBefore(), current, change.getAfter());
            if (merge.isConflict()) {
                throw new ContentException(CONFLICT, 52, "Change request " + cr.getId() + " conflicts with "
                        + describe(session, cr, change));
            }
            if (merge.getOutcome() != ThreeWayMerge.Outcome.FAST_FORWARD) {
                continue;
            }
            Page page = applyChange(session, cr, change, summary, actorId, sha, now);
            affected.add(page.getId());
            applied.add(page);
        }

        cr.setStatus(ChangeRequestStatus.MERGED);
        cr.setMergedAt(now);
        cr.setMergedBy(actorId);
        cr.setMergedCommitSha(sha);
        cr.setUpdatedAt(now);
        session.putChangeRequest(cr);

        if (plan.config != null && message != null) {
            GitSyncConfig config = session.getSyncConfig(plan.config.getId());
            if (config == null) {
                throw new ContentException(NOT_FOUND, 54, "Sync config " + plan.config.getId() + " not found");
            }
            GitCommitRecord record = new GitCommitRecord();
            record.setId(session.newId());
            record.setConfigId(config.getId());
            record.setSha(sha);
            record.setMessage(message);
            record.setAuthorId(actorId);
            record.setCommittedAt(clock.getTime());
            record.setDirection(SyncDirection.PUSH);
            record.setChangeRequestId(cr.getId());
            List<String> files = newArrayList();
            for (CommitFile file : plan.files) {
                files.add(file.getPath());
            }
            record.setFilesChanged(files);
            record.setResult(CommitResult.SUCCESS);
            session.putCommit(record);

            GitBranch branch = session.getBranch(config.getId(), cr.getTargetBranch());
            if (branch == null) {
                branch = new GitBranch();
                branch.setId(session.newId());
                branch.setConfigId(config.getId());
                branch.setName(cr.getTargetBranch());
                branch.setActive(true);
            }
            String previousHead = branch.getHeadCommit();
            branch.setHeadCommit(sha);
            session.putBranch(branch);

            if (cr.getTargetBranch().equals(config.getDefaultBranch())
                    && Objects.equals(previousHead, config.getLastSyncCommit())) {
                // nothing else happened on the branch, the pages are in sync with the merge commit
                config.setLastSyncCommit(sha);
                session.putSyncConfig(config);
                for (Page page : applied) {
                    Page stored = session.getPage(page.getId());
                    if (plan.syncedFiles.containsKey(page.getPath())) {
                        stored.setSyncedPath(plan.syncedFiles.get(page.getPath()));
                        session.putPage(stored);
                    }
                }
            }
        }
        return new MergeResult(cr.getId(), sha, affected);
    }

    /**
     * Applies a single change and records the previous content as a version
     * linked to the merge commit.
     *
     * @return the affected page
     */
    private Page applyChange(StoreSession session, ChangeRequest cr, ChangeRequestChange change, String summary,
                             String actorId, String sha, long now) throws ContentException {
        Page page;
        if (change.getPageId() != null) {
            page = session.getPage(change.getPageId());
            if (page == null) {
                throw new ContentException(NOT_FOUND, 51, "Page " + change.getPageId() + " not found");
            }
        } else {
            page = session.getPageByPath(cr.getSpaceId(), checkTargetPath(session, cr, change));
        }
        PageContent after = change.getAfter();
        if (after == null) {
            VersionedContent.snapshot(session, page, VersionedContent.read(session, page), summary,
                    actorId, sha, now);
            PageHierarchy.softDelete(session, page, actorId, now);
            return page;
        }
        if (page == null) {
            page = PageHierarchy.create(session, cr.getSpaceId(), change.getParentId(), change.getSlug(),
                    after.getTitle(), actorId, now);
            change.setPageId(page.getId());
            session.putChange(change);
        } else if (page.isDeleted()) {
            PageHierarchy.undelete(session, page, actorId, now);
        }
        VersionedContent.replace(session, page, after, summary, actorId, sha, now);
        return page;
    }

    /**
     * Stand-in merge commit id for spaces without a repository.
     */
    private String contentHash(MergePlan plan) {
        Hasher hasher = Hashing.sha1().newHasher()
                .putString(plan.cr.getId(), StandardCharsets.UTF_8)
                .putLong(clock.getTime());
        for (String changeId : plan.changeIds) {
            hasher.putString(changeId, StandardCharsets.UTF_8);
        }
        return hasher.hash().toString();
    }

    private static void checkMergeable(ChangeRequest cr, int requiredApprovals) throws ContentException {
        if (!ReviewTransitions.isMergeable(cr.getStatus(), requiredApprovals)) {
            throw new ContentException(FORBIDDEN, 50, "Change request " + cr.getId() + " is " + cr.getStatus()
                    + (requiredApprovals > 0 ? ", it needs " + requiredApprovals + " approval(s) to be merged"
                    : ", it must be submitted to be merged"));
        }
    }

    private static final class MergePlan {

        final ChangeRequest cr;

        final List<String> changeIds = newArrayList();

        final List<String> conflicts = newArrayList();

        GitSyncConfig config;

        GitBranch branch;

        final List<CommitFile> files = newArrayList();

        /**
         * File of each page path after the merge, {@code null} for deleted
         * pages.
         */
        final Map<String, String> syncedFiles = new LinkedHashMap<String, String>();

        MergePlan(ChangeRequest cr) {
            this.cr = cr;
        }
    }

    //----------------------------------------------------------< comments >---

    @NotNull
    @Override
    public ChangeRequestComment addComment(@NotNull final String changeRequestId,
                                           @Nullable final String parentCommentId, @Nullable final String pageId,
                                           @NotNull final String body, @NotNull final String actorId)
            throws ContentException {
        if (isBlank(body)) {
            throw new ContentException(VALIDATION, 55, "Comment must not be empty");
        }
        return store.write((StoreSession session) -> {
            ChangeRequest cr = readable(session, changeRequestId, actorId);
            if (parentCommentId != null) {
                getComment(session, cr, parentCommentId);
            }
            if (pageId != null && findChange(session, cr.getId(), pageId) == null) {
                throw new ContentException(VALIDATION, 56, "Page " + pageId + " is not changed by change request "
                        + cr.getId());
            }
            ChangeRequestComment comment = new ChangeRequestComment();
            comment.setId(session.newId());
            comment.setChangeRequestId(cr.getId());
            comment.setParentId(parentCommentId);
            comment.setPageId(pageId);
            comment.setAuthorId(actorId);
            comment.setBody(body);
            comment.setCreatedAt(clock.getTime());
            session.putComment(comment);
            return comment;
        });
    }

    @NotNull
    @Override
    public ChangeRequestComment resolveComment(@NotNull final String changeRequestId,
                                               @NotNull final String commentId, @NotNull final String actorId)
            throws ContentException {
        return store.write((StoreSession session) -> {
            ChangeRequest cr = readable(session, changeRequestId, actorId);
            ChangeRequestComment comment = getComment(session, cr, commentId);
            if (!comment.isResolved()) {
                comment.setResolved(true);
                comment.setResolvedBy(actorId);
                session.putComment(comment);
            }
            return comment;
        });
    }

    @NotNull
    @Override
    public List<ChangeRequestComment> getComments(@NotNull final String changeRequestId) throws ContentException {
        return store.read((StoreSession session) -> {
            getChangeRequest(session, changeRequestId);
            return session.getComments(changeRequestId);
        });
    }

    //------------------------------------------------------------< policy >---

    @NotNull
    @Override
    public ReviewPolicy setReviewPolicy(@NotNull final String spaceId, final int requiredApprovals,
                                        @NotNull String actorId) throws ContentException {
        access.check(actorId, new SpaceResource(spaceId), Permission.ADMINISTER);
        if (requiredApprovals < 0) {
            throw new ContentException(VALIDATION, 57, "Required approvals must not be negative");
        }
        ReviewPolicy policy = store.write((StoreSession session) -> {
            ReviewPolicy p = new ReviewPolicy(spaceId, requiredApprovals);
            session.putReviewPolicy(p);
            return p;
        });
        LOG.info("Space {} requires {} approval(s)", spaceId, requiredApprovals);
        return policy;
    }

    @NotNull
    @Override
    public ReviewPolicy getReviewPolicy(@NotNull final String spaceId) throws ContentException {
        return store.read((StoreSession session) -> {
            ReviewPolicy policy = session.getReviewPolicy(spaceId);
            return policy == null ? new ReviewPolicy(spaceId, defaultRequiredApprovals) : policy;
        });
    }

    private int requiredApprovals(StoreSession session, String spaceId) {
        ReviewPolicy policy = session.getReviewPolicy(spaceId);
        return policy == null ? defaultRequiredApprovals : policy.getRequiredApprovals();
    }

    //----------------------------------------------------------< internal >---

    private static ChangeRequest getChangeRequest(StoreSession session, String changeRequestId)
            throws ContentException {
        ChangeRequest cr = session.getChangeRequest(changeRequestId);
        if (cr == null) {
            throw new ContentException(NOT_FOUND, 50, "Change request " + changeRequestId + " not found");
        }
        return cr;
    }

    private ChangeRequest readable(StoreSession session, String changeRequestId, @Nullable String actorId)
            throws ContentException {
        ChangeRequest cr = getChangeRequest(session, changeRequestId);
        if (actorId != null) {
            access.check(actorId, resourceOf(cr), Permission.READ);
        }
        return cr;
    }

    /**
     * Returns the request if changes can still be proposed to it.
     */
    private static ChangeRequest editable(StoreSession session, String changeRequestId) throws ContentException {
        ChangeRequest cr = getChangeRequest(session, changeRequestId);
        if (cr.getStatus() != ChangeRequestStatus.DRAFT) {
            throw new ContentException(FORBIDDEN, 55, "Change request " + cr.getId() + " is "
                    + cr.getStatus() + ", changes can only be proposed to a draft");
        }
        return cr;
    }

    private static Page pageOf(StoreSession session, ChangeRequest cr, String pageId) throws ContentException {
        Page page = PageHierarchy.getLivePage(session, pageId);
        if (!page.getSpaceId().equals(cr.getSpaceId())) {
            throw new ContentException(NOT_FOUND, 51, "Page " + pageId + " not found in space " + cr.getSpaceId());
        }
        return page;
    }

    private static ChangeRequestComment getComment(StoreSession session, ChangeRequest cr, String commentId)
            throws ContentException {
        ChangeRequestComment comment = session.getComment(commentId);
        if (comment == null || !comment.getChangeRequestId().equals(cr.getId())) {
            throw new ContentException(NOT_FOUND, 53, "Comment " + commentId + " not found in change request "
                    + cr.getId());
        }
        return comment;
    }

    @Nullable
    private static ChangeRequestChange findChange(StoreSession session, String changeRequestId, String pageId) {
        for (ChangeRequestChange change : session.getChanges(changeRequestId)) {
            if (pageId.equals(change.getPageId())) {
                return change;
            }
        }
        return null;
    }

    private ChangeRequestChange newChange(StoreSession session, ChangeRequest cr, String actorId) {
        ChangeRequestChange change = new ChangeRequestChange();
        change.setId(session.newId());
        change.setChangeRequestId(cr.getId());
        change.setCreatedAt(clock.getTime());
        change.setCreatedBy(actorId);
        return change;
    }

    private ChangeRequestChange putChange(StoreSession session, ChangeRequest cr, ChangeRequestChange change)
            throws ContentException {
        change.setBlockDiffs(BlockDiffer.diff(change.getBefore(), change.getAfter()));
        change.setConflict(false);
        change.setConflictContent(null);
        session.putChange(change);
        cr.setUpdatedAt(clock.getTime());
        session.putChangeRequest(cr);
        return change;
    }

    /**
     * Current content of the page a change targets, {@code null} if there is
     * no such live page.
     */
    @Nullable
    private static PageContent targetContent(StoreSession session, ChangeRequest cr, ChangeRequestChange change) {
        Page page;
        if (change.getPageId() != null) {
            page = session.getPage(change.getPageId());
        } else {
            String path = targetPath(session, cr, change);
            page = path == null ? null : session.getPageByPath(cr.getSpaceId(), path);
        }
        return page == null || page.isDeleted() ? null : VersionedContent.read(session, page);
    }

    /**
     * Path of the page a change targets, {@code null} if the parent of a
     * page to create is gone.
     */
    @Nullable
    private static String targetPath(StoreSession session, ChangeRequest cr, ChangeRequestChange change) {
        if (change.getPageId() != null) {
            Page page = session.getPage(change.getPageId());
            return page == null ? null : page.getPath();
        }
        Page parent = null;
        if (change.getParentId() != null) {
            parent = session.getPage(change.getParentId());
            if (parent == null || parent.isDeleted()) {
                return null;
            }
        }
        return PageHierarchy.pathOf(parent, change.getSlug());
    }

    private static String checkTargetPath(StoreSession session, ChangeRequest cr, ChangeRequestChange change)
            throws ContentException {
        String path = targetPath(session, cr, change);
        if (path == null) {
            throw new ContentException(NOT_FOUND, 51, "Parent page " + change.getParentId()
                    + " of proposed page " + change.getSlug() + " not found");
        }
        return path;
    }

    private static String describe(StoreSession session, ChangeRequest cr, ChangeRequestChange change) {
        String path = targetPath(session, cr, change);
        return path == null ? "change " + change.getId() : path;
    }

    private static ChangeRequestResource resourceOf(ChangeRequest cr) {
        return new ChangeRequestResource(cr.getSpaceId(), cr.getId());
    }

    private static boolean isClosed(ChangeRequest cr) {
        return cr.getStatus() == ChangeRequestStatus.MERGED || cr.getStatus() == ChangeRequestStatus.CLOSED;
    }

    private static void addReviewer(ChangeRequest cr, String reviewerId) {
        if (!cr.getReviewers().contains(reviewerId)) {
            List<String> reviewers = newArrayList(cr.getReviewers());
            reviewers.add(reviewerId);
            cr.setReviewers(reviewers);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "ChangeRequestWorkflow[lockTimeout=" + lockTimeoutMillis + "ms]";
    }
}
