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

package org.docsync.spi.store;

import org.docsync.api.ContentException;
import org.jetbrains.annotations.NotNull;

/**
 * Transactional persistence of the content, version, sync and review
 * entities.
 * <p>
 * A {@link #write(StoreOperation) write} is atomic: either all of its
 * changes become visible or, if the operation throws, none of them.
 * Implementations enforce the entity invariants on every change and fail
 * the operation with a {@link ContentException} when one is violated:
 * <ul>
 *     <li>paths are unique among the live pages of a space (Conflict)</li>
 *     <li>a page's depth is its parent's depth plus one, its path is its
 *     parent's path followed by its slug and it is not its own ancestor
 *     (Conflict for cycles, Validation otherwise)</li>
 *     <li>version numbers of a page are 1, 2, 3, ... (Conflict)</li>
 *     <li>a commit sha is recorded at most once per sync config (Conflict)</li>
 *     <li>a space has at most one sync config (Conflict)</li>
 *     <li>a config has exactly one default branch</li>
 *     <li>a completed sync history record is never changed (Conflict)</li>
 *     <li>there is one review per change request and reviewer</li>
 * </ul>
 */
public interface ContentStore {

    /**
     * Runs an operation on a consistent, read-only view of the store.
     */
    <T> T read(@NotNull StoreOperation<T> operation) throws ContentException;

    /**
     * Runs an operation that may change the store, atomically.
     */
    <T> T write(@NotNull StoreOperation<T> operation) throws ContentException;
}
