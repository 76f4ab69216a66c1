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

package org.docsync.spi.security;

import org.docsync.api.ContentException;
import org.jetbrains.annotations.NotNull;

/**
 * Permission checks of the engine, one per resource kind. Authentication
 * happens outside of the engine; the actor id is trusted.
 */
public interface AccessControl {

    /**
     * Allows everything.
     */
    AccessControl OPEN = new AccessControl() {
        @Override
        public boolean canAccess(@NotNull String actorId, @NotNull SpaceResource space, @NotNull Permission permission) {
            return true;
        }

        @Override
        public boolean canAccess(@NotNull String actorId, @NotNull PageResource page, @NotNull Permission permission) {
            return true;
        }

        @Override
        public boolean canAccess(@NotNull String actorId, @NotNull ChangeRequestResource changeRequest,
                                 @NotNull Permission permission) {
            return true;
        }

        @Override
        public String toString() {
            return "AccessControl.OPEN";
        }
    };

    boolean canAccess(@NotNull String actorId, @NotNull SpaceResource space, @NotNull Permission permission);

    boolean canAccess(@NotNull String actorId, @NotNull PageResource page, @NotNull Permission permission);

    boolean canAccess(@NotNull String actorId, @NotNull ChangeRequestResource changeRequest,
                      @NotNull Permission permission);

    /**
     * Dispatches a resource to the matching check.
     */
    final class Checker {

        private final AccessControl accessControl;

        public Checker(@NotNull AccessControl accessControl) {
            this.accessControl = accessControl;
        }

        /**
         * @throws ContentException Forbidden if the actor lacks the permission
         */
        public void check(@NotNull final String actorId, @NotNull ResourceRef resource,
                          @NotNull final Permission permission) throws ContentException {
            boolean allowed = resource.accept(new ResourceRef.Visitor<Boolean>() {
                @Override
                public Boolean visit(@NotNull SpaceResource space) {
                    return accessControl.canAccess(actorId, space, permission);
                }

                @Override
                public Boolean visit(@NotNull PageResource page) {
                    return accessControl.canAccess(actorId, page, permission);
                }

                @Override
                public Boolean visit(@NotNull ChangeRequestResource changeRequest) {
                    return accessControl.canAccess(actorId, changeRequest, permission);
                }
            });
            if (!allowed) {
                throw new ContentException(ContentException.FORBIDDEN, 1,
                        actorId + " lacks " + permission + " permission on " + resource);
            }
        }
    }
}
