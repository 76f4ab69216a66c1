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

package org.docsync.api;

import static java.lang.String.format;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Main exception thrown by the content, version, sync and review operations.
 * It keeps track of the type of failure and a numeric code identifying the
 * place where it was raised. The message is formatted as
 * {@code DocSync<Type><code>: <message>}, e.g.
 * {@code DocSyncConflict0003: Path /guide already exists in space s1}.
 * <p>
 * All failures leave the affected entities in their last committed state.
 */
public class ContentException extends Exception {

    /**
     * Source name for exceptions thrown by the engine.
     */
    public static final String DOCSYNC = "DocSync";

    /**
     * A page, block, version, branch, commit, sync configuration or change
     * request does not exist.
     */
    public static final String NOT_FOUND = "NotFound";

    /**
     * Hierarchy cycle, duplicate slug or path, merge conflict or a sync that
     * is already in flight.
     */
    public static final String CONFLICT = "Conflict";

    /**
     * Role violation, invalid state transition or a merge without approval.
     */
    public static final String FORBIDDEN = "Forbidden";

    /**
     * Malformed input.
     */
    public static final String VALIDATION = "Validation";

    /**
     * The repository collaborator is unreachable or rejected a commit.
     */
    public static final String EXTERNAL = "External";

    /**
     * Unexpected failure.
     */
    public static final String INTERNAL = "Internal";

    /** Serial version UID */
    private static final long serialVersionUID = 4418204963115431807L;

    private final String source;

    private final String type;

    private final int code;

    public ContentException(
            String source, String type, int code, String message,
            @Nullable Throwable cause) {
        super(format("%s%s%04d: %s", source, type, code, message), cause);
        this.source = source;
        this.type = type;
        this.code = code;
    }

    public ContentException(String type, int code, String message, @Nullable Throwable cause) {
        this(DOCSYNC, type, code, message, cause);
    }

    public ContentException(String type, int code, String message) {
        this(type, code, message, null);
    }

    /**
     * Checks whether this exception is of the given type.
     *
     * @param type type name
     * @return {@code true} iff this exception is of the given type
     */
    public boolean isOfType(@NotNull String type) {
        return this.type.equals(type);
    }

    public boolean isNotFound() {
        return isOfType(NOT_FOUND);
    }

    public boolean isConflict() {
        return isOfType(CONFLICT);
    }

    public boolean isForbidden() {
        return isOfType(FORBIDDEN);
    }

    public boolean isValidation() {
        return isOfType(VALIDATION);
    }

    public boolean isExternal() {
        return isOfType(EXTERNAL);
    }

    public boolean isInternal() {
        return isOfType(INTERNAL);
    }

    /**
     * Returns the name of the source of this exception.
     *
     * @return source name
     */
    public String getSource() {
        return source;
    }

    /**
     * Return the name of the type of this exception.
     *
     * @return type name
     */
    public String getType() {
        return type;
    }

    /**
     * Returns the type-specific error code of this exception.
     *
     * @return error code
     */
    public int getCode() {
        return code;
    }
}
