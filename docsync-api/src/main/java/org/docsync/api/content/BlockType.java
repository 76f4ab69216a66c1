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

package org.docsync.api.content;

import org.jetbrains.annotations.NotNull;

/**
 * The closed set of block types. {@link #getName()} is the name used in
 * stored content and in the file representation.
 */
public enum BlockType {

    PARAGRAPH("paragraph"),
    HEADING_1("heading_1"),
    HEADING_2("heading_2"),
    HEADING_3("heading_3"),
    HEADING_4("heading_4"),
    HEADING_5("heading_5"),
    HEADING_6("heading_6"),
    BLOCKQUOTE("blockquote"),
    CODE_BLOCK("code_block"),
    TABLE("table"),
    HINT_INFO("hint_info"),
    HINT_WARNING("hint_warning"),
    HINT_DANGER("hint_danger"),
    HINT_SUCCESS("hint_success"),
    REUSABLE_BLOCK("reusable_block"),
    IMAGE("image"),
    VIDEO("video"),
    EMBED("embed"),
    MATH("math"),
    DIVIDER("divider"),
    TOGGLE("toggle"),
    TABS("tabs"),
    API_BLOCK("api_block"),
    FILE_ATTACHMENT("file_attachment"),
    ACTION_BUTTON("action_button");

    private final String name;

    BlockType(String name) {
        this.name = name;
    }

    @NotNull
    public String getName() {
        return name;
    }

    /**
     * Heading level 1..6, or 0 if this is not a heading.
     */
    public int getHeadingLevel() {
        switch (this) {
            case HEADING_1:
                return 1;
            case HEADING_2:
                return 2;
            case HEADING_3:
                return 3;
            case HEADING_4:
                return 4;
            case HEADING_5:
                return 5;
            case HEADING_6:
                return 6;
            default:
                return 0;
        }
    }

    @NotNull
    public static BlockType heading(int level) {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Invalid heading level: " + level);
        }
        return values()[HEADING_1.ordinal() + level - 1];
    }

    /**
     * Resolves a type by its name.
     *
     * @param name the type name, e.g. {@code hint_info}
     * @return the type, or {@code null} if there is no such type
     */
    public static BlockType fromName(String name) {
        for (BlockType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
