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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable, identifier free value of a block and its nested blocks. Two
 * blocks are equal if type, text, attributes, reference and children are
 * equal, which makes content trees comparable across the store and the
 * file representation.
 */
public final class ContentBlock {

    /**
     * Attribute key reserved for the reusable block reference in the file
     * representation. It can not be used as a regular attribute.
     */
    public static final String REF = "ref";

    private final BlockType type;

    private final String text;

    private final ImmutableSortedMap<String, String> attributes;

    private final String reusableBlockId;

    private final ImmutableList<ContentBlock> children;

    public ContentBlock(@NotNull BlockType type, @NotNull String text,
                        @NotNull Map<String, String> attributes,
                        @Nullable String reusableBlockId,
                        @NotNull List<ContentBlock> children) {
        this.type = checkNotNull(type);
        this.text = checkNotNull(text);
        this.attributes = ImmutableSortedMap.copyOf(attributes);
        checkArgument(!this.attributes.containsKey(REF), "Attribute name '%s' is reserved", REF);
        for (String key : this.attributes.keySet()) {
            checkArgument(isValidAttributeName(key), "Invalid attribute name '%s'", key);
        }
        this.reusableBlockId = reusableBlockId;
        this.children = ImmutableList.copyOf(children);
    }

    public static ContentBlock of(@NotNull BlockType type, @NotNull String text) {
        return new ContentBlock(type, text, ImmutableSortedMap.<String, String>of(), null,
                ImmutableList.<ContentBlock>of());
    }

    public static ContentBlock paragraph(@NotNull String text) {
        return of(BlockType.PARAGRAPH, text);
    }

    public static ContentBlock heading(int level, @NotNull String text) {
        return of(BlockType.heading(level), text);
    }

    public static ContentBlock reference(@NotNull String reusableBlockId, @NotNull ContentBlock fallback) {
        return new ContentBlock(BlockType.REUSABLE_BLOCK, fallback.getText(), fallback.getAttributes(),
                reusableBlockId, fallback.getChildren());
    }

    /**
     * Attribute names are lower case identifiers: {@code [a-z][a-zA-Z0-9_]*}.
     */
    public static boolean isValidAttributeName(String name) {
        if (name.isEmpty() || name.charAt(0) < 'a' || name.charAt(0) > 'z') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(Character.isLetterOrDigit(c) && c < 128) && c != '_') {
                return false;
            }
        }
        return true;
    }

    public ContentBlock withAttribute(@NotNull String name, @NotNull String value) {
        ImmutableSortedMap.Builder<String, String> builder = ImmutableSortedMap.naturalOrder();
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            if (!e.getKey().equals(name)) {
                builder.put(e);
            }
        }
        builder.put(name, value);
        return new ContentBlock(type, text, builder.build(), reusableBlockId, children);
    }

    public ContentBlock withChildren(@NotNull List<ContentBlock> children) {
        return new ContentBlock(type, text, attributes, reusableBlockId, children);
    }

    public ContentBlock withText(@NotNull String text) {
        return new ContentBlock(type, text, attributes, reusableBlockId, children);
    }

    @NotNull
    public BlockType getType() {
        return type;
    }

    @NotNull
    public String getText() {
        return text;
    }

    @NotNull
    public ImmutableSortedMap<String, String> getAttributes() {
        return attributes;
    }

    @Nullable
    public String getAttribute(String name) {
        return attributes.get(name);
    }

    @Nullable
    public String getReusableBlockId() {
        return reusableBlockId;
    }

    @NotNull
    public ImmutableList<ContentBlock> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ContentBlock)) {
            return false;
        }
        ContentBlock that = (ContentBlock) other;
        return type == that.type
                && text.equals(that.text)
                && attributes.equals(that.attributes)
                && Objects.equals(reusableBlockId, that.reusableBlockId)
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, attributes, reusableBlockId, children);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add("type", type)
                .add("text", text)
                .add("attributes", attributes.isEmpty() ? null : attributes)
                .add("ref", reusableBlockId)
                .add("children", children.isEmpty() ? null : children)
                .toString();
    }
}
