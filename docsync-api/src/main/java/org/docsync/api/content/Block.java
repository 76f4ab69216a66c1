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

import java.util.Map;

import com.google.common.collect.ImmutableSortedMap;
import org.jetbrains.annotations.Nullable;

/**
 * A stored block. Blocks of a page form a tree through their parent block
 * id and are ordered by position among their siblings.
 */
public class Block {

    private String id;
    private String pageId;
    private String parentId;
    private BlockType type;
    private int position;
    private String text = "";
    private ImmutableSortedMap<String, String> attributes = ImmutableSortedMap.of();
    private String reusableBlockId;

    public Block() {
    }

    public Block(Block other) {
        this.id = other.id;
        this.pageId = other.pageId;
        this.parentId = other.parentId;
        this.type = other.type;
        this.position = other.position;
        this.text = other.text;
        this.attributes = other.attributes;
        this.reusableBlockId = other.reusableBlockId;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getPageId() {
        return pageId;
    }

    public void setPageId(String pageId) {
        this.pageId = pageId;
    }

    @Nullable
    public String getParentId() {
        return parentId;
    }

    public void setParentId(@Nullable String parentId) {
        this.parentId = parentId;
    }

    public BlockType getType() {
        return type;
    }

    public void setType(BlockType type) {
        this.type = type;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public ImmutableSortedMap<String, String> getAttributes() {
        return attributes;
    }

    public void setAttributes(Map<String, String> attributes) {
        this.attributes = ImmutableSortedMap.copyOf(attributes);
    }

    /**
     * The block this block stands in for. Its own text, attributes and
     * children are the inline fallback.
     */
    @Nullable
    public String getReusableBlockId() {
        return reusableBlockId;
    }

    public void setReusableBlockId(@Nullable String reusableBlockId) {
        this.reusableBlockId = reusableBlockId;
    }
}
