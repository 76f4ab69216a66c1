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

package org.docsync.plugins.tree;

import static com.google.common.collect.Lists.newArrayList;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import org.docsync.api.content.Block;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.PageContent;
import org.docsync.spi.store.StoreSession;
import org.jetbrains.annotations.NotNull;

/**
 * Converts between the stored blocks of a page (flat, linked through parent
 * ids) and the nested {@link PageContent} value.
 */
public final class BlockTrees {

    private static final Comparator<Block> BY_POSITION = new Comparator<Block>() {
        @Override
        public int compare(Block a, Block b) {
            return Integer.compare(a.getPosition(), b.getPosition());
        }
    };

    private BlockTrees() {
    }

    /**
     * Flattens content into blocks with new ids, parents before children.
     */
    @NotNull
    public static List<Block> toBlocks(@NotNull String pageId, @NotNull List<ContentBlock> content,
                                       @NotNull StoreSession session) {
        List<Block> blocks = newArrayList();
        flatten(pageId, null, content, session, blocks);
        return blocks;
    }

    private static void flatten(String pageId, String parentId, List<ContentBlock> content,
                                StoreSession session, List<Block> target) {
        int position = 0;
        for (ContentBlock value : content) {
            Block block = new Block();
            block.setId(session.newId());
            block.setPageId(pageId);
            block.setParentId(parentId);
            block.setPosition(position++);
            block.setType(value.getType());
            block.setText(value.getText());
            block.setAttributes(value.getAttributes());
            block.setReusableBlockId(value.getReusableBlockId());
            target.add(block);
            flatten(pageId, block.getId(), value.getChildren(), session, target);
        }
    }

    /**
     * Rebuilds the nested content from stored blocks.
     */
    @NotNull
    public static PageContent toContent(@NotNull String title, @NotNull List<Block> blocks) {
        ListMultimap<String, Block> children = ArrayListMultimap.create();
        for (Block block : blocks) {
            children.put(block.getParentId() == null ? "" : block.getParentId(), block);
        }
        return new PageContent(title, build("", children));
    }

    private static List<ContentBlock> build(String parentKey, ListMultimap<String, Block> children) {
        List<Block> level = newArrayList(children.get(parentKey));
        Collections.sort(level, BY_POSITION);
        List<ContentBlock> result = newArrayList();
        for (Block block : level) {
            result.add(new ContentBlock(block.getType(), block.getText(), block.getAttributes(),
                    block.getReusableBlockId(), build(block.getId(), children)));
        }
        return result;
    }
}
