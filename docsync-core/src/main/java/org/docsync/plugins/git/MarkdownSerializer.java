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

package org.docsync.plugins.git;

import java.util.Map;
import java.util.regex.Pattern;

import com.google.common.base.Strings;
import org.docsync.api.content.BlockType;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.PageContent;
import org.docsync.commons.json.JsonStrings;
import org.jetbrains.annotations.NotNull;

/**
 * Writes page content as Markdown with directives.
 * <pre>
 * ---
 * title: "Getting started"
 * ---
 *
 * # Install
 *
 * :::hint_info
 * Requires Java 17.
 * :::
 * </pre>
 * Top level headings, paragraphs, code blocks, block quotes and dividers are
 * written as plain Markdown if {@link MarkdownParser} reads them back to the
 * same block. Everything else, nested blocks included, is written as a
 * directive: an opening fence {@code :::type key="value"}, the text lines,
 * the child directives (fenced with one more colon) and a closing fence.
 * Text lines starting with {@code :} or {@code \} are escaped with a
 * leading {@code \}. Attribute values and the reusable block reference
 * ({@code ref}) are JSON string literals.
 */
public class MarkdownSerializer {

    static final String FRONT_MATTER = "---";

    static final String TITLE_KEY = "title";

    static final String FENCE = ":::";

    static final String CODE_FENCE = "```";

    static final String LANGUAGE = "language";

    private static final Pattern LANGUAGE_NAME = Pattern.compile("[A-Za-z0-9_+#.-]+");

    private static final String UNSAFE_PARAGRAPH_START = "#>:\\`-*+|![<~=_";

    @NotNull
    public String serialize(@NotNull PageContent content) {
        StringBuilder buff = new StringBuilder();
        buff.append(FRONT_MATTER).append('\n');
        buff.append(TITLE_KEY).append(": ").append(JsonStrings.encode(content.getTitle())).append('\n');
        buff.append(FRONT_MATTER).append('\n');
        for (ContentBlock block : content.getBlocks()) {
            buff.append('\n');
            writeTopLevel(block, buff);
        }
        return buff.toString();
    }

    private static void writeTopLevel(ContentBlock block, StringBuilder buff) {
        if (isSimple(block)) {
            BlockType type = block.getType();
            String text = block.getText();
            if (type.getHeadingLevel() > 0 && isPlainHeading(text)) {
                buff.append(Strings.repeat("#", type.getHeadingLevel())).append(' ').append(text).append('\n');
                return;
            } else if (type == BlockType.PARAGRAPH && isPlainParagraph(text)) {
                buff.append(text).append('\n');
                return;
            } else if (type == BlockType.BLOCKQUOTE && !text.isEmpty()) {
                for (String line : lines(text)) {
                    buff.append(line.isEmpty() ? ">" : "> " + line).append('\n');
                }
                return;
            } else if (type == BlockType.DIVIDER && text.isEmpty() && block.getAttributes().isEmpty()) {
                buff.append(FRONT_MATTER).append('\n');
                return;
            }
        }
        if (isPlainCode(block)) {
            String language = block.getAttribute(LANGUAGE);
            buff.append(CODE_FENCE).append(language == null ? "" : language).append('\n');
            for (String line : lines(block.getText())) {
                buff.append(line).append('\n');
            }
            buff.append(CODE_FENCE).append('\n');
            return;
        }
        writeDirective(block, 3, buff);
    }

    private static void writeDirective(ContentBlock block, int depth, StringBuilder buff) {
        String fence = Strings.repeat(":", depth);
        buff.append(fence).append(block.getType().getName());
        if (block.getReusableBlockId() != null) {
            buff.append(' ').append(ContentBlock.REF).append('=').append(JsonStrings.encode(block.getReusableBlockId()));
        }
        for (Map.Entry<String, String> e : block.getAttributes().entrySet()) {
            buff.append(' ').append(e.getKey()).append('=').append(JsonStrings.encode(e.getValue()));
        }
        buff.append('\n');
        for (String line : lines(block.getText())) {
            if (line.startsWith(":") || line.startsWith("\\")) {
                buff.append('\\');
            }
            buff.append(line).append('\n');
        }
        for (ContentBlock child : block.getChildren()) {
            writeDirective(child, depth + 1, buff);
        }
        buff.append(fence).append('\n');
    }

    /**
     * Lines of a text. The empty text has no lines, any other text at least
     * one, so the two can be told apart when reading.
     */
    static String[] lines(String text) {
        return text.isEmpty() ? new String[0] : text.split("\n", -1);
    }

    private static boolean isSimple(ContentBlock block) {
        return block.getAttributes().isEmpty()
                && block.getReusableBlockId() == null
                && block.getChildren().isEmpty();
    }

    private static boolean isPlainHeading(String text) {
        return !text.isEmpty() && text.indexOf('\n') < 0 && text.equals(text.trim());
    }

    private static boolean isPlainParagraph(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (String line : lines(text)) {
            if (line.trim().isEmpty() || !line.equals(line.trim())
                    || UNSAFE_PARAGRAPH_START.indexOf(line.charAt(0)) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isPlainCode(ContentBlock block) {
        if (block.getType() != BlockType.CODE_BLOCK
                || block.getReusableBlockId() != null
                || !block.getChildren().isEmpty()) {
            return false;
        }
        Map<String, String> attributes = block.getAttributes();
        String language = attributes.get(LANGUAGE);
        if (attributes.size() > (language == null ? 0 : 1)) {
            return false;
        }
        if (language != null && !LANGUAGE_NAME.matcher(language).matches()) {
            return false;
        }
        for (String line : lines(block.getText())) {
            if (line.startsWith(CODE_FENCE)) {
                return false;
            }
        }
        return true;
    }
}
