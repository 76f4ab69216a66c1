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

import static com.google.common.collect.Lists.newArrayList;
import static org.docsync.api.ContentException.VALIDATION;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import org.docsync.api.ContentException;
import org.docsync.api.content.BlockType;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.PageContent;
import org.docsync.commons.json.JsonStrings;
import org.jetbrains.annotations.NotNull;

/**
 * Reads the Markdown written by {@link MarkdownSerializer}, and the plain
 * Markdown subset people write by hand, back into page content.
 * <p>
 * The title is taken from the front matter, then from the first level one
 * heading, and finally falls back to the given default title. Unterminated
 * code fences are closed at the end of the file. Directives must be well
 * formed.
 */
public class MarkdownParser {

    private static final Joiner LINES = Joiner.on('\n');

    private final String[] lines;

    private int pos;

    private MarkdownParser(String markdown) {
        String text = usesCrLf(markdown) ? markdown.replace("\r\n", "\n") : markdown;
        this.lines = text.split("\n", -1);
    }

    /**
     * Whether every line of the text ends with CR LF. Otherwise a CR before
     * a line feed is part of the text.
     */
    static boolean usesCrLf(String text) {
        int lf = text.indexOf('\n');
        if (lf < 0) {
            return false;
        }
        for (; lf >= 0; lf = text.indexOf('\n', lf + 1)) {
            if (lf == 0 || text.charAt(lf - 1) != '\r') {
                return false;
            }
        }
        return true;
    }

    /**
     * Parses a file.
     *
     * @param markdown the file contents
     * @param defaultTitle title to use if the file does not declare one
     * @throws ContentException Validation if a directive is malformed
     */
    @NotNull
    public static PageContent parse(@NotNull String markdown, @NotNull String defaultTitle)
            throws ContentException {
        return new MarkdownParser(markdown).read(defaultTitle);
    }

    private PageContent read(String defaultTitle) throws ContentException {
        String title = readFrontMatter();
        List<ContentBlock> blocks = newArrayList();
        while (pos < lines.length) {
            String line = lines[pos];
            if (line.trim().isEmpty()) {
                pos++;
            } else {
                blocks.add(readBlock(line));
            }
        }
        if (title == null) {
            for (ContentBlock block : blocks) {
                if (block.getType() == BlockType.HEADING_1 && !block.getText().isEmpty()) {
                    title = block.getText();
                    break;
                }
            }
        }
        return new PageContent(title == null ? defaultTitle : title, blocks);
    }

    private String readFrontMatter() throws ContentException {
        if (lines.length == 0 || !MarkdownSerializer.FRONT_MATTER.equals(lines[0])) {
            return null;
        }
        String title = null;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (MarkdownSerializer.FRONT_MATTER.equals(line)) {
                pos = i + 1;
                return title;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                // not front matter, the file starts with a divider
                return null;
            }
            if (MarkdownSerializer.TITLE_KEY.equals(line.substring(0, colon).trim())) {
                title = value(line.substring(colon + 1).trim());
            }
        }
        return null;
    }

    private static String value(String raw) throws ContentException {
        if (raw.startsWith("\"")) {
            try {
                return JsonStrings.decodeQuoted(raw);
            } catch (IllegalArgumentException e) {
                throw new ContentException(VALIDATION, 30, "Invalid front matter value: " + raw, e);
            }
        }
        if (raw.length() >= 2 && raw.startsWith("'") && raw.endsWith("'")) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }

    private ContentBlock readBlock(String line) throws ContentException {
        if (line.startsWith(MarkdownSerializer.FENCE)) {
            return readDirective(3);
        } else if (line.startsWith(MarkdownSerializer.CODE_FENCE)) {
            return readCode();
        } else if (isDivider(line)) {
            pos++;
            return ContentBlock.of(BlockType.DIVIDER, "");
        } else if (line.startsWith(">")) {
            return readQuote();
        }
        int level = headingLevel(line);
        if (level > 0) {
            pos++;
            return ContentBlock.heading(level, line.substring(level).trim());
        }
        return readParagraph();
    }

    private static boolean isDivider(String line) {
        String s = line.trim();
        return "---".equals(s) || "***".equals(s) || "___".equals(s);
    }

    private static int headingLevel(String line) {
        int level = 0;
        while (level < line.length() && line.charAt(level) == '#') {
            level++;
        }
        if (level == 0 || level > 6) {
            return 0;
        }
        if (level < line.length() && line.charAt(level) != ' ' && line.charAt(level) != '\t') {
            return 0;
        }
        return level;
    }

    private static boolean startsBlock(String line) {
        return line.startsWith(MarkdownSerializer.FENCE)
                || line.startsWith(MarkdownSerializer.CODE_FENCE)
                || line.startsWith(">")
                || isDivider(line)
                || headingLevel(line) > 0;
    }

    private ContentBlock readParagraph() {
        List<String> text = newArrayList();
        text.add(lines[pos++].trim());
        while (pos < lines.length && !lines[pos].trim().isEmpty() && !startsBlock(lines[pos])) {
            text.add(lines[pos++].trim());
        }
        return ContentBlock.paragraph(LINES.join(text));
    }

    private ContentBlock readQuote() {
        List<String> text = newArrayList();
        while (pos < lines.length && lines[pos].startsWith(">")) {
            String line = lines[pos++];
            text.add(line.startsWith("> ") ? line.substring(2) : line.substring(1));
        }
        return ContentBlock.of(BlockType.BLOCKQUOTE, LINES.join(text));
    }

    private ContentBlock readCode() {
        String language = lines[pos++].substring(MarkdownSerializer.CODE_FENCE.length()).trim();
        List<String> text = newArrayList();
        while (pos < lines.length && !lines[pos].startsWith(MarkdownSerializer.CODE_FENCE)) {
            text.add(lines[pos++]);
        }
        if (pos < lines.length) {
            pos++;
        } else {
            // unterminated fence; drop the line break ending the file
            while (!text.isEmpty() && text.get(text.size() - 1).isEmpty()) {
                text.remove(text.size() - 1);
            }
        }
        ContentBlock block = ContentBlock.of(BlockType.CODE_BLOCK, LINES.join(text));
        return language.isEmpty() ? block : block.withAttribute(MarkdownSerializer.LANGUAGE, language);
    }

    private ContentBlock readDirective(int depth) throws ContentException {
        String fence = Strings.repeat(":", depth);
        int start = pos;
        String header = lines[pos++];
        if (!header.startsWith(fence) || header.length() == depth || header.charAt(depth) == ':') {
            throw error(start, "Expected a directive opening with " + fence);
        }
        int end = header.indexOf(' ', depth);
        String name = end < 0 ? header.substring(depth) : header.substring(depth, end);
        BlockType type = BlockType.fromName(name);
        if (type == null) {
            throw error(start, "Unknown block type '" + name + "'");
        }
        Map<String, String> attributes = new TreeMap<String, String>();
        String ref = null;
        int i = end < 0 ? header.length() : end;
        while (i < header.length()) {
            if (header.charAt(i) == ' ') {
                i++;
                continue;
            }
            int eq = header.indexOf('=', i);
            if (eq < 0) {
                throw error(start, "Expected key=\"value\"");
            }
            String key = header.substring(i, eq);
            int valueEnd;
            String value;
            try {
                valueEnd = JsonStrings.endOfQuoted(header, eq + 1);
                value = JsonStrings.decode(header.substring(eq + 2, valueEnd - 1));
            } catch (IllegalArgumentException e) {
                throw error(start, e.getMessage());
            }
            if (ContentBlock.REF.equals(key)) {
                ref = value;
            } else if (ContentBlock.isValidAttributeName(key)) {
                attributes.put(key, value);
            } else {
                throw error(start, "Invalid attribute name '" + key + "'");
            }
            i = valueEnd;
        }

        List<String> text = newArrayList();
        List<ContentBlock> children = newArrayList();
        String childFence = fence + ":";
        while (true) {
            if (pos >= lines.length) {
                throw error(start, "Unterminated directive " + name);
            }
            String line = lines[pos];
            if (line.equals(fence)) {
                pos++;
                break;
            } else if (line.startsWith(childFence)) {
                children.add(readDirective(depth + 1));
            } else if (line.startsWith(":")) {
                throw error(pos, "Unexpected fence inside directive " + name);
            } else {
                text.add(line.startsWith("\\") ? line.substring(1) : line);
                pos++;
            }
        }
        return new ContentBlock(type, LINES.join(text), attributes, ref, children);
    }

    private static ContentException error(int line, String message) {
        return new ContentException(VALIDATION, 31, "Line " + (line + 1) + ": " + message);
    }
}
