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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.docsync.api.ContentException;
import org.docsync.api.content.BlockType;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.PageContent;
import org.junit.Test;

public class MarkdownParserTest {

    @Test
    public void handWrittenMarkdown() throws ContentException {
        String markdown = "# Setup\r\n"
                + "\r\n"
                + "Install the tool\r\n"
                + "  and run it.\r\n"
                + "## Options\r\n"
                + "> note\r\n"
                + "```java\r\n"
                + "class A {}\r\n"
                + "```\r\n"
                + "***\r\n";
        PageContent content = MarkdownParser.parse(markdown, "setup");
        PageContent expected = PageContent.of("Setup",
                ContentBlock.heading(1, "Setup"),
                ContentBlock.paragraph("Install the tool\nand run it."),
                ContentBlock.heading(2, "Options"),
                ContentBlock.of(BlockType.BLOCKQUOTE, "note"),
                ContentBlock.of(BlockType.CODE_BLOCK, "class A {}").withAttribute("language", "java"),
                ContentBlock.of(BlockType.DIVIDER, ""));
        assertEquals(expected, content);
    }

    @Test
    public void lineEndings() {
        assertTrue(MarkdownParser.usesCrLf("# A\r\n\r\ntext\r\n"));
        assertFalse(MarkdownParser.usesCrLf("# A\n\ntext\r\n"));
        assertFalse(MarkdownParser.usesCrLf("\n"));
        assertFalse(MarkdownParser.usesCrLf("no line feed\r"));
    }

    @Test
    public void titleSources() throws ContentException {
        assertEquals("Front", MarkdownParser.parse("---\ntitle: \"Front\"\n---\n# Heading\n", "d").getTitle());
        assertEquals("Single", MarkdownParser.parse("---\ntitle: 'Single'\nother: x\n---\n", "d").getTitle());
        assertEquals("Bare words", MarkdownParser.parse("---\ntitle: Bare words\n---\n", "d").getTitle());
        assertEquals("Heading", MarkdownParser.parse("Text\n\n# Heading\n", "d").getTitle());
        assertEquals("Default", MarkdownParser.parse("## Not a title\n", "Default").getTitle());
        assertEquals("Default", MarkdownParser.parse("", "Default").getTitle());
    }

    @Test
    public void leadingDividerIsNotFrontMatter() throws ContentException {
        PageContent content = MarkdownParser.parse("---\nplain text\n", "d");
        assertEquals(2, content.getBlockCount());
        assertEquals(BlockType.DIVIDER, content.getBlocks().get(0).getType());
    }

    @Test
    public void unterminatedCodeFence() throws ContentException {
        PageContent content = MarkdownParser.parse("```\nopen\n", "d");
        assertEquals(PageContent.of("d", ContentBlock.of(BlockType.CODE_BLOCK, "open")), content);
    }

    @Test
    public void malformedDirectives() {
        String[] broken = {
                ":::hint_info\nnever closed\n",
                ":::no_such_type\n:::\n",
                ":::hint_info label\n:::\n",
                ":::hint_info label=\"open\n:::\n",
                ":::hint_info Bad=\"x\"\n:::\n",
                ":::hint_info\n:: stray\n:::\n",
        };
        for (String markdown : broken) {
            try {
                MarkdownParser.parse(markdown, "d");
                fail("expected ContentException for " + markdown);
            } catch (ContentException e) {
                assertTrue(e.isValidation());
                assertEquals(31, e.getCode());
            }
        }
    }

    @Test
    public void invalidFrontMatterValue() {
        try {
            MarkdownParser.parse("---\ntitle: \"open\n---\n", "d");
            fail("expected ContentException");
        } catch (ContentException e) {
            assertEquals(30, e.getCode());
        }
    }
}
