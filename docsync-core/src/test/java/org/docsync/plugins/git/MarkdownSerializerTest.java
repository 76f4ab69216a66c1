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

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.docsync.api.ContentException;
import org.docsync.api.content.BlockType;
import org.docsync.api.content.ContentBlock;
import org.docsync.api.content.PageContent;
import org.junit.Test;

public class MarkdownSerializerTest {

    private final MarkdownSerializer serializer = new MarkdownSerializer();

    @Test
    public void plainMarkdown() {
        PageContent content = PageContent.of("Getting started",
                ContentBlock.heading(1, "Install"),
                ContentBlock.paragraph("Run the installer.\nThen restart."),
                ContentBlock.of(BlockType.CODE_BLOCK, "mvn install").withAttribute("language", "sh"),
                ContentBlock.of(BlockType.BLOCKQUOTE, "Quoted\n\ntext"),
                ContentBlock.of(BlockType.DIVIDER, ""));
        String expected = "---\n"
                + "title: \"Getting started\"\n"
                + "---\n"
                + "\n"
                + "# Install\n"
                + "\n"
                + "Run the installer.\nThen restart.\n"
                + "\n"
                + "```sh\nmvn install\n```\n"
                + "\n"
                + "> Quoted\n>\n> text\n"
                + "\n"
                + "---\n";
        assertEquals(expected, serializer.serialize(content));
    }

    @Test
    public void directives() {
        ContentBlock tab = ContentBlock.of(BlockType.PARAGRAPH, "Tab body");
        PageContent content = PageContent.of("Tabs",
                ContentBlock.of(BlockType.HINT_WARNING, "Careful\n:not a fence"),
                ContentBlock.of(BlockType.TABS, "").withAttribute("label", "Say \"hi\"")
                        .withChildren(asList(tab)),
                ContentBlock.reference("snippet-1", ContentBlock.paragraph("fallback")));
        String expected = "---\n"
                + "title: \"Tabs\"\n"
                + "---\n"
                + "\n"
                + ":::hint_warning\nCareful\n\\:not a fence\n:::\n"
                + "\n"
                + ":::tabs label=\"Say \\\"hi\\\"\"\n::::paragraph\nTab body\n::::\n:::\n"
                + "\n"
                + ":::reusable_block ref=\"snippet-1\"\nfallback\n:::\n";
        assertEquals(expected, serializer.serialize(content));
    }

    @Test
    public void unsafeParagraphsBecomeDirectives() throws ContentException {
        PageContent content = PageContent.of("List",
                ContentBlock.paragraph("- not a list"),
                ContentBlock.paragraph("  indented"),
                ContentBlock.paragraph("two\n\nparagraphs"),
                ContentBlock.heading(2, ""),
                ContentBlock.of(BlockType.CODE_BLOCK, "```\nnested\n```"));
        String markdown = serializer.serialize(content);
        assertEquals(content, MarkdownParser.parse(markdown, "ignored"));
    }

    @Test
    public void nestedContentSurvivesParsing() throws ContentException {
        ContentBlock inner = ContentBlock.of(BlockType.TOGGLE, "Inner")
                .withChildren(asList(ContentBlock.of(BlockType.MATH, "e = mc^2")));
        PageContent content = PageContent.of("Nested é",
                ContentBlock.of(BlockType.TOGGLE, "Outer\n\\escaped").withChildren(asList(inner)),
                ContentBlock.of(BlockType.IMAGE, "").withAttribute("src", "a.png").withAttribute("alt", "A"));
        assertEquals(content, MarkdownParser.parse(serializer.serialize(content), "ignored"));
    }

    @Test
    public void carriageReturnsInTextSurviveParsing() throws ContentException {
        PageContent content = PageContent.of("Line endings",
                ContentBlock.paragraph("windows\r\nline"),
                ContentBlock.of(BlockType.CODE_BLOCK, "one\r\ntwo"));
        String markdown = serializer.serialize(content);
        assertFalse(MarkdownParser.usesCrLf(markdown));
        assertEquals(content, MarkdownParser.parse(markdown, "ignored"));
    }
}
