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

package org.docsync.commons;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class PathUtilsTest {

    @Test
    public void parentAndName() {
        assertEquals("/guide", PathUtils.getParentPath("/guide/setup"));
        assertEquals("/", PathUtils.getParentPath("/intro"));
        assertEquals("/", PathUtils.getParentPath("/"));
        assertEquals("docs", PathUtils.getParentPath("docs/intro.md"));
        assertEquals("", PathUtils.getParentPath("intro.md"));

        assertEquals("setup", PathUtils.getName("/guide/setup"));
        assertEquals("intro.md", PathUtils.getName("docs/intro.md"));
        assertEquals("", PathUtils.getName("/"));
    }

    @Test
    public void elements() {
        assertEquals(ImmutableList.of("guide", "setup"), ImmutableList.copyOf(PathUtils.elements("/guide/setup")));
        assertEquals(ImmutableList.of("docs", "a.md"), ImmutableList.copyOf(PathUtils.elements("docs/a.md")));
        assertTrue(ImmutableList.copyOf(PathUtils.elements("/")).isEmpty());
    }

    @Test
    public void concat() {
        assertEquals("/intro", PathUtils.concat("/", "intro"));
        assertEquals("/guide/setup", PathUtils.concat("/guide", "setup"));
        assertEquals("docs", PathUtils.concat("", "docs"));
        assertEquals("/guide", PathUtils.concat("/guide", ""));
        try {
            PathUtils.concat("/guide", "/setup");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void concatRelativePaths() {
        assertEquals("docs/guide/setup.md", PathUtils.concatRelativePaths("docs/", "/guide/setup.md"));
        assertEquals("docs", PathUtils.concatRelativePaths("docs", "", null));
        assertNull(PathUtils.concatRelativePaths("/", ""));
    }

    @Test
    public void ancestors() {
        assertTrue(PathUtils.isAncestor("/", "/intro"));
        assertTrue(PathUtils.isAncestor("/guide", "/guide/setup/linux"));
        assertFalse(PathUtils.isAncestor("/guide", "/guide"));
        assertFalse(PathUtils.isAncestor("/guide", "/guides/setup"));
        assertFalse(PathUtils.isAncestor("/", "/"));
    }

    @Test
    public void relativize() {
        assertEquals("guide/setup.md", PathUtils.relativize("docs", "docs/guide/setup.md"));
        assertEquals("intro", PathUtils.relativize("/", "/intro"));
        assertEquals("", PathUtils.relativize("docs", "docs"));
        try {
            PathUtils.relativize("docs", "other/intro.md");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void validate() {
        assertTrue(PathUtils.isValid("/"));
        assertTrue(PathUtils.isValid("docs/intro.md"));
        assertFalse(PathUtils.isValid("/guide/"));
        assertFalse(PathUtils.isValid("docs//intro.md"));
        try {
            PathUtils.validate("/guide/");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
