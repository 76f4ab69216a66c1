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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.IOException;

import org.junit.Test;

public class ContentExceptionTest {

    @Test
    public void message() {
        ContentException e = new ContentException(ContentException.CONFLICT, 40, "Sync is still running");
        assertEquals("DocSyncConflict0040: Sync is still running", e.getMessage());
        assertEquals(ContentException.DOCSYNC, e.getSource());
        assertEquals(40, e.getCode());
    }

    @Test
    public void types() {
        ContentException e = new ContentException(ContentException.EXTERNAL, 1, "Unreachable", new IOException());
        assertTrue(e.isExternal());
        assertTrue(e.isOfType("External"));
        assertFalse(e.isConflict());
        assertFalse(e.isInternal());
        assertTrue(e.getCause() instanceof IOException);
        assertEquals(ContentException.EXTERNAL, e.getType());
    }
}
