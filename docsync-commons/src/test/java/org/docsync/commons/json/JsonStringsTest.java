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

package org.docsync.commons.json;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

public class JsonStringsTest {

    @Test
    public void encode() {
        assertEquals("\"Getting started\"", JsonStrings.encode("Getting started"));
        assertEquals("\"say \\\"hi\\\"\"", JsonStrings.encode("say \"hi\""));
        assertEquals("\"a\\nb\\tc\"", JsonStrings.encode("a\nb\tc"));
        assertEquals("\"\\u0001\"", JsonStrings.encode("\u0001"));
        assertEquals("\"c:\\\\dir\"", JsonStrings.encode("c:\\dir"));
    }

    @Test
    public void decode() {
        assertEquals("plain", JsonStrings.decode("plain"));
        assertEquals("a\nb", JsonStrings.decode("a\\nb"));
        assertEquals("\u00e9", JsonStrings.decode("\\u00e9"));
        assertEquals("x/y", JsonStrings.decode("x\\/y"));
        assertEquals("say \"hi\"", JsonStrings.decodeQuoted("\"say \\\"hi\\\"\""));
    }

    @Test
    public void decodeRejectsBadEscapes() {
        try {
            JsonStrings.decode("bad\\q");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            JsonStrings.decode("short\\u12");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            JsonStrings.decodeQuoted("unquoted");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void endOfQuoted() {
        String line = "key=\"a \\\" b\" next";
        int end = JsonStrings.endOfQuoted(line, 4);
        assertEquals("\"a \\\" b\"", line.substring(4, end));
        assertEquals("a \" b", JsonStrings.decodeQuoted(line.substring(4, end)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unterminated() {
        JsonStrings.endOfQuoted("\"open", 0);
    }
}
