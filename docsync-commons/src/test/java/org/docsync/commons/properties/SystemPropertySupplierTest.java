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

package org.docsync.commons.properties;

import static org.junit.Assert.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.Test;
import org.slf4j.LoggerFactory;

public class SystemPropertySupplierTest {

    @Test
    public void testBoolean() {
        assertEquals(Boolean.TRUE, SystemPropertySupplier.create("foo", Boolean.TRUE).usingSystemPropertyReader((n) -> null).get());
        assertEquals(Boolean.TRUE,
                SystemPropertySupplier.create("foo", Boolean.FALSE).usingSystemPropertyReader((n) -> "true").get());
        assertEquals(Boolean.FALSE,
                SystemPropertySupplier.create("foo", Boolean.TRUE).usingSystemPropertyReader((n) -> "false").get());
    }

    @Test
    public void testInteger() {
        assertEquals(Integer.valueOf(5),
                SystemPropertySupplier.create("docsync.git.maxAttempts", 5).usingSystemPropertyReader((n) -> null).get());
        assertEquals(Integer.valueOf(7),
                SystemPropertySupplier.create("docsync.git.maxAttempts", 5).usingSystemPropertyReader((n) -> " 7 ").get());
    }

    @Test
    public void testLong() {
        assertEquals(Long.valueOf(900000L),
                SystemPropertySupplier.create("foo", 900000L).usingSystemPropertyReader((n) -> null).get());
        assertEquals(Long.valueOf(1742L),
                SystemPropertySupplier.create("foo", 900000L).usingSystemPropertyReader((n) -> "1742").get());
    }

    @Test
    public void testString() {
        assertEquals("main", SystemPropertySupplier.create("foo", "main").usingSystemPropertyReader((n) -> null).get());
        assertEquals("develop", SystemPropertySupplier.create("foo", "main").usingSystemPropertyReader((n) -> "develop").get());
    }

    @Test
    public void testMalformedValueFallsBackToDefault() {
        assertEquals(Long.valueOf(200L),
                SystemPropertySupplier.create("foo", 200L).usingSystemPropertyReader((n) -> "soon").get());
    }

    @Test
    public void testFilter() {
        Logger logger = (Logger) LoggerFactory.getLogger(SystemPropertySupplierTest.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<ILoggingEvent>();
        appender.start();
        logger.addAppender(appender);
        try {
            int positive = SystemPropertySupplier.create("foo", Integer.valueOf(123)).loggingTo(logger)
                    .usingSystemPropertyReader((n) -> "-1").validateWith(n -> n >= 0).get();
            assertEquals(123, positive);
            assertEquals(1, appender.list.size());
            assertEquals(Level.ERROR, appender.list.get(0).getLevel());
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedType() {
        SystemPropertySupplier.create("foo", 1.5d);
    }
}
