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

package org.docsync.stats;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class ClockTest {

    @Test
    public void virtualClockOnlyMovesWhenAdvanced() {
        Clock.Virtual clock = new Clock.Virtual(1000);
        assertEquals(1000, clock.getTime());
        clock.advance(2, TimeUnit.SECONDS);
        assertEquals(3000, clock.getTime());
        clock.waitUntil(2000);
        assertEquals(3000, clock.getTime());
        clock.waitUntil(5000);
        assertEquals(5000, clock.getTime());
    }

    @Test
    public void monotonicNeverGoesBack() {
        Clock.Virtual clock = new Clock.Virtual(1000);
        assertEquals(1000, clock.getTimeMonotonic());
        Clock.Virtual other = new Clock.Virtual(500) {
            private boolean first = true;

            @Override
            public synchronized long getTime() {
                if (first) {
                    first = false;
                    return 800;
                }
                return 600;
            }
        };
        assertEquals(800, other.getTimeMonotonic());
        assertEquals(800, other.getTimeMonotonic());
    }

    @Test
    public void simpleClockFollowsSystemTime() {
        long before = System.currentTimeMillis();
        long now = Clock.SIMPLE.getTime();
        assertTrue(now >= before);
    }
}
