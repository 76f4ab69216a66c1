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

import java.util.Date;
import java.util.concurrent.TimeUnit;

/**
 * Mechanism for keeping track of time at millisecond accuracy.
 */
public abstract class Clock {

    private long monotonic = 0;

    /**
     * Returns the current time in milliseconds since the epoch.
     *
     * @see System#currentTimeMillis()
     * @return current time in milliseconds since the epoch
     */
    public abstract long getTime();

    /**
     * Returns a monotonically increasing timestamp based on the current time.
     * A call to this method will always return a value that is greater than
     * or equal to a value returned by any previous call, even when the system
     * time is adjusted backwards.
     *
     * @return monotonically increasing timestamp
     */
    public synchronized long getTimeMonotonic() {
        long now = getTime();
        if (now > monotonic) {
            monotonic = now;
        } else {
            now = monotonic;
        }
        return now;
    }

    public Date getDate() {
        return new Date(getTime());
    }

    /**
     * Simple clock implementation based on {@link System#currentTimeMillis()}.
     */
    public static final Clock SIMPLE = new Clock() {
        @Override
        public long getTime() {
            return System.currentTimeMillis();
        }

        @Override
        public String toString() {
            return "Clock.SIMPLE";
        }
    };

    /**
     * A virtual clock that has no connection to the actual system time.
     * Time only moves when {@link #waitUntil(long)} or {@link #advance(long, TimeUnit)}
     * is called.
     */
    public static class Virtual extends Clock {

        private long time;

        public Virtual() {
            this(0);
        }

        public Virtual(long start) {
            this.time = start;
        }

        @Override
        public synchronized long getTime() {
            return time;
        }

        public synchronized void waitUntil(long timestamp) {
            if (timestamp > time) {
                time = timestamp;
            }
        }

        public synchronized void advance(long amount, TimeUnit unit) {
            time += unit.toMillis(amount);
        }

        @Override
        public String toString() {
            return "Clock.Virtual";
        }
    }
}
