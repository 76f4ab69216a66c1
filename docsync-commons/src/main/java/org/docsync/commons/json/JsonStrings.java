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

import org.jetbrains.annotations.NotNull;

/**
 * Encoding and decoding of JSON string literals. Used wherever a free-form
 * value (a title, an attribute) has to be embedded in a single line of text.
 */
public final class JsonStrings {

    private JsonStrings() {
    }

    /**
     * Encode a string as a quoted JSON string literal.
     *
     * @param s the string
     * @return the quoted and escaped string
     */
    @NotNull
    public static String encode(@NotNull String s) {
        StringBuilder buff = new StringBuilder(s.length() + 2);
        buff.append('"');
        escape(s, buff);
        return buff.append('"').toString();
    }

    /**
     * Escape a string into the target buffer. Control characters, quotes and
     * backslashes are escaped; everything else is copied as is.
     */
    public static void escape(@NotNull String s, @NotNull StringBuilder buff) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    buff.append("\\\"");
                    break;
                case '\\':
                    buff.append("\\\\");
                    break;
                case '\b':
                    buff.append("\\b");
                    break;
                case '\f':
                    buff.append("\\f");
                    break;
                case '\n':
                    buff.append("\\n");
                    break;
                case '\r':
                    buff.append("\\r");
                    break;
                case '\t':
                    buff.append("\\t");
                    break;
                default:
                    if (c < ' ') {
                        buff.append(String.format("\\u%04x", (int) c));
                    } else {
                        buff.append(c);
                    }
            }
        }
    }

    /**
     * Decode a quoted JSON string literal.
     *
     * @param s the string including the surrounding quotes
     * @return the decoded string
     * @throws IllegalArgumentException if the string is not a quoted literal
     */
    @NotNull
    public static String decodeQuoted(@NotNull String s) {
        if (s.length() < 2 || s.charAt(0) != '"' || s.charAt(s.length() - 1) != '"') {
            throw new IllegalArgumentException("Not a quoted string: " + s);
        }
        return decode(s.substring(1, s.length() - 1));
    }

    /**
     * Returns the index just past the closing quote of the string literal
     * starting at {@code start}.
     *
     * @throws IllegalArgumentException if there is no literal at {@code start}
     *         or it is not terminated
     */
    public static int endOfQuoted(@NotNull String s, int start) {
        if (start >= s.length() || s.charAt(start) != '"') {
            throw new IllegalArgumentException("Expected '\"' at " + start + " in: " + s);
        }
        for (int i = start + 1; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                return i + 1;
            }
        }
        throw new IllegalArgumentException("Unterminated string in: " + s);
    }

    /**
     * Decode the escape sequences of an unquoted JSON string.
     */
    @NotNull
    public static String decode(@NotNull String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        int length = s.length();
        StringBuilder buff = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                if (i + 1 >= length) {
                    throw getFormatException(s, i);
                }
                c = s.charAt(++i);
                switch (c) {
                    case '"':
                        buff.append('"');
                        break;
                    case '\\':
                        buff.append('\\');
                        break;
                    case '/':
                        buff.append('/');
                        break;
                    case 'b':
                        buff.append('\b');
                        break;
                    case 'f':
                        buff.append('\f');
                        break;
                    case 'n':
                        buff.append('\n');
                        break;
                    case 'r':
                        buff.append('\r');
                        break;
                    case 't':
                        buff.append('\t');
                        break;
                    case 'u': {
                        if (i + 5 > length) {
                            throw getFormatException(s, i);
                        }
                        try {
                            c = (char) (Integer.parseInt(s.substring(i + 1, i + 5), 16));
                        } catch (NumberFormatException e) {
                            throw getFormatException(s, i);
                        }
                        i += 4;
                        buff.append(c);
                        break;
                    }
                    default:
                        throw getFormatException(s, i);
                }
            } else {
                buff.append(c);
            }
        }
        return buff.toString();
    }

    private static IllegalArgumentException getFormatException(String s, int i) {
        return new IllegalArgumentException(s.substring(0, i) + "[*]" + s.substring(i));
    }
}
