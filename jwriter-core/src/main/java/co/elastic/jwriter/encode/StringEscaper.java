/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
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
package co.elastic.jwriter.encode;

import com.dslplatform.json.JsonWriter;

import java.util.Objects;

/**
 * Writes JSON string literals which are also safe to embed into HTML and JSONP.
 * <p>
 * On top of what JSON requires, {@code <} and {@code >} are written as six character unicode escapes, and the
 * line and paragraph separators {@code U+2028} and {@code U+2029}, which may not appear in a JavaScript string
 * literal, are always escaped. Malformed input never fails: invalid UTF-8 sequences and unpaired surrogates are
 * replaced by the escaped replacement character {@code U+FFFD}. The solidus {@code /} is not escaped.
 * </p>
 * <p>
 * Input is scanned once. Characters which need no escaping are not copied one by one, the scan only remembers where
 * the current run of such characters started and copies the whole run once an escape or the end of the input is
 * reached.
 * </p>
 */
public final class StringEscaper {

    private static final byte[] HEX = {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'};

    private static final int LINE_SEPARATOR = 0x2028;
    private static final int PARAGRAPH_SEPARATOR = 0x2029;

    /**
     * For each ASCII character: {@code 0} if it is copied as is, {@code 'u'} if it needs the generic six character
     * escape, otherwise the character following the backslash of its short escape.
     */
    private static final byte[] ASCII_ESCAPES = new byte[128];

    static {
        for (int c = 0; c < 0x20; c++) {
            ASCII_ESCAPES[c] = 'u';
        }
        ASCII_ESCAPES['\t'] = 't';
        ASCII_ESCAPES['\r'] = 'r';
        ASCII_ESCAPES['\n'] = 'n';
        ASCII_ESCAPES['\\'] = '\\';
        ASCII_ESCAPES['"'] = '"';
        ASCII_ESCAPES['<'] = 'u';
        ASCII_ESCAPES['>'] = 'u';
    }

    private StringEscaper() {
    }

    public static void writeString(byte[] utf8, JsonWriter jw) {
        writeString(utf8, 0, utf8.length, jw);
    }

    /**
     * Writes {@code utf8[offset, offset + length)} as a quoted JSON string.
     *
     * @param utf8   text encoded as UTF-8, possibly malformed
     * @param offset index of the first byte
     * @param length number of bytes
     * @param jw     the target buffer
     */
    public static void writeString(byte[] utf8, int offset, int length, JsonWriter jw) {
        Objects.checkFromIndexSize(offset, length, utf8.length);
        jw.writeByte(JsonWriter.QUOTE);
        final int end = offset + length;
        // start of the pending run of bytes which are copied verbatim
        int p = offset;
        int i = offset;
        while (i < end) {
            final byte b = utf8[i];
            if (b >= 0) {
                if (ASCII_ESCAPES[b] == 0) {
                    i++;
                    continue;
                }
                flush(utf8, p, i, jw);
                writeAsciiEscape(b, jw);
                p = ++i;
                continue;
            }
            final int codePoint = Utf8.decodeCodePoint(utf8, i, end);
            if (codePoint == Utf8.INVALID) {
                flush(utf8, p, i, jw);
                writeUnicodeEscape(Utf8.REPLACEMENT_CHARACTER, jw);
                p = ++i;
                continue;
            }
            final int width = Utf8.encodedLength(codePoint);
            if (codePoint == LINE_SEPARATOR || codePoint == PARAGRAPH_SEPARATOR) {
                flush(utf8, p, i, jw);
                writeUnicodeEscape(codePoint, jw);
                i += width;
                p = i;
                continue;
            }
            i += width;
        }
        flush(utf8, p, end, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    /**
     * Writes {@code value} as a quoted JSON string, encoded as UTF-8.
     * A surrogate pair is a single code point which is copied as is, an unpaired surrogate is written as
     * the escaped replacement character.
     */
    public static void writeString(CharSequence value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        final int end = value.length();
        int p = 0;
        int i = 0;
        while (i < end) {
            final char c = value.charAt(i);
            if (c < 0x80) {
                if (ASCII_ESCAPES[c] == 0) {
                    i++;
                    continue;
                }
                Utf8.writeChars(value, p, i, jw);
                writeAsciiEscape(c, jw);
                p = ++i;
                continue;
            }
            if (Character.isSurrogate(c)) {
                if (Character.isHighSurrogate(c) && i + 1 < end && Character.isLowSurrogate(value.charAt(i + 1))) {
                    i += 2;
                    continue;
                }
                Utf8.writeChars(value, p, i, jw);
                writeUnicodeEscape(Utf8.REPLACEMENT_CHARACTER, jw);
                p = ++i;
                continue;
            }
            if (c == LINE_SEPARATOR || c == PARAGRAPH_SEPARATOR) {
                Utf8.writeChars(value, p, i, jw);
                writeUnicodeEscape(c, jw);
                p = ++i;
                continue;
            }
            i++;
        }
        Utf8.writeChars(value, p, end, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    private static void flush(byte[] utf8, int from, int to, JsonWriter jw) {
        if (to > from) {
            jw.writeRaw(utf8, from, to - from);
        }
    }

    private static void writeAsciiEscape(int c, JsonWriter jw) {
        final byte escape = ASCII_ESCAPES[c];
        if (escape == 'u') {
            writeUnicodeEscape(c, jw);
        } else {
            jw.writeByte(JsonWriter.ESCAPE);
            jw.writeByte(escape);
        }
    }

    private static void writeUnicodeEscape(int c, JsonWriter jw) {
        jw.writeByte(JsonWriter.ESCAPE);
        jw.writeByte((byte) 'u');
        jw.writeByte(HEX[(c >> 12) & 0xF]);
        jw.writeByte(HEX[(c >> 8) & 0xF]);
        jw.writeByte(HEX[(c >> 4) & 0xF]);
        jw.writeByte(HEX[c & 0xF]);
    }
}
