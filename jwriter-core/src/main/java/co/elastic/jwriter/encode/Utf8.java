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

/**
 * UTF-8 decoding and encoding primitives working directly on byte arrays and a dsl-json {@link JsonWriter}.
 * <p>
 * Decoding is strict: overlong forms, encoded UTF-16 surrogates, code points above {@code U+10FFFF} and sequences
 * cut short by the end of the input are all reported as {@link #INVALID}.
 * </p>
 */
public final class Utf8 {

    /**
     * Returned by {@link #decodeCodePoint(byte[], int, int)} when the bytes at the given index do not start a
     * well-formed UTF-8 sequence.
     */
    public static final int INVALID = -1;

    public static final int REPLACEMENT_CHARACTER = 0xFFFD;

    private static final int MAX_ENCODED_LENGTH = 4;
    private static final int SCRATCH_BUFFER_SIZE = 512;
    private static final ThreadLocal<byte[]> scratchBuffer = new ThreadLocal<byte[]>();

    private Utf8() {
    }

    /**
     * Decodes the code point starting at {@code index}.
     *
     * @param buf   the UTF-8 input
     * @param index position of the first byte of the sequence
     * @param end   exclusive end of the readable input
     * @return the code point, or {@link #INVALID}
     */
    public static int decodeCodePoint(byte[] buf, int index, int end) {
        if (index >= end) {
            return INVALID;
        }
        final int b0 = buf[index] & 0xFF;
        if (b0 < 0x80) {
            return b0;
        }
        if (b0 < 0xC2) {
            // continuation byte, or lead byte of an overlong two byte form
            return INVALID;
        }
        if (b0 < 0xE0) {
            if (end - index < 2) {
                return INVALID;
            }
            final int b1 = buf[index + 1] & 0xFF;
            if (!isContinuation(b1, 0x80, 0xBF)) {
                return INVALID;
            }
            return ((b0 & 0x1F) << 6) | (b1 & 0x3F);
        }
        if (b0 < 0xF0) {
            if (end - index < 3) {
                return INVALID;
            }
            final int b1 = buf[index + 1] & 0xFF;
            final int b2 = buf[index + 2] & 0xFF;
            // E0 would be overlong below A0, ED would encode a surrogate above 9F
            if (!isContinuation(b1, b0 == 0xE0 ? 0xA0 : 0x80, b0 == 0xED ? 0x9F : 0xBF)
                || !isContinuation(b2, 0x80, 0xBF)) {
                return INVALID;
            }
            return ((b0 & 0x0F) << 12) | ((b1 & 0x3F) << 6) | (b2 & 0x3F);
        }
        if (b0 < 0xF5) {
            if (end - index < 4) {
                return INVALID;
            }
            final int b1 = buf[index + 1] & 0xFF;
            final int b2 = buf[index + 2] & 0xFF;
            final int b3 = buf[index + 3] & 0xFF;
            // F0 would be overlong below 90, F4 would exceed U+10FFFF above 8F
            if (!isContinuation(b1, b0 == 0xF0 ? 0x90 : 0x80, b0 == 0xF4 ? 0x8F : 0xBF)
                || !isContinuation(b2, 0x80, 0xBF)
                || !isContinuation(b3, 0x80, 0xBF)) {
                return INVALID;
            }
            return ((b0 & 0x07) << 18) | ((b1 & 0x3F) << 12) | ((b2 & 0x3F) << 6) | (b3 & 0x3F);
        }
        return INVALID;
    }

    private static boolean isContinuation(int b, int min, int max) {
        return b >= min && b <= max;
    }

    /**
     * @param codePoint a valid code point
     * @return the number of bytes of its UTF-8 encoding
     */
    public static int encodedLength(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        } else if (codePoint < 0x800) {
            return 2;
        } else if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    /**
     * Writes the UTF-8 encoding of {@code value[from, to)} as is.
     * Surrogate pairs are combined; a surrogate without its counterpart is written as {@code U+FFFD}.
     * The text is encoded into a scratch buffer which is copied to {@code jw} in chunks.
     */
    public static void writeChars(CharSequence value, int from, int to, JsonWriter jw) {
        if (from >= to) {
            return;
        }
        final byte[] scratch = getScratchBuffer();
        int n = 0;
        for (int i = from; i < to; i++) {
            if (n > SCRATCH_BUFFER_SIZE - MAX_ENCODED_LENGTH) {
                jw.writeRaw(scratch, 0, n);
                n = 0;
            }
            final char c = value.charAt(i);
            if (c < 0x80) {
                scratch[n++] = (byte) c;
            } else if (Character.isSurrogate(c)) {
                if (Character.isHighSurrogate(c) && i + 1 < to && Character.isLowSurrogate(value.charAt(i + 1))) {
                    n = encode(Character.toCodePoint(c, value.charAt(++i)), scratch, n);
                } else {
                    n = encode(REPLACEMENT_CHARACTER, scratch, n);
                }
            } else {
                n = encode(c, scratch, n);
            }
        }
        jw.writeRaw(scratch, 0, n);
    }

    private static byte[] getScratchBuffer() {
        byte[] buffer = scratchBuffer.get();
        if (buffer == null) {
            buffer = new byte[SCRATCH_BUFFER_SIZE];
            scratchBuffer.set(buffer);
        }
        return buffer;
    }

    /**
     * @return the index after the last byte written
     */
    private static int encode(int codePoint, byte[] buf, int index) {
        if (codePoint < 0x80) {
            buf[index++] = (byte) codePoint;
        } else if (codePoint < 0x800) {
            buf[index++] = (byte) (0xC0 | (codePoint >> 6));
            buf[index++] = (byte) (0x80 | (codePoint & 0x3F));
        } else if (codePoint < 0x10000) {
            buf[index++] = (byte) (0xE0 | (codePoint >> 12));
            buf[index++] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
            buf[index++] = (byte) (0x80 | (codePoint & 0x3F));
        } else {
            buf[index++] = (byte) (0xF0 | (codePoint >> 18));
            buf[index++] = (byte) (0x80 | ((codePoint >> 12) & 0x3F));
            buf[index++] = (byte) (0x80 | ((codePoint >> 6) & 0x3F));
            buf[index++] = (byte) (0x80 | (codePoint & 0x3F));
        }
        return index;
    }
}
