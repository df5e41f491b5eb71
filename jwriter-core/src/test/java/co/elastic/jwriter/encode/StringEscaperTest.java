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

import com.dslplatform.json.DslJson;
import com.dslplatform.json.JsonWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.SplittableRandom;

import static co.elastic.jwriter.encode.Utf8Test.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StringEscaperTest {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final String LINE_SEPARATOR = String.valueOf((char) 0x2028);
    private static final String PARAGRAPH_SEPARATOR = String.valueOf((char) 0x2029);
    private static final String REPLACEMENT = String.valueOf((char) 0xFFFD);
    private static final String GRINNING_FACE = new String(Character.toChars(0x1F600));

    private final JsonWriter jw = new DslJson<>().newWriter();

    @Test
    void testHtmlAndQuoteEscaping() {
        StringEscaper.writeString("he said \"hi\"\n<script>".getBytes(StandardCharsets.UTF_8), jw);
        assertThat(jw.toString()).isEqualTo("\"he said \\\"hi\\\"\\n\\u003cscript\\u003e\"");
    }

    @Test
    void testShortEscapes() {
        StringEscaper.writeString("a\tb\rc\nd\\e".getBytes(StandardCharsets.UTF_8), jw);
        assertThat(jw.toString()).isEqualTo("\"a\\tb\\rc\\nd\\\\e\"");
    }

    @Test
    void testControlCharacters() {
        StringEscaper.writeString(bytes(0x00, 0x01, 0x08, 0x0C, 0x1F, 0x7F), jw);
        // DEL is not a control character in JSON
        assertThat(jw.toString()).isEqualTo("\"\\u0000\\u0001\\u0008\\u000c\\u001f" + (char) 0x7F + "\"");
    }

    @Test
    void testSolidusIsNotEscaped() {
        StringEscaper.writeString("a/b</c".getBytes(StandardCharsets.UTF_8), jw);
        assertThat(jw.toString()).isEqualTo("\"a/b\\u003c/c\"");
    }

    @Test
    void testEmpty() {
        StringEscaper.writeString(new byte[0], jw);
        assertThat(jw.toString()).isEqualTo("\"\"");
    }

    @Test
    void testInvalidByte() {
        StringEscaper.writeString(bytes(0x80), jw);
        assertThat(jw.toString()).isEqualTo("\"\\ufffd\"");
    }

    @Test
    void testInvalidSequenceAdvancesOneByte() {
        // truncated three byte sequence followed by ASCII
        StringEscaper.writeString(bytes(0x61, 0xE2, 0x82, 0x62), jw);
        assertThat(jw.toString()).isEqualTo("\"a\\ufffd\\ufffdb\"");
    }

    @Test
    void testTruncatedAtEnd() {
        StringEscaper.writeString(bytes(0x61, 0xF0, 0x9F, 0x98), jw);
        assertThat(jw.toString()).isEqualTo("\"a\\ufffd\\ufffd\\ufffd\"");
    }

    @Test
    void testLineAndParagraphSeparators() {
        StringEscaper.writeString(("a" + LINE_SEPARATOR + "b" + PARAGRAPH_SEPARATOR).getBytes(StandardCharsets.UTF_8), jw);
        assertThat(jw.toString()).isEqualTo("\"a\\u2028b\\u2029\"");
    }

    @Test
    void testMultiByteIsCopied() {
        String text = "caf" + (char) 0xE9 + " " + (char) 0x20AC + GRINNING_FACE;
        StringEscaper.writeString(text.getBytes(StandardCharsets.UTF_8), jw);
        assertThat(jw.toString()).isEqualTo("\"" + text + "\"");
    }

    @Test
    void testCleanInputIsCopiedVerbatim() {
        byte[] input = "The quick brown fox jumps over the lazy dog 0123456789".getBytes(StandardCharsets.UTF_8);
        StringEscaper.writeString(input, jw);
        byte[] output = jw.toByteArray();
        assertThat(output).hasSize(input.length + 2);
        assertThat(output[0]).isEqualTo((byte) '"');
        assertThat(output[output.length - 1]).isEqualTo((byte) '"');
        for (int i = 0; i < input.length; i++) {
            assertThat(output[i + 1]).isEqualTo(input[i]);
        }
    }

    @Test
    void testSlice() {
        StringEscaper.writeString("xx<ab>xx".getBytes(StandardCharsets.UTF_8), 2, 4, jw);
        assertThat(jw.toString()).isEqualTo("\"\\u003cab\\u003e\"");
    }

    @Test
    void testSliceOutOfBounds() {
        assertThatThrownBy(() -> StringEscaper.writeString(new byte[4], 2, 3, jw))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> StringEscaper.writeString(new byte[4], -1, 1, jw))
            .isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(jw.size()).isEqualTo(0);
    }

    @Test
    void testCharSequence() {
        StringEscaper.writeString("he said \"hi\"\n<script>" + LINE_SEPARATOR + GRINNING_FACE, jw);
        assertThat(jw.toString()).isEqualTo("\"he said \\\"hi\\\"\\n\\u003cscript\\u003e\\u2028" + GRINNING_FACE + "\"");
    }

    @Test
    void testCharSequenceLoneSurrogates() {
        StringEscaper.writeString("a" + (char) 0xD83D + "b" + (char) 0xDE00, jw);
        assertThat(jw.toString()).isEqualTo("\"a\\ufffdb\\ufffd\"");
    }

    @Test
    void testCharSequenceMatchesBytes() {
        String text = "tab\there " + (char) 0xE9 + "<>\\" + GRINNING_FACE + PARAGRAPH_SEPARATOR + (char) 0x01;
        StringEscaper.writeString(text, jw);
        JsonWriter fromBytes = new DslJson<>().newWriter();
        StringEscaper.writeString(text.getBytes(StandardCharsets.UTF_8), fromBytes);
        assertThat(jw.toByteArray()).isEqualTo(fromBytes.toByteArray());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "plain ascii",
        "quotes \" and backslashes \\ and / solidus",
        "<html><body onload='x'>&amp;</body></html>",
        "control \0\1\37\b\f\t\r\n",
    })
    void testRoundTripThroughParser(String text) throws Exception {
        StringEscaper.writeString(text.getBytes(StandardCharsets.UTF_8), jw);
        assertThat(objectMapper.readValue(jw.toByteArray(), String.class)).isEqualTo(text);
    }

    @Test
    void testRoundTripNonAscii() throws Exception {
        String text = (char) 0xE9 + LINE_SEPARATOR + GRINNING_FACE + PARAGRAPH_SEPARATOR + "<" + (char) 0x20AC;
        StringEscaper.writeString(text.getBytes(StandardCharsets.UTF_8), jw);
        assertThat(objectMapper.readValue(jw.toByteArray(), String.class)).isEqualTo(text);
    }

    @Test
    void testRoundTripReplacesInvalidBytes() throws Exception {
        StringEscaper.writeString(bytes(0x6F, 0x6B, 0xFF, 0xC3, 0x28), jw);
        assertThat(objectMapper.readValue(jw.toByteArray(), String.class)).isEqualTo("ok" + REPLACEMENT + REPLACEMENT + "(");
    }

    @Test
    void testRandomBytesRoundTrip() throws Exception {
        SplittableRandom random = new SplittableRandom(42);
        for (int i = 0; i < 2_000; i++) {
            byte[] input = randomBytes(random);
            JsonWriter out = new DslJson<>().newWriter();
            StringEscaper.writeString(input, out);
            byte[] output = out.toByteArray();

            assertThat(objectMapper.readValue(output, String.class)).isEqualTo(decodeReplacingInvalid(input));
            assertHtmlSafe(output);
        }
    }

    @Test
    void testRandomCodePointsRoundTrip() throws Exception {
        SplittableRandom random = new SplittableRandom(7);
        for (int i = 0; i < 2_000; i++) {
            String text = randomText(random);
            JsonWriter fromBytes = new DslJson<>().newWriter();
            StringEscaper.writeString(text.getBytes(StandardCharsets.UTF_8), fromBytes);
            JsonWriter fromChars = new DslJson<>().newWriter();
            StringEscaper.writeString(text, fromChars);

            assertThat(objectMapper.readValue(fromBytes.toByteArray(), String.class)).isEqualTo(text);
            assertThat(fromChars.toByteArray()).isEqualTo(fromBytes.toByteArray());
            assertHtmlSafe(fromBytes.toByteArray());
        }
    }

    @Test
    void testRandomCleanTextIsCopiedVerbatim() {
        SplittableRandom random = new SplittableRandom(13);
        for (int i = 0; i < 2_000; i++) {
            String text = randomText(random).replaceAll("[\\x00-\\x1f<>\\\\\"\\x{2028}\\x{2029}]", "");
            byte[] input = text.getBytes(StandardCharsets.UTF_8);
            JsonWriter out = new DslJson<>().newWriter();
            StringEscaper.writeString(input, out);

            byte[] expected = new byte[input.length + 2];
            expected[0] = '"';
            System.arraycopy(input, 0, expected, 1, input.length);
            expected[expected.length - 1] = '"';
            assertThat(out.toByteArray()).isEqualTo(expected);
        }
    }

    private static byte[] randomBytes(SplittableRandom random) {
        byte[] bytes = new byte[random.nextInt(64)];
        for (int i = 0; i < bytes.length; i++) {
            // mostly ASCII, with lead and continuation bytes mixed in
            bytes[i] = (byte) (random.nextInt(4) == 0 ? random.nextInt(0x80, 0x100) : random.nextInt(0x80));
        }
        return bytes;
    }

    private static String randomText(SplittableRandom random) {
        StringBuilder text = new StringBuilder();
        int length = random.nextInt(32);
        while (text.length() < length) {
            int codePoint;
            switch (random.nextInt(4)) {
                case 0:
                    codePoint = random.nextInt(0x80);
                    break;
                case 1:
                    codePoint = random.nextInt(0x80, 0x800);
                    break;
                case 2:
                    codePoint = random.nextInt(0x800, 0x10000);
                    break;
                default:
                    codePoint = random.nextInt(0x10000, 0x110000);
            }
            if (!Character.isSurrogate((char) codePoint) || codePoint >= 0x10000) {
                text.appendCodePoint(codePoint);
            }
        }
        return text.toString();
    }

    /**
     * Decodes UTF-8, replacing each byte which does not start a well-formed sequence by U+FFFD.
     */
    private static String decodeReplacingInvalid(byte[] utf8) {
        StringBuilder result = new StringBuilder();
        int i = 0;
        while (i < utf8.length) {
            int codePoint = Utf8.decodeCodePoint(utf8, i, utf8.length);
            if (codePoint == Utf8.INVALID) {
                result.append(REPLACEMENT);
                i++;
            } else {
                String decoded = new String(Character.toChars(codePoint));
                assertThat(new String(utf8, i, Utf8.encodedLength(codePoint), StandardCharsets.UTF_8)).isEqualTo(decoded);
                result.append(decoded);
                i += Utf8.encodedLength(codePoint);
            }
        }
        return result.toString();
    }

    private static void assertHtmlSafe(byte[] output) {
        for (int i = 0; i < output.length; i++) {
            int b = output[i] & 0xFF;
            assertThat(b).isGreaterThanOrEqualTo(0x20).isNotEqualTo((int) '<').isNotEqualTo((int) '>');
            if (b == 0xE2 && i + 2 < output.length) {
                // raw U+2028 or U+2029
                assertThat(output[i + 1] == (byte) 0x80 && (output[i + 2] == (byte) 0xA8 || output[i + 2] == (byte) 0xA9)).isFalse();
            }
        }
    }
}
