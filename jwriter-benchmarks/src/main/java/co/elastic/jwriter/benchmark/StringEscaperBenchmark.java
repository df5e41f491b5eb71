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
package co.elastic.jwriter.benchmark;

import co.elastic.jwriter.JsonValueWriter;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.runner.RunnerException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class StringEscaperBenchmark extends AbstractBenchmark {

    private JsonValueWriter writer;
    private byte[] ascii;
    private byte[] escapeHeavy;
    private byte[] nonAscii;
    private String asciiString;

    public static void main(String[] args) throws RunnerException {
        run(StringEscaperBenchmark.class);
    }

    @Setup
    public void setUp() {
        writer = JsonValueWriter.create(4096);
        StringBuilder plain = new StringBuilder();
        StringBuilder escapes = new StringBuilder();
        StringBuilder international = new StringBuilder();
        for (int i = 0; i < 16; i++) {
            plain.append("GET /api/products/").append(i).append("?page=2 HTTP/1.1 ");
            escapes.append("<a href=\"/x\">\t").append(i).append("</a>\n");
            international.append("Gr").append((char) 0xFC).append((char) 0xDF).append("e ")
                .append((char) 0x65E5).append((char) 0x672C).append(' ').append(Character.toChars(0x1F600));
        }
        asciiString = plain.toString();
        ascii = asciiString.getBytes(StandardCharsets.UTF_8);
        escapeHeavy = escapes.toString().getBytes(StandardCharsets.UTF_8);
        nonAscii = international.toString().getBytes(StandardCharsets.UTF_8);
    }

    @Benchmark
    public int testAscii() {
        writer.resetState();
        writer.writeString(ascii);
        return writer.size();
    }

    @Benchmark
    public int testAsciiCharSequence() {
        writer.resetState();
        writer.writeString(asciiString);
        return writer.size();
    }

    @Benchmark
    public int testEscapeHeavy() {
        writer.resetState();
        writer.writeString(escapeHeavy);
        return writer.size();
    }

    @Benchmark
    public int testNonAscii() {
        writer.resetState();
        writer.writeString(nonAscii);
        return writer.size();
    }
}
