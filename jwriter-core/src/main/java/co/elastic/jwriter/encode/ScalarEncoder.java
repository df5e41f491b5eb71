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

import com.dslplatform.json.BoolConverter;
import com.dslplatform.json.JsonWriter;
import com.dslplatform.json.NumberConverter;

/**
 * Appends the JSON text of numbers and booleans.
 * <p>
 * Integers are written as plain decimal digits. Java has no unsigned types, so the {@code writeUint*} methods
 * interpret the bits of their signed argument as an unsigned number of the same width. The native integer width is
 * 64 bits. The {@code *Str} variants wrap the digits in double quotes, for consumers which cannot represent every
 * 64 bit integer as a number.
 * </p>
 */
public final class ScalarEncoder {

    private ScalarEncoder() {
    }

    public static void writeInt8(byte value, JsonWriter jw) {
        NumberConverter.serialize((int) value, jw);
    }

    public static void writeInt16(short value, JsonWriter jw) {
        NumberConverter.serialize((int) value, jw);
    }

    public static void writeInt32(int value, JsonWriter jw) {
        NumberConverter.serialize(value, jw);
    }

    public static void writeInt64(long value, JsonWriter jw) {
        NumberConverter.serialize(value, jw);
    }

    public static void writeInt(long value, JsonWriter jw) {
        writeInt64(value, jw);
    }

    public static void writeUint8(byte value, JsonWriter jw) {
        NumberConverter.serialize(Byte.toUnsignedInt(value), jw);
    }

    public static void writeUint16(short value, JsonWriter jw) {
        NumberConverter.serialize(Short.toUnsignedInt(value), jw);
    }

    public static void writeUint32(int value, JsonWriter jw) {
        NumberConverter.serialize(Integer.toUnsignedLong(value), jw);
    }

    public static void writeUint64(long value, JsonWriter jw) {
        if (value >= 0) {
            NumberConverter.serialize(value, jw);
        } else {
            jw.writeAscii(Long.toUnsignedString(value));
        }
    }

    public static void writeUint(long value, JsonWriter jw) {
        writeUint64(value, jw);
    }

    public static void writeInt8Str(byte value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        writeInt8(value, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    public static void writeInt16Str(short value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        writeInt16(value, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    public static void writeInt32Str(int value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        writeInt32(value, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    public static void writeInt64Str(long value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        writeInt64(value, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    public static void writeIntStr(long value, JsonWriter jw) {
        writeInt64Str(value, jw);
    }

    public static void writeUint8Str(byte value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        writeUint8(value, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    public static void writeUint16Str(short value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        writeUint16(value, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    public static void writeUint32Str(int value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        writeUint32(value, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    public static void writeUint64Str(long value, JsonWriter jw) {
        jw.writeByte(JsonWriter.QUOTE);
        writeUint64(value, jw);
        jw.writeByte(JsonWriter.QUOTE);
    }

    public static void writeUintStr(long value, JsonWriter jw) {
        writeUint64Str(value, jw);
    }

    /**
     * Writes the shortest decimal which parses back to the same {@code float}.
     * The result for NaN and the infinities is not valid JSON.
     */
    public static void writeFloat32(float value, JsonWriter jw) {
        FloatFormatter.writeFloat32(value, jw);
    }

    /**
     * Writes the shortest decimal which parses back to the same {@code double}.
     * The result for NaN and the infinities is not valid JSON.
     */
    public static void writeFloat64(double value, JsonWriter jw) {
        FloatFormatter.writeFloat64(value, jw);
    }

    public static void writeBool(boolean value, JsonWriter jw) {
        BoolConverter.serialize(value, jw);
    }
}
