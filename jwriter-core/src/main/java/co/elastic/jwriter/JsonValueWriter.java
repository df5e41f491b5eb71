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
package co.elastic.jwriter;

import co.elastic.jwriter.encode.ScalarEncoder;
import co.elastic.jwriter.encode.StringEscaper;
import co.elastic.jwriter.encode.Utf8;
import co.elastic.jwriter.objectpool.Recyclable;
import com.dslplatform.json.DslJson;
import com.dslplatform.json.JsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * A growable buffer which JSON values are appended to, one at a time, without building a tree.
 * <p>
 * The writer remembers the first error passed to {@link #writeRaw(byte[], Exception)}. From then on it is
 * <em>poisoned</em>: further raw writes are ignored and {@link #buildBytes()} as well as {@link #toByteArray()}
 * throw an {@link EncodeException} instead of returning the content. The scalar and string methods never fail and
 * don't check for a recorded error. {@link #resetState()} clears both the content and the error.
 * </p>
 * <p>
 * Instances are not thread safe. Usually they are obtained from a {@link co.elastic.jwriter.pool.WriterPool} and
 * handed back to it when the content has been consumed.
 * </p>
 */
public class JsonValueWriter implements Recyclable {

    private static final Logger logger = LoggerFactory.getLogger(JsonValueWriter.class);

    /**
     * Smaller buffers would not grow, as the growth of {@link JsonWriter} is relative to its current size.
     */
    static final int MIN_BUFFER_SIZE = 64;

    private static final DslJson<Object> dslJson = new DslJson<>(new DslJson.Settings<>());

    private final JsonWriter jw;
    @Nullable
    private Exception error;

    JsonValueWriter(JsonWriter jw) {
        this.jw = jw;
    }

    /**
     * @param initialBufferSize the initial capacity in bytes, small values are rounded up to a sane minimum
     */
    public static JsonValueWriter create(int initialBufferSize) {
        if (initialBufferSize < 0) {
            throw new IllegalArgumentException("Initial buffer size must not be negative: " + initialBufferSize);
        }
        return new JsonValueWriter(dslJson.newWriter(Math.max(initialBufferSize, MIN_BUFFER_SIZE)));
    }

    public void writeRawByte(byte b) {
        jw.writeByte(b);
    }

    /**
     * Appends the UTF-8 encoding of {@code value} without any escaping.
     */
    public void writeRawString(CharSequence value) {
        Utf8.writeChars(value, 0, value.length(), jw);
    }

    /**
     * Appends an already encoded JSON fragment, or records the error which prevented it from being encoded.
     *
     * @param data  the encoded fragment, a {@code null} or empty fragment is written as {@code null}
     * @param error the error which occurred when encoding the fragment
     * @return what happened to the fragment
     */
    public RawWriteResult writeRaw(@Nullable byte[] data, @Nullable Exception error) {
        if (this.error != null) {
            if (logger.isTraceEnabled()) {
                logger.trace("Ignoring raw write as the writer already failed with {}", this.error.toString());
            }
            return RawWriteResult.SUPPRESSED;
        }
        if (error != null) {
            logger.debug("Recording encoding error, further raw writes are ignored", error);
            this.error = error;
            return RawWriteResult.ERROR_RECORDED;
        }
        if (data == null || data.length == 0) {
            jw.writeNull();
            return RawWriteResult.WROTE_NULL;
        }
        jw.writeRaw(data, 0, data.length);
        return RawWriteResult.WRITTEN;
    }

    /**
     * Encodes a value through its {@link RawJson#toJson()} and appends the result as by {@link #writeRaw(byte[], Exception)}.
     * Once the writer is poisoned, {@code producer} is not invoked at all.
     */
    public RawWriteResult writeRaw(RawJson producer) {
        if (error != null) {
            return writeRaw(null, null);
        }
        byte[] data;
        try {
            data = producer.toJson();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return writeRaw(null, e);
        }
        return writeRaw(data, null);
    }

    public void writeInt8(byte value) {
        ScalarEncoder.writeInt8(value, jw);
    }

    public void writeInt16(short value) {
        ScalarEncoder.writeInt16(value, jw);
    }

    public void writeInt32(int value) {
        ScalarEncoder.writeInt32(value, jw);
    }

    public void writeInt64(long value) {
        ScalarEncoder.writeInt64(value, jw);
    }

    public void writeInt(long value) {
        ScalarEncoder.writeInt(value, jw);
    }

    public void writeUint8(byte value) {
        ScalarEncoder.writeUint8(value, jw);
    }

    public void writeUint16(short value) {
        ScalarEncoder.writeUint16(value, jw);
    }

    public void writeUint32(int value) {
        ScalarEncoder.writeUint32(value, jw);
    }

    public void writeUint64(long value) {
        ScalarEncoder.writeUint64(value, jw);
    }

    public void writeUint(long value) {
        ScalarEncoder.writeUint(value, jw);
    }

    public void writeInt8Str(byte value) {
        ScalarEncoder.writeInt8Str(value, jw);
    }

    public void writeInt16Str(short value) {
        ScalarEncoder.writeInt16Str(value, jw);
    }

    public void writeInt32Str(int value) {
        ScalarEncoder.writeInt32Str(value, jw);
    }

    public void writeInt64Str(long value) {
        ScalarEncoder.writeInt64Str(value, jw);
    }

    public void writeIntStr(long value) {
        ScalarEncoder.writeIntStr(value, jw);
    }

    public void writeUint8Str(byte value) {
        ScalarEncoder.writeUint8Str(value, jw);
    }

    public void writeUint16Str(short value) {
        ScalarEncoder.writeUint16Str(value, jw);
    }

    public void writeUint32Str(int value) {
        ScalarEncoder.writeUint32Str(value, jw);
    }

    public void writeUint64Str(long value) {
        ScalarEncoder.writeUint64Str(value, jw);
    }

    public void writeUintStr(long value) {
        ScalarEncoder.writeUintStr(value, jw);
    }

    public void writeFloat32(float value) {
        ScalarEncoder.writeFloat32(value, jw);
    }

    public void writeFloat64(double value) {
        ScalarEncoder.writeFloat64(value, jw);
    }

    public void writeBool(boolean value) {
        ScalarEncoder.writeBool(value, jw);
    }

    public void writeString(byte[] utf8) {
        StringEscaper.writeString(utf8, jw);
    }

    public void writeString(byte[] utf8, int offset, int length) {
        StringEscaper.writeString(utf8, offset, length, jw);
    }

    public void writeString(CharSequence value) {
        StringEscaper.writeString(value, jw);
    }

    /**
     * @return the number of bytes written since the last reset
     */
    public int size() {
        return jw.size();
    }

    /**
     * @return the number of bytes the writer can hold before its buffer has to grow
     */
    public int getCapacity() {
        return jw.getByteBuffer().length;
    }

    public boolean isPoisoned() {
        return error != null;
    }

    @Nullable
    public Exception getError() {
        return error;
    }

    /**
     * Returns a read-only view of the content. The view shares the buffer of this writer, it is only valid until the
     * next write or reset.
     *
     * @throws EncodeException if an encoding error has been recorded
     */
    public ByteBuffer buildBytes() throws EncodeException {
        throwIfPoisoned();
        return ByteBuffer.wrap(jw.getByteBuffer(), 0, jw.size()).slice().asReadOnlyBuffer();
    }

    /**
     * @return a copy of the content
     * @throws EncodeException if an encoding error has been recorded
     */
    public byte[] toByteArray() throws EncodeException {
        throwIfPoisoned();
        return jw.toByteArray();
    }

    /**
     * Writes the content to {@code out}, whether or not an encoding error has been recorded.
     * The content is kept, call {@link #resetState()} to discard it.
     *
     * @return the number of bytes written
     * @throws IOException if {@code out} fails
     */
    public int dumpTo(OutputStream out) throws IOException {
        final int size = jw.size();
        jw.toStream(out);
        return size;
    }

    private void throwIfPoisoned() throws EncodeException {
        if (error != null) {
            throw new EncodeException("Can't build JSON as encoding a value failed: " + error.getMessage(), error);
        }
    }

    @Override
    public void resetState() {
        jw.reset();
        error = null;
    }

    /**
     * @return the content decoded as UTF-8, for debugging
     */
    @Override
    public String toString() {
        return jw.toString();
    }
}
