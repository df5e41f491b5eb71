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
package co.elastic.jwriter.pool;

import co.elastic.jwriter.JsonValueWriter;

/**
 * Scopes the use of a pooled writer to a try-with-resources block.
 * <pre>
 * try (WriterHandle handle = pool.acquireHandle()) {
 *     handle.get().writeString("foo");
 *     handle.get().dumpTo(out);
 * }
 * </pre>
 */
public final class WriterHandle implements AutoCloseable {

    private final WriterPool pool;
    private final JsonValueWriter writer;
    private boolean closed;

    WriterHandle(WriterPool pool, JsonValueWriter writer) {
        this.pool = pool;
        this.writer = writer;
    }

    public JsonValueWriter get() {
        if (closed) {
            throw new IllegalStateException("Writer has already been released");
        }
        return writer;
    }

    /**
     * Releases the writer to its pool. Subsequent calls have no effect.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            pool.release(writer);
        }
    }
}
