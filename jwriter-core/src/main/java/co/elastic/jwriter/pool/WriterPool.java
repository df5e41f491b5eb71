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
import org.jctools.queues.atomic.MpmcAtomicArrayQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationRegistry;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A bounded set of idle {@link JsonValueWriter}s.
 * <p>
 * {@link #acquire()} and {@link #release(JsonValueWriter)} may be called from any thread, each of them atomically
 * hands over one writer. There is no ordering between idle writers. An acquired writer is always empty but may have
 * a buffer which has grown during a previous use.
 * </p>
 * <p>
 * A released writer is not kept if the pool is full, or if its buffer has grown beyond the configured
 * {@link WriterPoolConfiguration#getMaxPooledBufferSize() maximum}. Either way it is left to the garbage collector.
 * </p>
 */
public class WriterPool {

    private static final Logger logger = LoggerFactory.getLogger(WriterPool.class);

    @Nullable
    private static volatile WriterPool shared;

    private final MpmcAtomicArrayQueue<JsonValueWriter> idleWriters;
    private final int initialBufferSize;
    private final int maxPooledBufferSize;
    private final AtomicLong garbageCreated = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();

    WriterPool(int capacity, int initialBufferSize, int maxPooledBufferSize, boolean preallocate) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Pool capacity must be positive: " + capacity);
        }
        if (initialBufferSize < 0) {
            throw new IllegalArgumentException("Initial buffer size must not be negative: " + initialBufferSize);
        }
        if (maxPooledBufferSize < -1) {
            throw new IllegalArgumentException("Max pooled buffer size must be -1 or at least 0: " + maxPooledBufferSize);
        }
        this.initialBufferSize = initialBufferSize;
        this.maxPooledBufferSize = maxPooledBufferSize;
        // the queue needs room for at least two elements and rounds its capacity up to a power of two
        this.idleWriters = new MpmcAtomicArrayQueue<JsonValueWriter>(Math.max(2, capacity));
        if (preallocate) {
            for (int i = 0, n = idleWriters.capacity(); i < n; i++) {
                idleWriters.offer(JsonValueWriter.create(initialBufferSize));
            }
        }
        logger.debug("Created writer pool with capacity {}, initial buffer size {} and max pooled buffer size {}",
            idleWriters.capacity(), initialBufferSize, maxPooledBufferSize);
    }

    public static WriterPool create(WriterPoolConfiguration config) {
        return new WriterPool(config.getPoolCapacity(), config.getInitialBufferSize(), config.getMaxPooledBufferSize(),
            config.isPreallocate());
    }

    /**
     * @return the process wide pool with the default configuration, created on first use
     */
    public static WriterPool shared() {
        WriterPool result = shared;
        if (result == null) {
            synchronized (WriterPool.class) {
                result = shared;
                if (result == null) {
                    ConfigurationRegistry registry = ConfigurationRegistry.builder()
                        .addOptionProvider(new WriterPoolConfiguration())
                        .build();
                    shared = result = create(registry.getConfig(WriterPoolConfiguration.class));
                }
            }
        }
        return result;
    }

    /**
     * @return an empty writer, which is newly created if no writer is idle
     */
    public JsonValueWriter acquire() {
        JsonValueWriter writer = idleWriters.poll();
        if (writer == null) {
            writer = JsonValueWriter.create(initialBufferSize);
        }
        return writer;
    }

    /**
     * Resets {@code writer} and makes it available to {@link #acquire()}.
     * The caller must not use the writer afterwards.
     */
    public void release(JsonValueWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.resetState();
        if (maxPooledBufferSize >= 0 && writer.getCapacity() > maxPooledBufferSize) {
            logger.debug("Discarding writer with a buffer of {} bytes", writer.getCapacity());
            discarded.incrementAndGet();
            return;
        }
        if (!idleWriters.offer(writer)) {
            garbageCreated.incrementAndGet();
        }
    }

    public WriterHandle acquireHandle() {
        return new WriterHandle(this, acquire());
    }

    public int getObjectsInPool() {
        return idleWriters.size();
    }

    /**
     * @return the number of released writers which did not fit into the pool
     */
    public long getGarbageCreated() {
        return garbageCreated.get();
    }

    /**
     * @return the number of released writers which were dropped because their buffer was too large
     */
    public long getDiscarded() {
        return discarded.get();
    }
}
