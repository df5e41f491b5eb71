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
import co.elastic.jwriter.pool.WriterPool;
import co.elastic.jwriter.pool.WriterPoolConfiguration;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.runner.RunnerException;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.SimpleSource;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class WriterPoolBenchmark extends AbstractBenchmark {

    private WriterPool pool;

    public static void main(String[] args) throws RunnerException {
        run(WriterPoolBenchmark.class);
    }

    @Setup
    public void setUp() {
        ConfigurationRegistry registry = ConfigurationRegistry.builder()
            .addOptionProvider(new WriterPoolConfiguration())
            .addConfigSource(new SimpleSource("benchmark")
                .add(WriterPoolConfiguration.WRITER_POOL_CAPACITY, "256")
                .add(WriterPoolConfiguration.WRITER_POOL_PREALLOCATE, "true"))
            .build();
        pool = WriterPool.create(registry.getConfig(WriterPoolConfiguration.class));
    }

    @TearDown
    public void tearDown() {
        System.out.println("Writers dropped by the pool: " + pool.getGarbageCreated());
    }

    @Benchmark
    @Threads(8)
    public JsonValueWriter testAcquireRelease() {
        JsonValueWriter writer = pool.acquire();
        writer.writeInt64(42);
        pool.release(writer);
        return writer;
    }

    @Benchmark
    @Threads(8)
    public JsonValueWriter testNewWriter() {
        JsonValueWriter writer = JsonValueWriter.create(1024);
        writer.writeInt64(42);
        return writer;
    }
}
