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

import co.elastic.jwriter.TestConfiguration;
import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.SimpleSource;

import static org.assertj.core.api.Assertions.assertThat;

class WriterPoolConfigurationTest {

    @Test
    void testDefaults() {
        WriterPoolConfiguration config = TestConfiguration.createConfig().getConfig(WriterPoolConfiguration.class);

        assertThat(config.getPoolCapacity()).isGreaterThanOrEqualTo(16);
        assertThat(config.getInitialBufferSize()).isEqualTo(1024);
        assertThat(config.getMaxPooledBufferSize()).isEqualTo(1024 * 1024);
        assertThat(config.isPreallocate()).isFalse();
    }

    @Test
    void testOverrides() {
        ConfigurationRegistry registry = TestConfiguration.createConfig(SimpleSource.forTest(WriterPoolConfiguration.WRITER_POOL_CAPACITY, "4")
            .add(WriterPoolConfiguration.WRITER_INITIAL_BUFFER_SIZE, "256")
            .add(WriterPoolConfiguration.WRITER_MAX_POOLED_BUFFER_SIZE, "-1")
            .add(WriterPoolConfiguration.WRITER_POOL_PREALLOCATE, "true"));
        WriterPoolConfiguration config = registry.getConfig(WriterPoolConfiguration.class);

        assertThat(config.getPoolCapacity()).isEqualTo(4);
        assertThat(config.getInitialBufferSize()).isEqualTo(256);
        assertThat(config.getMaxPooledBufferSize()).isEqualTo(-1);
        assertThat(config.isPreallocate()).isTrue();

        WriterPool pool = WriterPool.create(config);
        assertThat(pool.getObjectsInPool()).isEqualTo(4);
        assertThat(pool.acquire().getCapacity()).isEqualTo(256);
    }
}
