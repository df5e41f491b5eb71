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

import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

public class WriterPoolConfiguration extends ConfigurationOptionProvider {

    private static final String SERIALIZATION_CATEGORY = "Serialization";
    public static final String WRITER_POOL_CAPACITY = "writer_pool_capacity";
    public static final String WRITER_INITIAL_BUFFER_SIZE = "writer_initial_buffer_size";
    public static final String WRITER_MAX_POOLED_BUFFER_SIZE = "writer_max_pooled_buffer_size";
    public static final String WRITER_POOL_PREALLOCATE = "writer_pool_preallocate";

    private final ConfigurationOption<Integer> poolCapacity = ConfigurationOption.integerOption()
        .key(WRITER_POOL_CAPACITY)
        .configurationCategory(SERIALIZATION_CATEGORY)
        .description("The maximum number of idle writers kept for reuse.\n" +
            "Writers released while the pool is full are left to the garbage collector.\n" +
            "The effective capacity is rounded up to the next power of two.")
        .dynamic(false)
        .buildWithDefault(Math.max(16, 2 * Runtime.getRuntime().availableProcessors()));

    private final ConfigurationOption<Integer> initialBufferSize = ConfigurationOption.integerOption()
        .key(WRITER_INITIAL_BUFFER_SIZE)
        .configurationCategory(SERIALIZATION_CATEGORY)
        .description("The initial size in bytes of the buffer of a newly created writer. " +
            "Buffers grow as needed, very small values are rounded up.")
        .dynamic(false)
        .buildWithDefault(1024);

    private final ConfigurationOption<Integer> maxPooledBufferSize = ConfigurationOption.integerOption()
        .key(WRITER_MAX_POOLED_BUFFER_SIZE)
        .configurationCategory(SERIALIZATION_CATEGORY)
        .description("Writers whose buffer has grown beyond this size in bytes are not put back into the pool, " +
            "so that a single large document does not keep its memory allocated.\n" +
            "\n" +
            "Setting it to -1 means that writers are pooled regardless of their size.")
        .dynamic(false)
        .buildWithDefault(1024 * 1024);

    private final ConfigurationOption<Boolean> preallocate = ConfigurationOption.booleanOption()
        .key(WRITER_POOL_PREALLOCATE)
        .configurationCategory(SERIALIZATION_CATEGORY)
        .description("If set to `true`, the pool is filled with writers when it is created.")
        .dynamic(false)
        .buildWithDefault(false);

    public int getPoolCapacity() {
        return poolCapacity.get();
    }

    public int getInitialBufferSize() {
        return initialBufferSize.get();
    }

    public int getMaxPooledBufferSize() {
        return maxPooledBufferSize.get();
    }

    public boolean isPreallocate() {
        return preallocate.get();
    }
}
