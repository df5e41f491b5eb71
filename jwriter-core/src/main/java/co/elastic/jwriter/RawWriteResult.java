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

/**
 * The outcome of {@link JsonValueWriter#writeRaw(byte[], Exception)}.
 */
public enum RawWriteResult {
    /**
     * The fragment was appended as is.
     */
    WRITTEN,
    /**
     * The fragment was empty, {@code null} was appended instead.
     */
    WROTE_NULL,
    /**
     * An error came with the fragment. Nothing was appended and the writer is now poisoned.
     */
    ERROR_RECORDED,
    /**
     * The writer already was poisoned. Nothing was appended and the error was ignored.
     */
    SUPPRESSED
}
