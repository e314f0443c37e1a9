/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.muxstream.disk;

import java.io.IOException;

/**
 * A supplier of RandomAccessReaders over a shared source.
 * Implementations are responsible for opening new readers but not for managing their lifecycle
 * after creation.
 */
public interface ReaderSupplier extends AutoCloseable {
    /**
     * Returns a RandomAccessReader for the calling thread. Callers are responsible for closing
     * the returned reader when done.
     * @return a reader
     * @throws IOException if an I/O error occurs while opening the reader
     */
    RandomAccessReader get() throws IOException;

    default void close() throws IOException {
    }
}
