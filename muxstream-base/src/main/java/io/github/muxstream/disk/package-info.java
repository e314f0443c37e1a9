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

/**
 * Provides low-level I/O abstractions for random-access byte streams.
 *
 * <h2>Core Abstractions</h2>
 * <ul>
 *   <li>{@link io.github.muxstream.disk.SeekableStream} - A byte stream with one current
 *       position, capability queries, length management and seeking relative to a
 *       {@link io.github.muxstream.disk.SeekOrigin}.</li>
 *   <li>{@link io.github.muxstream.disk.RandomAccessReader} - Typed reads (ints, longs, floats,
 *       bulk arrays) after a seek, the shape container parsers consume.</li>
 *   <li>{@link io.github.muxstream.disk.ReaderSupplier} - Hands out
 *       {@code RandomAccessReader}s over a shared source.</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link io.github.muxstream.disk.FileChannelStream} - File-backed stream over a
 *       {@code FileChannel}</li>
 *   <li>{@link io.github.muxstream.disk.ByteArraySeekableStream} - Growable in-memory stream</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * {@code SeekableStream} implementations in this package are <b>not thread-safe</b>: they have a
 * single physical position. Share one between threads through
 * {@link io.github.muxstream.mux.MultiplexedCursorStream}.
 */
package io.github.muxstream.disk;
