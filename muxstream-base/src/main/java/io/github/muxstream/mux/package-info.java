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
 * Shares one {@link io.github.muxstream.disk.SeekableStream} between many threads.
 * <p>
 * {@link io.github.muxstream.mux.MultiplexedCursorStream} gives each owner (by default each
 * thread) a private logical cursor, kept in a {@link io.github.muxstream.mux.CursorRegistry}, and
 * funnels physical I/O through a single lock. The registry resolves the caller's cursor through a
 * one-slot cache, then a linear scan that is periodically re-sorted so the busiest owners are
 * found first.
 *
 * <h2>Usage Pattern</h2>
 * <pre>{@code
 * try (var file = FileChannelStream.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
 *      var shared = new MultiplexedCursorStream(file)) {
 *     executor.submit(() -> {
 *         shared.seek(headerOffset, SeekOrigin.BEGIN);
 *         shared.read(header, 0, header.length);   // only this thread's cursor moves
 *         return null;
 *     });
 * }
 * }</pre>
 *
 * <h2>Views</h2>
 * <ul>
 *   <li>{@code reader(ByteOrder)} / {@code get()} - a {@code RandomAccessReader} over the
 *       caller's cursor</li>
 *   <li>{@code asInputStream()} / {@code asOutputStream()} - {@code java.io} adapters</li>
 * </ul>
 * None of the views own the multiplexed stream; closing them leaves it open.
 */
package io.github.muxstream.mux;
