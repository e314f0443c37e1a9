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
 * Provides custom exception types used throughout muxstream.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.muxstream.exceptions.PositionOutOfRangeException} - An unchecked
 *       exception raised when a seek target, or the cursor an I/O request starts from, lies
 *       outside {@code [0, length]}. It extends {@link java.lang.IllegalArgumentException} and
 *       carries both the requested position and the length it was checked against.</li>
 * </ul>
 *
 * <h2>Other Errors</h2>
 * <p>
 * Everything else is reported with standard Java exceptions:
 * <ul>
 *   <li>{@link java.lang.IllegalArgumentException} when a multiplexed stream is built over a
 *       stream that cannot seek</li>
 *   <li>{@link java.lang.UnsupportedOperationException} when seeking, reading or writing is not
 *       supported by the underlying stream</li>
 *   <li>{@link java.io.IOException} from the underlying stream, propagated unchanged, and for any
 *       use of a closed stream</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     stream.seek(granulePageOffset, SeekOrigin.BEGIN);
 * } catch (PositionOutOfRangeException e) {
 *     // the container index points past the data we have
 *     log.debug("Page offset {} beyond length {}", e.getPosition(), e.getLength());
 * }
 * }</pre>
 *
 * @see io.github.muxstream.exceptions.PositionOutOfRangeException
 */
package io.github.muxstream.exceptions;
