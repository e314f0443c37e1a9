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

package io.github.muxstream.exceptions;

/**
 * Thrown when a position falls outside {@code [0, length]} of a stream: a seek target that is
 * negative, past the end or not representable, or an I/O request from a cursor left past the end
 * by a shrinking {@code setLength}.
 */
public class PositionOutOfRangeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final long position;
    private final long length;

    /**
     * @param position the offending position
     * @param length the stream length the position was checked against
     */
    public PositionOutOfRangeException(long position, long length) {
        super("Position " + position + " is outside of [0, " + length + "]");
        this.position = position;
        this.length = length;
    }

    /**
     * @param message detail message
     * @param length the stream length the position was checked against
     */
    public PositionOutOfRangeException(String message, long length) {
        super(message);
        this.position = -1;
        this.length = length;
    }

    /**
     * @return the requested position, or -1 if it could not be computed
     */
    public long getPosition() {
        return position;
    }

    public long getLength() {
        return length;
    }
}
