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

import io.github.muxstream.exceptions.PositionOutOfRangeException;

/**
 * Reference point for {@link SeekableStream#seek(long, SeekOrigin)}.
 */
public enum SeekOrigin {
    /** Offset is absolute. */
    BEGIN,
    /** Offset is relative to the current position. */
    CURRENT,
    /** Offset is relative to the stream length. */
    END;

    /**
     * Computes the absolute target of a seek.
     *
     * @param offset the seek offset
     * @param position the current position
     * @param length the current length
     * @return the absolute target, which may be negative
     * @throws PositionOutOfRangeException if the target does not fit in a long
     */
    public long resolve(long offset, long position, long length) {
        try {
            switch (this) {
                case BEGIN:
                    return offset;
                case CURRENT:
                    return Math.addExact(position, offset);
                case END:
                    return Math.addExact(length, offset);
                default:
                    throw new AssertionError(this);
            }
        } catch (ArithmeticException e) {
            throw new PositionOutOfRangeException("Seek by " + offset + " from " + this + " overflows", length);
        }
    }
}
