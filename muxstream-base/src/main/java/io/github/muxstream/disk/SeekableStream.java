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

import java.io.Closeable;
import java.io.IOException;

/**
 * A random-access byte stream with a single current position, the contract shared by the
 * stream implementations in this package and by {@link io.github.muxstream.mux.MultiplexedCursorStream}.
 * <p>
 * Reads and writes start at the current position and advance it. Capability queries tell the
 * caller which of reading, writing and seeking are supported; unsupported operations throw
 * {@link UnsupportedOperationException}.
 * <p>
 * Implementations are expected to be stateful and NOT threadsafe. Wrap a stream in a
 * {@code MultiplexedCursorStream} to share it between threads.
 */
public interface SeekableStream extends Closeable {
    /**
     * @return true if the stream supports reading
     */
    boolean canRead();

    /**
     * @return true if the stream supports writing
     */
    boolean canWrite();

    /**
     * @return true if the stream supports changing its position
     */
    boolean canSeek();

    /**
     * Length of the stream in bytes.
     * @return the length
     * @throws IOException if an error occurs
     */
    long length() throws IOException;

    /**
     * Truncates or extends the stream. Bytes added by extending read as zero.
     * @param newLength the new length, not negative
     * @throws IOException if an error occurs
     */
    void setLength(long newLength) throws IOException;

    /**
     * Get the current position in the stream.
     * @return the current position
     * @throws IOException if an error occurs
     */
    long getPosition() throws IOException;

    /**
     * Moves the current position.
     * @param position the new position, not negative
     * @throws IOException if an error occurs
     */
    void setPosition(long position) throws IOException;

    /**
     * Moves the current position relative to {@code origin}.
     * <p>
     * The default implementation rejects negative targets and lets the stream itself decide
     * whether a target past the end is acceptable.
     *
     * @param offset the offset from {@code origin}
     * @param origin the reference point
     * @return the new position
     * @throws IOException if an error occurs
     */
    default long seek(long offset, SeekOrigin origin) throws IOException {
        if (!canSeek()) {
            throw new UnsupportedOperationException("Stream does not support seeking");
        }
        long length = length();
        long target = origin.resolve(offset, getPosition(), length);
        if (target < 0) {
            throw new PositionOutOfRangeException(target, length);
        }
        setPosition(target);
        return target;
    }

    /**
     * Reads one byte.
     * @return the byte as an int in 0-255, or -1 at end of stream
     * @throws IOException if an error occurs
     */
    default int read() throws IOException {
        byte[] b = new byte[1];
        return read(b, 0, 1) == 1 ? b[0] & 0xFF : -1;
    }

    /**
     * Reads up to {@code count} bytes. Fewer bytes than requested may be returned.
     * @param buffer the destination
     * @param offset the first index of {@code buffer} to fill
     * @param count the maximum number of bytes to read
     * @return the number of bytes read, 0 if {@code count} is 0, or -1 at end of stream
     * @throws IOException if an error occurs
     */
    int read(byte[] buffer, int offset, int count) throws IOException;

    /**
     * Writes {@code count} bytes, extending the stream if the write runs past its end.
     * @param buffer the source
     * @param offset the first index of {@code buffer} to write
     * @param count the number of bytes to write
     * @throws IOException if an error occurs
     */
    void write(byte[] buffer, int offset, int count) throws IOException;

    /**
     * Flushes buffered data to the underlying storage.
     * @throws IOException if an error occurs
     */
    void flush() throws IOException;
}
