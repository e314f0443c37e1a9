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

package io.github.muxstream.mux;

import io.github.muxstream.annotations.VisibleForTesting;
import io.github.muxstream.disk.RandomAccessReader;
import io.github.muxstream.disk.ReaderSupplier;
import io.github.muxstream.disk.SeekOrigin;
import io.github.muxstream.disk.SeekableStream;
import io.github.muxstream.exceptions.PositionOutOfRangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Shares one SeekableStream between threads, giving every thread its own logical position.
 * <p>
 * The wrapped stream has a single physical position and is not threadsafe. This class keeps a
 * cursor per owner (by default the calling {@link Thread}) in a {@link CursorRegistry}, and
 * serializes all physical I/O through one lock: each read or write moves the wrapped stream to
 * the caller's logical position, performs the operation, then advances the caller's cursor.
 * Owners never observe each other's positions.
 * <p>
 * The registry lock and the I/O lock are never held together. A call first resolves its cursor,
 * releasing the registry lock, and only then takes the I/O lock.
 * <p>
 * Closing this stream drops all cursors but does not close the wrapped stream, which stays the
 * caller's responsibility.
 *
 * <pre>{@code
 * try (var file = FileChannelStream.open(path);
 *      var shared = new MultiplexedCursorStream(file)) {
 *     // from any number of threads
 *     try (RandomAccessReader reader = shared.get()) {
 *         reader.seek(pageOffset);
 *         int magic = reader.readInt();
 *     }
 * }
 * }</pre>
 */
public class MultiplexedCursorStream implements SeekableStream, ReaderSupplier {
    private static final Logger logger = LoggerFactory.getLogger(MultiplexedCursorStream.class);

    /**
     * Full registry scans between two reordering passes, configurable via the
     * muxstream.reorder_interval system property
     */
    public static final int DEFAULT_REORDER_INTERVAL = Integer.getInteger("muxstream.reorder_interval", 50);

    private final SeekableStream stream;
    private final CursorRegistry registry;

    private final ReentrantLock ioLock = new ReentrantLock();
    // guarded by ioLock
    private final byte[] singleByte = new byte[1];
    // written under ioLock, read without it
    private volatile long length;

    private volatile boolean closed;

    /**
     * Wraps {@code stream}, keying cursors by the calling thread.
     *
     * @param stream an open stream that supports seeking
     * @throws IOException if the stream length cannot be read
     * @throws IllegalArgumentException if the stream cannot seek
     */
    public MultiplexedCursorStream(SeekableStream stream) throws IOException {
        this(stream, DEFAULT_REORDER_INTERVAL, Thread::currentThread);
    }

    /**
     * @param stream an open stream that supports seeking
     * @param reorderInterval full registry scans between two reordering passes
     * @param ownerIdentity supplies the identity of the calling context, e.g. a task id; must be
     *                      stable for the lifetime of that context and comparable with equals
     * @throws IOException if the stream length cannot be read
     * @throws IllegalArgumentException if the stream cannot seek
     */
    public MultiplexedCursorStream(SeekableStream stream, int reorderInterval, Supplier<?> ownerIdentity) throws IOException {
        Objects.requireNonNull(stream, "stream");
        if (!stream.canSeek()) {
            throw new IllegalArgumentException("The stream must be seekable");
        }
        this.stream = stream;
        this.registry = new CursorRegistry(ownerIdentity, reorderInterval);
        this.length = stream.length();
        logger.debug("Multiplexing {} of length {}", stream, length);
    }

    @Override
    public boolean canRead() {
        return stream.canRead();
    }

    @Override
    public boolean canWrite() {
        return stream.canWrite();
    }

    @Override
    public boolean canSeek() {
        return stream.canSeek();
    }

    /**
     * Returns the cached length. Does not query the wrapped stream.
     */
    @Override
    public long length() throws IOException {
        ensureOpen();
        return length;
    }

    /**
     * Changes the length of the wrapped stream. Cursors past the new end are left where they
     * are; their next seek, read or write fails with {@link PositionOutOfRangeException}.
     */
    @Override
    public void setLength(long newLength) throws IOException {
        ensureOpen();
        ioLock.lock();
        try {
            try {
                stream.setLength(newLength);
            } catch (Throwable t) {
                refreshLengthAfter(t);
                throw t;
            }
            length = newLength;
        } finally {
            ioLock.unlock();
        }
    }

    /**
     * @return the calling owner's logical position
     */
    @Override
    public long getPosition() throws IOException {
        ensureOpen();
        return registry.resolve().position();
    }

    /**
     * Equivalent to {@code seek(position, SeekOrigin.BEGIN)}.
     */
    @Override
    public void setPosition(long position) throws IOException {
        seek(position, SeekOrigin.BEGIN);
    }

    /**
     * Moves the calling owner's cursor. Unlike some streams, the target may not lie past the
     * end; extend the stream with {@link #setLength} first.
     *
     * @throws PositionOutOfRangeException if the target is negative or greater than the length
     * @throws UnsupportedOperationException if the wrapped stream cannot seek
     */
    @Override
    public long seek(long offset, SeekOrigin origin) throws IOException {
        Objects.requireNonNull(origin, "origin");
        ensureOpen();
        if (!canSeek()) {
            throw new UnsupportedOperationException("Stream does not support seeking");
        }
        CursorEntry cursor = registry.resolve();
        long len = length;
        long target = origin.resolve(offset, cursor.position(), len);
        if (target < 0 || target > len) {
            throw new PositionOutOfRangeException(target, len);
        }
        cursor.position(target);
        return target;
    }

    @Override
    public int read() throws IOException {
        ensureOpen();
        CursorEntry cursor = registry.resolve();
        int value;
        ioLock.lock();
        try {
            moveTo(cursor);
            value = stream.read(singleByte, 0, 1) == 1 ? singleByte[0] & 0xFF : -1;
        } finally {
            ioLock.unlock();
        }
        if (value >= 0) {
            cursor.advance(1);
        }
        return value;
    }

    /**
     * Reads from the calling owner's position. Short reads are returned as they come from the
     * wrapped stream, not retried.
     */
    @Override
    public int read(byte[] buffer, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, buffer.length);
        ensureOpen();
        CursorEntry cursor = registry.resolve();
        int n;
        ioLock.lock();
        try {
            moveTo(cursor);
            if (count == 0) {
                return 0;
            }
            n = stream.read(buffer, offset, count);
        } finally {
            ioLock.unlock();
        }
        if (n > 0) {
            cursor.advance(n);
        }
        return n;
    }

    @Override
    public void write(byte[] buffer, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, buffer.length);
        ensureOpen();
        CursorEntry cursor = registry.resolve();
        ioLock.lock();
        try {
            moveTo(cursor);
            try {
                stream.write(buffer, offset, count);
            } catch (Throwable t) {
                refreshLengthAfter(t);
                throw t;
            }
            length = stream.length();
        } finally {
            ioLock.unlock();
        }
        cursor.advance(count);
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        ioLock.lock();
        try {
            stream.flush();
        } finally {
            ioLock.unlock();
        }
    }

    /**
     * Drops all cursors. The wrapped stream is left open. Closing twice has no effect.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        registry.close();
        logger.debug("Closed multiplexed view of {}", stream);
    }

    /**
     * Returns a reader positioned at the calling owner's cursor, reading little-endian values.
     */
    @Override
    public RandomAccessReader get() throws IOException {
        return reader(ByteOrder.LITTLE_ENDIAN);
    }

    /**
     * Returns a typed reader over this stream. The reader has no position of its own: it reads
     * and seeks the cursor of whichever owner calls it, so one reader may be shared by threads.
     *
     * @param order the byte order of multi-byte values
     * @return a reader
     * @throws IOException if this stream is closed
     */
    public RandomAccessReader reader(ByteOrder order) throws IOException {
        ensureOpen();
        return new CursorReader(this, order);
    }

    /**
     * @return an InputStream reading from the calling owner's cursor
     */
    public InputStream asInputStream() {
        return new CursorInputStream(this);
    }

    /**
     * @return an OutputStream writing at the calling owner's cursor
     */
    public OutputStream asOutputStream() {
        return new CursorOutputStream(this);
    }

    /**
     * @return the number of owners that have used this stream
     */
    public int ownerCount() {
        return registry.size();
    }

    Object currentOwner() {
        return registry.currentOwner();
    }

    @VisibleForTesting
    CursorRegistry registry() {
        return registry;
    }

    // caller holds ioLock
    private void moveTo(CursorEntry cursor) throws IOException {
        long position = cursor.position();
        if (position > length) {
            throw new PositionOutOfRangeException(position, length);
        }
        if (stream.getPosition() != position) {
            stream.setPosition(position);
        }
    }

    // a failed write or resize may still have changed the wrapped stream; caller holds ioLock
    private void refreshLengthAfter(Throwable failure) {
        try {
            length = stream.length();
        } catch (IOException | RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
    }

    @Override
    public String toString() {
        return "MultiplexedCursorStream(" + stream + ", owners=" + registry.size() + ")";
    }
}
