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
import java.util.Arrays;
import java.util.Objects;

/**
 * An in-memory SeekableStream backed by a growable byte array.
 * The position may be set past the end; a write there fills the gap with zeros.
 */
public class ByteArraySeekableStream implements SeekableStream {
    private byte[] data;
    private int length;
    private int position;
    private final boolean writable;
    private boolean closed;

    /**
     * Creates an empty, writable stream.
     */
    public ByteArraySeekableStream() {
        this(new byte[0], true);
    }

    /**
     * Creates a stream over a copy of {@code contents}.
     *
     * @param contents initial contents
     * @param writable whether writes and length changes are allowed
     */
    public ByteArraySeekableStream(byte[] contents, boolean writable) {
        this.data = contents.clone();
        this.length = contents.length;
        this.writable = writable;
    }

    @Override
    public boolean canRead() {
        return !closed;
    }

    @Override
    public boolean canWrite() {
        return writable && !closed;
    }

    @Override
    public boolean canSeek() {
        return !closed;
    }

    @Override
    public long length() throws IOException {
        ensureOpen();
        return length;
    }

    @Override
    public void setLength(long newLength) throws IOException {
        ensureOpen();
        requireWritable();
        if (newLength < 0 || newLength > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid length " + newLength);
        }
        int n = (int) newLength;
        ensureCapacity(n);
        if (n > length) {
            Arrays.fill(data, length, n, (byte) 0);
        }
        length = n;
    }

    @Override
    public long getPosition() throws IOException {
        ensureOpen();
        return position;
    }

    @Override
    public void setPosition(long position) throws IOException {
        ensureOpen();
        if (position < 0 || position > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid position " + position);
        }
        this.position = (int) position;
    }

    @Override
    public int read(byte[] buffer, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, buffer.length);
        ensureOpen();
        if (count == 0) {
            return 0;
        }
        if (position >= length) {
            return -1;
        }
        int n = Math.min(count, length - position);
        System.arraycopy(data, position, buffer, offset, n);
        position += n;
        return n;
    }

    @Override
    public void write(byte[] buffer, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, buffer.length);
        ensureOpen();
        requireWritable();
        long end = (long) position + count;
        if (end > Integer.MAX_VALUE) {
            throw new IOException("Stream would exceed " + Integer.MAX_VALUE + " bytes");
        }
        ensureCapacity((int) end);
        if (position > length) {
            Arrays.fill(data, length, position, (byte) 0);
        }
        System.arraycopy(buffer, offset, data, position, count);
        position = (int) end;
        length = Math.max(length, position);
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
        closed = true;
    }

    /**
     * @return a copy of the current contents
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, length);
    }

    private void ensureCapacity(int capacity) {
        if (capacity > data.length) {
            int grown = (int) Math.min(Integer.MAX_VALUE, Math.max(capacity, 2L * data.length));
            data = Arrays.copyOf(data, grown);
        }
    }

    private void requireWritable() {
        if (!writable) {
            throw new UnsupportedOperationException("Stream is not writable");
        }
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream is closed");
        }
    }
}
