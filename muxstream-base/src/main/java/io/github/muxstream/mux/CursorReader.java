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

import io.github.muxstream.disk.RandomAccessReader;
import io.github.muxstream.disk.SeekOrigin;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * RandomAccessReader over a {@link MultiplexedCursorStream}. Every call works on the calling
 * owner's cursor; the reader holds no position and no per-thread state.
 * <p>
 * Bulk array reads go through the stream in chunks of at most {@code CHUNK_BYTES}.
 */
final class CursorReader implements RandomAccessReader {
    static final int CHUNK_BYTES = 8192;

    private final MultiplexedCursorStream stream;
    private final ByteOrder order;

    CursorReader(MultiplexedCursorStream stream, ByteOrder order) {
        this.stream = stream;
        this.order = Objects.requireNonNull(order, "order");
    }

    @Override
    public void seek(long offset) throws IOException {
        stream.seek(offset, SeekOrigin.BEGIN);
    }

    @Override
    public long getPosition() throws IOException {
        return stream.getPosition();
    }

    @Override
    public byte readByte() throws IOException {
        int b = stream.read();
        if (b < 0) {
            throw new EOFException();
        }
        return (byte) b;
    }

    @Override
    public short readShort() throws IOException {
        return value(Short.BYTES).getShort();
    }

    @Override
    public int readInt() throws IOException {
        return value(Integer.BYTES).getInt();
    }

    @Override
    public float readFloat() throws IOException {
        return value(Float.BYTES).getFloat();
    }

    @Override
    public long readLong() throws IOException {
        return value(Long.BYTES).getLong();
    }

    @Override
    public void readFully(byte[] bytes) throws IOException {
        readFully(bytes, 0, bytes.length);
    }

    @Override
    public void readFully(ByteBuffer buffer) throws IOException {
        if (buffer.hasArray()) {
            int start = buffer.arrayOffset() + buffer.position();
            readFully(buffer.array(), start, buffer.remaining());
            buffer.position(buffer.limit());
        } else {
            byte[] bytes = new byte[Math.min(buffer.remaining(), CHUNK_BYTES)];
            while (buffer.hasRemaining()) {
                int n = Math.min(buffer.remaining(), bytes.length);
                readFully(bytes, 0, n);
                buffer.put(bytes, 0, n);
            }
        }
    }

    @Override
    public void readFully(long[] longs) throws IOException {
        ByteBuffer chunk = chunk(longs.length, Long.BYTES);
        for (int done = 0; done < longs.length; ) {
            int n = Math.min(longs.length - done, chunk.capacity() / Long.BYTES);
            fill(chunk, n * Long.BYTES).asLongBuffer().get(longs, done, n);
            done += n;
        }
    }

    @Override
    public void read(int[] ints, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, ints.length);
        ByteBuffer chunk = chunk(count, Integer.BYTES);
        for (int done = 0; done < count; ) {
            int n = Math.min(count - done, chunk.capacity() / Integer.BYTES);
            fill(chunk, n * Integer.BYTES).asIntBuffer().get(ints, offset + done, n);
            done += n;
        }
    }

    @Override
    public void read(float[] floats, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, floats.length);
        ByteBuffer chunk = chunk(count, Float.BYTES);
        for (int done = 0; done < count; ) {
            int n = Math.min(count - done, chunk.capacity() / Float.BYTES);
            fill(chunk, n * Float.BYTES).asFloatBuffer().get(floats, offset + done, n);
            done += n;
        }
    }

    /**
     * Does nothing; the stream belongs to its creator.
     */
    @Override
    public void close() {
    }

    @Override
    public long length() throws IOException {
        return stream.length();
    }

    private ByteBuffer value(int size) throws IOException {
        return fill(ByteBuffer.allocate(size).order(order), size);
    }

    // sized for the whole read when small, otherwise one chunk; the long product cannot overflow
    private ByteBuffer chunk(int elements, int width) {
        int size = (int) Math.min(CHUNK_BYTES, (long) elements * width);
        return ByteBuffer.allocate(Math.max(size, width)).order(order);
    }

    private ByteBuffer fill(ByteBuffer buffer, int size) throws IOException {
        buffer.clear();
        readFully(buffer.array(), 0, size);
        buffer.limit(size);
        return buffer;
    }

    private void readFully(byte[] bytes, int offset, int count) throws IOException {
        int done = 0;
        while (done < count) {
            int n = stream.read(bytes, offset + done, count - done);
            if (n < 0) {
                throw new EOFException("Needed " + count + " bytes, stream ended after " + done);
            }
            done += n;
        }
    }
}
