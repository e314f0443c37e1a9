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

import io.github.muxstream.disk.SeekOrigin;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InputStream view of a {@link MultiplexedCursorStream}, reading from the calling owner's cursor.
 * Marks are kept per owner.
 */
final class CursorInputStream extends InputStream {
    private final MultiplexedCursorStream stream;
    // owner -> marked position
    private final Map<Object, Long> marks = new ConcurrentHashMap<>();

    CursorInputStream(MultiplexedCursorStream stream) {
        this.stream = stream;
    }

    @Override
    public int read() throws IOException {
        return stream.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        return stream.read(b, off, len);
    }

    @Override
    public long skip(long n) throws IOException {
        if (n <= 0) {
            return 0;
        }
        long position = stream.getPosition();
        long skipped = Math.min(n, Math.max(0, stream.length() - position));
        stream.seek(position + skipped, SeekOrigin.BEGIN);
        return skipped;
    }

    @Override
    public int available() throws IOException {
        long remaining = stream.length() - stream.getPosition();
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, remaining));
    }

    @Override
    public boolean markSupported() {
        return true;
    }

    @Override
    public void mark(int readlimit) {
        try {
            marks.put(stream.currentOwner(), stream.getPosition());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public void reset() throws IOException {
        Long mark = marks.get(stream.currentOwner());
        if (mark == null) {
            throw new IOException("Mark not set");
        }
        stream.seek(mark, SeekOrigin.BEGIN);
    }

    /**
     * Leaves the multiplexed stream open.
     */
    @Override
    public void close() {
        marks.clear();
    }
}
