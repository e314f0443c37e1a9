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

import io.github.muxstream.disk.SeekableStream;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps a stream, counting calls and recording any two operations that overlap in time.
 * Can also cap the size of reads, fail reads, and withdraw seek support.
 */
class InstrumentedStream implements SeekableStream {
    private final SeekableStream delegate;
    private final AtomicInteger inFlight = new AtomicInteger();

    final AtomicInteger overlaps = new AtomicInteger();
    final AtomicInteger lengthCalls = new AtomicInteger();
    final AtomicInteger setPositionCalls = new AtomicInteger();
    final AtomicInteger flushCalls = new AtomicInteger();
    volatile int maxReadChunk = Integer.MAX_VALUE;
    volatile boolean seekable = true;
    volatile IOException readFailure;
    volatile boolean closed;

    InstrumentedStream(SeekableStream delegate) {
        this.delegate = delegate;
    }

    private void enter() {
        if (inFlight.incrementAndGet() > 1) {
            overlaps.incrementAndGet();
        }
        // widen the window for a racing caller
        Thread.yield();
    }

    private void exit() {
        inFlight.decrementAndGet();
    }

    @Override
    public boolean canRead() {
        return delegate.canRead();
    }

    @Override
    public boolean canWrite() {
        return delegate.canWrite();
    }

    @Override
    public boolean canSeek() {
        return seekable && delegate.canSeek();
    }

    @Override
    public long length() throws IOException {
        lengthCalls.incrementAndGet();
        return delegate.length();
    }

    @Override
    public void setLength(long newLength) throws IOException {
        enter();
        try {
            delegate.setLength(newLength);
        } finally {
            exit();
        }
    }

    @Override
    public long getPosition() throws IOException {
        return delegate.getPosition();
    }

    @Override
    public void setPosition(long position) throws IOException {
        setPositionCalls.incrementAndGet();
        enter();
        try {
            delegate.setPosition(position);
        } finally {
            exit();
        }
    }

    @Override
    public int read(byte[] buffer, int offset, int count) throws IOException {
        enter();
        try {
            if (readFailure != null) {
                throw readFailure;
            }
            return delegate.read(buffer, offset, Math.min(count, maxReadChunk));
        } finally {
            exit();
        }
    }

    @Override
    public void write(byte[] buffer, int offset, int count) throws IOException {
        enter();
        try {
            delegate.write(buffer, offset, count);
        } finally {
            exit();
        }
    }

    @Override
    public void flush() throws IOException {
        flushCalls.incrementAndGet();
        enter();
        try {
            delegate.flush();
        } finally {
            exit();
        }
    }

    @Override
    public void close() throws IOException {
        closed = true;
        delegate.close();
    }
}
