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

import java.io.IOException;
import java.io.OutputStream;

/**
 * OutputStream view of a {@link MultiplexedCursorStream}, writing at the calling owner's cursor.
 */
final class CursorOutputStream extends OutputStream {
    private final MultiplexedCursorStream stream;

    CursorOutputStream(MultiplexedCursorStream stream) {
        this.stream = stream;
    }

    @Override
    public void write(int b) throws IOException {
        stream.write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        stream.write(b, off, len);
    }

    @Override
    public void flush() throws IOException {
        stream.flush();
    }

    /**
     * Leaves the multiplexed stream open.
     */
    @Override
    public void close() {
    }
}
