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
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * A SeekableStream over a {@link FileChannel}. The channel's own position is the stream position.
 */
public class FileChannelStream implements SeekableStream {
    private final FileChannel channel;
    private final boolean readable;
    private final boolean writable;

    /**
     * @param channel an open channel
     * @param readable whether the channel was opened for reading
     * @param writable whether the channel was opened for writing
     */
    public FileChannelStream(FileChannel channel, boolean readable, boolean writable) {
        this.channel = Objects.requireNonNull(channel);
        this.readable = readable;
        this.writable = writable;
    }

    /**
     * Opens a file. With no options the file is opened for reading only.
     *
     * @param path the file to open
     * @param options options as for {@link FileChannel#open(Path, OpenOption...)}
     * @return a stream positioned at 0
     * @throws IOException if the file cannot be opened
     */
    public static FileChannelStream open(Path path, OpenOption... options) throws IOException {
        Set<OpenOption> opts = Set.copyOf(Arrays.asList(options));
        boolean writable = opts.contains(StandardOpenOption.WRITE) || opts.contains(StandardOpenOption.APPEND);
        boolean readable = opts.contains(StandardOpenOption.READ) || !writable;
        if (opts.contains(StandardOpenOption.APPEND)) {
            // append mode ignores the channel position on write
            throw new IllegalArgumentException("APPEND is not supported by a seekable stream");
        }
        return new FileChannelStream(FileChannel.open(path, options), readable, writable);
    }

    @Override
    public boolean canRead() {
        return readable && channel.isOpen();
    }

    @Override
    public boolean canWrite() {
        return writable && channel.isOpen();
    }

    @Override
    public boolean canSeek() {
        return channel.isOpen();
    }

    @Override
    public long length() throws IOException {
        return channel.size();
    }

    @Override
    public void setLength(long newLength) throws IOException {
        if (newLength < 0) {
            throw new IllegalArgumentException("Negative length " + newLength);
        }
        requireWritable();
        long size = channel.size();
        if (newLength < size) {
            long position = channel.position();
            channel.truncate(newLength);
            // truncate clamps the position, restore it to match other implementations
            channel.position(position);
        } else if (newLength > size) {
            channel.write(ByteBuffer.wrap(new byte[1]), newLength - 1);
        }
    }

    @Override
    public long getPosition() throws IOException {
        return channel.position();
    }

    @Override
    public void setPosition(long position) throws IOException {
        if (position < 0) {
            throw new IllegalArgumentException("Negative position " + position);
        }
        channel.position(position);
    }

    @Override
    public int read(byte[] buffer, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, buffer.length);
        if (!readable) {
            throw new UnsupportedOperationException("Stream is not readable");
        }
        if (count == 0) {
            return 0;
        }
        return channel.read(ByteBuffer.wrap(buffer, offset, count));
    }

    @Override
    public void write(byte[] buffer, int offset, int count) throws IOException {
        Objects.checkFromIndexSize(offset, count, buffer.length);
        requireWritable();
        ByteBuffer src = ByteBuffer.wrap(buffer, offset, count);
        while (src.hasRemaining()) {
            channel.write(src);
        }
    }

    @Override
    public void flush() throws IOException {
        if (writable) {
            channel.force(false);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }

    private void requireWritable() {
        if (!writable) {
            throw new UnsupportedOperationException("Stream is not writable");
        }
    }
}
