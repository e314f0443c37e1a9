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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.muxstream.disk.ByteArraySeekableStream;
import io.github.muxstream.disk.FileChannelStream;
import io.github.muxstream.disk.SeekOrigin;
import io.github.muxstream.disk.SeekableStream;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;

/**
 * Tests that many threads sharing one MultiplexedCursorStream each see their own cursor and
 * their own data, and that the wrapped stream never runs two operations at once.
 */
@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestMultiplexedCursorStreamConcurrency extends RandomizedTest {
    private static final int NUM_OWNERS = 64;
    private static final int ITERATIONS = 20;

    private Path testDirectory;
    private ExecutorService executor;

    @Before
    public void setUp() throws IOException {
        testDirectory = Files.createTempDirectory("test_multiplexed_cursor_stream");
        executor = Executors.newFixedThreadPool(NUM_OWNERS);
    }

    @After
    public void tearDown() throws IOException {
        executor.shutdownNow();
        try (var files = Files.list(testDirectory)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                Files.deleteIfExists(p);
            }
        }
        Files.deleteIfExists(testDirectory);
    }

    @Test
    public void testDistinctPatternsInMemory() throws Exception {
        var instrumented = new InstrumentedStream(new ByteArraySeekableStream());
        checkDistinctPatterns(instrumented);
        assertEquals("Wrapped stream saw overlapping operations", 0, instrumented.overlaps.get());
    }

    @Test
    public void testDistinctPatternsOnDisk() throws Exception {
        Path file = testDirectory.resolve("patterns");
        try (var fileStream = FileChannelStream.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            var instrumented = new InstrumentedStream(fileStream);
            checkDistinctPatterns(instrumented);
            assertEquals("Wrapped stream saw overlapping operations", 0, instrumented.overlaps.get());
        }
        assertEquals((long) NUM_OWNERS * NUM_OWNERS, Files.size(file));
    }

    /**
     * Every owner writes its own NUM_OWNERS-byte pattern at index * NUM_OWNERS, then reads it back.
     */
    private void checkDistinctPatterns(SeekableStream underlying) throws Exception {
        var stream = new MultiplexedCursorStream(underlying);
        stream.setLength((long) NUM_OWNERS * NUM_OWNERS);
        AtomicInteger errorCount = new AtomicInteger();

        for (int iteration = 0; iteration < ITERATIONS; iteration++) {
            final int round = iteration;
            CyclicBarrier barrier = new CyclicBarrier(NUM_OWNERS);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < NUM_OWNERS; t++) {
                final int index = t;
                futures.add(executor.submit(() -> {
                    byte[] pattern = new byte[NUM_OWNERS];
                    for (int i = 0; i < pattern.length; i++) {
                        pattern[i] = (byte) (index * 31 + i * 7 + round);
                    }
                    long offset = (long) index * NUM_OWNERS;

                    barrier.await();
                    stream.seek(offset, SeekOrigin.BEGIN);
                    stream.write(pattern, 0, pattern.length);
                    if (stream.getPosition() != offset + NUM_OWNERS) {
                        errorCount.incrementAndGet();
                    }

                    stream.seek(offset, SeekOrigin.BEGIN);
                    byte[] back = new byte[NUM_OWNERS];
                    int done = 0;
                    while (done < back.length) {
                        int n = stream.read(back, done, back.length - done);
                        if (n < 0) {
                            break;
                        }
                        done += n;
                    }
                    for (int i = 0; i < back.length; i++) {
                        if (back[i] != pattern[i]) {
                            System.err.println("Owner " + index + " round " + round + " expected " + pattern[i] + " at " + i + " but got " + back[i]);
                            errorCount.incrementAndGet();
                            break;
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        }

        assertEquals("Expected no cross-contamination between owners", 0, errorCount.get());
        assertEquals(NUM_OWNERS, stream.ownerCount());
        assertEquals((long) NUM_OWNERS * NUM_OWNERS, stream.length());
    }

    @Test
    public void testConcurrentRandomReads() throws Exception {
        int size = 64 * 1024;
        byte[] contents = new byte[size];
        for (int i = 0; i < size; i += 4) {
            contents[i] = (byte) (i >>> 24);
            contents[i + 1] = (byte) (i >>> 16);
            contents[i + 2] = (byte) (i >>> 8);
            contents[i + 3] = (byte) i;
        }
        var instrumented = new InstrumentedStream(new ByteArraySeekableStream(contents, false));
        var stream = new MultiplexedCursorStream(instrumented);
        var reader = stream.reader(ByteOrder.BIG_ENDIAN);
        AtomicInteger errorCount = new AtomicInteger();
        CyclicBarrier barrier = new CyclicBarrier(NUM_OWNERS);
        long seed = randomLong();

        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < NUM_OWNERS; t++) {
            final int threadId = t;
            futures.add(executor.submit(() -> {
                Random random = new Random(seed + threadId);
                barrier.await();
                for (int i = 0; i < 500; i++) {
                    int position = random.nextInt(size / 4) * 4;
                    reader.seek(position);
                    // reads a run of values, letting other owners move the physical position in between
                    int run = Math.min(1 + random.nextInt(4), (size - position) / 4);
                    for (int k = 0; k < run; k++) {
                        int value = reader.readInt();
                        if (value != position + 4 * k) {
                            errorCount.incrementAndGet();
                        }
                    }
                    if (reader.getPosition() != position + 4L * run) {
                        errorCount.incrementAndGet();
                    }
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get();
        }

        assertEquals("Expected no errors during concurrent reads", 0, errorCount.get());
        assertEquals(0, instrumented.overlaps.get());
    }

    @Test
    public void testConcurrentLengthChangesKeepCacheInSync() throws Exception {
        var backing = new ByteArraySeekableStream();
        var stream = new MultiplexedCursorStream(backing);
        CyclicBarrier barrier = new CyclicBarrier(NUM_OWNERS);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < NUM_OWNERS; t++) {
            final int threadId = t;
            futures.add(executor.submit(() -> {
                barrier.await();
                for (int i = 0; i < 50; i++) {
                    if ((threadId + i) % 5 == 0) {
                        stream.setLength(threadId + i);
                    } else {
                        stream.seek(0, SeekOrigin.BEGIN);
                        stream.write(new byte[threadId + 1], 0, threadId + 1);
                    }
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get();
        }
        assertEquals(backing.length(), stream.length());
    }
}
