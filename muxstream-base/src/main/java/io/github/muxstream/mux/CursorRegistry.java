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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Maps owner identities to their {@link CursorEntry}, creating entries on first use.
 * <p>
 * Lookup is a linear scan in an order kept roughly sorted by descending hit count, so the owners
 * that resolve most often are found first. A single "last resolved" slot short-circuits the scan
 * when the same owner resolves repeatedly, which is the common case of a tight read loop.
 * <p>
 * Every {@code reorderInterval}-th scan triggers an insertion-sort pass over the list. The pass
 * checks for out-of-order neighbours under the read lock and only takes the write lock when
 * something must move. Hit counts are incremented under the read lock, so they are frozen while
 * the pass holds the write lock.
 */
public final class CursorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CursorRegistry.class);

    private final Supplier<?> ownerIdentity;
    private final int reorderInterval;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    // guarded by lock
    private final List<CursorEntry> entries = new ArrayList<>();

    // hint only, always verified against the caller's identity before use
    private volatile CursorEntry lastResolved;

    private final AtomicLong fullResolutions = new AtomicLong();
    private final AtomicLong reorderPasses = new AtomicLong();
    // guarded by lock
    private boolean closed;

    /**
     * @param ownerIdentity supplies the identity of the calling context; must be stable for the
     *                      lifetime of that context and comparable with {@code equals}
     * @param reorderInterval number of full resolutions between two reordering passes
     */
    CursorRegistry(Supplier<?> ownerIdentity, int reorderInterval) {
        if (reorderInterval <= 0) {
            throw new IllegalArgumentException("reorderInterval must be positive: " + reorderInterval);
        }
        this.ownerIdentity = Objects.requireNonNull(ownerIdentity);
        this.reorderInterval = reorderInterval;
    }

    /**
     * Returns the cursor of the calling owner, registering a new cursor at position 0 on first use.
     *
     * @return the caller's cursor
     * @throws IOException if the registry has been closed and the caller has no cursor
     */
    CursorEntry resolve() throws IOException {
        Object owner = currentOwner();

        CursorEntry last = lastResolved;
        if (last != null && last.owner().equals(owner)) {
            return last;
        }

        if (fullResolutions.incrementAndGet() % reorderInterval == 0) {
            reorder();
        }

        lock.readLock().lock();
        try {
            for (CursorEntry entry : entries) {
                if (entry.owner().equals(owner)) {
                    entry.hit();
                    lastResolved = entry;
                    return entry;
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        return register(owner);
    }

    Object currentOwner() {
        return Objects.requireNonNull(ownerIdentity.get(), "owner identity");
    }

    private CursorEntry register(Object owner) throws IOException {
        CursorEntry entry;
        int size;
        lock.writeLock().lock();
        try {
            if (closed) {
                throw new IOException("Stream closed");
            }
            // an owner token shared between threads may have been registered since our scan
            for (CursorEntry existing : entries) {
                if (existing.owner().equals(owner)) {
                    existing.hit();
                    lastResolved = existing;
                    return existing;
                }
            }
            entry = new CursorEntry(owner);
            entries.add(entry);
            size = entries.size();
            lastResolved = entry;
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Registered cursor for owner {} ({} owners)", owner, size);
        return entry;
    }

    /**
     * Sorts the scan order by descending hit count, taking the write lock only if needed.
     */
    @VisibleForTesting
    void reorder() {
        lock.readLock().lock();
        try {
            if (isOrdered()) {
                return;
            }
        } finally {
            lock.readLock().unlock();
        }

        // the check above may be stale by now; sorting again is harmless
        boolean moved;
        int size;
        lock.writeLock().lock();
        try {
            moved = sortByHitCount();
            size = entries.size();
        } finally {
            lock.writeLock().unlock();
        }
        if (moved) {
            reorderPasses.incrementAndGet();
            logger.trace("Reordered cursor registry of {} entries", size);
        }
    }

    private boolean isOrdered() {
        for (int i = 1; i < entries.size(); i++) {
            if (entries.get(i - 1).hitCount() < entries.get(i).hitCount()) {
                return false;
            }
        }
        return true;
    }

    // stable insertion sort, descending hit count
    private boolean sortByHitCount() {
        boolean moved = false;
        for (int i = 1; i < entries.size(); i++) {
            CursorEntry current = entries.get(i);
            long hits = current.hitCount();
            int j = i;
            while (j > 0 && entries.get(j - 1).hitCount() < hits) {
                entries.set(j, entries.get(j - 1));
                j--;
            }
            if (j != i) {
                entries.set(j, current);
                moved = true;
            }
        }
        return moved;
    }

    /**
     * Drops every cursor and refuses later registrations.
     */
    void close() {
        lock.writeLock().lock();
        try {
            closed = true;
            entries.clear();
            lastResolved = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return the number of registered owners
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return copies of all cursors, in current scan order
     */
    public List<CursorSnapshot> snapshot() {
        lock.readLock().lock();
        try {
            List<CursorSnapshot> copy = new ArrayList<>(entries.size());
            for (CursorEntry entry : entries) {
                copy.add(entry.snapshot());
            }
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return number of resolutions that missed the fast path and scanned the registry
     */
    @VisibleForTesting
    public long fullResolutionCount() {
        return fullResolutions.get();
    }

    /**
     * @return number of reordering passes that moved at least one entry
     */
    @VisibleForTesting
    public long reorderPassCount() {
        return reorderPasses.get();
    }

    @VisibleForTesting
    int reorderInterval() {
        return reorderInterval;
    }
}
