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

/**
 * The logical cursor of one owner. Position and hit count are only written by the owner itself
 * (the hit count additionally only while the registry read lock is held), so plain volatile
 * fields are enough for other threads to observe them.
 */
final class CursorEntry {
    private final Object owner;
    private volatile long position;
    private volatile long hitCount = 1;

    CursorEntry(Object owner) {
        this.owner = owner;
    }

    Object owner() {
        return owner;
    }

    long position() {
        return position;
    }

    void position(long position) {
        this.position = position;
    }

    void advance(long bytes) {
        position += bytes;
    }

    long hitCount() {
        return hitCount;
    }

    void hit() {
        hitCount++;
    }

    CursorSnapshot snapshot() {
        return new CursorSnapshot(owner, position, hitCount);
    }

    @Override
    public String toString() {
        return "CursorEntry(" + owner + " @ " + position + ", hits=" + hitCount + ")";
    }
}
