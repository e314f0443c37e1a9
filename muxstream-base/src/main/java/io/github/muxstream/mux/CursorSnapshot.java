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
 * A point-in-time copy of one owner's cursor.
 *
 * @param owner the owner identity
 * @param position the owner's logical position
 * @param hitCount how many times the owner was resolved through a registry scan
 */
public record CursorSnapshot(Object owner, long position, long hitCount) {
}
