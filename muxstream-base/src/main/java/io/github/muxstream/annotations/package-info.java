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

/**
 * Provides annotation types for documenting API visibility constraints.
 * <p>
 * {@link io.github.muxstream.annotations.VisibleForTesting} marks classes, methods or fields
 * that are made visible solely so tests can inspect them, such as the resolution counters of
 * {@link io.github.muxstream.mux.CursorRegistry}. Do not rely on them from library code; they
 * may change without following semantic versioning rules.
 */
package io.github.muxstream.annotations;
