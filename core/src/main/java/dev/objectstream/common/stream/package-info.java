/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

/**
 * The building blocks of an in-memory object stream: a zero-capacity {@link HandOffChannel}, the
 * {@link StreamGuard} which closes it exactly once, and the {@link Message} which travels through it.
 *
 * <h2>End of stream</h2>
 * <p>A receiver observes the end of a stream as a {@code null} return value, never as an exception.
 * An error sent by the other endpoint is a {@link Message} of its own and is always the last message of
 * its stream half.
 */
@NonNullByDefault
package dev.objectstream.common.stream;

import dev.objectstream.common.annotation.NonNullByDefault;
