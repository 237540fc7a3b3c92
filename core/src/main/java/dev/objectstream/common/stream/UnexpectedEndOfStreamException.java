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

package dev.objectstream.common.stream;

import dev.objectstream.common.annotation.Nullable;

/**
 * A {@link RuntimeException} raised when a stream half ended without the terminal message the caller
 * was waiting for, e.g. an upload whose response half was closed before a result or an error was sent.
 */
public final class UnexpectedEndOfStreamException extends RuntimeException {

    private static final long serialVersionUID = 5217342419452217711L;

    /**
     * Creates a new instance with the specified {@code message}.
     */
    public UnexpectedEndOfStreamException(@Nullable String message) {
        super(message);
    }
}
