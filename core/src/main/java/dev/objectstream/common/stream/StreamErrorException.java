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

import static java.util.Objects.requireNonNull;

/**
 * A {@link RuntimeException} raised on the receiving endpoint when the other endpoint terminated the
 * stream with an error. The error sent by the other endpoint is available via {@link #getCause()}.
 */
public final class StreamErrorException extends RuntimeException {

    private static final long serialVersionUID = 3071556480117096287L;

    /**
     * Creates a new instance with the error received from the other endpoint.
     */
    public StreamErrorException(Throwable cause) {
        super(requireNonNull(cause, "cause").toString(), cause);
    }
}
