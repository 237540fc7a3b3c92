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

package dev.objectstream.grpc;

import static java.util.Objects.requireNonNull;

import io.grpc.Context;
import io.grpc.Metadata;

/**
 * The call-level state of an in-memory stream. Since an in-memory stream never crosses a wire, there are no
 * headers or trailers to exchange and nothing to cancel the call from outside. Headers and trailers are
 * always empty and the {@link Context} is always the root context.
 */
public final class StreamCallContext {

    private static final StreamCallContext INSTANCE = new StreamCallContext();

    /**
     * Returns the {@link StreamCallContext}.
     */
    public static StreamCallContext get() {
        return INSTANCE;
    }

    private StreamCallContext() {}

    /**
     * Returns the headers received from the other endpoint, which are always empty.
     */
    public Metadata headers() {
        return new Metadata();
    }

    /**
     * Returns the trailers received from the other endpoint, which are always empty.
     */
    public Metadata trailers() {
        return new Metadata();
    }

    /**
     * Discards the specified headers.
     */
    public void setHeaders(Metadata headers) {
        requireNonNull(headers, "headers");
    }

    /**
     * Discards the specified headers.
     */
    public void sendHeaders(Metadata headers) {
        requireNonNull(headers, "headers");
    }

    /**
     * Discards the specified trailers.
     */
    public void setTrailers(Metadata trailers) {
        requireNonNull(trailers, "trailers");
    }

    /**
     * Returns {@link Context#ROOT}, which is never cancelled.
     */
    public Context context() {
        return Context.ROOT;
    }

    @Override
    public String toString() {
        return "StreamCallContext";
    }
}
