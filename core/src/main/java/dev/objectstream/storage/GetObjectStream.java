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

package dev.objectstream.storage;

import com.google.common.base.MoreObjects;

import dev.objectstream.common.stream.HandOffChannel;
import dev.objectstream.common.stream.Message;
import dev.objectstream.common.stream.StreamGuard;

/**
 * An in-memory {@code GetObject} stream which connects a {@link GetObjectClientStream} and a
 * {@link GetObjectServerStream}. The two sides share a single zero-capacity channel and the
 * {@link StreamGuard} which closes it.
 */
public final class GetObjectStream {

    private final HandOffChannel<Message<GetObjectResponse>> messages = new HandOffChannel<>();
    private final StreamGuard guard = StreamGuard.of("GetObject", messages);
    private final GetObjectClientStream client = new DefaultGetObjectClientStream(messages, guard);
    private final GetObjectServerStream server = new DefaultGetObjectServerStream(messages, guard);

    /**
     * Returns the host side of this stream.
     */
    public GetObjectClientStream client() {
        return client;
    }

    /**
     * Returns the plugin side of this stream.
     */
    public GetObjectServerStream server() {
        return server;
    }

    /**
     * Returns {@code true} if this stream has been closed.
     */
    public boolean isClosed() {
        return guard.isClosed();
    }

    /**
     * Closes this stream if it is not closed yet.
     *
     * @return {@code true} if this invocation closed the stream
     */
    public boolean close() {
        return guard.close();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("closed", isClosed())
                          .toString();
    }
}
