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

import dev.objectstream.common.annotation.Nullable;
import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.common.stream.Message;
import dev.objectstream.common.stream.StreamErrorException;

/**
 * The host side of a {@code GetObject} call, which receives the chunks of an object sent by a plugin.
 */
public interface GetObjectClientStream {

    /**
     * Receives the next chunk, blocking until the plugin sends one or the stream is closed.
     *
     * @return the next chunk, or {@code null} if the stream ended
     * @throws StreamErrorException if the plugin terminated the stream with an error
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    @Nullable
    GetObjectResponse receive() throws InterruptedException;

    /**
     * Receives the next {@link Message}, blocking until the plugin sends one or the stream is closed.
     * Unlike {@link #receive()}, an error sent by the plugin is returned as a {@link Message} rather than
     * thrown.
     *
     * @return the next message, or {@code null} if the stream ended
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    @Nullable
    Message<GetObjectResponse> receiveMessage() throws InterruptedException;

    /**
     * Closes the stream from the host side, abandoning the download. The plugin fails to send any further
     * chunk with a {@link ClosedStreamException}.
     *
     * @throws ClosedStreamException if the stream has been closed already
     */
    void closeSend();

    /**
     * Returns {@code true} if the stream has been closed by either side.
     */
    boolean isClosed();
}
