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

import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.common.stream.Message;

/**
 * The plugin side of a {@code GetObject} call, which sends the chunks of an object to a host.
 *
 * <p>Every sending method blocks until the host receives the message, so a plugin can never get ahead
 * of a host which does not read.
 */
public interface GetObjectServerStream {

    /**
     * Sends the specified chunk, blocking until the host receives it. The stream stays open.
     *
     * @throws IllegalArgumentException if the {@code response} is {@code null}
     * @throws ClosedStreamException if the stream has been closed
     * @throws InterruptedException if the current thread is interrupted before the host receives it
     */
    void send(GetObjectResponse response) throws InterruptedException;

    /**
     * Terminates the stream with the specified error. The stream is closed afterwards, even if the host
     * never receives the error.
     *
     * @throws IllegalArgumentException if the {@code cause} is {@code null}
     * @throws ClosedStreamException if the stream has been closed
     * @throws InterruptedException if the current thread is interrupted before the host receives it
     */
    void sendError(Throwable cause) throws InterruptedException;

    /**
     * Sends the specified {@link Message}. A payload is sent as {@link #send(GetObjectResponse)} does and
     * an error as {@link #sendError(Throwable)} does.
     *
     * @throws IllegalArgumentException if the {@code message} is {@code null}
     * @throws ClosedStreamException if the stream has been closed
     * @throws InterruptedException if the current thread is interrupted before the host receives it
     */
    void sendMessage(Message<GetObjectResponse> message) throws InterruptedException;

    /**
     * Closes the stream after the last chunk has been sent. The host observes the end of the stream.
     *
     * @return {@code true} if this invocation closed the stream,
     *         {@code false} if it was closed already
     */
    boolean complete();

    /**
     * Returns {@code true} if the stream has been closed by either side.
     */
    boolean isClosed();
}
