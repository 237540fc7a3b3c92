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

/**
 * The plugin side of a {@code PutObject} call, which receives the chunks of an object from a host and
 * sends back exactly one response.
 */
public interface PutObjectServerStream {

    /**
     * Receives the next chunk, blocking until the host sends one or closes the request half.
     *
     * @return the next chunk, or {@code null} if the host sent all chunks
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    @Nullable
    PutObjectRequest receive() throws InterruptedException;

    /**
     * Receives the next {@link Message}, blocking until the host sends one or closes the request half.
     *
     * @return the next message, or {@code null} if the host sent all chunks
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    @Nullable
    Message<PutObjectRequest> receiveMessage() throws InterruptedException;

    /**
     * Sends the specified response and closes the response half of the stream.
     *
     * @throws IllegalArgumentException if the {@code response} is {@code null}
     * @throws ClosedStreamException if the response half has been closed
     * @throws InterruptedException if the current thread is interrupted before the host receives it
     */
    void sendAndClose(PutObjectResponse response) throws InterruptedException;

    /**
     * Terminates the response half with the specified error. The response half is closed afterwards,
     * even if the host never receives the error.
     *
     * @throws IllegalArgumentException if the {@code cause} is {@code null}
     * @throws ClosedStreamException if the response half has been closed
     * @throws InterruptedException if the current thread is interrupted before the host receives it
     */
    void sendError(Throwable cause) throws InterruptedException;

    /**
     * Sends the specified {@link Message}. A payload is sent as {@link #sendAndClose(PutObjectResponse)}
     * does and an error as {@link #sendError(Throwable)} does.
     *
     * @throws IllegalArgumentException if the {@code message} is {@code null}
     * @throws ClosedStreamException if the response half has been closed
     * @throws InterruptedException if the current thread is interrupted before the host receives it
     */
    void sendMessage(Message<PutObjectResponse> message) throws InterruptedException;

    /**
     * Returns {@code true} if the response half of the stream has been closed.
     */
    boolean isClosed();
}
