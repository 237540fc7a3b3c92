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
import dev.objectstream.common.stream.UnexpectedEndOfStreamException;

/**
 * The host side of a {@code PutObject} call, which sends the chunks of an object to a plugin and waits
 * for the plugin's single response.
 */
public interface PutObjectClientStream {

    /**
     * Sends the specified chunk, blocking until the plugin receives it.
     *
     * @throws IllegalArgumentException if the {@code request} is {@code null}
     * @throws ClosedStreamException if the request half of the stream has been closed
     * @throws InterruptedException if the current thread is interrupted before the plugin receives it
     */
    void send(PutObjectRequest request) throws InterruptedException;

    /**
     * Closes the request half of the stream, telling the plugin that no more chunks will follow.
     *
     * @throws ClosedStreamException if the request half has been closed already
     */
    void closeSend();

    /**
     * Closes the request half of the stream if it is still open and waits for the plugin's response.
     *
     * @return the response, or {@code null} if the response half was closed without a response or an
     *         error. A well-formed call always yields either, so callers usually treat {@code null} as
     *         an {@link UnexpectedEndOfStreamException}.
     * @throws StreamErrorException if the plugin responded with an error
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    @Nullable
    PutObjectResponse closeAndReceive() throws InterruptedException;

    /**
     * Closes the request half of the stream if it is still open and waits for the plugin's response
     * {@link Message}. Unlike {@link #closeAndReceive()}, an error sent by the plugin is returned as a
     * {@link Message} rather than thrown.
     *
     * @return the response message, or {@code null} if the response half was closed without one
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    @Nullable
    Message<PutObjectResponse> closeAndReceiveMessage() throws InterruptedException;

    /**
     * Returns {@code true} if the request half of the stream has been closed.
     */
    boolean isClosed();
}
