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
 * An in-memory {@code PutObject} stream which connects a {@link PutObjectClientStream} and a
 * {@link PutObjectServerStream}. The request half, from the host to the plugin, and the response half,
 * from the plugin to the host, are closed independently of each other.
 */
public final class PutObjectStream {

    private final HandOffChannel<Message<PutObjectRequest>> requests = new HandOffChannel<>();
    private final HandOffChannel<Message<PutObjectResponse>> responses = new HandOffChannel<>();
    private final StreamGuard requestGuard = StreamGuard.of("PutObject.request", requests);
    private final StreamGuard responseGuard = StreamGuard.of("PutObject.response", responses);
    private final PutObjectClientStream client =
            new DefaultPutObjectClientStream(requests, responses, requestGuard, responseGuard);
    private final PutObjectServerStream server =
            new DefaultPutObjectServerStream(requests, responses, responseGuard);

    /**
     * Returns the host side of this stream.
     */
    public PutObjectClientStream client() {
        return client;
    }

    /**
     * Returns the plugin side of this stream.
     */
    public PutObjectServerStream server() {
        return server;
    }

    /**
     * Returns {@code true} if the request half has been closed.
     */
    public boolean isRequestClosed() {
        return requestGuard.isClosed();
    }

    /**
     * Returns {@code true} if the response half has been closed.
     */
    public boolean isResponseClosed() {
        return responseGuard.isClosed();
    }

    /**
     * Closes the request half if it is not closed yet. A host blocked in sending a chunk fails with a
     * {@link dev.objectstream.common.stream.ClosedStreamException} and the plugin observes the end of the
     * requests.
     *
     * @return {@code true} if this invocation closed the request half
     */
    public boolean closeRequest() {
        return requestGuard.close();
    }

    /**
     * Closes the response half if it is not closed yet. A host waiting for the response observes the end
     * of the stream instead.
     *
     * @return {@code true} if this invocation closed the response half
     */
    public boolean closeResponse() {
        return responseGuard.close();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("requestClosed", isRequestClosed())
                          .add("responseClosed", isResponseClosed())
                          .toString();
    }
}
