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

import static com.google.common.base.Preconditions.checkArgument;

import dev.objectstream.common.annotation.Nullable;
import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.common.stream.HandOffChannel;
import dev.objectstream.common.stream.Message;
import dev.objectstream.common.stream.StreamErrorException;
import dev.objectstream.common.stream.StreamGuard;

final class DefaultPutObjectClientStream implements PutObjectClientStream {

    private final HandOffChannel<Message<PutObjectRequest>> sendToServer;
    private final HandOffChannel<Message<PutObjectResponse>> sentFromServer;
    private final StreamGuard requestGuard;
    private final StreamGuard responseGuard;

    DefaultPutObjectClientStream(HandOffChannel<Message<PutObjectRequest>> sendToServer,
                                 HandOffChannel<Message<PutObjectResponse>> sentFromServer,
                                 StreamGuard requestGuard, StreamGuard responseGuard) {
        this.sendToServer = sendToServer;
        this.sentFromServer = sentFromServer;
        this.requestGuard = requestGuard;
        this.responseGuard = responseGuard;
    }

    @Override
    public void send(PutObjectRequest request) throws InterruptedException {
        checkArgument(request != null, "request: null (expected: non-null)");
        if (requestGuard.isClosed()) {
            throw ClosedStreamException.get();
        }
        sendToServer.send(Message.of(request));
    }

    @Override
    public void closeSend() {
        if (!requestGuard.close()) {
            throw ClosedStreamException.get();
        }
    }

    @Nullable
    @Override
    public PutObjectResponse closeAndReceive() throws InterruptedException {
        final Message<PutObjectResponse> message = closeAndReceiveMessage();
        if (message == null) {
            return null;
        }
        if (message.isError()) {
            throw new StreamErrorException(message.cause());
        }
        return message.payload();
    }

    @Nullable
    @Override
    public Message<PutObjectResponse> closeAndReceiveMessage() throws InterruptedException {
        requestGuard.close();
        final Message<PutObjectResponse> message = sentFromServer.receive();
        if (message != null) {
            // The response half carries a single message.
            responseGuard.close();
        }
        return message;
    }

    @Override
    public boolean isClosed() {
        return requestGuard.isClosed();
    }
}
