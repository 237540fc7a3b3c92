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
import dev.objectstream.common.stream.StreamGuard;

final class DefaultPutObjectServerStream implements PutObjectServerStream {

    private final HandOffChannel<Message<PutObjectRequest>> sentFromClient;
    private final HandOffChannel<Message<PutObjectResponse>> sendToClient;
    private final StreamGuard responseGuard;

    DefaultPutObjectServerStream(HandOffChannel<Message<PutObjectRequest>> sentFromClient,
                                 HandOffChannel<Message<PutObjectResponse>> sendToClient,
                                 StreamGuard responseGuard) {
        this.sentFromClient = sentFromClient;
        this.sendToClient = sendToClient;
        this.responseGuard = responseGuard;
    }

    @Nullable
    @Override
    public PutObjectRequest receive() throws InterruptedException {
        final Message<PutObjectRequest> message = receiveMessage();
        // The host sends no error on the request half.
        return message != null ? message.payload() : null;
    }

    @Nullable
    @Override
    public Message<PutObjectRequest> receiveMessage() throws InterruptedException {
        return sentFromClient.receive();
    }

    @Override
    public void sendAndClose(PutObjectResponse response) throws InterruptedException {
        checkArgument(response != null, "response: null (expected: non-null)");
        sendAndClose(Message.of(response));
    }

    @Override
    public void sendError(Throwable cause) throws InterruptedException {
        checkArgument(cause != null, "cause: null (expected: non-null)");
        sendAndClose(Message.ofError(cause));
    }

    @Override
    public void sendMessage(Message<PutObjectResponse> message) throws InterruptedException {
        checkArgument(message != null, "message: null (expected: non-null)");
        sendAndClose(message);
    }

    private void sendAndClose(Message<PutObjectResponse> message) throws InterruptedException {
        if (responseGuard.isClosed()) {
            throw ClosedStreamException.get();
        }
        try {
            sendToClient.send(message);
        } finally {
            responseGuard.close();
        }
    }

    @Override
    public boolean isClosed() {
        return responseGuard.isClosed();
    }
}
