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

import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.common.stream.HandOffChannel;
import dev.objectstream.common.stream.Message;
import dev.objectstream.common.stream.StreamGuard;

final class DefaultGetObjectServerStream implements GetObjectServerStream {

    private final HandOffChannel<Message<GetObjectResponse>> sendToClient;
    private final StreamGuard guard;

    DefaultGetObjectServerStream(HandOffChannel<Message<GetObjectResponse>> sendToClient, StreamGuard guard) {
        this.sendToClient = sendToClient;
        this.guard = guard;
    }

    @Override
    public void send(GetObjectResponse response) throws InterruptedException {
        checkArgument(response != null, "response: null (expected: non-null)");
        if (guard.isClosed()) {
            throw ClosedStreamException.get();
        }
        sendToClient.send(Message.of(response));
    }

    @Override
    public void sendError(Throwable cause) throws InterruptedException {
        checkArgument(cause != null, "cause: null (expected: non-null)");
        if (guard.isClosed()) {
            throw ClosedStreamException.get();
        }
        try {
            sendToClient.send(Message.ofError(cause));
        } finally {
            guard.close();
        }
    }

    @Override
    public void sendMessage(Message<GetObjectResponse> message) throws InterruptedException {
        checkArgument(message != null, "message: null (expected: non-null)");
        if (message.isError()) {
            sendError(message.cause());
        } else {
            send(message.payload());
        }
    }

    @Override
    public boolean complete() {
        return guard.close();
    }

    @Override
    public boolean isClosed() {
        return guard.isClosed();
    }
}
