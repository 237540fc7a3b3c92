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
import dev.objectstream.common.stream.HandOffChannel;
import dev.objectstream.common.stream.Message;
import dev.objectstream.common.stream.StreamErrorException;
import dev.objectstream.common.stream.StreamGuard;

final class DefaultGetObjectClientStream implements GetObjectClientStream {

    private final HandOffChannel<Message<GetObjectResponse>> sentFromServer;
    private final StreamGuard guard;

    DefaultGetObjectClientStream(HandOffChannel<Message<GetObjectResponse>> sentFromServer,
                                 StreamGuard guard) {
        this.sentFromServer = sentFromServer;
        this.guard = guard;
    }

    @Nullable
    @Override
    public GetObjectResponse receive() throws InterruptedException {
        final Message<GetObjectResponse> message = receiveMessage();
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
    public Message<GetObjectResponse> receiveMessage() throws InterruptedException {
        final Message<GetObjectResponse> message = sentFromServer.receive();
        if (message != null && message.isError()) {
            // An error is the last message. The half is closed once it has been taken.
            guard.close();
        }
        return message;
    }

    @Override
    public void closeSend() {
        if (!guard.close()) {
            throw ClosedStreamException.get();
        }
    }

    @Override
    public boolean isClosed() {
        return guard.isClosed();
    }
}
