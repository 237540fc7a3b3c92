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

package dev.objectstream.loopback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import dev.objectstream.common.Flags;
import dev.objectstream.common.stream.StreamErrorException;
import dev.objectstream.common.stream.UnexpectedEndOfStreamException;
import dev.objectstream.storage.GetObjectClientStream;
import dev.objectstream.storage.GetObjectRequest;
import dev.objectstream.storage.GetObjectResponse;
import dev.objectstream.storage.GetObjectServerStream;
import dev.objectstream.storage.PutObjectServerStream;
import dev.objectstream.storage.StoragePluginService;

class LoopbackStoragePluginClientTest {

    private LoopbackStoragePluginClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    @Test
    void getObjectHandlerFailureIsSentAsError() throws Exception {
        final IllegalStateException failure = new IllegalStateException("disk failure");
        client = LoopbackStoragePluginClient.of(new PluginAdapter() {
            @Override
            public void getObject(GetObjectRequest request, GetObjectServerStream stream) throws Exception {
                stream.send(GetObjectResponse.ofUtf8("a"));
                throw failure;
            }
        });

        final GetObjectClientStream stream = client.getObject(GetObjectRequest.of("bucket", "key"));
        assertThat(stream.receive().contentUtf8()).isEqualTo("a");
        assertThatThrownBy(stream::receive).isInstanceOf(StreamErrorException.class)
                                           .hasCause(failure);
        assertThat(stream.receive()).isNull();
    }

    @Test
    void getObjectLeftOpenIsClosed() throws Exception {
        client = LoopbackStoragePluginClient.of(new PluginAdapter() {
            @Override
            public void getObject(GetObjectRequest request, GetObjectServerStream stream) throws Exception {
                stream.send(GetObjectResponse.ofUtf8("a"));
            }
        });

        assertThat(client.download("bucket", "key")).isEqualTo(new byte[] { 'a' });
    }

    @Test
    void putObjectWithoutResponse() {
        client = LoopbackStoragePluginClient.of(new PluginAdapter() {
            @Override
            public void putObject(PutObjectServerStream stream) throws Exception {
                stream.receive();
            }
        });

        assertThatThrownBy(() -> client.upload("bucket", "key", new byte[3 * Flags.defaultChunkSize()]))
                .isInstanceOf(UnexpectedEndOfStreamException.class)
                .hasMessageContaining("bucket/key");
    }

    @Test
    void putObjectHandlerFailureStopsUpload() {
        final IllegalStateException failure = new IllegalStateException("quota exceeded");
        client = LoopbackStoragePluginClient.of(new PluginAdapter() {
            @Override
            public void putObject(PutObjectServerStream stream) throws Exception {
                stream.receive();
                throw failure;
            }
        });

        assertThatThrownBy(() -> client.upload("bucket", "key", new byte[3 * Flags.defaultChunkSize()]))
                .isInstanceOf(StreamErrorException.class)
                .hasCause(failure);
    }

    @Test
    void handlersRunOnWorkerThreads() throws Exception {
        final AtomicReference<Thread> handlerThread = new AtomicReference<>();
        client = LoopbackStoragePluginClient.of(new PluginAdapter() {
            @Override
            public void getObject(GetObjectRequest request, GetObjectServerStream stream) throws Exception {
                handlerThread.set(Thread.currentThread());
                stream.complete();
            }
        });

        assertThat(client.download("bucket", "key")).isEmpty();
        assertThat(handlerThread.get().getName()).startsWith("loopback-storage-plugin-");
        assertThat(handlerThread.get().isDaemon()).isTrue();
    }

    @Test
    void closedClientRejectsCalls() {
        client = LoopbackStoragePluginClient.of(new PluginAdapter());
        client.close();

        assertThatThrownBy(() -> client.getObject(GetObjectRequest.of("bucket", "key")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> client.putObject()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsInvalidUpload() {
        client = LoopbackStoragePluginClient.of(new PluginAdapter());

        assertThatThrownBy(() -> client.upload("", "key", new byte[1]))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> client.upload("bucket", "", new byte[1]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static class PluginAdapter implements StoragePluginService {
        @Override
        public void getObject(GetObjectRequest request, GetObjectServerStream stream) throws Exception {
            stream.complete();
        }

        @Override
        public void putObject(PutObjectServerStream stream) throws Exception {
            while (stream.receive() != null) {
                // Discard.
            }
        }
    }
}
