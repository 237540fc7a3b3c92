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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.google.common.hash.Hashing;

import dev.objectstream.common.stream.StreamErrorException;
import dev.objectstream.storage.GetObjectClientStream;
import dev.objectstream.storage.GetObjectRequest;
import dev.objectstream.storage.GetObjectResponse;
import dev.objectstream.storage.PutObjectClientStream;
import dev.objectstream.storage.PutObjectRequest;
import dev.objectstream.storage.PutObjectResponse;

class LoopbackStoragePluginTest {

    private static final byte[] HELLO = "hello, world".getBytes(StandardCharsets.UTF_8);

    private LoopbackStoragePluginClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private LoopbackStoragePluginClient connect(LoopbackStoragePlugin plugin) {
        client = LoopbackStoragePluginClient.of(plugin);
        return client;
    }

    @Test
    void getObjectInChunks() throws Exception {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder()
                                                                  .object("bucket", "hello", HELLO)
                                                                  .chunkSize(5)
                                                                  .build();
        final GetObjectClientStream stream = connect(plugin).getObject(GetObjectRequest.of("bucket", "hello"));

        final List<String> chunks = new ArrayList<>();
        GetObjectResponse response;
        while ((response = stream.receive()) != null) {
            chunks.add(response.contentUtf8());
        }

        assertThat(chunks).containsExactly("hello", ", wor", "ld");
        assertThat(stream.isClosed()).isTrue();
    }

    @Test
    void emptyObjectIsSentAsEmptyChunk() throws Exception {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder()
                                                                  .object("bucket", "empty", new byte[0])
                                                                  .build();
        final GetObjectClientStream stream = connect(plugin).getObject(GetObjectRequest.of("bucket", "empty"));

        assertThat(stream.receive().isEmpty()).isTrue();
        assertThat(stream.receive()).isNull();
    }

    @Test
    void download() throws Exception {
        final byte[] data = new byte[200_000];
        new Random(42).nextBytes(data);
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder()
                                                                  .object("bucket", "random", data)
                                                                  .chunkSize(4096)
                                                                  .build();

        assertThat(connect(plugin).download("bucket", "random")).isEqualTo(data);
    }

    @Test
    void getObjectFromUnknownBucket() {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder().bucket("bucket").build();

        assertThatThrownBy(() -> connect(plugin).download("unknown", "hello"))
                .isInstanceOf(StreamErrorException.class)
                .hasCauseInstanceOf(NoSuchBucketException.class)
                .hasMessageContaining("unknown");
    }

    @Test
    void getUnknownObject() {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder().bucket("bucket").build();

        assertThatThrownBy(() -> connect(plugin).download("bucket", "hello"))
                .isInstanceOf(StreamErrorException.class)
                .satisfies(e -> {
                    final NoSuchObjectException cause = (NoSuchObjectException) e.getCause();
                    assertThat(cause.bucketName()).isEqualTo("bucket");
                    assertThat(cause.key()).isEqualTo("hello");
                });
    }

    @Test
    void getObjectError() {
        final IllegalStateException error = new IllegalStateException("backend unavailable");
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder()
                                                                  .object("bucket", "hello", HELLO)
                                                                  .getObjectError(error)
                                                                  .build();

        assertThatThrownBy(() -> connect(plugin).download("bucket", "hello"))
                .isInstanceOf(StreamErrorException.class)
                .hasCause(error);
    }

    @Test
    void hostClosesGetObjectEarly() throws Exception {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder()
                                                                  .object("bucket", "hello", HELLO)
                                                                  .chunkSize(1)
                                                                  .build();
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try (LoopbackStoragePluginClient sharedClient = LoopbackStoragePluginClient.of(plugin, executor)) {
            final GetObjectClientStream stream =
                    sharedClient.getObject(GetObjectRequest.of("bucket", "hello"));
            assertThat(stream.receive().contentUtf8()).isEqualTo("h");
            stream.closeSend();

            // The only worker thread is released by the closed call.
            assertThat(sharedClient.download("bucket", "hello")).isEqualTo(HELLO);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void upload() throws Exception {
        final byte[] data = new byte[200_000];
        new Random(7).nextBytes(data);
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder().bucket("bucket").build();

        final PutObjectResponse response = connect(plugin).upload("bucket", "random", data);

        assertThat(response.checksumSha256()).isEqualTo(Hashing.sha256().hashBytes(data).asBytes());
        assertThat(plugin.objectData("bucket", "random")).hasValue(data);
        assertThat(client.download("bucket", "random")).isEqualTo(data);
    }

    @Test
    void uploadEmptyObject() throws Exception {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder().bucket("bucket").build();

        final PutObjectResponse response = connect(plugin).upload("bucket", "empty", new byte[0]);

        assertThat(response.checksumSha256Hex())
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(plugin.objectData("bucket", "empty")).hasValue(new byte[0]);
    }

    @Test
    void uploadToUnknownBucket() {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder().bucket("bucket").build();

        // Larger than a chunk so that the plugin has to drain the remaining chunks.
        assertThatThrownBy(() -> connect(plugin).upload("unknown", "hello", new byte[300_000]))
                .isInstanceOf(StreamErrorException.class)
                .hasCauseInstanceOf(NoSuchBucketException.class);
        assertThat(plugin.buckets()).containsExactly("bucket");
    }

    @Test
    void putObjectWithDifferentKeys() throws Exception {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder().bucket("bucket").build();
        final PutObjectClientStream stream = connect(plugin).putObject();

        stream.send(PutObjectRequest.ofUtf8("bucket", "a", "foo"));
        stream.send(PutObjectRequest.ofUtf8("bucket", "b", "bar"));

        assertThatThrownBy(stream::closeAndReceive)
                .isInstanceOf(StreamErrorException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(plugin.objectData("bucket", "a")).isEmpty();
        assertThat(plugin.objectData("bucket", "b")).isEmpty();
    }

    @Test
    void putObjectWithoutRequest() {
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder().bucket("bucket").build();
        final PutObjectClientStream stream = connect(plugin).putObject();

        assertThatThrownBy(stream::closeAndReceive)
                .isInstanceOf(StreamErrorException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void putObjectError() {
        final IllegalStateException error = new IllegalStateException("read-only");
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder()
                                                                  .bucket("bucket")
                                                                  .putObjectError(error)
                                                                  .build();

        assertThatThrownBy(() -> connect(plugin).upload("bucket", "hello", HELLO))
                .isInstanceOf(StreamErrorException.class)
                .hasCause(error);
        assertThat(plugin.objectData("bucket", "hello")).isEmpty();
    }

    @Test
    void objectDataIsCopied() {
        final byte[] data = HELLO.clone();
        final LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder()
                                                                  .object("bucket", "hello", data)
                                                                  .build();
        data[0] = 'j';
        plugin.objectData("bucket", "hello").get()[1] = 'a';

        assertThat(plugin.objectData("bucket", "hello")).hasValue(HELLO);
        assertThat(plugin.objectData("unknown", "hello")).isEmpty();
        assertThat(plugin.buckets()).containsExactly("bucket");
    }

    @Test
    void builderValidation() {
        assertThatThrownBy(() -> LoopbackStoragePlugin.builder().chunkSize(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LoopbackStoragePlugin.builder().bucket(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LoopbackStoragePlugin.builder().object("bucket", "", HELLO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
