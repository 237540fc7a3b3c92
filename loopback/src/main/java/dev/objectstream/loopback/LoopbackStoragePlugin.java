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

import static java.util.Objects.requireNonNull;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import com.google.common.hash.Hashing;

import dev.objectstream.common.annotation.Nullable;
import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.storage.GetObjectRequest;
import dev.objectstream.storage.GetObjectResponse;
import dev.objectstream.storage.GetObjectServerStream;
import dev.objectstream.storage.PutObjectRequest;
import dev.objectstream.storage.PutObjectResponse;
import dev.objectstream.storage.PutObjectServerStream;
import dev.objectstream.storage.StoragePluginService;

/**
 * A {@link StoragePluginService} which keeps its buckets and objects in memory, which is useful for
 * testing a host without a real storage backend.
 *
 * <p>A failure is always sent to the host as an error on the stream rather than thrown:
 * <ul>
 *   <li>{@link NoSuchBucketException} if a request names an unknown bucket,</li>
 *   <li>{@link NoSuchObjectException} if a {@code GetObject} request names an unknown object,</li>
 *   <li>{@link IllegalArgumentException} if a {@code PutObject} call has no request or its requests
 *       name different objects.</li>
 * </ul>
 * A {@code PutObject} error is sent only after the host stopped sending requests.
 *
 * <pre>{@code
 * LoopbackStoragePlugin plugin = LoopbackStoragePlugin.builder()
 *                                                     .object("bucket", "key", data)
 *                                                     .build();
 * try (LoopbackStoragePluginClient client = LoopbackStoragePluginClient.of(plugin)) {
 *     byte[] downloaded = client.download("bucket", "key");
 * }
 * }</pre>
 */
public final class LoopbackStoragePlugin implements StoragePluginService {

    private static final Logger logger = LoggerFactory.getLogger(LoopbackStoragePlugin.class);

    /**
     * Returns a new {@link LoopbackStoragePluginBuilder}.
     */
    public static LoopbackStoragePluginBuilder builder() {
        return new LoopbackStoragePluginBuilder();
    }

    private final ConcurrentMap<String, ConcurrentMap<String, byte[]>> buckets = new ConcurrentHashMap<>();
    private final int chunkSize;
    @Nullable
    private final Throwable getObjectError;
    @Nullable
    private final Throwable putObjectError;

    LoopbackStoragePlugin(Map<String, Map<String, byte[]>> buckets, int chunkSize,
                          @Nullable Throwable getObjectError, @Nullable Throwable putObjectError) {
        buckets.forEach((bucketName, objects) -> {
            this.buckets.put(bucketName, new ConcurrentHashMap<>(objects));
        });
        this.chunkSize = chunkSize;
        this.getObjectError = getObjectError;
        this.putObjectError = putObjectError;
    }

    @Override
    public void getObject(GetObjectRequest request, GetObjectServerStream stream) throws InterruptedException {
        requireNonNull(request, "request");
        requireNonNull(stream, "stream");
        try {
            if (getObjectError != null) {
                stream.sendError(getObjectError);
                return;
            }

            final Map<String, byte[]> objects = buckets.get(request.bucketName());
            if (objects == null) {
                stream.sendError(new NoSuchBucketException(request.bucketName()));
                return;
            }
            final byte[] data = objects.get(request.key());
            if (data == null) {
                stream.sendError(new NoSuchObjectException(request.bucketName(), request.key()));
                return;
            }

            if (data.length == 0) {
                stream.send(GetObjectResponse.empty());
            }
            for (int offset = 0; offset < data.length; offset += chunkSize) {
                stream.send(GetObjectResponse.of(data, offset, Math.min(chunkSize, data.length - offset)));
            }
            stream.complete();
        } catch (ClosedStreamException e) {
            logger.debug("GetObject closed by the host: {}", request);
        }
    }

    @Override
    public void putObject(PutObjectServerStream stream) throws InterruptedException {
        requireNonNull(stream, "stream");
        final ByteArrayOutputStream content = new ByteArrayOutputStream();
        @Nullable
        String bucketName = null;
        @Nullable
        String key = null;
        @Nullable
        Throwable failure = putObjectError;

        for (;;) {
            final PutObjectRequest request = stream.receive();
            if (request == null) {
                break;
            }
            if (failure != null) {
                // Drain the remaining requests.
                continue;
            }

            if (bucketName == null) {
                bucketName = request.bucketName();
                key = request.key();
                if (!buckets.containsKey(bucketName)) {
                    failure = new NoSuchBucketException(bucketName);
                    continue;
                }
            } else if (!bucketName.equals(request.bucketName()) || !request.key().equals(key)) {
                failure = new IllegalArgumentException(
                        "request for a different object: " + request.bucketName() + '/' + request.key() +
                        " (expected: " + bucketName + '/' + key + ')');
                continue;
            }
            final byte[] chunk = request.fileChunk();
            content.write(chunk, 0, chunk.length);
        }

        if (failure == null && bucketName == null) {
            failure = new IllegalArgumentException("no PutObject request received");
        }

        try {
            if (failure != null) {
                stream.sendError(failure);
                return;
            }
            assert key != null;

            final byte[] data = content.toByteArray();
            buckets.get(bucketName).put(key, data);
            logger.info("Stored an object: {}/{} ({} bytes)", bucketName, key, data.length);
            stream.sendAndClose(PutObjectResponse.of(Hashing.sha256().hashBytes(data).asBytes()));
        } catch (ClosedStreamException e) {
            logger.debug("PutObject closed by the host before a response was sent: {}/{}", bucketName, key);
        }
    }

    /**
     * Returns a copy of the content of the specified object, or {@link Optional#empty()} if there's no such
     * object.
     */
    public Optional<byte[]> objectData(String bucketName, String key) {
        requireNonNull(bucketName, "bucketName");
        requireNonNull(key, "key");
        final Map<String, byte[]> objects = buckets.get(bucketName);
        if (objects == null) {
            return Optional.empty();
        }
        final byte[] data = objects.get(key);
        return data != null ? Optional.of(Arrays.copyOf(data, data.length)) : Optional.empty();
    }

    /**
     * Returns the names of the buckets of this plugin.
     */
    public Set<String> buckets() {
        return ImmutableSet.copyOf(buckets.keySet());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("buckets", buckets.keySet())
                          .add("chunkSize", chunkSize)
                          .toString();
    }
}
