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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import dev.objectstream.common.Flags;
import dev.objectstream.common.annotation.Nullable;

/**
 * A builder for {@link LoopbackStoragePlugin}.
 */
public final class LoopbackStoragePluginBuilder {

    private final Map<String, Map<String, byte[]>> buckets = new LinkedHashMap<>();
    private int chunkSize = Flags.defaultChunkSize();
    @Nullable
    private Throwable getObjectError;
    @Nullable
    private Throwable putObjectError;

    LoopbackStoragePluginBuilder() {}

    /**
     * Adds an empty bucket with the specified name. Adding an existing bucket again has no effect.
     */
    public LoopbackStoragePluginBuilder bucket(String bucketName) {
        requireNonNull(bucketName, "bucketName");
        checkArgument(!bucketName.isEmpty(), "bucketName is empty.");
        buckets.computeIfAbsent(bucketName, unused -> new LinkedHashMap<>());
        return this;
    }

    /**
     * Adds an object with the specified content, creating its bucket if necessary. The {@code data} is
     * copied.
     */
    public LoopbackStoragePluginBuilder object(String bucketName, String key, byte[] data) {
        requireNonNull(key, "key");
        requireNonNull(data, "data");
        checkArgument(!key.isEmpty(), "key is empty.");
        bucket(bucketName);
        buckets.get(bucketName).put(key, Arrays.copyOf(data, data.length));
        return this;
    }

    /**
     * Sets the maximum number of bytes of a {@code GetObject} response chunk.
     * If not specified, {@link Flags#defaultChunkSize()} is used by default.
     */
    public LoopbackStoragePluginBuilder chunkSize(int chunkSize) {
        checkArgument(chunkSize > 0, "chunkSize: %s (expected: > 0)", chunkSize);
        this.chunkSize = chunkSize;
        return this;
    }

    /**
     * Makes every {@code GetObject} call fail with the specified error instead of sending an object.
     */
    public LoopbackStoragePluginBuilder getObjectError(Throwable getObjectError) {
        this.getObjectError = requireNonNull(getObjectError, "getObjectError");
        return this;
    }

    /**
     * Makes every {@code PutObject} call fail with the specified error instead of storing an object.
     * The requests are still received until the host stops sending.
     */
    public LoopbackStoragePluginBuilder putObjectError(Throwable putObjectError) {
        this.putObjectError = requireNonNull(putObjectError, "putObjectError");
        return this;
    }

    /**
     * Returns a newly created {@link LoopbackStoragePlugin}.
     */
    public LoopbackStoragePlugin build() {
        return new LoopbackStoragePlugin(buckets, chunkSize, getObjectError, putObjectError);
    }
}
