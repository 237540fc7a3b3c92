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
import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import com.google.common.base.MoreObjects;

import dev.objectstream.common.annotation.Nullable;

/**
 * A chunk of object data sent by a host during a {@code PutObject} call. Every chunk of a call names the
 * same bucket and key.
 */
public final class PutObjectRequest {

    /**
     * Returns a new {@link PutObjectRequest} which carries a copy of the specified {@code fileChunk}.
     */
    public static PutObjectRequest of(String bucketName, String key, byte[] fileChunk) {
        requireNonNull(fileChunk, "fileChunk");
        return of(bucketName, key, fileChunk, 0, fileChunk.length);
    }

    /**
     * Returns a new {@link PutObjectRequest} which carries a copy of the specified range of
     * {@code fileChunk}.
     */
    public static PutObjectRequest of(String bucketName, String key, byte[] fileChunk, int offset, int length) {
        requireNonNull(fileChunk, "fileChunk");
        return new PutObjectRequest(bucketName, key, Arrays.copyOfRange(fileChunk, offset, offset + length));
    }

    /**
     * Returns a new {@link PutObjectRequest} which carries the UTF-8 encoding of the specified
     * {@code text}.
     */
    public static PutObjectRequest ofUtf8(String bucketName, String key, String text) {
        requireNonNull(text, "text");
        return new PutObjectRequest(bucketName, key, text.getBytes(StandardCharsets.UTF_8));
    }

    private final String bucketName;
    private final String key;
    private final byte[] fileChunk;

    private PutObjectRequest(String bucketName, String key, byte[] fileChunk) {
        requireNonNull(bucketName, "bucketName");
        requireNonNull(key, "key");
        checkArgument(!bucketName.isEmpty(), "bucketName is empty.");
        checkArgument(!key.isEmpty(), "key is empty.");
        this.bucketName = bucketName;
        this.key = key;
        this.fileChunk = fileChunk;
    }

    /**
     * Returns the name of the bucket the object is stored into.
     */
    public String bucketName() {
        return bucketName;
    }

    /**
     * Returns the key of the object.
     */
    public String key() {
        return key;
    }

    /**
     * Returns a copy of the chunk data.
     */
    public byte[] fileChunk() {
        return fileChunk.clone();
    }

    /**
     * Returns the number of bytes in the chunk.
     */
    public int length() {
        return fileChunk.length;
    }

    /**
     * Decodes the chunk data as UTF-8.
     */
    public String contentUtf8() {
        return new String(fileChunk, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PutObjectRequest)) {
            return false;
        }
        final PutObjectRequest that = (PutObjectRequest) o;
        return bucketName.equals(that.bucketName) && key.equals(that.key) &&
               Arrays.equals(fileChunk, that.fileChunk);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucketName, key) * 31 + Arrays.hashCode(fileChunk);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("bucketName", bucketName)
                          .add("key", key)
                          .add("length", fileChunk.length)
                          .toString();
    }
}
