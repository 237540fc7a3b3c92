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

import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.base.MoreObjects;

import dev.objectstream.common.annotation.Nullable;

/**
 * A chunk of object data sent by a plugin during a {@code GetObject} call.
 */
public final class GetObjectResponse {

    private static final byte[] EMPTY_BYTES = new byte[0];

    private static final GetObjectResponse EMPTY = new GetObjectResponse(EMPTY_BYTES);

    /**
     * Returns a {@link GetObjectResponse} without any data.
     */
    public static GetObjectResponse empty() {
        return EMPTY;
    }

    /**
     * Returns a new {@link GetObjectResponse} which carries a copy of the specified {@code fileChunk}.
     */
    public static GetObjectResponse of(byte[] fileChunk) {
        requireNonNull(fileChunk, "fileChunk");
        return of(fileChunk, 0, fileChunk.length);
    }

    /**
     * Returns a new {@link GetObjectResponse} which carries a copy of the specified range of
     * {@code fileChunk}.
     */
    public static GetObjectResponse of(byte[] fileChunk, int offset, int length) {
        requireNonNull(fileChunk, "fileChunk");
        if (length == 0) {
            return EMPTY;
        }
        return new GetObjectResponse(Arrays.copyOfRange(fileChunk, offset, offset + length));
    }

    /**
     * Returns a new {@link GetObjectResponse} which carries the UTF-8 encoding of the specified
     * {@code text}.
     */
    public static GetObjectResponse ofUtf8(String text) {
        requireNonNull(text, "text");
        return of(text.getBytes(StandardCharsets.UTF_8));
    }

    private final byte[] fileChunk;

    private GetObjectResponse(byte[] fileChunk) {
        this.fileChunk = fileChunk;
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
     * Returns {@code true} if the chunk has no data.
     */
    public boolean isEmpty() {
        return fileChunk.length == 0;
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
        if (!(o instanceof GetObjectResponse)) {
            return false;
        }
        return Arrays.equals(fileChunk, ((GetObjectResponse) o).fileChunk);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(fileChunk);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("length", fileChunk.length)
                          .toString();
    }
}
