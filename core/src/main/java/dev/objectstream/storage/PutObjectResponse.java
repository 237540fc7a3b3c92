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

import java.util.Arrays;

import com.google.common.base.MoreObjects;
import com.google.common.io.BaseEncoding;

import dev.objectstream.common.annotation.Nullable;

/**
 * The single response of a {@code PutObject} call, sent by a plugin once it stored the object.
 */
public final class PutObjectResponse {

    /**
     * Returns a new {@link PutObjectResponse} with a copy of the specified SHA-256 checksum of the
     * stored object.
     */
    public static PutObjectResponse of(byte[] checksumSha256) {
        requireNonNull(checksumSha256, "checksumSha256");
        return new PutObjectResponse(checksumSha256.clone());
    }

    private final byte[] checksumSha256;

    private PutObjectResponse(byte[] checksumSha256) {
        this.checksumSha256 = checksumSha256;
    }

    /**
     * Returns a copy of the SHA-256 checksum of the stored object.
     */
    public byte[] checksumSha256() {
        return checksumSha256.clone();
    }

    /**
     * Returns the SHA-256 checksum of the stored object as a lower-case hexadecimal string.
     */
    public String checksumSha256Hex() {
        return BaseEncoding.base16().lowerCase().encode(checksumSha256);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PutObjectResponse)) {
            return false;
        }
        return Arrays.equals(checksumSha256, ((PutObjectResponse) o).checksumSha256);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(checksumSha256);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("checksumSha256", checksumSha256Hex())
                          .toString();
    }
}
