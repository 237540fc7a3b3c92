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

import java.util.Objects;

import com.google.common.base.MoreObjects;

import dev.objectstream.common.annotation.Nullable;

/**
 * A request which starts a {@code GetObject} call, naming the object to download.
 */
public final class GetObjectRequest {

    /**
     * Returns a new {@link GetObjectRequest} for the object stored under the specified {@code key} in the
     * specified bucket.
     */
    public static GetObjectRequest of(String bucketName, String key) {
        return new GetObjectRequest(bucketName, key);
    }

    private final String bucketName;
    private final String key;

    private GetObjectRequest(String bucketName, String key) {
        requireNonNull(bucketName, "bucketName");
        requireNonNull(key, "key");
        checkArgument(!bucketName.isEmpty(), "bucketName is empty.");
        checkArgument(!key.isEmpty(), "key is empty.");
        this.bucketName = bucketName;
        this.key = key;
    }

    /**
     * Returns the name of the bucket which contains the object.
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

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GetObjectRequest)) {
            return false;
        }
        final GetObjectRequest that = (GetObjectRequest) o;
        return bucketName.equals(that.bucketName) && key.equals(that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bucketName, key);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("bucketName", bucketName)
                          .add("key", key)
                          .toString();
    }
}
