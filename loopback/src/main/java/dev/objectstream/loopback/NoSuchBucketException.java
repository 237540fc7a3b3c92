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

/**
 * A {@link RuntimeException} sent by a {@link LoopbackStoragePlugin} when a request names a bucket which
 * does not exist.
 */
public final class NoSuchBucketException extends RuntimeException {

    private static final long serialVersionUID = -2399231863513270813L;

    private final String bucketName;

    /**
     * Creates a new instance with the name of the missing bucket.
     */
    public NoSuchBucketException(String bucketName) {
        super("no such bucket: " + requireNonNull(bucketName, "bucketName"));
        this.bucketName = bucketName;
    }

    /**
     * Returns the name of the missing bucket.
     */
    public String bucketName() {
        return bucketName;
    }
}
