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
 * A {@link RuntimeException} sent by a {@link LoopbackStoragePlugin} when a {@code GetObject} request
 * names an object which does not exist in an existing bucket.
 */
public final class NoSuchObjectException extends RuntimeException {

    private static final long serialVersionUID = 8812740655392218114L;

    private final String bucketName;
    private final String key;

    /**
     * Creates a new instance with the bucket and the key of the missing object.
     */
    public NoSuchObjectException(String bucketName, String key) {
        super("no such object: " + requireNonNull(bucketName, "bucketName") + '/' +
              requireNonNull(key, "key"));
        this.bucketName = bucketName;
        this.key = key;
    }

    public String bucketName() {
        return bucketName;
    }

    public String key() {
        return key;
    }
}
