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

/**
 * The {@code GetObject} and {@code PutObject} calls between a host and a storage-backend plugin, and an
 * in-memory implementation of their streams.
 *
 * <p>A {@link dev.objectstream.storage.GetObjectStream} or a
 * {@link dev.objectstream.storage.PutObjectStream} connects the host side and the plugin side of one
 * call. Either side may close it; a close takes effect only once.
 *
 * <pre>{@code
 * GetObjectStream stream = new GetObjectStream();
 * executor.submit(() -> {
 *     plugin.getObject(request, stream.server());
 *     return null;
 * });
 *
 * GetObjectResponse chunk;
 * while ((chunk = stream.client().receive()) != null) {
 *     out.write(chunk.fileChunk());
 * }
 * }</pre>
 */
@NonNullByDefault
package dev.objectstream.storage;

import dev.objectstream.common.annotation.NonNullByDefault;
