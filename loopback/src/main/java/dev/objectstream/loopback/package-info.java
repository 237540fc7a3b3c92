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
 * An in-memory storage-backend plugin and the client which connects a host to any
 * {@link dev.objectstream.storage.StoragePluginService} through in-memory object streams.
 */
@NonNullByDefault
package dev.objectstream.loopback;

import dev.objectstream.common.annotation.NonNullByDefault;
