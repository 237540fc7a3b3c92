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

package dev.objectstream.grpc;

import dev.objectstream.storage.GetObjectRequest;
import dev.objectstream.storage.GetObjectResponse;
import dev.objectstream.storage.PutObjectRequest;
import dev.objectstream.storage.PutObjectResponse;

import io.grpc.stub.StreamObserver;

/**
 * A storage-backend plugin written in the asynchronous style of a gRPC service implementation.
 *
 * @see StreamObserverStoragePluginService
 */
public interface StreamingStoragePluginService {

    /**
     * Streams the content of the requested object. The call ends with {@link StreamObserver#onCompleted()}
     * or {@link StreamObserver#onError(Throwable)}, which may be invoked from any thread.
     */
    void getObject(GetObjectRequest request, StreamObserver<GetObjectResponse> responseObserver);

    /**
     * Returns the {@link StreamObserver} which receives the chunks of the object to store. The result
     * should be written into the {@code responseObserver} once the returned observer has been completed.
     */
    StreamObserver<PutObjectRequest> putObject(StreamObserver<PutObjectResponse> responseObserver);
}
