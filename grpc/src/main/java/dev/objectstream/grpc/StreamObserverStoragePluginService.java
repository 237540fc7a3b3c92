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

import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

import dev.objectstream.storage.GetObjectRequest;
import dev.objectstream.storage.GetObjectServerStream;
import dev.objectstream.storage.PutObjectRequest;
import dev.objectstream.storage.PutObjectServerStream;
import dev.objectstream.storage.StoragePluginService;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;

/**
 * A {@link StoragePluginService} which serves a {@link StreamingStoragePluginService}. Each handler runs
 * the delegate in {@linkplain StreamCallContext#context() the root context} and returns once the delegate
 * terminated the call, so that the caller may close whatever is left open.
 */
public final class StreamObserverStoragePluginService implements StoragePluginService {

    private static final Logger logger = LoggerFactory.getLogger(StreamObserverStoragePluginService.class);

    /**
     * Returns a new {@link StoragePluginService} which serves the specified
     * {@link StreamingStoragePluginService}.
     */
    public static StoragePluginService of(StreamingStoragePluginService delegate) {
        return new StreamObserverStoragePluginService(delegate);
    }

    private final StreamingStoragePluginService delegate;

    private StreamObserverStoragePluginService(StreamingStoragePluginService delegate) {
        this.delegate = requireNonNull(delegate, "delegate");
    }

    @Override
    public void getObject(GetObjectRequest request, GetObjectServerStream stream) throws Exception {
        final GetObjectResponseObserver responseObserver = new GetObjectResponseObserver(stream);
        try {
            StreamCallContext.get().context().call(() -> {
                delegate.getObject(request, responseObserver);
                return null;
            });
        } catch (StatusRuntimeException e) {
            if (!responseObserver.isCancelled()) {
                throw e;
            }
            logger.debug("GetObject cancelled by the host: {}", request);
            return;
        }
        responseObserver.awaitTermination();
    }

    @Override
    public void putObject(PutObjectServerStream stream) throws Exception {
        final PutObjectResponseObserver responseObserver = new PutObjectResponseObserver(stream);
        final StreamObserver<PutObjectRequest> requestObserver =
                StreamCallContext.get().context().call(() -> delegate.putObject(responseObserver));
        requireNonNull(requestObserver, "putObject() returned null");

        try {
            for (;;) {
                final PutObjectRequest request = stream.receive();
                if (request == null) {
                    break;
                }
                requestObserver.onNext(request);
            }
        } catch (InterruptedException e) {
            requestObserver.onError(Status.CANCELLED.withCause(e).asRuntimeException());
            throw e;
        }

        requestObserver.onCompleted();
        responseObserver.awaitTermination();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("delegate", delegate)
                          .toString();
    }
}
