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

import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.storage.GetObjectResponse;
import dev.objectstream.storage.GetObjectServerStream;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;

/**
 * A {@link StreamObserver} which writes the {@link GetObjectResponse}s of a server-streaming call into a
 * {@link GetObjectServerStream}.
 *
 * <p>{@link #onNext(GetObjectResponse)} blocks until the host receives the chunk. If the host closed the
 * stream, it fails with a {@link io.grpc.StatusRuntimeException} whose status is {@link Status#CANCELLED},
 * just like a gRPC server call cancelled by its client. The following {@link #onError(Throwable)} or
 * {@link #onCompleted()} is ignored then.
 */
public final class GetObjectResponseObserver extends AbstractResponseObserver<GetObjectResponse> {

    private static final Logger logger = LoggerFactory.getLogger(GetObjectResponseObserver.class);

    private final GetObjectServerStream stream;

    /**
     * Creates a new instance which writes into the specified {@link GetObjectServerStream}.
     */
    public GetObjectResponseObserver(GetObjectServerStream stream) {
        this.stream = requireNonNull(stream, "stream");
    }

    @Override
    public void onNext(GetObjectResponse value) {
        checkNotClosed("onNext");
        if (isCancelled()) {
            throw Status.CANCELLED.withDescription("call already cancelled").asRuntimeException();
        }
        try {
            stream.send(value);
        } catch (ClosedStreamException e) {
            cancel();
            throw GrpcStatuses.toStatusRuntimeException(e);
        } catch (InterruptedException e) {
            cancel();
            throw GrpcStatuses.toStatusRuntimeException(e);
        }
    }

    @Override
    public void onError(Throwable t) {
        checkNotClosed("onError");
        if (isCancelled()) {
            logger.debug("Ignoring an error of a cancelled call:", t);
            return;
        }
        try {
            stream.sendError(t);
        } catch (ClosedStreamException e) {
            logger.debug("The host closed the stream before receiving an error:", t);
        } catch (InterruptedException e) {
            throw GrpcStatuses.toStatusRuntimeException(e);
        } finally {
            terminate();
        }
    }

    @Override
    public void onCompleted() {
        checkNotClosed("onCompleted");
        if (!stream.complete() && !isCancelled()) {
            logger.debug("The host closed the stream before completion: {}", stream);
        }
        terminate();
    }
}
