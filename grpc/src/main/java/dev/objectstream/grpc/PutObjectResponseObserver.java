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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.storage.PutObjectResponse;
import dev.objectstream.storage.PutObjectServerStream;

import io.grpc.stub.StreamObserver;

/**
 * A {@link StreamObserver} which writes the single {@link PutObjectResponse} of a client-streaming call
 * into a {@link PutObjectServerStream}.
 *
 * <p>The response is handed over to the host synchronously, so it should be written after the request
 * {@link StreamObserver} has been completed, as a client-streaming gRPC service usually does. Otherwise
 * the response blocks until the host stops sending requests.
 *
 * <p>{@link #onCompleted()} does not close the response half by itself. A call completed without a
 * response leaves the response half to the caller, which closes it once the handler returns.
 */
public final class PutObjectResponseObserver extends AbstractResponseObserver<PutObjectResponse> {

    private static final Logger logger = LoggerFactory.getLogger(PutObjectResponseObserver.class);

    private final PutObjectServerStream stream;
    private volatile boolean responded;

    /**
     * Creates a new instance which writes into the specified {@link PutObjectServerStream}.
     */
    public PutObjectResponseObserver(PutObjectServerStream stream) {
        this.stream = requireNonNull(stream, "stream");
    }

    @Override
    public void onNext(PutObjectResponse value) {
        checkNotClosed("onNext");
        checkState(!responded, "a client-streaming call has only one response");
        responded = true;
        try {
            stream.sendAndClose(value);
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
        if (isCancelled() || responded) {
            logger.debug("Ignoring an error after the response half was closed:", t);
            terminate();
            return;
        }
        responded = true;
        try {
            stream.sendError(t);
        } catch (ClosedStreamException e) {
            logger.debug("The response half was closed before an error was sent:", t);
        } catch (InterruptedException e) {
            throw GrpcStatuses.toStatusRuntimeException(e);
        } finally {
            terminate();
        }
    }

    @Override
    public void onCompleted() {
        checkNotClosed("onCompleted");
        if (!responded) {
            logger.debug("PutObject completed without a response.");
        }
        terminate();
    }
}
