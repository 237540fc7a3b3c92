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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import io.grpc.stub.StreamObserver;

/**
 * A skeletal {@link StreamObserver} which writes responses into an in-memory stream and keeps track of
 * whether the call has been terminated.
 *
 * @param <T> the type of the responses
 */
abstract class AbstractResponseObserver<T> implements StreamObserver<T> {

    private final CompletableFuture<Void> whenTerminated = new CompletableFuture<>();
    private volatile boolean cancelled;

    /**
     * Returns the {@link StreamCallContext} of the call.
     */
    public final StreamCallContext callContext() {
        return StreamCallContext.get();
    }

    /**
     * Returns a {@link CompletableFuture} which is completed when {@link #onCompleted()} or
     * {@link #onError(Throwable)} is invoked, or the host closed the stream while a response was being
     * written.
     */
    public final CompletableFuture<Void> whenTerminated() {
        return whenTerminated;
    }

    /**
     * Returns {@code true} if the call has been terminated.
     */
    public final boolean isTerminated() {
        return whenTerminated.isDone();
    }

    /**
     * Returns {@code true} if the host closed the stream before the call was terminated by this observer.
     */
    public final boolean isCancelled() {
        return cancelled;
    }

    final void awaitTermination() throws InterruptedException {
        try {
            whenTerminated.get();
        } catch (ExecutionException e) {
            // whenTerminated is never completed exceptionally.
            throw new IllegalStateException(e.getCause());
        }
    }

    final void checkNotClosed(String method) {
        checkState(!isTerminated() || cancelled, "%s() called on a closed call", method);
    }

    final void terminate() {
        whenTerminated.complete(null);
    }

    final void cancel() {
        cancelled = true;
        whenTerminated.complete(null);
    }
}
