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

import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.common.stream.StreamErrorException;
import dev.objectstream.common.stream.UnexpectedEndOfStreamException;
import dev.objectstream.common.util.Exceptions;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;

/**
 * Utilities for converting the exceptions raised by the object streams into gRPC {@link Status}es.
 */
public final class GrpcStatuses {

    /**
     * Returns the {@link Status} which corresponds to the specified {@link Throwable}.
     *
     * <ul>
     *   <li>{@link ClosedStreamException} and {@link InterruptedException} - {@link Status#CANCELLED}</li>
     *   <li>{@link IllegalArgumentException} - {@link Status#INVALID_ARGUMENT}</li>
     *   <li>{@link UnexpectedEndOfStreamException} - {@link Status#UNAVAILABLE}</li>
     *   <li>{@link StreamErrorException} - the {@link Status} of the error sent by the other endpoint</li>
     *   <li>{@link StatusException} and {@link StatusRuntimeException} - the {@link Status} they carry</li>
     *   <li>Others - {@link Status#UNKNOWN}</li>
     * </ul>
     */
    public static Status fromThrowable(Throwable cause) {
        requireNonNull(cause, "cause");
        cause = Exceptions.peel(cause);

        if (cause instanceof StreamErrorException) {
            final Throwable carried = cause.getCause();
            assert carried != null;
            return fromThrowable(carried);
        }
        if (cause instanceof StatusException) {
            return ((StatusException) cause).getStatus();
        }
        if (cause instanceof StatusRuntimeException) {
            return ((StatusRuntimeException) cause).getStatus();
        }
        if (cause instanceof ClosedStreamException || cause instanceof InterruptedException) {
            return Status.CANCELLED.withCause(cause);
        }
        if (cause instanceof IllegalArgumentException) {
            return Status.INVALID_ARGUMENT.withDescription(cause.getMessage()).withCause(cause);
        }
        if (cause instanceof UnexpectedEndOfStreamException) {
            return Status.UNAVAILABLE.withDescription(cause.getMessage()).withCause(cause);
        }
        return Status.fromThrowable(cause);
    }

    /**
     * Converts the specified {@link Throwable} into a {@link StatusRuntimeException} whose {@link Status}
     * is determined by {@link #fromThrowable(Throwable)}. The interrupt flag of the current thread is
     * restored if the {@code cause} is an {@link InterruptedException}.
     */
    public static StatusRuntimeException toStatusRuntimeException(Throwable cause) {
        requireNonNull(cause, "cause");
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (cause instanceof StatusRuntimeException) {
            return (StatusRuntimeException) cause;
        }
        return fromThrowable(cause).asRuntimeException();
    }

    private GrpcStatuses() {}
}
