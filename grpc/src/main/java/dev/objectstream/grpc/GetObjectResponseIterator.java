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

import java.util.Iterator;
import java.util.NoSuchElementException;

import com.google.common.base.MoreObjects;

import dev.objectstream.common.annotation.Nullable;
import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.common.stream.StreamErrorException;
import dev.objectstream.storage.GetObjectClientStream;
import dev.objectstream.storage.GetObjectResponse;

/**
 * An {@link Iterator} over the {@link GetObjectResponse}s received from a {@link GetObjectClientStream},
 * which behaves like the iterator returned by a blocking gRPC stub for a server-streaming call.
 * {@link #hasNext()} blocks until the next chunk arrives or the stream ends, and an error sent by the
 * plugin is raised as a {@link io.grpc.StatusRuntimeException}.
 *
 * <p>This iterator is not thread-safe.
 */
public final class GetObjectResponseIterator implements Iterator<GetObjectResponse> {

    private final GetObjectClientStream stream;

    @Nullable
    private GetObjectResponse next;
    private boolean done;

    /**
     * Creates a new instance which receives from the specified {@link GetObjectClientStream}.
     */
    public GetObjectResponseIterator(GetObjectClientStream stream) {
        this.stream = requireNonNull(stream, "stream");
    }

    /**
     * Returns the {@link StreamCallContext} of the call.
     */
    public StreamCallContext callContext() {
        return StreamCallContext.get();
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (done) {
            return false;
        }

        try {
            next = stream.receive();
        } catch (StreamErrorException e) {
            done = true;
            throw GrpcStatuses.toStatusRuntimeException(e);
        } catch (InterruptedException e) {
            done = true;
            throw GrpcStatuses.toStatusRuntimeException(e);
        }

        if (next == null) {
            done = true;
            return false;
        }
        return true;
    }

    @Override
    public GetObjectResponse next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final GetObjectResponse response = next;
        assert response != null;
        next = null;
        return response;
    }

    /**
     * Stops receiving by closing the stream. The plugin fails to send the next chunk.
     *
     * @return {@code true} if this invocation closed the stream
     */
    public boolean cancel() {
        done = true;
        next = null;
        try {
            stream.closeSend();
            return true;
        } catch (ClosedStreamException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("stream", stream)
                          .add("done", done)
                          .toString();
    }
}
