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

package dev.objectstream.common.stream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.Objects;

import com.google.common.base.MoreObjects;

import dev.objectstream.common.annotation.Nullable;

/**
 * A unit of a stream which carries either a payload or an error, never both. A {@link Message} with an
 * error is always the last message of the stream half it travels through.
 *
 * @param <T> the type of the payload
 */
public final class Message<T> {

    /**
     * Returns a new {@link Message} which carries the specified {@code payload}.
     *
     * @throws IllegalArgumentException if the {@code payload} is {@code null}
     */
    public static <T> Message<T> of(T payload) {
        checkArgument(payload != null, "payload: null (expected: non-null)");
        return new Message<>(payload, null);
    }

    /**
     * Returns a new {@link Message} which terminates a stream half with the specified {@code cause}.
     *
     * @throws IllegalArgumentException if the {@code cause} is {@code null}
     */
    public static <T> Message<T> ofError(Throwable cause) {
        checkArgument(cause != null, "cause: null (expected: non-null)");
        return new Message<>(null, cause);
    }

    @Nullable
    private final T payload;
    @Nullable
    private final Throwable cause;

    private Message(@Nullable T payload, @Nullable Throwable cause) {
        this.payload = payload;
        this.cause = cause;
    }

    /**
     * Returns {@code true} if this message carries an error instead of a payload.
     */
    public boolean isError() {
        return cause != null;
    }

    /**
     * Returns the payload of this message.
     *
     * @throws IllegalStateException if this message carries an error
     */
    public T payload() {
        checkState(payload != null, "an error message has no payload: %s", cause);
        return payload;
    }

    /**
     * Returns the error carried by this message.
     *
     * @throws IllegalStateException if this message carries a payload
     */
    public Throwable cause() {
        checkState(cause != null, "a payload message has no cause");
        return cause;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message)) {
            return false;
        }
        final Message<?> that = (Message<?>) o;
        return Objects.equals(payload, that.payload) && Objects.equals(cause, that.cause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, cause);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("payload", payload)
                          .add("cause", cause)
                          .toString();
    }
}
