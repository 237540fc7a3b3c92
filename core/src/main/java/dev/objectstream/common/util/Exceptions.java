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

package dev.objectstream.common.util;

import static java.util.Objects.requireNonNull;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import dev.objectstream.common.Flags;
import dev.objectstream.common.stream.ClosedStreamException;

/**
 * Provides the methods that are useful for handling exceptions.
 */
public final class Exceptions {

    private static final StackTraceElement[] EMPTY_STACK_TRACE = new StackTraceElement[0];

    /**
     * Returns whether the verbose mode is enabled. When enabled, the exceptions frequently thrown by the
     * streams will have full stack trace. When disabled, such exceptions will have empty stack trace to
     * eliminate the cost of capturing the stack trace.
     *
     * @see Flags#verboseExceptions()
     */
    public static boolean isVerbose() {
        return Flags.verboseExceptions();
    }

    /**
     * Returns {@code true} if the specified exception is expected to occur when one endpoint keeps
     * using a stream after the other endpoint closed it.
     */
    public static boolean isStreamCancellation(Throwable cause) {
        return peel(cause) instanceof ClosedStreamException;
    }

    /**
     * Empties the stack trace of the specified {@code exception}.
     */
    public static <T extends Throwable> T clearTrace(T exception) {
        requireNonNull(exception, "exception");
        exception.setStackTrace(EMPTY_STACK_TRACE);
        return exception;
    }

    /**
     * Returns the cause of the specified {@code throwable} peeling it recursively, if it is one of the
     * {@link CompletionException} and {@link ExecutionException}. Otherwise returns the {@code throwable}.
     */
    public static Throwable peel(Throwable throwable) {
        requireNonNull(throwable, "throwable");
        Throwable cause = throwable.getCause();
        while (cause != null && cause != throwable &&
               (throwable instanceof CompletionException || throwable instanceof ExecutionException)) {
            throwable = cause;
            cause = throwable.getCause();
        }
        return throwable;
    }

    private Exceptions() {}
}
