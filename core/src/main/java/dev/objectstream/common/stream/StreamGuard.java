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

import static java.util.Objects.requireNonNull;

import javax.annotation.concurrent.GuardedBy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

/**
 * Keeps the closed state of a stream half which is shared by the two endpoints of a stream.
 * {@link #close()} runs the close action exactly once no matter how many times or from how many threads
 * it is invoked, so that the underlying {@link HandOffChannel} is never closed twice.
 */
public final class StreamGuard {

    private static final Logger logger = LoggerFactory.getLogger(StreamGuard.class);

    private final String name;
    private final Runnable closeAction;

    @GuardedBy("this")
    private boolean closed;

    /**
     * Creates a new instance which guards the specified {@link HandOffChannel}.
     *
     * @param name the name of the guarded stream half, used for logging
     */
    public static StreamGuard of(String name, HandOffChannel<?> channel) {
        requireNonNull(channel, "channel");
        return new StreamGuard(name, channel::close);
    }

    /**
     * Creates a new instance.
     *
     * @param name the name of the guarded stream half, used for logging
     * @param closeAction the action which closes the stream half. Invoked at most once.
     */
    public StreamGuard(String name, Runnable closeAction) {
        this.name = requireNonNull(name, "name");
        this.closeAction = requireNonNull(closeAction, "closeAction");
    }

    /**
     * Returns {@code true} if the guarded stream half has been closed.
     */
    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Closes the guarded stream half if it is not closed yet.
     *
     * @return {@code true} if this invocation closed the stream half,
     *         {@code false} if it was closed already
     */
    public boolean close() {
        synchronized (this) {
            if (closed) {
                return false;
            }
            closeAction.run();
            closed = true;
        }

        logger.debug("{} closed", name);
        return true;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("closed", isClosed())
                          .toString();
    }
}
