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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.concurrent.GuardedBy;

import com.google.common.base.MoreObjects;

import dev.objectstream.common.annotation.Nullable;

/**
 * A zero-capacity conduit between one or more senders and a receiver. {@link #send(Object)} returns only
 * after a receiver took the element, so a sender can never get ahead of a slow or absent receiver.
 * Elements are received in the order they were sent.
 *
 * <p>Once {@linkplain #close() closed}, {@link #receive()} returns {@code null} instead of blocking and
 * {@link #send(Object)} fails with a {@link ClosedStreamException}, including the senders which were
 * blocked when the channel was closed. A channel must be closed only once; use a {@link StreamGuard}
 * when more than one party may close it.
 *
 * @param <T> the type of the elements
 */
public final class HandOffChannel<T> {

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Signaled when an element is placed into {@link #pending}.
     */
    private final Condition offered = lock.newCondition();

    /**
     * Signaled when a receiver took the {@link #pending} element.
     */
    private final Condition taken = lock.newCondition();

    /**
     * Signaled when {@link #pending} becomes available to the next sender.
     */
    private final Condition vacant = lock.newCondition();

    @Nullable
    @GuardedBy("lock")
    private T pending;

    @GuardedBy("lock")
    private long numOffered;

    @GuardedBy("lock")
    private long numTaken;

    @GuardedBy("lock")
    private boolean closed;

    /**
     * Hands the specified {@code element} over to a receiver, blocking until a receiver takes it.
     *
     * @throws ClosedStreamException if this channel is closed before the element is taken
     * @throws InterruptedException if the current thread is interrupted before the element is taken.
     *                              The element is withdrawn and will not be received.
     */
    public void send(T element) throws InterruptedException {
        requireNonNull(element, "element");
        lock.lockInterruptibly();
        try {
            while (pending != null && !closed) {
                vacant.await();
            }
            if (closed) {
                throw ClosedStreamException.get();
            }

            pending = element;
            final long ticket = ++numOffered;
            offered.signal();

            while (numTaken < ticket) {
                if (closed) {
                    // close() discarded the element.
                    throw ClosedStreamException.get();
                }
                try {
                    taken.await();
                } catch (InterruptedException e) {
                    if (numTaken >= ticket) {
                        // Handed over already; keep the interrupt for the caller.
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (!closed) {
                        pending = null;
                        numOffered--;
                        vacant.signal();
                    }
                    throw e;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes the next element, blocking until a sender offers one or this channel is closed.
     *
     * @return the element, or {@code null} if this channel has been closed
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    @Nullable
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending == null) {
                if (closed) {
                    return null;
                }
                offered.await();
            }

            final T element = pending;
            pending = null;
            numTaken++;
            taken.signalAll();
            vacant.signal();
            return element;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes this channel, waking up all blocked senders and receivers. An element which was offered but
     * not taken yet is discarded and its sender fails with a {@link ClosedStreamException}.
     *
     * @throws IllegalStateException if this channel has been closed already
     */
    public void close() {
        lock.lock();
        try {
            checkState(!closed, "channel closed already");
            closed = true;
            pending = null;
            offered.signalAll();
            taken.signalAll();
            vacant.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns {@code true} if this channel has been closed.
     */
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return MoreObjects.toStringHelper(this)
                              .add("closed", closed)
                              .add("numOffered", numOffered)
                              .add("numTaken", numTaken)
                              .toString();
        } finally {
            lock.unlock();
        }
    }
}
