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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class StreamGuardTest {

    @Test
    void closeRunsActionOnlyOnce() {
        final AtomicInteger numCloses = new AtomicInteger();
        final StreamGuard guard = new StreamGuard("test", numCloses::incrementAndGet);

        assertThat(guard.isClosed()).isFalse();
        assertThat(guard.close()).isTrue();
        assertThat(guard.close()).isFalse();
        assertThat(guard.close()).isFalse();
        assertThat(guard.isClosed()).isTrue();
        assertThat(numCloses).hasValue(1);
    }

    @Test
    void concurrentClosesRunActionOnlyOnce() throws Exception {
        final int numThreads = 16;
        final AtomicInteger numCloses = new AtomicInteger();
        final StreamGuard guard = new StreamGuard("test", numCloses::incrementAndGet);
        final CountDownLatch startLatch = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        try {
            final List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < numThreads; i++) {
                results.add(executor.submit(() -> {
                    startLatch.await();
                    return guard.close();
                }));
            }
            startLatch.countDown();

            int numEffectiveCloses = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    numEffectiveCloses++;
                }
            }
            assertThat(numEffectiveCloses).isOne();
            assertThat(numCloses).hasValue(1);
            assertThat(guard.isClosed()).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void closesGuardedChannel() throws Exception {
        final HandOffChannel<String> channel = new HandOffChannel<>();
        final StreamGuard guard = StreamGuard.of("test", channel);

        assertThat(guard.close()).isTrue();
        assertThat(channel.isClosed()).isTrue();
        assertThat(channel.receive()).isNull();

        // Must not close the channel again.
        assertThat(guard.close()).isFalse();
    }

    @Test
    void toStringShowsState() {
        final StreamGuard guard = new StreamGuard("GetObject", () -> {});
        assertThat(guard.toString()).contains("GetObject").contains("closed=false");
        guard.close();
        assertThat(guard.toString()).contains("closed=true");
    }
}
