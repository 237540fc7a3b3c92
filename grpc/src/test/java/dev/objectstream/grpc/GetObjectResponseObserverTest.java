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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import dev.objectstream.common.stream.ClosedStreamException;
import dev.objectstream.storage.GetObjectResponse;
import dev.objectstream.storage.GetObjectServerStream;

import io.grpc.Status.Code;
import io.grpc.StatusRuntimeException;

@ExtendWith(MockitoExtension.class)
class GetObjectResponseObserverTest {

    @Mock
    private GetObjectServerStream stream;

    private GetObjectResponseObserver observer;

    @BeforeEach
    void setUp() {
        observer = new GetObjectResponseObserver(stream);
    }

    @Test
    void onNextSendsChunk() throws Exception {
        final GetObjectResponse chunk = GetObjectResponse.ofUtf8("a");
        observer.onNext(chunk);

        verify(stream).send(chunk);
        assertThat(observer.isTerminated()).isFalse();
    }

    @Test
    void onCompletedCompletesStream() {
        when(stream.complete()).thenReturn(true);
        observer.onCompleted();

        verify(stream).complete();
        assertThat(observer.whenTerminated()).isDone();
        assertThat(observer.isCancelled()).isFalse();
    }

    @Test
    void onErrorSendsError() throws Exception {
        final IllegalStateException cause = new IllegalStateException();
        observer.onError(cause);

        verify(stream).sendError(cause);
        assertThat(observer.isTerminated()).isTrue();
    }

    @Test
    void onNextAfterHostClosedIsCancelled() throws Exception {
        doThrow(ClosedStreamException.get()).when(stream).send(any());

        assertThatThrownBy(() -> observer.onNext(GetObjectResponse.ofUtf8("a")))
                .isInstanceOfSatisfying(StatusRuntimeException.class,
                                        e -> assertThat(e.getStatus().getCode()).isEqualTo(Code.CANCELLED));
        assertThat(observer.isCancelled()).isTrue();
        assertThat(observer.isTerminated()).isTrue();

        // Ignored after cancellation.
        observer.onError(new IllegalStateException());
        verify(stream, never()).sendError(any());
        observer.onCompleted();
    }

    @Test
    void interruptedOnNextRestoresInterruptFlag() throws Exception {
        doThrow(new InterruptedException()).when(stream).send(any());
        try {
            assertThatThrownBy(() -> observer.onNext(GetObjectResponse.ofUtf8("a")))
                    .isInstanceOf(StatusRuntimeException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void callsAfterTerminationFail() throws Exception {
        when(stream.complete()).thenReturn(true);
        observer.onCompleted();

        assertThatThrownBy(() -> observer.onNext(GetObjectResponse.ofUtf8("a")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(observer::onCompleted).isInstanceOf(IllegalStateException.class);
        verify(stream, never()).send(any());
    }
}
