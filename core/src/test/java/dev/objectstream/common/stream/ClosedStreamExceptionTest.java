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

import org.junit.jupiter.api.Test;

class ClosedStreamExceptionTest {

    @Test
    void singletonHasNoStackTrace() {
        final ClosedStreamException exception = ClosedStreamException.get();
        assertThat(ClosedStreamException.get()).isSameAs(exception);
        assertThat(exception.getStackTrace()).isEmpty();
        assertThat(exception).hasMessage("stream is closed");
    }

    @Test
    void singletonIgnoresSuppressedExceptions() {
        final ClosedStreamException exception = ClosedStreamException.get();
        exception.addSuppressed(new IllegalStateException());
        assertThat(exception.getSuppressed()).isEmpty();
    }
}
