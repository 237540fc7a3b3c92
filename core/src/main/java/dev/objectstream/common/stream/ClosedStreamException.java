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

import dev.objectstream.common.util.Exceptions;

/**
 * A {@link RuntimeException} raised when an operation is attempted on a stream half which has been
 * closed already, either by the other endpoint, by an error delivery or by an explicit close.
 */
public final class ClosedStreamException extends RuntimeException {

    private static final long serialVersionUID = -7665826869012452735L;

    private static final String MESSAGE = "stream is closed";

    private static final ClosedStreamException INSTANCE =
            Exceptions.clearTrace(new ClosedStreamException(false));

    /**
     * Returns a {@link ClosedStreamException} which may be a singleton or a new instance, depending on
     * whether {@linkplain Exceptions#isVerbose() the verbose exception mode} is enabled.
     */
    public static ClosedStreamException get() {
        return Exceptions.isVerbose() ? new ClosedStreamException(true) : INSTANCE;
    }

    private ClosedStreamException(boolean enableSuppression) {
        super(MESSAGE, null, enableSuppression, true);
    }
}
