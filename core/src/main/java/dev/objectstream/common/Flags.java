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

package dev.objectstream.common;

import java.util.function.IntPredicate;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;

import dev.objectstream.common.annotation.Nullable;
import dev.objectstream.common.stream.ClosedStreamException;

/**
 * The system properties that affect the runtime behavior of the object streams. Every property is read
 * once, when this class is initialized, and is prefixed with {@value #PREFIX}. A value which fails
 * validation is ignored and the default is used instead.
 */
public final class Flags {

    private static final Logger logger = LoggerFactory.getLogger(Flags.class);

    private static final String PREFIX = "dev.objectstream.";

    private static final boolean DEFAULT_VERBOSE_EXCEPTIONS = false;
    private static final int DEFAULT_CHUNK_SIZE = 64 * 1024;
    private static final int DEFAULT_NUM_LOOPBACK_WORKERS = 16;

    private static final boolean VERBOSE_EXCEPTIONS =
            getBoolean("verboseExceptions", DEFAULT_VERBOSE_EXCEPTIONS);

    private static final int CHUNK_SIZE =
            getInt("defaultChunkSize", DEFAULT_CHUNK_SIZE, value -> value > 0);

    private static final int NUM_LOOPBACK_WORKERS =
            getInt("numLoopbackWorkers", DEFAULT_NUM_LOOPBACK_WORKERS, value -> value > 0);

    /**
     * Returns whether the verbose exception mode is enabled. When enabled, the exceptions frequently
     * thrown by the streams, such as {@link ClosedStreamException}, will have a full stack trace. When
     * disabled, such exceptions will have an empty stack trace to eliminate the cost of capturing it.
     *
     * <p>This flag is disabled by default. Specify the
     * {@code -Ddev.objectstream.verboseExceptions=true} JVM option to enable it.
     */
    public static boolean verboseExceptions() {
        return VERBOSE_EXCEPTIONS;
    }

    /**
     * Returns the default number of bytes carried by a single object chunk.
     *
     * <p>The default value of this flag is {@value #DEFAULT_CHUNK_SIZE}. Specify the
     * {@code -Ddev.objectstream.defaultChunkSize=<integer>} JVM option to override the default value.
     */
    public static int defaultChunkSize() {
        return CHUNK_SIZE;
    }

    /**
     * Returns the maximum number of threads the loopback plugin client uses for running plugin handlers
     * when it creates its own executor.
     *
     * <p>The default value of this flag is {@value #DEFAULT_NUM_LOOPBACK_WORKERS}. Specify the
     * {@code -Ddev.objectstream.numLoopbackWorkers=<integer>} JVM option to override the default value.
     */
    public static int numLoopbackWorkers() {
        return NUM_LOOPBACK_WORKERS;
    }

    @VisibleForTesting
    static boolean getBoolean(String name, boolean defaultValue) {
        return Boolean.parseBoolean(getNormalized(name, String.valueOf(defaultValue),
                                                  value -> "true".equals(value) || "false".equals(value)));
    }

    @VisibleForTesting
    static int getInt(String name, int defaultValue, IntPredicate validator) {
        return Integer.parseInt(getNormalized(name, String.valueOf(defaultValue), value -> {
            try {
                return validator.test(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                // Not a number.
                return false;
            }
        }));
    }

    private static String getNormalized(String name, String defaultValue, Predicate<String> validator) {
        final String fullName = PREFIX + name;
        @Nullable
        String value = System.getProperty(fullName);
        if (value != null) {
            value = Ascii.toLowerCase(value.trim());
            if (validator.test(value)) {
                logger.info("{}: {} (sysprops)", fullName, value);
                return value;
            }
            logger.warn("{}: {} (sysprops, validation failed)", fullName, value);
        }

        logger.info("{}: {} (default)", fullName, defaultValue);
        return defaultValue;
    }

    private Flags() {}
}
