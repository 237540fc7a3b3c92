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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junitpioneer.jupiter.ClearSystemProperty;
import org.junitpioneer.jupiter.SetSystemProperty;

class FlagsTest {

    @Test
    void defaults() {
        assertThat(Flags.verboseExceptions()).isFalse();
        assertThat(Flags.defaultChunkSize()).isEqualTo(65536);
        assertThat(Flags.numLoopbackWorkers()).isEqualTo(16);
    }

    @Test
    @SetSystemProperty(key = "dev.objectstream.testInt", value = " 42 ")
    void intFromSystemProperty() {
        assertThat(Flags.getInt("testInt", 7, value -> value > 0)).isEqualTo(42);
    }

    @Test
    @SetSystemProperty(key = "dev.objectstream.testInt", value = "-1")
    void invalidIntFallsBackToDefault() {
        assertThat(Flags.getInt("testInt", 7, value -> value > 0)).isEqualTo(7);
    }

    @Test
    @SetSystemProperty(key = "dev.objectstream.testInt", value = "many")
    void nonNumericIntFallsBackToDefault() {
        assertThat(Flags.getInt("testInt", 7, value -> value > 0)).isEqualTo(7);
    }

    @Test
    @ClearSystemProperty(key = "dev.objectstream.testInt")
    void missingIntFallsBackToDefault() {
        assertThat(Flags.getInt("testInt", 7, value -> value > 0)).isEqualTo(7);
    }

    @Test
    @SetSystemProperty(key = "dev.objectstream.testBoolean", value = "TRUE")
    void booleanIsCaseInsensitive() {
        assertThat(Flags.getBoolean("testBoolean", false)).isTrue();
    }

    @Test
    @SetSystemProperty(key = "dev.objectstream.testBoolean", value = "yes")
    void invalidBooleanFallsBackToDefault() {
        assertThat(Flags.getBoolean("testBoolean", true)).isTrue();
        assertThat(Flags.getBoolean("testBoolean", false)).isFalse();
    }
}
