/*
 * Copyright 2025 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.mediabridge.bluetooth;

import static com.google.common.truth.Truth.assertThat;

import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BridgeEventLoggerTest {

    @Test
    public void add_dropsOldestWhenFull() {
        BridgeEventLogger logger = new BridgeEventLogger(2, "Test log");

        logger.logd("Tag", "first");
        logger.logi("Tag", "second");
        logger.logd("Tag", "third");

        assertThat(logger.size()).isEqualTo(2);
        StringBuilder sb = new StringBuilder();
        logger.dump(sb);
        assertThat(sb.toString()).startsWith("Test log (last 2):\n");
        assertThat(sb.toString()).doesNotContain("first");
        assertThat(sb.toString()).contains("second");
        assertThat(sb.toString()).contains("third");
    }

    @Test
    public void dump_recordsLevelAndTag() {
        BridgeEventLogger logger = new BridgeEventLogger(5, "Test log");
        logger.logw("Session", "warning");
        logger.loge("Bearer", "error");

        StringBuilder sb = new StringBuilder();
        logger.dump(sb);

        assertThat(sb.toString()).contains(" W Session: warning\n");
        assertThat(sb.toString()).contains(" E Bearer: error\n");
        assertThat(sb.toString().indexOf("warning")).isLessThan(sb.toString().indexOf("error"));
    }

    @Test
    public void invalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new BridgeEventLogger(0, "Test log"));
    }
}
