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

package com.mediabridge.bluetooth.util;

import static com.mediabridge.bluetooth.TestUtils.MockitoRule;

import static com.google.common.truth.Truth.assertThat;

import static org.mockito.Mockito.doReturn;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;

@RunWith(JUnit4.class)
public class SystemPropertiesTest {
    private static final String KEY = "bluetooth.mediabridge.test_property";

    @Rule public final MockitoRule mMockitoRule = new MockitoRule();

    @Mock private SystemProperties.MockableSystemProperties mProperties;

    @After
    public void tearDown() {
        SystemProperties.mProperties = null;
        System.clearProperty(KEY);
    }

    @Test
    public void unset_returnsDefaults() {
        assertThat(SystemProperties.get(KEY)).isEmpty();
        assertThat(SystemProperties.get(KEY, "fallback")).isEqualTo("fallback");
        assertThat(SystemProperties.getInt(KEY, 7)).isEqualTo(7);
        assertThat(SystemProperties.getLong(KEY, 800L)).isEqualTo(800L);
    }

    @Test
    public void readsJvmProperties() {
        System.setProperty(KEY, " 1500 ");

        assertThat(SystemProperties.getInt(KEY, 7)).isEqualTo(1500);
        assertThat(SystemProperties.getLong(KEY, 800L)).isEqualTo(1500L);
    }

    @Test
    public void malformedNumber_returnsDefault() {
        System.setProperty(KEY, "soon");

        assertThat(SystemProperties.getInt(KEY, 7)).isEqualTo(7);
        assertThat(SystemProperties.getLong(KEY, 800L)).isEqualTo(800L);
    }

    @Test
    public void override_takesPrecedence() {
        System.setProperty(KEY, "from-jvm");
        doReturn("from-override").when(mProperties).get(KEY);
        doReturn(3).when(mProperties).getInt(KEY, 7);
        SystemProperties.mProperties = mProperties;

        assertThat(SystemProperties.get(KEY, "fallback")).isEqualTo("from-override");
        assertThat(SystemProperties.getInt(KEY, 7)).isEqualTo(3);
    }

    @Test
    public void override_emptyValue_returnsDefault() {
        doReturn("").when(mProperties).get(KEY);
        SystemProperties.mProperties = mProperties;

        assertThat(SystemProperties.get(KEY, "fallback")).isEqualTo("fallback");
    }
}
