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

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Miscellaneous helpers shared by the bridge components. */
public final class Utils {
    private static final DateTimeFormatter LOCAL_TIME_FORMAT =
            DateTimeFormatter.ofPattern("MM-dd HH:mm:ss.SSS", Locale.US)
                    .withZone(ZoneId.systemDefault());

    private Utils() {}

    /** Source of monotonic time, replaced by a fake clock in tests. */
    public interface TimeProvider {
        long elapsedRealtime();
    }

    public static final TimeProvider DEFAULT_TIME_PROVIDER =
            () -> System.nanoTime() / 1_000_000L;

    /** Wall clock time formatted for event logs. */
    public static String getLocalTimeString() {
        return LOCAL_TIME_FORMAT.format(Instant.now());
    }

    /** Formats a byte array as space separated hex, e.g. {@code "01 04 00"}. */
    public static String toHexString(byte[] value) {
        if (value == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder(value.length * 3);
        for (int i = 0; i < value.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format(Locale.US, "%02X", value[i] & 0xFF));
        }
        return sb.toString();
    }
}
