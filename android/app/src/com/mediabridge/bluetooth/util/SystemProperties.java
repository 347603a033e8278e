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

import com.mediabridge.bluetooth.Log;

// Helper to read tunables from JVM system properties, overridable from tests
public class SystemProperties {
    private static final String TAG = "SystemProperties";

    public static MockableSystemProperties mProperties;

    public interface MockableSystemProperties {
        String get(String key);

        int getInt(String key, int def);

        long getLong(String key, long def);
    }

    public static String get(String key) {
        return get(key, "");
    }

    public static String get(String key, String def) {
        if (mProperties != null) {
            String value = mProperties.get(key);
            return value == null || value.isEmpty() ? def : value;
        }
        return System.getProperty(key, def);
    }

    public static int getInt(String key, int def) {
        if (mProperties != null) {
            return mProperties.getInt(key, def);
        }
        String value = System.getProperty(key);
        if (value == null || value.isEmpty()) {
            return def;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            Log.w(TAG, "Invalid int for " + key + ": " + value + ", using " + def);
            return def;
        }
    }

    public static long getLong(String key, long def) {
        if (mProperties != null) {
            return mProperties.getLong(key, def);
        }
        String value = System.getProperty(key);
        if (value == null || value.isEmpty()) {
            return def;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            Log.w(TAG, "Invalid long for " + key + ": " + value + ", using " + def);
            return def;
        }
    }
}
