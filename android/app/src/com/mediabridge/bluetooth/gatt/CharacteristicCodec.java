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

package com.mediabridge.bluetooth.gatt;

import java.nio.charset.StandardCharsets;

/** Conversions between domain values and characteristic byte layouts. */
public final class CharacteristicCodec {
    /** Index of the single call the bearer exposes. */
    public static final int CALL_INDEX = 0x01;

    public static final int CALL_FLAGS_NONE = 0x00;

    /** Returned by {@link #decodeOpcode(byte[])} when the write carried no bytes. */
    public static final int INVALID_OPCODE = -1;

    public static final long UINT32_MAX = 0xFFFFFFFFL;

    private CharacteristicCodec() {}

    /** UTF-8 without terminator. A null string encodes as an empty value. */
    public static byte[] encodeString(String value) {
        if (value == null) {
            return new byte[0];
        }
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Encodes a millisecond duration as 4 byte little endian centiseconds. Negative durations
     * encode as zero, durations past the uint32 range saturate at {@link #UINT32_MAX}.
     */
    public static byte[] encodeCentiseconds(long millis) {
        return encodeUint32(Math.min(Math.max(0L, millis) / 10L, UINT32_MAX));
    }

    public static byte[] encodeUint32(long value) {
        return new byte[] {
            (byte) (value & 0xFF),
            (byte) ((value >> 8) & 0xFF),
            (byte) ((value >> 16) & 0xFF),
            (byte) ((value >> 24) & 0xFF)
        };
    }

    public static byte[] encodeUint8(int value) {
        return new byte[] {(byte) (value & 0xFF)};
    }

    /** Call state record: {@code [callIndex, state, flags]}. */
    public static byte[] encodeCallState(int state) {
        return new byte[] {(byte) CALL_INDEX, (byte) (state & 0xFF), (byte) CALL_FLAGS_NONE};
    }

    /** Termination reason record: {@code [callIndex, reason]}. */
    public static byte[] encodeTerminationReason(int reason) {
        return new byte[] {(byte) CALL_INDEX, (byte) (reason & 0xFF)};
    }

    /** Unsigned leading byte of a control point write, trailing bytes ignored. */
    public static int decodeOpcode(byte[] value) {
        if (value == null || value.length == 0) {
            return INVALID_OPCODE;
        }
        return value[0] & 0xFF;
    }
}
