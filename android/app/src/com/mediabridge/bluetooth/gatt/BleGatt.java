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

import java.util.UUID;

/** Status codes, link states, bond states and well known UUIDs of the attribute protocol. */
public final class BleGatt {
    public static final int GATT_SUCCESS = 0x00;
    public static final int GATT_READ_NOT_PERMITTED = 0x02;
    public static final int GATT_WRITE_NOT_PERMITTED = 0x03;
    public static final int GATT_REQUEST_NOT_SUPPORTED = 0x06;
    public static final int GATT_INVALID_OFFSET = 0x07;
    public static final int GATT_INVALID_ATTRIBUTE_LENGTH = 0x0d;
    public static final int GATT_FAILURE = 0x101;

    public static final int STATE_DISCONNECTED = 0;
    public static final int STATE_CONNECTING = 1;
    public static final int STATE_CONNECTED = 2;
    public static final int STATE_DISCONNECTING = 3;

    public static final int BOND_NONE = 10;
    public static final int BOND_BONDING = 11;
    public static final int BOND_BONDED = 12;

    private static final long BASE_UUID_LSB = 0x800000805f9b34fbL;
    private static final long BASE_UUID_MSB_LOW = 0x00001000L;

    public static final UUID UUID_CLIENT_CHARACTERISTIC_CONFIGURATION = fromShortUuid(0x2902);

    private BleGatt() {}

    /** Expands a 16 bit SIG assigned number onto the Bluetooth base UUID. */
    public static UUID fromShortUuid(int shortUuid) {
        return new UUID(((long) (shortUuid & 0xFFFF) << 32) | BASE_UUID_MSB_LOW, BASE_UUID_LSB);
    }

    public static String connectionStateToString(int state) {
        return switch (state) {
            case STATE_DISCONNECTED -> "DISCONNECTED";
            case STATE_CONNECTING -> "CONNECTING";
            case STATE_CONNECTED -> "CONNECTED";
            case STATE_DISCONNECTING -> "DISCONNECTING";
            default -> "UNKNOWN(" + state + ")";
        };
    }

    public static String bondStateToString(int state) {
        return switch (state) {
            case BOND_NONE -> "BOND_NONE";
            case BOND_BONDING -> "BOND_BONDING";
            case BOND_BONDED -> "BOND_BONDED";
            default -> "UNKNOWN(" + state + ")";
        };
    }
}
