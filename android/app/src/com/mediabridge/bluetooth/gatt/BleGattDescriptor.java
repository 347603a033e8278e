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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.UUID;

/** A descriptor hosted by the local GATT server. */
public class BleGattDescriptor {
    public static final byte[] ENABLE_NOTIFICATION_VALUE = {0x01, 0x00};
    public static final byte[] ENABLE_INDICATION_VALUE = {0x02, 0x00};
    public static final byte[] DISABLE_NOTIFICATION_VALUE = {0x00, 0x00};

    public static final int PERMISSION_READ = 0x01;
    public static final int PERMISSION_WRITE = 0x10;

    private final UUID mUuid;
    private final int mPermissions;
    private BleGattCharacteristic mCharacteristic;
    private byte[] mValue;

    public BleGattDescriptor(UUID uuid, int permissions) {
        mUuid = requireNonNull(uuid);
        mPermissions = permissions;
    }

    public UUID getUuid() {
        return mUuid;
    }

    public int getPermissions() {
        return mPermissions;
    }

    public BleGattCharacteristic getCharacteristic() {
        return mCharacteristic;
    }

    void setCharacteristic(BleGattCharacteristic characteristic) {
        mCharacteristic = characteristic;
    }

    public byte[] getValue() {
        return mValue == null ? null : mValue.clone();
    }

    public void setValue(byte[] value) {
        mValue = value == null ? null : value.clone();
    }

    @Override
    public String toString() {
        return "BleGattDescriptor{uuid=" + mUuid + ", value=" + Arrays.toString(mValue) + "}";
    }
}
