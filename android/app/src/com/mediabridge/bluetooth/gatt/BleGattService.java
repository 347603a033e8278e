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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/** A primary service definition registered on the local GATT server. */
public class BleGattService {
    private final UUID mUuid;
    private final List<BleGattCharacteristic> mCharacteristics = new ArrayList<>();

    public BleGattService(UUID uuid) {
        mUuid = requireNonNull(uuid);
    }

    public UUID getUuid() {
        return mUuid;
    }

    public boolean addCharacteristic(BleGattCharacteristic characteristic) {
        characteristic.setService(this);
        return mCharacteristics.add(characteristic);
    }

    /**
     * Creates a readable, notifying characteristic with a Client Characteristic Configuration
     * descriptor and adds it to this service.
     */
    public BleGattCharacteristic addNotifyCharacteristic(
            UUID uuid, int extraProperties, int extraPermissions) {
        BleGattCharacteristic characteristic =
                new BleGattCharacteristic(
                        uuid,
                        BleGattCharacteristic.PROPERTY_READ
                                | BleGattCharacteristic.PROPERTY_NOTIFY
                                | extraProperties,
                        BleGattCharacteristic.PERMISSION_READ | extraPermissions);
        BleGattDescriptor cccd =
                new BleGattDescriptor(
                        BleGatt.UUID_CLIENT_CHARACTERISTIC_CONFIGURATION,
                        BleGattDescriptor.PERMISSION_READ | BleGattDescriptor.PERMISSION_WRITE);
        cccd.setValue(BleGattDescriptor.DISABLE_NOTIFICATION_VALUE);
        characteristic.addDescriptor(cccd);
        addCharacteristic(characteristic);
        return characteristic;
    }

    public BleGattCharacteristic getCharacteristic(UUID uuid) {
        for (BleGattCharacteristic characteristic : mCharacteristics) {
            if (characteristic.getUuid().equals(uuid)) {
                return characteristic;
            }
        }
        return null;
    }

    public List<BleGattCharacteristic> getCharacteristics() {
        return Collections.unmodifiableList(mCharacteristics);
    }

    @Override
    public String toString() {
        return "BleGattService{uuid="
                + mUuid
                + ", characteristics="
                + mCharacteristics.size()
                + "}";
    }
}
