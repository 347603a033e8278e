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

import com.mediabridge.bluetooth.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/** A characteristic hosted by the local GATT server together with its current value. */
public class BleGattCharacteristic {
    public static final int PROPERTY_READ = 0x02;
    public static final int PROPERTY_WRITE_NO_RESPONSE = 0x04;
    public static final int PROPERTY_WRITE = 0x08;
    public static final int PROPERTY_NOTIFY = 0x10;
    public static final int PROPERTY_INDICATE = 0x20;

    public static final int PERMISSION_READ = 0x01;
    public static final int PERMISSION_WRITE = 0x10;

    private final UUID mUuid;
    private final int mProperties;
    private final int mPermissions;
    private final List<BleGattDescriptor> mDescriptors = new ArrayList<>();
    private BleGattService mService;
    private byte[] mValue = new byte[0];

    public BleGattCharacteristic(UUID uuid, int properties, int permissions) {
        mUuid = requireNonNull(uuid);
        mProperties = properties;
        mPermissions = permissions;
    }

    public UUID getUuid() {
        return mUuid;
    }

    public int getProperties() {
        return mProperties;
    }

    public int getPermissions() {
        return mPermissions;
    }

    public boolean isNotifiable() {
        return (mProperties & (PROPERTY_NOTIFY | PROPERTY_INDICATE)) != 0;
    }

    public boolean isWritable() {
        return (mProperties & (PROPERTY_WRITE | PROPERTY_WRITE_NO_RESPONSE)) != 0;
    }

    public BleGattService getService() {
        return mService;
    }

    void setService(BleGattService service) {
        mService = service;
    }

    public boolean addDescriptor(BleGattDescriptor descriptor) {
        descriptor.setCharacteristic(this);
        return mDescriptors.add(descriptor);
    }

    public BleGattDescriptor getDescriptor(UUID uuid) {
        for (BleGattDescriptor descriptor : mDescriptors) {
            if (descriptor.getUuid().equals(uuid)) {
                return descriptor;
            }
        }
        return null;
    }

    public List<BleGattDescriptor> getDescriptors() {
        return Collections.unmodifiableList(mDescriptors);
    }

    /** Returns a copy of the current value, never null. */
    public synchronized byte[] getValue() {
        return mValue.clone();
    }

    public synchronized void setValue(byte[] value) {
        mValue = value == null ? new byte[0] : value.clone();
    }

    @Override
    public String toString() {
        return "BleGattCharacteristic{uuid=" + mUuid + ", value=" + Utils.toHexString(mValue) + "}";
    }
}
