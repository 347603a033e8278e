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

/**
 * Internal event handed to a {@link ProfileGattService}. Every GATT callback and every metadata
 * update a profile reacts to is funneled through {@link ProfileGattService#dispatch}.
 */
public final class GattEvent {
    public enum Type {
        DEVICE_CONNECTED,
        DEVICE_DISCONNECTED,
        SERVICE_REGISTERED,
        CHARACTERISTIC_WRITTEN,
        METADATA_UPDATED,
    }

    private final Type mType;
    private final RemoteDevice mDevice;
    private final int mStatus;
    private final BleGattService mService;
    private final BleGattCharacteristic mCharacteristic;
    private final byte[] mValue;
    private final Object mMetadata;

    private GattEvent(
            Type type,
            RemoteDevice device,
            int status,
            BleGattService service,
            BleGattCharacteristic characteristic,
            byte[] value,
            Object metadata) {
        mType = type;
        mDevice = device;
        mStatus = status;
        mService = service;
        mCharacteristic = characteristic;
        mValue = value;
        mMetadata = metadata;
    }

    public static GattEvent deviceConnected(RemoteDevice device) {
        return new GattEvent(
                Type.DEVICE_CONNECTED, requireNonNull(device), BleGatt.GATT_SUCCESS, null, null,
                null, null);
    }

    public static GattEvent deviceDisconnected(RemoteDevice device) {
        return new GattEvent(
                Type.DEVICE_DISCONNECTED, requireNonNull(device), BleGatt.GATT_SUCCESS, null,
                null, null, null);
    }

    public static GattEvent serviceRegistered(int status, BleGattService service) {
        return new GattEvent(
                Type.SERVICE_REGISTERED, null, status, requireNonNull(service), null, null, null);
    }

    public static GattEvent characteristicWritten(
            RemoteDevice device, BleGattCharacteristic characteristic, byte[] value) {
        return new GattEvent(
                Type.CHARACTERISTIC_WRITTEN,
                requireNonNull(device),
                BleGatt.GATT_SUCCESS,
                characteristic.getService(),
                characteristic,
                value == null ? new byte[0] : value.clone(),
                null);
    }

    public static GattEvent metadataUpdated(Object metadata) {
        return new GattEvent(
                Type.METADATA_UPDATED, null, BleGatt.GATT_SUCCESS, null, null, null,
                requireNonNull(metadata));
    }

    public Type getType() {
        return mType;
    }

    public RemoteDevice getDevice() {
        return mDevice;
    }

    public int getStatus() {
        return mStatus;
    }

    public BleGattService getService() {
        return mService;
    }

    public BleGattCharacteristic getCharacteristic() {
        return mCharacteristic;
    }

    public byte[] getValue() {
        return mValue == null ? null : mValue.clone();
    }

    /** Returns the update payload, or null if it is not of {@code type}. */
    public <T> T getMetadata(Class<T> type) {
        return type.isInstance(mMetadata) ? type.cast(mMetadata) : null;
    }

    @Override
    public String toString() {
        return "GattEvent{type=" + mType + ", device=" + mDevice + ", status=" + mStatus + "}";
    }
}
