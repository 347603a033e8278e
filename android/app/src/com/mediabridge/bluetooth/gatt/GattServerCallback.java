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

/** Events delivered by the GATT server. Default implementations ignore the event. */
public abstract class GattServerCallback {
    public void onConnectionStateChange(RemoteDevice device, int status, int newState) {}

    public void onServiceAdded(int status, BleGattService service) {}

    public void onCharacteristicReadRequest(
            RemoteDevice device,
            int requestId,
            int offset,
            BleGattCharacteristic characteristic) {}

    public void onCharacteristicWriteRequest(
            RemoteDevice device,
            int requestId,
            BleGattCharacteristic characteristic,
            boolean preparedWrite,
            boolean responseNeeded,
            int offset,
            byte[] value) {}

    public void onDescriptorReadRequest(
            RemoteDevice device, int requestId, int offset, BleGattDescriptor descriptor) {}

    public void onDescriptorWriteRequest(
            RemoteDevice device,
            int requestId,
            BleGattDescriptor descriptor,
            boolean preparedWrite,
            boolean responseNeeded,
            int offset,
            byte[] value) {}

    public void onNotificationSent(RemoteDevice device, int status) {}
}
