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

import java.util.List;
import java.util.UUID;

/**
 * Seam over the platform GATT server. Implementations forward to the BLE stack; tests mock it.
 *
 * <p>All methods return the stack's immediate acknowledgement only. A {@code true} result does
 * not mean the peer received anything.
 */
public interface GattServerProxy {
    /** Opens a server instance delivering events to {@code callback}. */
    boolean open(GattServerCallback callback);

    void close();

    void clearServices();

    /** Queues a service for registration. Completion arrives via {@code onServiceAdded}. */
    boolean addService(BleGattService service);

    BleGattService getService(UUID uuid);

    List<BleGattService> getServices();

    boolean sendResponse(RemoteDevice device, int requestId, int status, int offset, byte[] value);

    /** Sends the characteristic's current value to {@code device}. */
    boolean notifyCharacteristicChanged(
            RemoteDevice device, BleGattCharacteristic characteristic, boolean confirm);
}
