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

import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/** What a profile needs from the session that hosts its GATT service. */
public interface GattServiceHost {
    Set<RemoteDevice> getConnectedDevices();

    Set<RemoteDevice> getRecentlyConnectedDevices();

    /** Sends the characteristic's current value. Returns the stack's acknowledgement. */
    boolean notifyCharacteristicChanged(RemoteDevice device, BleGattCharacteristic characteristic);

    /** Runs {@code task} on the session's sequencing queue. */
    void post(Runnable task);

    ScheduledFuture<?> postDelayed(Runnable task, long delayMillis);
}
