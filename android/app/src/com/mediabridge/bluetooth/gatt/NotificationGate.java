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

import com.mediabridge.bluetooth.Log;
import com.mediabridge.bluetooth.Utils;

import com.google.common.annotations.VisibleForTesting;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Change detection in front of characteristic notifications.
 *
 * <p>A changed value goes to every connected peer. An unchanged value goes only to peers that
 * have not received their state snapshot yet, since a notification is never replayed to a peer
 * that connects after it was sent.
 */
public class NotificationGate {
    private static final String TAG = "NotificationGate";

    private final GattServiceHost mHost;
    private final Map<UUID, byte[]> mLastSentValues = new HashMap<>();

    public NotificationGate(GattServiceHost host) {
        mHost = requireNonNull(host);
    }

    /**
     * Stores {@code value} in the characteristic and notifies the peers selected for it.
     *
     * @param force treat the value as changed even if it equals the cached one
     * @return number of peers the stack accepted the notification for
     */
    public synchronized int publish(
            BleGattCharacteristic characteristic, byte[] value, boolean force) {
        UUID uuid = characteristic.getUuid();
        Set<RemoteDevice> recipients =
                selectRecipients(
                        uuid,
                        value,
                        mHost.getConnectedDevices(),
                        mHost.getRecentlyConnectedDevices(),
                        force);
        characteristic.setValue(value);
        if (recipients.isEmpty()) {
            Log.v(TAG, "No recipients for " + uuid + " value=" + Utils.toHexString(value));
            return 0;
        }

        int accepted = 0;
        for (RemoteDevice device : recipients) {
            if (mHost.notifyCharacteristicChanged(device, characteristic)) {
                accepted++;
            }
        }
        Log.d(
                TAG,
                "Notified "
                        + uuid
                        + " value="
                        + Utils.toHexString(value)
                        + " to "
                        + accepted
                        + "/"
                        + recipients.size());
        return accepted;
    }

    /**
     * Decides who receives {@code value} and updates the cache when the value changed.
     *
     * @return all of {@code connected} on change, else {@code recentlyConnected}
     */
    @VisibleForTesting
    synchronized Set<RemoteDevice> selectRecipients(
            UUID uuid,
            byte[] value,
            Set<RemoteDevice> connected,
            Set<RemoteDevice> recentlyConnected,
            boolean force) {
        byte[] lastValue = mLastSentValues.get(uuid);
        if (force || !Arrays.equals(lastValue, value)) {
            mLastSentValues.put(uuid, value.clone());
            return connected;
        }
        if (!recentlyConnected.isEmpty()) {
            return recentlyConnected;
        }
        return Collections.emptySet();
    }

    public synchronized byte[] getLastSentValue(UUID uuid) {
        byte[] value = mLastSentValues.get(uuid);
        return value == null ? null : value.clone();
    }
}
