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

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Peers currently connected to the GATT server.
 *
 * <p>A peer stays in the recently connected subset from the moment it connects until its state
 * snapshot has been delivered. Notification subscriptions are tracked per peer and dropped with
 * it.
 */
public class ConnectedDeviceRegistry {
    private final Set<RemoteDevice> mConnectedDevices = new LinkedHashSet<>();
    private final Set<RemoteDevice> mRecentlyConnectedDevices = new LinkedHashSet<>();
    private final Map<RemoteDevice, Set<UUID>> mSubscriptions = new HashMap<>();

    /** Returns false if the device was already registered. */
    public synchronized boolean addDevice(RemoteDevice device) {
        if (!mConnectedDevices.add(device)) {
            return false;
        }
        mRecentlyConnectedDevices.add(device);
        return true;
    }

    /** Returns false if the device was not registered. */
    public synchronized boolean removeDevice(RemoteDevice device) {
        mRecentlyConnectedDevices.remove(device);
        mSubscriptions.remove(device);
        return mConnectedDevices.remove(device);
    }

    public synchronized void markSnapshotDelivered(RemoteDevice device) {
        mRecentlyConnectedDevices.remove(device);
    }

    public synchronized boolean isConnected(RemoteDevice device) {
        return mConnectedDevices.contains(device);
    }

    public synchronized boolean isRecentlyConnected(RemoteDevice device) {
        return mRecentlyConnectedDevices.contains(device);
    }

    public synchronized Set<RemoteDevice> getConnectedDevices() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(mConnectedDevices));
    }

    public synchronized Set<RemoteDevice> getRecentlyConnectedDevices() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(mRecentlyConnectedDevices));
    }

    public synchronized void setSubscribed(RemoteDevice device, UUID characteristic, boolean on) {
        if (!mConnectedDevices.contains(device)) {
            return;
        }
        if (on) {
            mSubscriptions.computeIfAbsent(device, d -> new HashSet<>()).add(characteristic);
        } else {
            Set<UUID> subscribed = mSubscriptions.get(device);
            if (subscribed != null) {
                subscribed.remove(characteristic);
            }
        }
    }

    public synchronized boolean isSubscribed(RemoteDevice device, UUID characteristic) {
        Set<UUID> subscribed = mSubscriptions.get(device);
        return subscribed != null && subscribed.contains(characteristic);
    }

    public synchronized Set<UUID> getSubscriptions(RemoteDevice device) {
        Set<UUID> subscribed = mSubscriptions.get(device);
        return subscribed == null ? Collections.emptySet() : Set.copyOf(subscribed);
    }

    public synchronized void clear() {
        mConnectedDevices.clear();
        mRecentlyConnectedDevices.clear();
        mSubscriptions.clear();
    }

    public synchronized void dump(StringBuilder sb) {
        sb.append("  Connected devices: ").append(mConnectedDevices).append("\n");
        sb.append("  Recently connected: ").append(mRecentlyConnectedDevices).append("\n");
        for (Map.Entry<RemoteDevice, Set<UUID>> entry : mSubscriptions.entrySet()) {
            sb.append("  Subscriptions of ")
                    .append(entry.getKey())
                    .append(": ")
                    .append(entry.getValue().size())
                    .append("\n");
        }
    }
}
