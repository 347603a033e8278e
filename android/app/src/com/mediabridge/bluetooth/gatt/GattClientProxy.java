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

/** Seam over the platform GATT client (central role) and the bonding API. */
public interface GattClientProxy {
    /** Starts a client connection to {@code device}. */
    boolean connect(RemoteDevice device, GattClientCallback callback);

    void disconnect();

    void close();

    boolean discoverServices();

    int getBondState(RemoteDevice device);

    boolean createBond(RemoteDevice device);
}
