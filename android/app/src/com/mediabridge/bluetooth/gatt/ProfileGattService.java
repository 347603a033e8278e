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

/** A profile whose GATT service is hosted by {@link GattSessionManager}. */
public interface ProfileGattService {
    UUID getServiceUuid();

    /**
     * Builds a fresh service definition. Called every time the GATT server is (re)started, so
     * implementations must drop references to characteristics of earlier instances.
     */
    BleGattService createService();

    /** Characteristics that must be present after registration for the profile to work. */
    List<UUID> getRequiredCharacteristics();

    /** Handles one event. Always called on the session's sequencing queue. */
    void dispatch(GattEvent event);

    void dump(StringBuilder sb);
}
