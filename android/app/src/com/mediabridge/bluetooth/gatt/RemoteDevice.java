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

import java.util.Locale;
import java.util.regex.Pattern;

/** A remote BLE peer identified by its public address. */
public final class RemoteDevice {
    private static final Pattern ADDRESS_PATTERN =
            Pattern.compile("^([0-9A-F]{2}:){5}[0-9A-F]{2}$");

    private final String mAddress;

    public RemoteDevice(String address) {
        requireNonNull(address);
        String normalized = address.toUpperCase(Locale.ROOT);
        if (!ADDRESS_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException(address + " is not a valid Bluetooth address");
        }
        mAddress = normalized;
    }

    public String getAddress() {
        return mAddress;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RemoteDevice)) {
            return false;
        }
        return mAddress.equals(((RemoteDevice) o).mAddress);
    }

    @Override
    public int hashCode() {
        return mAddress.hashCode();
    }

    @Override
    public String toString() {
        return mAddress;
    }
}
