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

package com.mediabridge.bluetooth.tbs;

/** Call state as carried in the Call State characteristic. */
public enum CallState {
    IDLE(0x00),
    INCOMING(0x01),
    DIALING(0x02),
    ALERTING(0x03),
    ACTIVE(0x04),
    LOCALLY_HELD(0x05),
    REMOTELY_HELD(0x06),
    LOCALLY_AND_REMOTELY_HELD(0x07);

    private final int mValue;

    CallState(int value) {
        mValue = value;
    }

    public int getValue() {
        return mValue;
    }
}
