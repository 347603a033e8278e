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

package com.mediabridge.bluetooth.mcp;

/** Value of the Media State characteristic. */
public enum MediaState {
    INACTIVE(0x00),
    PLAYING(0x01),
    PAUSED(0x02);

    private final int mValue;

    MediaState(int value) {
        mValue = value;
    }

    public int getValue() {
        return mValue;
    }
}
