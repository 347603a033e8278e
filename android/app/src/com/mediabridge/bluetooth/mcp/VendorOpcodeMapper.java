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

/**
 * Maps opcodes written by the peripheral's firmware to the opcodes of {@link MediaCommand}.
 *
 * <p>The firmware sends its own aliases in the 0x30 range for track skipping and play/pause.
 */
public final class VendorOpcodeMapper {
    public static final int UNMAPPED = -1;

    private VendorOpcodeMapper() {}

    public static int map(int rawOpcode) {
        return switch (rawOpcode) {
            case 0x01, 0x02, 0x03, 0x04, 0x05, 0x10, 0x11 -> rawOpcode;
            case 0x30, 0x32 -> MediaCommand.PREVIOUS_TRACK.getOpcode();
            case 0x31 -> MediaCommand.NEXT_TRACK.getOpcode();
            case 0x33 -> MediaCommand.PLAY.getOpcode();
            case 0x34 -> MediaCommand.PAUSE.getOpcode();
            default -> UNMAPPED;
        };
    }
}
