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
 * Player commands reachable from the Media Control Point.
 *
 * <p>Each command carries its opcode as received from the peripheral and the bit it occupies in
 * the Supported Opcodes characteristic.
 */
public enum MediaCommand {
    PLAY(0x01, 0),
    PAUSE(0x02, 1),
    STOP(0x03, 4),
    NEXT_TRACK(0x04, 12),
    PREVIOUS_TRACK(0x05, 11),
    FAST_REWIND(0x10, 2),
    FAST_FORWARD(0x11, 3),
    GOTO(0x30, 15);

    private final int mOpcode;
    private final int mSupportedBit;

    MediaCommand(int opcode, int supportedBit) {
        mOpcode = opcode;
        mSupportedBit = supportedBit;
    }

    public int getOpcode() {
        return mOpcode;
    }

    /** Returns the command for {@code opcode}, or null if it is not supported. */
    public static MediaCommand fromOpcode(int opcode) {
        for (MediaCommand command : values()) {
            if (command.mOpcode == opcode) {
                return command;
            }
        }
        return null;
    }

    /** Bitmask advertised in the Supported Opcodes characteristic. */
    public static int getSupportedOpcodesBitmask() {
        int mask = 0;
        for (MediaCommand command : values()) {
            mask |= 1 << command.mSupportedBit;
        }
        return mask;
    }
}
