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

/** Call Control Point opcodes. */
public enum CallCommand {
    ACCEPT(0x01),
    REJECT(0x02),
    END(0x03),
    HOLD(0x04),
    UNHOLD(0x05);

    private final int mOpcode;

    CallCommand(int opcode) {
        mOpcode = opcode;
    }

    public int getOpcode() {
        return mOpcode;
    }

    /** Returns the command for {@code opcode}, or null if it is unknown. */
    public static CallCommand fromOpcode(int opcode) {
        for (CallCommand command : values()) {
            if (command.mOpcode == opcode) {
                return command;
            }
        }
        return null;
    }
}
