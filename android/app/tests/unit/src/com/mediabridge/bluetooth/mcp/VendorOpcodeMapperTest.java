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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class VendorOpcodeMapperTest {

    @Test
    public void standardOpcodes_passThrough() {
        for (int opcode : new int[] {0x01, 0x02, 0x03, 0x04, 0x05, 0x10, 0x11}) {
            assertThat(VendorOpcodeMapper.map(opcode)).isEqualTo(opcode);
        }
    }

    @Test
    public void vendorAliases_mapToTrackAndPlaybackCommands() {
        assertThat(VendorOpcodeMapper.map(0x30)).isEqualTo(MediaCommand.PREVIOUS_TRACK.getOpcode());
        assertThat(VendorOpcodeMapper.map(0x31)).isEqualTo(MediaCommand.NEXT_TRACK.getOpcode());
        assertThat(VendorOpcodeMapper.map(0x32)).isEqualTo(MediaCommand.PREVIOUS_TRACK.getOpcode());
        assertThat(VendorOpcodeMapper.map(0x33)).isEqualTo(MediaCommand.PLAY.getOpcode());
        assertThat(VendorOpcodeMapper.map(0x34)).isEqualTo(MediaCommand.PAUSE.getOpcode());
    }

    @Test
    public void unknownOpcodes_areUnmapped() {
        assertThat(VendorOpcodeMapper.map(0x00)).isEqualTo(VendorOpcodeMapper.UNMAPPED);
        assertThat(VendorOpcodeMapper.map(0x06)).isEqualTo(VendorOpcodeMapper.UNMAPPED);
        assertThat(VendorOpcodeMapper.map(0x20)).isEqualTo(VendorOpcodeMapper.UNMAPPED);
        assertThat(VendorOpcodeMapper.map(0x35)).isEqualTo(VendorOpcodeMapper.UNMAPPED);
        assertThat(VendorOpcodeMapper.map(0xFF)).isEqualTo(VendorOpcodeMapper.UNMAPPED);
    }

    @Test
    public void everyMappedOpcode_resolvesToACommand() {
        for (int opcode = 0; opcode <= 0xFF; opcode++) {
            int mapped = VendorOpcodeMapper.map(opcode);
            if (mapped != VendorOpcodeMapper.UNMAPPED) {
                assertThat(MediaCommand.fromOpcode(mapped)).isNotNull();
            }
        }
    }

    @Test
    public void supportedOpcodesBitmask() {
        assertThat(MediaCommand.getSupportedOpcodesBitmask()).isEqualTo(0x981F);
    }

    @Test
    public void fromOpcode_unknown_returnsNull() {
        assertThat(MediaCommand.fromOpcode(0x06)).isNull();
        assertThat(MediaCommand.fromOpcode(0x30)).isEqualTo(MediaCommand.GOTO);
    }
}
