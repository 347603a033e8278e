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
public class MediaMetadataTest {

    @Test
    public void mediaState_playingWinsOverTitle() {
        MediaMetadata playing = new MediaMetadata.Builder().setPlaying(true).build();

        assertThat(playing.getMediaState()).isEqualTo(MediaState.PLAYING);
    }

    @Test
    public void mediaState_pausedWithTitle() {
        MediaMetadata paused = new MediaMetadata.Builder().setTitle("Song A").build();

        assertThat(paused.getMediaState()).isEqualTo(MediaState.PAUSED);
        assertThat(paused.getDisplayTitle()).isEqualTo("Song A");
    }

    @Test
    public void emptyTitle_isInactiveAndShowsNoMedia() {
        MediaMetadata empty = new MediaMetadata.Builder().setTitle("").build();

        assertThat(empty.getMediaState()).isEqualTo(MediaState.INACTIVE);
        assertThat(empty.getDisplayTitle()).isEqualTo(MediaMetadata.NO_MEDIA_TITLE);
        assertThat(MediaMetadata.EMPTY.getMediaState()).isEqualTo(MediaState.INACTIVE);
    }
}
