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

import java.util.Locale;

/** Derives the Media Player Name from the package of the playing app. */
public final class PlayerNameResolver {
    public static final String DEFAULT_PLAYER_NAME = "MediaPlayer";

    private PlayerNameResolver() {}

    public static String resolve(String packageName) {
        if (packageName == null || packageName.trim().isEmpty()) {
            return DEFAULT_PLAYER_NAME;
        }
        String pkg = packageName.trim().toLowerCase(Locale.ROOT);
        if (pkg.contains("spotify")) {
            return "Spotify";
        }
        if (pkg.contains("youtube")) {
            return "YouTube Music";
        }
        if (pkg.contains("music")) {
            if (pkg.contains("google")) {
                return "YouTube Music";
            }
            if (pkg.contains("apple")) {
                return "Apple Music";
            }
            return "Music";
        }
        if (pkg.contains("soundcloud")) {
            return "SoundCloud";
        }
        if (pkg.contains("pandora")) {
            return "Pandora";
        }
        if (pkg.contains("deezer")) {
            return "Deezer";
        }

        String trimmed = packageName.trim();
        String last = trimmed.substring(trimmed.lastIndexOf('.') + 1);
        if (last.isEmpty()) {
            return DEFAULT_PLAYER_NAME;
        }
        return last.substring(0, 1).toUpperCase(Locale.ROOT) + last.substring(1);
    }
}
