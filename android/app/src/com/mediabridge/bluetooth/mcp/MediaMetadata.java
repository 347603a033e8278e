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

import java.util.Objects;

/** Snapshot of the active media session. Each update replaces the previous one entirely. */
public final class MediaMetadata {
    public static final String NO_MEDIA_TITLE = "No Media";

    /** State exposed before any media session has been observed. */
    public static final MediaMetadata EMPTY = new Builder().build();

    private final String mTitle;
    private final String mArtist;
    private final String mAlbum;
    private final String mPackageName;
    private final boolean mIsPlaying;
    private final long mDurationMs;
    private final long mPositionMs;
    private final long mTimestamp;

    private MediaMetadata(Builder builder) {
        mTitle = builder.mTitle;
        mArtist = builder.mArtist;
        mAlbum = builder.mAlbum;
        mPackageName = builder.mPackageName;
        mIsPlaying = builder.mIsPlaying;
        mDurationMs = Math.max(0L, builder.mDurationMs);
        mPositionMs = Math.max(0L, builder.mPositionMs);
        mTimestamp = builder.mTimestamp;
    }

    public String getTitle() {
        return mTitle;
    }

    /** Title to put on the wire, {@link #NO_MEDIA_TITLE} when there is none. */
    public String getDisplayTitle() {
        return hasTitle() ? mTitle : NO_MEDIA_TITLE;
    }

    private boolean hasTitle() {
        return mTitle != null && !mTitle.isEmpty();
    }

    public String getArtist() {
        return mArtist;
    }

    public String getAlbum() {
        return mAlbum;
    }

    public String getPackageName() {
        return mPackageName;
    }

    public boolean isPlaying() {
        return mIsPlaying;
    }

    public long getDurationMs() {
        return mDurationMs;
    }

    public long getPositionMs() {
        return mPositionMs;
    }

    public long getTimestamp() {
        return mTimestamp;
    }

    public MediaState getMediaState() {
        if (mIsPlaying) {
            return MediaState.PLAYING;
        }
        return hasTitle() ? MediaState.PAUSED : MediaState.INACTIVE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MediaMetadata)) {
            return false;
        }
        MediaMetadata other = (MediaMetadata) o;
        return mIsPlaying == other.mIsPlaying
                && mDurationMs == other.mDurationMs
                && mPositionMs == other.mPositionMs
                && mTimestamp == other.mTimestamp
                && Objects.equals(mTitle, other.mTitle)
                && Objects.equals(mArtist, other.mArtist)
                && Objects.equals(mAlbum, other.mAlbum)
                && Objects.equals(mPackageName, other.mPackageName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                mTitle, mArtist, mAlbum, mPackageName, mIsPlaying, mDurationMs, mPositionMs,
                mTimestamp);
    }

    @Override
    public String toString() {
        return "MediaMetadata{title="
                + mTitle
                + ", artist="
                + mArtist
                + ", package="
                + mPackageName
                + ", playing="
                + mIsPlaying
                + ", duration="
                + mDurationMs
                + ", position="
                + mPositionMs
                + "}";
    }

    public static final class Builder {
        private String mTitle;
        private String mArtist;
        private String mAlbum;
        private String mPackageName;
        private boolean mIsPlaying;
        private long mDurationMs;
        private long mPositionMs;
        private long mTimestamp;

        public Builder setTitle(String title) {
            mTitle = title;
            return this;
        }

        public Builder setArtist(String artist) {
            mArtist = artist;
            return this;
        }

        public Builder setAlbum(String album) {
            mAlbum = album;
            return this;
        }

        public Builder setPackageName(String packageName) {
            mPackageName = packageName;
            return this;
        }

        public Builder setPlaying(boolean isPlaying) {
            mIsPlaying = isPlaying;
            return this;
        }

        public Builder setDurationMs(long durationMs) {
            mDurationMs = durationMs;
            return this;
        }

        public Builder setPositionMs(long positionMs) {
            mPositionMs = positionMs;
            return this;
        }

        public Builder setTimestamp(long timestamp) {
            mTimestamp = timestamp;
            return this;
        }

        public MediaMetadata build() {
            return new MediaMetadata(this);
        }
    }
}
