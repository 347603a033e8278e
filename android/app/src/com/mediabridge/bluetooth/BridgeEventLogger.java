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

package com.mediabridge.bluetooth;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * Bounded history of session events for {@code dump()}. Each record keeps its wall clock time,
 * level and tag, and is also forwarded to {@link Log}.
 */
public class BridgeEventLogger {
    private final String mTitle;
    private final Queue<String> mEvents;
    private final int mSize;

    public BridgeEventLogger(int size, String title) {
        if (size <= 0) {
            throw new IllegalArgumentException("Size must be > 0");
        }
        mSize = size;
        mEvents = new ArrayDeque<>(size);
        mTitle = title;
    }

    private void add(char level, String tag, String msg) {
        if (mEvents.size() == mSize) {
            mEvents.remove();
        }
        mEvents.add(Utils.getLocalTimeString() + " " + level + " " + tag + ": " + msg);
    }

    public synchronized void logd(String tag, String msg) {
        add('D', tag, msg);
        Log.d(tag, msg);
    }

    public synchronized void logi(String tag, String msg) {
        add('I', tag, msg);
        Log.i(tag, msg);
    }

    public synchronized void logw(String tag, String msg) {
        add('W', tag, msg);
        Log.w(tag, msg);
    }

    public synchronized void loge(String tag, String msg) {
        add('E', tag, msg);
        Log.e(tag, msg);
    }

    synchronized int size() {
        return mEvents.size();
    }

    public synchronized void dump(StringBuilder sb) {
        sb.append(mTitle).append(" (last ").append(mSize).append("):\n");
        for (String msg : mEvents) {
            sb.append("  ").append(msg).append("\n");
        }
    }
}
