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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tag based logging facade over {@link java.util.logging}.
 *
 * <p>Each tag maps to one {@link Logger} so that verbosity can be tuned per class from the
 * logging configuration.
 */
public final class Log {
    private static final ConcurrentMap<String, Logger> sLoggers = new ConcurrentHashMap<>();

    private Log() {}

    private static Logger logger(String tag) {
        return sLoggers.computeIfAbsent(tag, Logger::getLogger);
    }

    public static void v(String tag, String msg) {
        logger(tag).log(Level.FINEST, msg);
    }

    public static void d(String tag, String msg) {
        logger(tag).log(Level.FINE, msg);
    }

    public static void i(String tag, String msg) {
        logger(tag).log(Level.INFO, msg);
    }

    public static void w(String tag, String msg) {
        logger(tag).log(Level.WARNING, msg);
    }

    public static void w(String tag, String msg, Throwable tr) {
        logger(tag).log(Level.WARNING, msg, tr);
    }

    public static void e(String tag, String msg) {
        logger(tag).log(Level.SEVERE, msg);
    }

    public static void e(String tag, String msg, Throwable tr) {
        logger(tag).log(Level.SEVERE, msg, tr);
    }
}
