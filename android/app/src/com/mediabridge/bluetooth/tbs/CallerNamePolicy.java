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

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which caller name to keep when several sources report one.
 *
 * <p>Rules, in order: values on the deny list are ignored; a placeholder is replaced by anything
 * concrete; a phone number may be replaced by a name but a name is never replaced by a number;
 * once a concrete name is set it stays for the rest of the call.
 */
public final class CallerNamePolicy {
    public static final String INCOMING_CALL = "Incoming Call";
    public static final String OUTGOING_CALL = "Outgoing Call";
    public static final String UNKNOWN_CALLER = "Unknown";

    private static final List<String> PLACEHOLDERS =
            List.of(
                    INCOMING_CALL,
                    OUTGOING_CALL,
                    "Active Call",
                    "Unknown Caller",
                    "Unknown Number",
                    "Private Number",
                    "Blocked",
                    "Call in progress",
                    "Ongoing call");

    /** System and promotional texts that show up where a caller name is expected. */
    private static final List<String> DENY_LIST =
            List.of(
                    "unknown number",
                    "private number",
                    "blocked",
                    "spam protection disabled",
                    "allow truecaller",
                    "premium",
                    "subscription");

    private static final Pattern PHONE_NUMBER = Pattern.compile("^[+\\d\\s\\-()]+$");
    private static final Pattern BIDI_FORMATTING =
            Pattern.compile("[\\u202A-\\u202E\\u2066-\\u2069]");

    private CallerNamePolicy() {}

    /** Removes bidirectional formatting characters and surrounding whitespace. */
    public static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        return BIDI_FORMATTING.matcher(value).replaceAll("").trim();
    }

    /** Telephony reports missing numbers as empty or "unknown". */
    public static String normalizeNumber(String number) {
        String sanitized = sanitize(number);
        if (sanitized == null || sanitized.isEmpty() || sanitized.equalsIgnoreCase("unknown")) {
            return null;
        }
        return sanitized;
    }

    public static boolean isPlaceholder(String name) {
        if (name == null) {
            return false;
        }
        String sanitized = sanitize(name);
        for (String placeholder : PLACEHOLDERS) {
            if (placeholder.equalsIgnoreCase(sanitized)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isDenied(String name) {
        if (name == null) {
            return false;
        }
        String lower = sanitize(name).toLowerCase(Locale.ROOT);
        for (String denied : DENY_LIST) {
            if (lower.contains(denied)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isPhoneNumber(String value) {
        if (value == null) {
            return false;
        }
        String sanitized = sanitize(value);
        return !sanitized.isEmpty() && PHONE_NUMBER.matcher(sanitized).matches();
    }

    /** A name that is neither empty, a placeholder nor a phone number. */
    public static boolean isConcreteName(String value) {
        return value != null
                && !sanitize(value).isEmpty()
                && !isPlaceholder(value)
                && !isPhoneNumber(value);
    }

    /**
     * Returns the name to keep given the {@code current} one and a {@code candidate} that just
     * arrived. Either may be null.
     */
    public static String choose(String current, String candidate) {
        String next = sanitize(candidate);
        if (next == null || next.isEmpty() || isDenied(next)) {
            return current;
        }
        if (current == null || sanitize(current).isEmpty()) {
            return next;
        }
        if (sanitize(current).equalsIgnoreCase(next)) {
            return current;
        }
        if (isPlaceholder(current)) {
            return isPlaceholder(next) ? current : next;
        }
        if (isPhoneNumber(current)) {
            return isConcreteName(next) ? next : current;
        }
        return current;
    }
}
