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

import static java.util.Objects.requireNonNull;

/** A telephony state change together with what the platform knew about the other party. */
public final class CallMetadataUpdate {
    private final String mPhoneNumber;
    private final String mCallerName;
    private final TelephonyState mTelephonyState;

    public CallMetadataUpdate(
            String phoneNumber, String callerName, TelephonyState telephonyState) {
        mPhoneNumber = phoneNumber;
        mCallerName = callerName;
        mTelephonyState = requireNonNull(telephonyState);
    }

    public String getPhoneNumber() {
        return mPhoneNumber;
    }

    public String getCallerName() {
        return mCallerName;
    }

    public TelephonyState getTelephonyState() {
        return mTelephonyState;
    }

    @Override
    public String toString() {
        return "CallMetadataUpdate{state=" + mTelephonyState + ", number=" + mPhoneNumber
                + ", name=" + mCallerName + "}";
    }
}
