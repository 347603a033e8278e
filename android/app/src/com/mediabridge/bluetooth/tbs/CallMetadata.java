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

import java.util.Objects;

/** Snapshot of the single call exposed by the bearer. */
public final class CallMetadata {
    public static final String NO_ACTIVE_CALL = "No Active Call";

    private final String mPhoneNumber;
    private final String mCallerName;
    private final CallState mState;
    private final String mCallId;
    private final long mTimestamp;
    private final TerminationReason mTerminationReason;
    private final boolean mIsIncoming;

    private CallMetadata(Builder builder) {
        mPhoneNumber = builder.mPhoneNumber;
        mCallerName = builder.mCallerName;
        mState = requireNonNull(builder.mState);
        mCallId = builder.mCallId;
        mTimestamp = builder.mTimestamp;
        mTerminationReason = builder.mTerminationReason;
        mIsIncoming = builder.mIsIncoming;
    }

    /** No call, nothing terminated. */
    public static CallMetadata idle(long timestamp) {
        return new Builder(CallState.IDLE).setTimestamp(timestamp).build();
    }

    public String getPhoneNumber() {
        return mPhoneNumber;
    }

    public String getCallerName() {
        return mCallerName;
    }

    public CallState getState() {
        return mState;
    }

    public String getCallId() {
        return mCallId;
    }

    public long getTimestamp() {
        return mTimestamp;
    }

    public TerminationReason getTerminationReason() {
        return mTerminationReason;
    }

    public boolean isIncoming() {
        return mIsIncoming;
    }

    public boolean isIdle() {
        return mState == CallState.IDLE;
    }

    /**
     * A concrete caller name if known, else the number, else whatever placeholder is set, else
     * {@link CallerNamePolicy#UNKNOWN_CALLER}.
     */
    public String getDisplayName() {
        if (mCallerName != null
                && !mCallerName.isEmpty()
                && !CallerNamePolicy.isPlaceholder(mCallerName)) {
            return mCallerName;
        }
        if (mPhoneNumber != null && !mPhoneNumber.isEmpty()) {
            return mPhoneNumber;
        }
        if (mCallerName != null && !mCallerName.isEmpty()) {
            return mCallerName;
        }
        return CallerNamePolicy.UNKNOWN_CALLER;
    }

    public Builder toBuilder() {
        return new Builder(mState)
                .setPhoneNumber(mPhoneNumber)
                .setCallerName(mCallerName)
                .setCallId(mCallId)
                .setTimestamp(mTimestamp)
                .setTerminationReason(mTerminationReason)
                .setIncoming(mIsIncoming);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallMetadata)) {
            return false;
        }
        CallMetadata other = (CallMetadata) o;
        return mTimestamp == other.mTimestamp
                && mIsIncoming == other.mIsIncoming
                && mState == other.mState
                && mTerminationReason == other.mTerminationReason
                && Objects.equals(mPhoneNumber, other.mPhoneNumber)
                && Objects.equals(mCallerName, other.mCallerName)
                && Objects.equals(mCallId, other.mCallId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                mPhoneNumber,
                mCallerName,
                mState,
                mCallId,
                mTimestamp,
                mTerminationReason,
                mIsIncoming);
    }

    @Override
    public String toString() {
        return "CallMetadata{state="
                + mState
                + ", callId="
                + mCallId
                + ", number="
                + mPhoneNumber
                + ", name="
                + mCallerName
                + ", incoming="
                + mIsIncoming
                + ", terminationReason="
                + mTerminationReason
                + "}";
    }

    public static final class Builder {
        private String mPhoneNumber;
        private String mCallerName;
        private CallState mState;
        private String mCallId;
        private long mTimestamp;
        private TerminationReason mTerminationReason;
        private boolean mIsIncoming;

        public Builder(CallState state) {
            mState = requireNonNull(state);
        }

        public Builder setState(CallState state) {
            mState = requireNonNull(state);
            return this;
        }

        public Builder setPhoneNumber(String phoneNumber) {
            mPhoneNumber = phoneNumber;
            return this;
        }

        public Builder setCallerName(String callerName) {
            mCallerName = callerName;
            return this;
        }

        public Builder setCallId(String callId) {
            mCallId = callId;
            return this;
        }

        public Builder setTimestamp(long timestamp) {
            mTimestamp = timestamp;
            return this;
        }

        public Builder setTerminationReason(TerminationReason terminationReason) {
            mTerminationReason = terminationReason;
            return this;
        }

        public Builder setIncoming(boolean isIncoming) {
            mIsIncoming = isIncoming;
            return this;
        }

        public CallMetadata build() {
            return new CallMetadata(this);
        }
    }
}
