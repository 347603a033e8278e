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

import com.mediabridge.bluetooth.BridgeEventLogger;
import com.mediabridge.bluetooth.Log;
import com.mediabridge.bluetooth.Utils.TimeProvider;
import com.mediabridge.bluetooth.util.SystemProperties;

import com.google.common.annotations.VisibleForTesting;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Turns telephony state changes and caller name hints into {@link CallMetadata}.
 *
 * <p>The platform only reports IDLE, RINGING and OFFHOOK. OFFHOOK means both "dialing" and
 * "answered", so an outgoing call is assumed to be answered on a second OFFHOOK that is not
 * jitter, or when the dialing watchdog expires.
 */
public class CallStateReconciler {
    private static final String TAG = "CallStateReconciler";

    static final String PROPERTY_DIALING_WATCHDOG_MS =
            "bluetooth.mediabridge.dialing_watchdog_ms";
    static final String PROPERTY_OFFHOOK_JITTER_MS = "bluetooth.mediabridge.offhook_jitter_ms";
    static final String PROPERTY_NEW_CALL_GAP_MS = "bluetooth.mediabridge.new_call_gap_ms";

    @VisibleForTesting static final long DEFAULT_DIALING_WATCHDOG_MS = 5000;

    /** A second OFFHOOK closer than this to the first one is a duplicate. */
    @VisibleForTesting static final long DEFAULT_OFFHOOK_JITTER_MS = 500;

    /** OFFHOOK while ACTIVE starts a new outgoing call only after this much quiet time. */
    @VisibleForTesting static final long DEFAULT_NEW_CALL_GAP_MS = 1000;

    /** Receives every new call snapshot. */
    public interface Callback {
        void onCallMetadataChanged(CallMetadata metadata);
    }

    private final Callback mCallback;
    private final ScheduledExecutorService mExecutor;
    private final TimeProvider mTimeProvider;
    private final long mDialingWatchdogMs;
    private final long mOffhookJitterMs;
    private final long mNewCallGapMs;
    private final BridgeEventLogger mEventLogger =
            new BridgeEventLogger(50, TAG + " event log");

    private CallMetadata mCurrent;
    private ScheduledFuture<?> mWatchdog;
    private int mCallSequence;

    public CallStateReconciler(
            Callback callback, ScheduledExecutorService executor, TimeProvider timeProvider) {
        mCallback = requireNonNull(callback);
        mExecutor = requireNonNull(executor);
        mTimeProvider = requireNonNull(timeProvider);
        mDialingWatchdogMs =
                SystemProperties.getLong(PROPERTY_DIALING_WATCHDOG_MS, DEFAULT_DIALING_WATCHDOG_MS);
        mOffhookJitterMs =
                SystemProperties.getLong(PROPERTY_OFFHOOK_JITTER_MS, DEFAULT_OFFHOOK_JITTER_MS);
        mNewCallGapMs = SystemProperties.getLong(PROPERTY_NEW_CALL_GAP_MS, DEFAULT_NEW_CALL_GAP_MS);
        mCurrent = CallMetadata.idle(timeProvider.elapsedRealtime());
    }

    public synchronized CallMetadata getCurrentCall() {
        return mCurrent;
    }

    /** Handles a telephony state change. */
    public synchronized void onCallStateChanged(CallMetadataUpdate update) {
        requireNonNull(update);
        String number = CallerNamePolicy.normalizeNumber(update.getPhoneNumber());
        Log.d(TAG, "onCallStateChanged: " + update + ", current=" + mCurrent.getState());
        switch (update.getTelephonyState()) {
            case RINGING -> onRinging(number, update.getCallerName());
            case OFFHOOK -> onOffhook(number, update.getCallerName());
            case IDLE -> onIdle();
        }
    }

    /** Handles a caller name inferred outside of telephony, e.g. from a notification. */
    public synchronized void onCallerNameHint(String name) {
        if (mCurrent.isIdle()) {
            Log.d(TAG, "Ignoring caller name hint while idle");
            return;
        }
        String chosen = CallerNamePolicy.choose(mCurrent.getCallerName(), name);
        if (Objects.equals(chosen, mCurrent.getCallerName())) {
            Log.d(TAG, "Caller name hint \"" + name + "\" rejected");
            return;
        }
        mEventLogger.logd(TAG, "Caller name " + mCurrent.getCallerName() + " -> " + chosen);
        emit(mCurrent.toBuilder().setCallerName(chosen).build());
    }

    private void onRinging(String number, String callerName) {
        long now = mTimeProvider.elapsedRealtime();
        if (mCurrent.getState() == CallState.INCOMING) {
            CallMetadata.Builder merged = mCurrent.toBuilder();
            if (mCurrent.getPhoneNumber() == null && number != null) {
                merged.setPhoneNumber(number);
            }
            merged.setCallerName(CallerNamePolicy.choose(mCurrent.getCallerName(), callerName));
            CallMetadata next = merged.build();
            if (!next.equals(mCurrent)) {
                emit(next);
            }
            return;
        }

        cancelWatchdog();
        String name = CallerNamePolicy.choose(CallerNamePolicy.INCOMING_CALL, callerName);
        emit(
                new CallMetadata.Builder(CallState.INCOMING)
                        .setPhoneNumber(number)
                        .setCallerName(name)
                        .setCallId(newCallId(now))
                        .setTimestamp(now)
                        .setIncoming(true)
                        .build());
    }

    private void onOffhook(String number, String callerName) {
        long now = mTimeProvider.elapsedRealtime();
        long sinceLastUpdate = now - mCurrent.getTimestamp();
        switch (mCurrent.getState()) {
            case INCOMING -> {
                emit(answered(number, callerName, now));
            }
            case DIALING -> {
                if (sinceLastUpdate <= mOffhookJitterMs) {
                    Log.d(TAG, "OFFHOOK " + sinceLastUpdate + "ms after dialing, ignoring");
                    return;
                }
                cancelWatchdog();
                emit(answered(number, callerName, now));
            }
            case ACTIVE -> {
                if (sinceLastUpdate <= mNewCallGapMs) {
                    Log.d(TAG, "OFFHOOK " + sinceLastUpdate + "ms after answer, ignoring");
                    return;
                }
                startOutgoingCall(number, callerName, now);
            }
            case IDLE -> startOutgoingCall(number, callerName, now);
            default -> Log.w(TAG, "OFFHOOK ignored in state " + mCurrent.getState());
        }
    }

    private CallMetadata answered(String number, String callerName, long now) {
        CallMetadata.Builder builder =
                mCurrent.toBuilder().setState(CallState.ACTIVE).setTimestamp(now);
        if (mCurrent.getPhoneNumber() == null && number != null) {
            builder.setPhoneNumber(number);
        }
        builder.setCallerName(CallerNamePolicy.choose(mCurrent.getCallerName(), callerName));
        return builder.build();
    }

    private void startOutgoingCall(String number, String callerName, long now) {
        cancelWatchdog();
        String callId = newCallId(now);
        emit(
                new CallMetadata.Builder(CallState.DIALING)
                        .setPhoneNumber(number)
                        .setCallerName(
                                CallerNamePolicy.choose(CallerNamePolicy.OUTGOING_CALL, callerName))
                        .setCallId(callId)
                        .setTimestamp(now)
                        .setIncoming(false)
                        .build());
        try {
            mWatchdog =
                    mExecutor.schedule(
                            () -> onDialingWatchdog(callId),
                            mDialingWatchdogMs,
                            TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            Log.w(TAG, "Unable to arm dialing watchdog", e);
        }
    }

    @VisibleForTesting
    synchronized void onDialingWatchdog(String callId) {
        if (mCurrent.getState() != CallState.DIALING
                || !Objects.equals(callId, mCurrent.getCallId())) {
            Log.d(TAG, "Dialing watchdog for " + callId + " is stale, current=" + mCurrent);
            return;
        }
        mWatchdog = null;
        mEventLogger.logd(TAG, "No answer signal for " + callId + ", assuming ACTIVE");
        emit(
                mCurrent.toBuilder()
                        .setState(CallState.ACTIVE)
                        .setTimestamp(mTimeProvider.elapsedRealtime())
                        .build());
    }

    private void onIdle() {
        cancelWatchdog();
        if (mCurrent.isIdle()) {
            Log.d(TAG, "Already idle");
            return;
        }
        TerminationReason reason =
                mCurrent.getState() == CallState.INCOMING
                        ? TerminationReason.NO_ANSWER
                        : TerminationReason.UNKNOWN;
        emit(
                mCurrent.toBuilder()
                        .setState(CallState.IDLE)
                        .setTerminationReason(reason)
                        .setTimestamp(mTimeProvider.elapsedRealtime())
                        .build());
    }

    private void cancelWatchdog() {
        if (mWatchdog != null) {
            mWatchdog.cancel(false);
            mWatchdog = null;
        }
    }

    private String newCallId(long now) {
        return "call_" + now + "_" + (++mCallSequence);
    }

    private void emit(CallMetadata metadata) {
        mEventLogger.logd(TAG, mCurrent.getState() + " -> " + metadata);
        mCurrent = metadata;
        mCallback.onCallMetadataChanged(metadata);
    }

    public synchronized void dump(StringBuilder sb) {
        sb.append(TAG).append(":\n");
        sb.append("  Current: ").append(mCurrent).append("\n");
        sb.append("  Watchdog armed: ").append(mWatchdog != null).append("\n");
        mEventLogger.dump(sb);
    }
}
