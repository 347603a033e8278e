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

import static com.google.common.truth.Truth.assertThat;

import com.mediabridge.bluetooth.TestUtils.FakeScheduler;
import com.mediabridge.bluetooth.TestUtils.FakeTimeProvider;

import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@RunWith(JUnit4.class)
public class CallStateReconcilerTest {
    private static final String NUMBER = "+1 555 0100";

    private final List<CallMetadata> mEmitted = new ArrayList<>();
    private FakeScheduler mScheduler;
    private FakeTimeProvider mTime;
    private CallStateReconciler mReconciler;

    @Before
    public void setUp() {
        mScheduler = new FakeScheduler();
        mTime = new FakeTimeProvider();
        mReconciler = new CallStateReconciler(mEmitted::add, mScheduler.getExecutor(), mTime);
    }

    private void ringing(String number, String name) {
        mReconciler.onCallStateChanged(
                new CallMetadataUpdate(number, name, TelephonyState.RINGING));
    }

    private void offhook() {
        mReconciler.onCallStateChanged(new CallMetadataUpdate(null, null, TelephonyState.OFFHOOK));
    }

    private void idle() {
        mReconciler.onCallStateChanged(new CallMetadataUpdate(null, null, TelephonyState.IDLE));
    }

    private void advance(long millis) {
        mTime.advanceTime(Duration.ofMillis(millis));
    }

    private CallMetadata last() {
        return mEmitted.get(mEmitted.size() - 1);
    }

    @Test
    public void initialState_isIdle() {
        assertThat(mReconciler.getCurrentCall().isIdle()).isTrue();
        assertThat(mEmitted).isEmpty();
    }

    @Test
    public void incomingCall_answeredAndHungUp() {
        ringing(NUMBER, null);
        CallMetadata incoming = last();
        assertThat(incoming.getState()).isEqualTo(CallState.INCOMING);
        assertThat(incoming.getPhoneNumber()).isEqualTo(NUMBER);
        assertThat(incoming.getCallerName()).isEqualTo(CallerNamePolicy.INCOMING_CALL);
        assertThat(incoming.isIncoming()).isTrue();
        assertThat(incoming.getCallId()).startsWith("call_");

        advance(3000);
        offhook();
        CallMetadata active = last();
        assertThat(active.getState()).isEqualTo(CallState.ACTIVE);
        assertThat(active.getCallId()).isEqualTo(incoming.getCallId());
        assertThat(active.getPhoneNumber()).isEqualTo(NUMBER);

        advance(60_000);
        idle();
        CallMetadata ended = last();
        assertThat(ended.getState()).isEqualTo(CallState.IDLE);
        assertThat(ended.getTerminationReason()).isEqualTo(TerminationReason.UNKNOWN);
        assertThat(ended.getCallId()).isEqualTo(incoming.getCallId());
        assertThat(ended.getPhoneNumber()).isEqualTo(NUMBER);
        assertThat(mEmitted).hasSize(3);
    }

    @Test
    public void incomingCall_missed_reportsNoAnswer() {
        ringing(NUMBER, "John");
        advance(20_000);
        idle();

        assertThat(last().getTerminationReason()).isEqualTo(TerminationReason.NO_ANSWER);
        assertThat(last().getCallerName()).isEqualTo("John");
    }

    @Test
    public void outgoingCall_secondOffhookMeansAnswered() {
        offhook();
        CallMetadata dialing = last();
        assertThat(dialing.getState()).isEqualTo(CallState.DIALING);
        assertThat(dialing.getCallerName()).isEqualTo(CallerNamePolicy.OUTGOING_CALL);
        assertThat(dialing.isIncoming()).isFalse();
        assertThat(mScheduler.getPendingDelays())
                .containsExactly(CallStateReconciler.DEFAULT_DIALING_WATCHDOG_MS);

        advance(2000);
        offhook();

        assertThat(last().getState()).isEqualTo(CallState.ACTIVE);
        assertThat(last().getCallId()).isEqualTo(dialing.getCallId());
        assertThat(mScheduler.getPendingDelays()).isEmpty();
    }

    @Test
    public void outgoingCall_watchdogAssumesAnswered() {
        offhook();
        String callId = last().getCallId();

        advance(CallStateReconciler.DEFAULT_DIALING_WATCHDOG_MS);
        mScheduler.runPending(CallStateReconciler.DEFAULT_DIALING_WATCHDOG_MS);

        assertThat(last().getState()).isEqualTo(CallState.ACTIVE);
        assertThat(last().getCallId()).isEqualTo(callId);
        assertThat(mEmitted).hasSize(2);
    }

    @Test
    public void outgoingCall_offhookJitterIsIgnored() {
        offhook();
        advance(CallStateReconciler.DEFAULT_OFFHOOK_JITTER_MS - 100);
        offhook();

        assertThat(mEmitted).hasSize(1);
        assertThat(last().getState()).isEqualTo(CallState.DIALING);
    }

    @Test
    public void activeCall_offhookAfterGap_startsNewOutgoingCall() {
        offhook();
        advance(2000);
        offhook();
        String firstCall = last().getCallId();

        advance(CallStateReconciler.DEFAULT_NEW_CALL_GAP_MS - 100);
        offhook();
        assertThat(last().getState()).isEqualTo(CallState.ACTIVE);

        advance(CallStateReconciler.DEFAULT_NEW_CALL_GAP_MS + 500);
        offhook();
        assertThat(last().getState()).isEqualTo(CallState.DIALING);
        assertThat(last().getCallId()).isNotEqualTo(firstCall);
    }

    @Test
    public void staleWatchdog_isDropped() {
        offhook();
        String firstCall = last().getCallId();
        advance(1000);
        idle();
        offhook();
        int emitted = mEmitted.size();

        mScheduler.runCancelled(CallStateReconciler.DEFAULT_DIALING_WATCHDOG_MS);
        mReconciler.onDialingWatchdog(firstCall);

        assertThat(mEmitted).hasSize(emitted);
        assertThat(last().getState()).isEqualTo(CallState.DIALING);
    }

    @Test
    public void hangUpWhileDialing_cancelsWatchdog() {
        offhook();
        advance(1000);
        idle();

        assertThat(last().getTerminationReason()).isEqualTo(TerminationReason.UNKNOWN);
        assertThat(mScheduler.getPendingDelays()).isEmpty();
    }

    @Test
    public void idleWhileIdle_isIgnored() {
        idle();

        assertThat(mEmitted).isEmpty();
    }

    @Test
    public void duplicateRinging_mergesIntoSameCall() {
        ringing(null, null);
        String callId = last().getCallId();

        ringing(NUMBER, "John");
        assertThat(mEmitted).hasSize(2);
        assertThat(last().getCallId()).isEqualTo(callId);
        assertThat(last().getPhoneNumber()).isEqualTo(NUMBER);
        assertThat(last().getCallerName()).isEqualTo("John");

        ringing(NUMBER, "John");
        assertThat(mEmitted).hasSize(2);
    }

    @Test
    public void unknownNumber_isDropped() {
        ringing("unknown", null);

        assertThat(last().getPhoneNumber()).isNull();
        assertThat(last().getDisplayName()).isEqualTo(CallerNamePolicy.INCOMING_CALL);
    }

    @Test
    public void ringingWhileDialing_startsIncomingCall() {
        offhook();
        String outgoing = last().getCallId();

        ringing(NUMBER, null);

        assertThat(last().getState()).isEqualTo(CallState.INCOMING);
        assertThat(last().getCallId()).isNotEqualTo(outgoing);
        assertThat(mScheduler.getPendingDelays()).isEmpty();
    }

    @Test
    public void callIds_areUniqueAtTheSameTime() {
        ringing(NUMBER, null);
        String first = last().getCallId();
        idle();
        ringing(NUMBER, null);

        assertThat(last().getCallId()).isNotEqualTo(first);
    }

    @Test
    public void nameHint_whileIdle_isIgnored() {
        mReconciler.onCallerNameHint("John");

        assertThat(mEmitted).isEmpty();
    }

    @Test
    public void nameHint_replacesPlaceholderOnce() {
        ringing(NUMBER, null);

        mReconciler.onCallerNameHint("John");
        assertThat(last().getCallerName()).isEqualTo("John");
        assertThat(mEmitted).hasSize(2);

        mReconciler.onCallerNameHint("Jane");
        mReconciler.onCallerNameHint("Spam protection disabled");
        assertThat(mEmitted).hasSize(2);
    }

    @Test
    public void nameHint_survivesAnswer() {
        ringing(NUMBER, null);
        mReconciler.onCallerNameHint("John");
        advance(2000);
        offhook();

        assertThat(last().getState()).isEqualTo(CallState.ACTIVE);
        assertThat(last().getCallerName()).isEqualTo("John");
    }

    @Test
    public void dump_doesNotCrash() {
        ringing(NUMBER, "John");

        StringBuilder sb = new StringBuilder();
        mReconciler.dump(sb);

        assertThat(sb.toString()).contains("INCOMING");
    }
}
