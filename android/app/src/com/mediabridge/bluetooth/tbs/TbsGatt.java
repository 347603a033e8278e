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
import com.mediabridge.bluetooth.gatt.BleGatt;
import com.mediabridge.bluetooth.gatt.BleGattCharacteristic;
import com.mediabridge.bluetooth.gatt.BleGattService;
import com.mediabridge.bluetooth.gatt.CharacteristicCodec;
import com.mediabridge.bluetooth.gatt.GattEvent;
import com.mediabridge.bluetooth.gatt.GattServiceHost;
import com.mediabridge.bluetooth.gatt.NotificationGate;
import com.mediabridge.bluetooth.gatt.ProfileGattService;
import com.mediabridge.bluetooth.gatt.RemoteDevice;

import com.google.common.annotations.VisibleForTesting;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Telephone Bearer Service exposing a single call.
 *
 * <p>Call snapshots come from {@link CallStateReconciler}. Call Control Point writes are turned
 * into {@link TelephonyController} actions.
 */
public class TbsGatt implements ProfileGattService, CallStateReconciler.Callback {
    private static final String TAG = "TbsGatt";

    public static final UUID UUID_TBS = BleGatt.fromShortUuid(0x184C);
    public static final UUID UUID_CALL_STATE = BleGatt.fromShortUuid(0x2BBD);
    public static final UUID UUID_CALL_CONTROL_POINT = BleGatt.fromShortUuid(0x2BBE);
    public static final UUID UUID_TERMINATION_REASON = BleGatt.fromShortUuid(0x2BC0);
    public static final UUID UUID_CALL_FRIENDLY_NAME = BleGatt.fromShortUuid(0x2BC2);

    private static final List<UUID> REQUIRED_CHARACTERISTICS =
            List.of(
                    UUID_CALL_STATE,
                    UUID_CALL_CONTROL_POINT,
                    UUID_CALL_FRIENDLY_NAME,
                    UUID_TERMINATION_REASON);

    private final GattServiceHost mHost;
    private final TelephonyController mTelephony;
    private final NotificationGate mGate;
    private final BridgeEventLogger mEventLogger =
            new BridgeEventLogger(50, TAG + " event log");

    private BleGattService mService;
    private boolean mServiceReady;
    private CallMetadata mCurrentCall = CallMetadata.idle(0);

    public TbsGatt(GattServiceHost host, TelephonyController telephony) {
        mHost = requireNonNull(host);
        mTelephony = requireNonNull(telephony);
        mGate = new NotificationGate(host);
    }

    /** Queues a call snapshot. May be called from any thread. */
    public void updateCallMetadata(CallMetadata metadata) {
        requireNonNull(metadata);
        mHost.post(() -> dispatch(GattEvent.metadataUpdated(metadata)));
    }

    @Override
    public void onCallMetadataChanged(CallMetadata metadata) {
        updateCallMetadata(metadata);
    }

    @Override
    public UUID getServiceUuid() {
        return UUID_TBS;
    }

    @Override
    public List<UUID> getRequiredCharacteristics() {
        return REQUIRED_CHARACTERISTICS;
    }

    @Override
    public BleGattService createService() {
        BleGattService service = new BleGattService(UUID_TBS);
        service.addNotifyCharacteristic(UUID_CALL_STATE, 0, 0)
                .setValue(CharacteristicCodec.encodeCallState(CallState.IDLE.getValue()));
        service.addNotifyCharacteristic(
                UUID_CALL_CONTROL_POINT,
                BleGattCharacteristic.PROPERTY_WRITE
                        | BleGattCharacteristic.PROPERTY_WRITE_NO_RESPONSE,
                BleGattCharacteristic.PERMISSION_WRITE);
        service.addNotifyCharacteristic(UUID_CALL_FRIENDLY_NAME, 0, 0)
                .setValue(CharacteristicCodec.encodeString(CallMetadata.NO_ACTIVE_CALL));
        service.addNotifyCharacteristic(UUID_TERMINATION_REASON, 0, 0)
                .setValue(
                        CharacteristicCodec.encodeTerminationReason(
                                TerminationReason.UNKNOWN.getValue()));
        mService = service;
        mServiceReady = false;
        return service;
    }

    @Override
    public void dispatch(GattEvent event) {
        switch (event.getType()) {
            case SERVICE_REGISTERED -> onServiceRegistered(event.getStatus(), event.getService());
            case DEVICE_CONNECTED -> onDeviceConnected(event.getDevice());
            case DEVICE_DISCONNECTED -> Log.d(TAG, "Device disconnected: " + event.getDevice());
            case CHARACTERISTIC_WRITTEN -> {
                if (UUID_CALL_CONTROL_POINT.equals(event.getCharacteristic().getUuid())) {
                    onCallControlPointWrite(event.getDevice(), event.getValue());
                }
            }
            case METADATA_UPDATED -> {
                CallMetadata metadata = event.getMetadata(CallMetadata.class);
                if (metadata != null) {
                    onCallMetadataUpdated(metadata);
                }
            }
        }
    }

    private void onServiceRegistered(int status, BleGattService service) {
        if (service != mService) {
            Log.w(TAG, "Registration result for a stale service instance");
            return;
        }
        mServiceReady = status == BleGatt.GATT_SUCCESS;
        if (!mServiceReady) {
            mEventLogger.loge(TAG, "Service registration failed, status=" + status);
            return;
        }
        mEventLogger.logd(TAG, "Service registered");
        publishSnapshot();
    }

    private void onDeviceConnected(RemoteDevice device) {
        if (!mServiceReady) {
            Log.w(TAG, "Device " + device + " connected before service registration");
            return;
        }
        mEventLogger.logd(TAG, "Sending call snapshot, device=" + device);
        publishSnapshot();
    }

    private void onCallMetadataUpdated(CallMetadata metadata) {
        CallMetadata previous = mCurrentCall;
        boolean callIdChanged = !Objects.equals(previous.getCallId(), metadata.getCallId());
        mEventLogger.logd(TAG, "Call " + previous.getState() + " -> " + metadata);

        if (metadata.isIdle() && metadata.getTerminationReason() != null) {
            // The next snapshot shows a plain idle bearer.
            mCurrentCall = CallMetadata.idle(metadata.getTimestamp());
            if (!mServiceReady) {
                return;
            }
            publish(
                    UUID_TERMINATION_REASON,
                    CharacteristicCodec.encodeTerminationReason(
                            metadata.getTerminationReason().getValue()),
                    true);
            publish(
                    UUID_CALL_FRIENDLY_NAME,
                    CharacteristicCodec.encodeString(metadata.getDisplayName()),
                    true);
            publish(
                    UUID_CALL_STATE,
                    CharacteristicCodec.encodeCallState(CallState.IDLE.getValue()),
                    true);
            return;
        }

        mCurrentCall = metadata;
        if (!mServiceReady) {
            return;
        }
        publish(
                UUID_CALL_STATE,
                CharacteristicCodec.encodeCallState(metadata.getState().getValue()),
                callIdChanged);
        publish(
                UUID_CALL_FRIENDLY_NAME,
                CharacteristicCodec.encodeString(getFriendlyName(metadata)),
                false);
    }

    private void publishSnapshot() {
        CallMetadata call = mCurrentCall;
        publish(
                UUID_CALL_STATE,
                CharacteristicCodec.encodeCallState(call.getState().getValue()),
                false);
        publish(
                UUID_CALL_FRIENDLY_NAME,
                CharacteristicCodec.encodeString(getFriendlyName(call)),
                false);
    }

    private static String getFriendlyName(CallMetadata call) {
        return call.isIdle() ? CallMetadata.NO_ACTIVE_CALL : call.getDisplayName();
    }

    private void publish(UUID uuid, byte[] value, boolean force) {
        BleGattCharacteristic characteristic = mService.getCharacteristic(uuid);
        if (characteristic == null) {
            Log.e(TAG, "Characteristic " + uuid + " is missing from the service");
            return;
        }
        mGate.publish(characteristic, value, force);
    }

    private void onCallControlPointWrite(RemoteDevice device, byte[] value) {
        int opcode = CharacteristicCodec.decodeOpcode(value);
        CallCommand command = CallCommand.fromOpcode(opcode);
        if (command == null) {
            mEventLogger.logw(
                    TAG,
                    String.format(
                            Locale.US, "Unknown call control opcode 0x%02X from %s", opcode,
                            device));
            return;
        }
        boolean result = executeCallCommand(command);
        mEventLogger.logd(TAG, command + " from " + device + ", result=" + result);
    }

    /** Runs {@code command} on the platform. Returns false if it could not be carried out. */
    @VisibleForTesting
    boolean executeCallCommand(CallCommand command) {
        int apiLevel = mTelephony.getPlatformApiLevel();
        try {
            switch (command) {
                case ACCEPT:
                    if (apiLevel < TelephonyController.API_LEVEL_ACCEPT_RINGING_CALL) {
                        Log.w(TAG, "Accepting calls needs API "
                                + TelephonyController.API_LEVEL_ACCEPT_RINGING_CALL);
                        return false;
                    }
                    return mTelephony.acceptRingingCall();
                case REJECT:
                case END:
                    if (apiLevel < TelephonyController.API_LEVEL_END_CALL) {
                        Log.w(
                                TAG,
                                "Ending calls needs API " + TelephonyController.API_LEVEL_END_CALL);
                        return false;
                    }
                    return mTelephony.endCall();
                case HOLD:
                case UNHOLD:
                default:
                    Log.w(TAG, command + " is not supported");
                    return false;
            }
        } catch (SecurityException e) {
            Log.e(TAG, "Not allowed to execute " + command, e);
            return false;
        }
    }

    @VisibleForTesting
    CallMetadata getCurrentCall() {
        return mCurrentCall;
    }

    @Override
    public void dump(StringBuilder sb) {
        sb.append(TAG).append(":\n");
        sb.append("  Service ready: ").append(mServiceReady).append("\n");
        sb.append("  Current call: ").append(mCurrentCall).append("\n");
        mEventLogger.dump(sb);
    }
}
