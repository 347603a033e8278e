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
 * Media Control Service.
 *
 * <p>Mirrors the latest {@link MediaMetadata} into the service characteristics and forwards
 * control point writes to the {@link MediaSource}.
 */
public class MediaControlGattService implements ProfileGattService {
    private static final String TAG = "MediaControlGattService";

    public static final UUID UUID_MCS = BleGatt.fromShortUuid(0x1849);
    public static final UUID UUID_PLAYER_NAME = BleGatt.fromShortUuid(0x2B93);
    public static final UUID UUID_TRACK_CHANGED = BleGatt.fromShortUuid(0x2B96);
    public static final UUID UUID_TRACK_TITLE = BleGatt.fromShortUuid(0x2B97);
    public static final UUID UUID_TRACK_DURATION = BleGatt.fromShortUuid(0x2B98);
    public static final UUID UUID_TRACK_POSITION = BleGatt.fromShortUuid(0x2B99);
    public static final UUID UUID_MEDIA_STATE = BleGatt.fromShortUuid(0x2BA3);
    public static final UUID UUID_MEDIA_CONTROL_POINT = BleGatt.fromShortUuid(0x2BA4);
    public static final UUID UUID_SUPPORTED_OPCODES = BleGatt.fromShortUuid(0x2BA5);

    private static final List<UUID> REQUIRED_CHARACTERISTICS =
            List.of(
                    UUID_PLAYER_NAME,
                    UUID_TRACK_CHANGED,
                    UUID_TRACK_TITLE,
                    UUID_TRACK_DURATION,
                    UUID_TRACK_POSITION,
                    UUID_MEDIA_STATE,
                    UUID_MEDIA_CONTROL_POINT,
                    UUID_SUPPORTED_OPCODES);

    private final GattServiceHost mHost;
    private final MediaSource mMediaSource;
    private final NotificationGate mGate;
    private final BridgeEventLogger mEventLogger =
            new BridgeEventLogger(50, TAG + " event log");

    private BleGattService mService;
    private boolean mServiceReady;
    private MediaMetadata mMetadata = MediaMetadata.EMPTY;
    private String mLastTitle;
    private int mTrackCounter;

    public MediaControlGattService(GattServiceHost host, MediaSource mediaSource) {
        mHost = requireNonNull(host);
        mMediaSource = requireNonNull(mediaSource);
        mGate = new NotificationGate(host);
    }

    /** Queues a metadata snapshot. May be called from any thread. */
    public void updateMediaMetadata(MediaMetadata metadata) {
        requireNonNull(metadata);
        mHost.post(() -> dispatch(GattEvent.metadataUpdated(metadata)));
    }

    @Override
    public UUID getServiceUuid() {
        return UUID_MCS;
    }

    @Override
    public List<UUID> getRequiredCharacteristics() {
        return REQUIRED_CHARACTERISTICS;
    }

    @Override
    public BleGattService createService() {
        BleGattService service = new BleGattService(UUID_MCS);
        service.addNotifyCharacteristic(UUID_PLAYER_NAME, 0, 0);
        service.addNotifyCharacteristic(UUID_TRACK_CHANGED, 0, 0);
        service.addNotifyCharacteristic(UUID_TRACK_TITLE, 0, 0);
        service.addNotifyCharacteristic(UUID_TRACK_DURATION, 0, 0);
        service.addNotifyCharacteristic(UUID_TRACK_POSITION, 0, 0);
        service.addNotifyCharacteristic(UUID_MEDIA_STATE, 0, 0);
        service.addCharacteristic(
                new BleGattCharacteristic(
                        UUID_MEDIA_CONTROL_POINT,
                        BleGattCharacteristic.PROPERTY_WRITE
                                | BleGattCharacteristic.PROPERTY_WRITE_NO_RESPONSE,
                        BleGattCharacteristic.PERMISSION_WRITE));
        service.addNotifyCharacteristic(UUID_SUPPORTED_OPCODES, 0, 0);
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
                if (UUID_MEDIA_CONTROL_POINT.equals(event.getCharacteristic().getUuid())) {
                    onControlPointWrite(event.getDevice(), event.getValue());
                }
            }
            case METADATA_UPDATED -> {
                MediaMetadata metadata = event.getMetadata(MediaMetadata.class);
                if (metadata != null) {
                    onMetadataUpdated(metadata);
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
        mEventLogger.logd(TAG, "Sending state snapshot, device=" + device);
        publishSnapshot();
    }

    private void onMetadataUpdated(MediaMetadata metadata) {
        mMetadata = metadata;
        boolean trackChanged = !Objects.equals(metadata.getTitle(), mLastTitle);
        if (trackChanged) {
            mTrackCounter = (mTrackCounter + 1) & 0xFF;
            mLastTitle = metadata.getTitle();
            mEventLogger.logd(
                    TAG,
                    "Track changed to \"" + metadata.getTitle() + "\", counter=" + mTrackCounter);
        }
        if (!mServiceReady) {
            Log.d(TAG, "Service not registered yet, caching " + metadata);
            return;
        }

        publish(UUID_TRACK_CHANGED, CharacteristicCodec.encodeUint8(mTrackCounter));
        publish(UUID_TRACK_TITLE, CharacteristicCodec.encodeString(metadata.getDisplayTitle()));
        publish(
                UUID_TRACK_DURATION,
                CharacteristicCodec.encodeCentiseconds(metadata.getDurationMs()));
        publish(
                UUID_TRACK_POSITION,
                CharacteristicCodec.encodeCentiseconds(metadata.getPositionMs()));
        publish(
                UUID_PLAYER_NAME,
                CharacteristicCodec.encodeString(
                        PlayerNameResolver.resolve(metadata.getPackageName())));
        publish(
                UUID_MEDIA_STATE,
                CharacteristicCodec.encodeUint8(metadata.getMediaState().getValue()));
    }

    private void publishSnapshot() {
        MediaMetadata metadata = mMetadata;
        publish(
                UUID_PLAYER_NAME,
                CharacteristicCodec.encodeString(
                        PlayerNameResolver.resolve(metadata.getPackageName())));
        publish(UUID_TRACK_CHANGED, CharacteristicCodec.encodeUint8(mTrackCounter));
        publish(UUID_TRACK_TITLE, CharacteristicCodec.encodeString(metadata.getDisplayTitle()));
        publish(
                UUID_TRACK_DURATION,
                CharacteristicCodec.encodeCentiseconds(metadata.getDurationMs()));
        publish(
                UUID_TRACK_POSITION,
                CharacteristicCodec.encodeCentiseconds(metadata.getPositionMs()));
        publish(
                UUID_MEDIA_STATE,
                CharacteristicCodec.encodeUint8(metadata.getMediaState().getValue()));
        publish(
                UUID_SUPPORTED_OPCODES,
                CharacteristicCodec.encodeUint32(MediaCommand.getSupportedOpcodesBitmask()));
    }

    private void publish(UUID uuid, byte[] value) {
        BleGattCharacteristic characteristic = mService.getCharacteristic(uuid);
        if (characteristic == null) {
            Log.e(TAG, "Characteristic " + uuid + " is missing from the service");
            return;
        }
        mGate.publish(characteristic, value, false);
    }

    private void onControlPointWrite(RemoteDevice device, byte[] value) {
        int opcode = CharacteristicCodec.decodeOpcode(value);
        if (opcode == CharacteristicCodec.INVALID_OPCODE) {
            Log.w(TAG, "Empty control point write from " + device);
            return;
        }
        int mapped = VendorOpcodeMapper.map(opcode);
        MediaCommand command =
                mapped == VendorOpcodeMapper.UNMAPPED ? null : MediaCommand.fromOpcode(mapped);
        if (command == null) {
            mEventLogger.logw(
                    TAG,
                    String.format(Locale.US, "Unsupported opcode 0x%02X from %s", opcode, device));
            return;
        }

        boolean handled;
        try {
            handled = mMediaSource.executeCommand(command);
        } catch (RuntimeException e) {
            Log.e(TAG, "Media source failed to execute " + command, e);
            handled = false;
        }
        mEventLogger.logd(
                TAG,
                String.format(
                        Locale.US,
                        "Opcode 0x%02X -> %s from %s, handled=%b",
                        opcode,
                        command,
                        device,
                        handled));
    }

    @VisibleForTesting
    int getTrackCounter() {
        return mTrackCounter;
    }

    @VisibleForTesting
    MediaMetadata getCurrentMetadata() {
        return mMetadata;
    }

    @Override
    public void dump(StringBuilder sb) {
        sb.append(TAG).append(":\n");
        sb.append("  Service ready: ").append(mServiceReady).append("\n");
        sb.append("  Metadata: ").append(mMetadata).append("\n");
        sb.append("  Track counter: ").append(mTrackCounter).append("\n");
        mEventLogger.dump(sb);
    }
}
