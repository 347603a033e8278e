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

import static java.util.Objects.requireNonNull;

import com.mediabridge.bluetooth.Utils.TimeProvider;
import com.mediabridge.bluetooth.gatt.GattClientProxy;
import com.mediabridge.bluetooth.gatt.GattServerProxy;
import com.mediabridge.bluetooth.gatt.GattSessionManager;
import com.mediabridge.bluetooth.gatt.PermissionChecker;
import com.mediabridge.bluetooth.gatt.RemoteDevice;
import com.mediabridge.bluetooth.mcp.MediaControlGattService;
import com.mediabridge.bluetooth.mcp.MediaMetadata;
import com.mediabridge.bluetooth.mcp.MediaSource;
import com.mediabridge.bluetooth.tbs.CallMetadataUpdate;
import com.mediabridge.bluetooth.tbs.CallStateReconciler;
import com.mediabridge.bluetooth.tbs.TbsGatt;
import com.mediabridge.bluetooth.tbs.TelephonyController;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * One bridge session: the GATT session manager, both profiles and the call reconciler, all
 * sharing one sequencing thread.
 *
 * <p>Media and telephony observers feed this object from their own threads.
 */
public class MediaBridgeSession implements AutoCloseable {
    private static final String TAG = "MediaBridgeSession";

    private final ScheduledExecutorService mExecutor;
    private final GattSessionManager mSessionManager;
    private final MediaControlGattService mMediaControl;
    private final TbsGatt mTbsGatt;
    private final CallStateReconciler mReconciler;

    public MediaBridgeSession(
            GattServerProxy gattServer,
            GattClientProxy gattClient,
            PermissionChecker permissionChecker,
            MediaSource mediaSource,
            TelephonyController telephony) {
        this(
                gattServer,
                gattClient,
                permissionChecker,
                mediaSource,
                telephony,
                Executors.newSingleThreadScheduledExecutor(
                        new ThreadFactoryBuilder()
                                .setNameFormat("mediabridge-gatt-%d")
                                .setDaemon(true)
                                .build()),
                Utils.DEFAULT_TIME_PROVIDER);
    }

    @VisibleForTesting
    MediaBridgeSession(
            GattServerProxy gattServer,
            GattClientProxy gattClient,
            PermissionChecker permissionChecker,
            MediaSource mediaSource,
            TelephonyController telephony,
            ScheduledExecutorService executor,
            TimeProvider timeProvider) {
        mExecutor = requireNonNull(executor);
        mSessionManager =
                new GattSessionManager(gattServer, gattClient, permissionChecker, executor);
        mMediaControl = new MediaControlGattService(mSessionManager, mediaSource);
        mTbsGatt = new TbsGatt(mSessionManager, telephony);
        mReconciler = new CallStateReconciler(mTbsGatt, executor, timeProvider);

        mSessionManager.addProfile(mMediaControl);
        mSessionManager.addProfile(mTbsGatt);
    }

    public void start() {
        Log.i(TAG, "start");
        mSessionManager.start();
    }

    public void connect(RemoteDevice device) {
        mSessionManager.connect(device);
    }

    public void disconnect() {
        mSessionManager.disconnect();
    }

    public void onMediaMetadataUpdate(MediaMetadata metadata) {
        mMediaControl.updateMediaMetadata(metadata);
    }

    public void onCallStateChanged(CallMetadataUpdate update) {
        mReconciler.onCallStateChanged(update);
    }

    public void onCallerNameHint(String name) {
        mReconciler.onCallerNameHint(name);
    }

    public GattSessionManager.SessionState getState() {
        return mSessionManager.getState();
    }

    @VisibleForTesting
    GattSessionManager getSessionManager() {
        return mSessionManager;
    }

    /** Tears the session down. The session cannot be restarted afterwards. */
    @Override
    public void close() {
        Log.i(TAG, "close");
        mSessionManager.cleanup();
        mExecutor.shutdown();
    }

    public void dump(StringBuilder sb) {
        mSessionManager.dump(sb);
        mReconciler.dump(sb);
    }
}
