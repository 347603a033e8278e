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

package com.mediabridge.bluetooth.gatt;

import static java.util.Objects.requireNonNull;

import com.mediabridge.bluetooth.BridgeEventLogger;
import com.mediabridge.bluetooth.Log;
import com.mediabridge.bluetooth.util.SystemProperties;

import com.google.common.annotations.VisibleForTesting;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the GATT server and the client link to the peripheral.
 *
 * <p>Every callback and public request is posted onto one sequencing executor, so the state
 * below is only touched from that thread. Delayed work (client connect, server restart,
 * subscription checks) captures the session generation when scheduled and is dropped if the
 * session was torn down in between.
 */
public class GattSessionManager implements GattServiceHost {
    private static final String TAG = "GattSessionManager";

    static final String PROPERTY_DEVICE_NAME = "bluetooth.mediabridge.device_name";
    static final String PROPERTY_CLIENT_CONNECT_DELAY_MS =
            "bluetooth.mediabridge.client_connect_delay_ms";
    static final String PROPERTY_SERVER_RESTART_COOLDOWN_MS =
            "bluetooth.mediabridge.server_restart_cooldown_ms";
    static final String PROPERTY_MONITOR_INITIAL_DELAY_MS =
            "bluetooth.mediabridge.subscription_monitor.initial_delay_ms";
    static final String PROPERTY_MONITOR_INTERVAL_MS =
            "bluetooth.mediabridge.subscription_monitor.interval_ms";
    static final String PROPERTY_MONITOR_MAX_CHECKS =
            "bluetooth.mediabridge.subscription_monitor.max_checks";

    @VisibleForTesting static final String DEFAULT_DEVICE_NAME = "Android BLE Device";

    /** Soft barrier between opening the server and starting the client connection. */
    @VisibleForTesting static final long DEFAULT_CLIENT_CONNECT_DELAY_MS = 100;

    /**
     * Some stacks silently fail to register services on a server opened while the previous
     * instance is still being torn down. A stack without that defect can set this to zero, the
     * close then restart ordering is kept either way.
     */
    @VisibleForTesting static final long DEFAULT_SERVER_RESTART_COOLDOWN_MS = 800;

    @VisibleForTesting static final long DEFAULT_MONITOR_INITIAL_DELAY_MS = 3000;
    @VisibleForTesting static final long DEFAULT_MONITOR_INTERVAL_MS = 2000;
    @VisibleForTesting static final int DEFAULT_MONITOR_MAX_CHECKS = 10;

    public static final UUID UUID_GENERIC_ACCESS = BleGatt.fromShortUuid(0x1800);
    public static final UUID UUID_DEVICE_NAME = BleGatt.fromShortUuid(0x2A00);
    public static final UUID UUID_APPEARANCE = BleGatt.fromShortUuid(0x2A01);

    private static final byte[] APPEARANCE_GENERIC = {0x00, 0x00};
    private static final List<UUID> GENERIC_ACCESS_CHARACTERISTICS =
            List.of(UUID_DEVICE_NAME, UUID_APPEARANCE);

    public enum SessionState {
        IDLE,
        SERVER_STARTING,
        SERVER_READY,
        CLIENT_CONNECTING,
        CONNECTED,
        DISCONNECTING,
        COOLDOWN_PENDING,
    }

    private final GattServerProxy mGattServer;
    private final GattClientProxy mGattClient;
    private final PermissionChecker mPermissionChecker;
    private final ScheduledExecutorService mExecutor;
    private final ConnectedDeviceRegistry mRegistry = new ConnectedDeviceRegistry();
    private final List<ProfileGattService> mProfiles = new ArrayList<>();
    private final BridgeEventLogger mEventLogger =
            new BridgeEventLogger(50, TAG + " event log");

    private final String mDeviceName;
    private final long mClientConnectDelayMs;
    private final long mRestartCooldownMs;
    private final long mMonitorInitialDelayMs;
    private final long mMonitorIntervalMs;
    private final int mMonitorMaxChecks;

    private volatile SessionState mState = SessionState.IDLE;
    private int mGeneration;
    private boolean mServerOpen;
    private final List<BleGattService> mPendingServices = new ArrayList<>();
    private final List<BleGattService> mRegisteredServices = new ArrayList<>();
    private BleGattService mServiceInFlight;
    private RemoteDevice mTargetDevice;
    private boolean mClientActive;
    private RemoteDevice mPendingConnectDevice;
    private ScheduledFuture<?> mClientConnectFuture;
    private ScheduledFuture<?> mRestartFuture;
    private final Map<RemoteDevice, ScheduledFuture<?>> mSubscriptionMonitors = new HashMap<>();

    @VisibleForTesting final GattServerCallback mServerCallback = new ServerCallback();
    @VisibleForTesting final GattClientCallback mClientCallback = new ClientCallback();

    public GattSessionManager(
            GattServerProxy gattServer,
            GattClientProxy gattClient,
            PermissionChecker permissionChecker,
            ScheduledExecutorService executor) {
        mGattServer = requireNonNull(gattServer);
        mGattClient = requireNonNull(gattClient);
        mPermissionChecker = requireNonNull(permissionChecker);
        mExecutor = requireNonNull(executor);

        mDeviceName = SystemProperties.get(PROPERTY_DEVICE_NAME, DEFAULT_DEVICE_NAME);
        mClientConnectDelayMs =
                SystemProperties.getLong(
                        PROPERTY_CLIENT_CONNECT_DELAY_MS, DEFAULT_CLIENT_CONNECT_DELAY_MS);
        mRestartCooldownMs =
                SystemProperties.getLong(
                        PROPERTY_SERVER_RESTART_COOLDOWN_MS, DEFAULT_SERVER_RESTART_COOLDOWN_MS);
        mMonitorInitialDelayMs =
                SystemProperties.getLong(
                        PROPERTY_MONITOR_INITIAL_DELAY_MS, DEFAULT_MONITOR_INITIAL_DELAY_MS);
        mMonitorIntervalMs =
                SystemProperties.getLong(
                        PROPERTY_MONITOR_INTERVAL_MS, DEFAULT_MONITOR_INTERVAL_MS);
        mMonitorMaxChecks =
                SystemProperties.getInt(PROPERTY_MONITOR_MAX_CHECKS, DEFAULT_MONITOR_MAX_CHECKS);
    }

    /** Registers a profile. Services are added to the server in registration order. */
    public synchronized void addProfile(ProfileGattService profile) {
        requireNonNull(profile);
        if (mState != SessionState.IDLE) {
            throw new IllegalStateException("Profiles must be added before start()");
        }
        mProfiles.add(profile);
    }

    public SessionState getState() {
        return mState;
    }

    /** Opens the GATT server and registers all services. */
    public void start() {
        post(this::startServer);
    }

    /** Opens the server if needed, then connects to {@code device} as a client. */
    public void connect(RemoteDevice device) {
        requireNonNull(device);
        post(() -> handleConnect(device));
    }

    /** Drops the client link and restarts the server after the cooldown. */
    public void disconnect() {
        post(this::handleDisconnect);
    }

    /** Closes everything without restarting. */
    public void cleanup() {
        post(this::handleCleanup);
    }

    @Override
    public Set<RemoteDevice> getConnectedDevices() {
        return mRegistry.getConnectedDevices();
    }

    /**
     * Peers still waiting for their state snapshot. Empty while services are being registered.
     * Those peers get the snapshot once the last service is added.
     */
    @Override
    public Set<RemoteDevice> getRecentlyConnectedDevices() {
        if (isRegisteringServices()) {
            return Set.of();
        }
        return mRegistry.getRecentlyConnectedDevices();
    }

    private boolean isRegisteringServices() {
        return mServiceInFlight != null;
    }

    @VisibleForTesting
    ConnectedDeviceRegistry getRegistry() {
        return mRegistry;
    }

    @Override
    public boolean notifyCharacteristicChanged(
            RemoteDevice device, BleGattCharacteristic characteristic) {
        if (!mServerOpen) {
            Log.d(TAG, "notifyCharacteristicChanged: server is closed");
            return false;
        }
        if (!mPermissionChecker.hasConnectPermission()) {
            Log.w(TAG, "notifyCharacteristicChanged: missing connect permission");
            return false;
        }
        boolean ok = mGattServer.notifyCharacteristicChanged(device, characteristic, false);
        if (!ok) {
            Log.w(TAG, "Notify " + characteristic.getUuid() + " to " + device + " failed");
        }
        return ok;
    }

    @Override
    public void post(Runnable task) {
        try {
            mExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            Log.w(TAG, "Dropping task, executor is shut down", e);
        }
    }

    @Override
    public ScheduledFuture<?> postDelayed(Runnable task, long delayMillis) {
        try {
            return mExecutor.schedule(task, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            Log.w(TAG, "Dropping delayed task, executor is shut down", e);
            return null;
        }
    }

    private void setState(SessionState state) {
        if (mState != state) {
            mEventLogger.logd(TAG, "State " + mState + " -> " + state);
            mState = state;
        }
    }

    private void startServer() {
        if (mServerOpen) {
            Log.d(TAG, "startServer: already running");
            return;
        }
        if (!mPermissionChecker.hasConnectPermission()) {
            mEventLogger.logw(TAG, "startServer: missing connect permission");
            return;
        }
        setState(SessionState.SERVER_STARTING);
        if (!mGattServer.open(mServerCallback)) {
            mEventLogger.loge(TAG, "startServer: unable to open GATT server");
            setState(SessionState.IDLE);
            return;
        }
        mServerOpen = true;
        mRegisteredServices.clear();
        mPendingServices.clear();
        mPendingServices.add(createGenericAccessService());
        for (ProfileGattService profile : mProfiles) {
            mPendingServices.add(profile.createService());
        }
        addNextService();
    }

    private BleGattService createGenericAccessService() {
        BleGattService service = new BleGattService(UUID_GENERIC_ACCESS);

        BleGattCharacteristic deviceName =
                new BleGattCharacteristic(
                        UUID_DEVICE_NAME,
                        BleGattCharacteristic.PROPERTY_READ,
                        BleGattCharacteristic.PERMISSION_READ);
        deviceName.setValue(CharacteristicCodec.encodeString(mDeviceName));
        service.addCharacteristic(deviceName);

        BleGattCharacteristic appearance =
                new BleGattCharacteristic(
                        UUID_APPEARANCE,
                        BleGattCharacteristic.PROPERTY_READ,
                        BleGattCharacteristic.PERMISSION_READ);
        appearance.setValue(APPEARANCE_GENERIC);
        service.addCharacteristic(appearance);
        return service;
    }

    private void addNextService() {
        while (!mPendingServices.isEmpty()) {
            mServiceInFlight = mPendingServices.remove(0);
            if (mGattServer.addService(mServiceInFlight)) {
                Log.d(TAG, "Adding service " + mServiceInFlight.getUuid());
                return;
            }
            mEventLogger.loge(TAG, "addService rejected for " + mServiceInFlight.getUuid());
        }
        mServiceInFlight = null;
        mEventLogger.logi(TAG, "GATT server ready, services=" + mRegisteredServices.size());
        if (mState == SessionState.SERVER_STARTING) {
            setState(SessionState.SERVER_READY);
        }
        for (RemoteDevice device : mRegistry.getRecentlyConnectedDevices()) {
            sendSnapshot(device);
        }
    }

    private void handleServiceAdded(int status, BleGattService service) {
        if (!mServerOpen) {
            Log.d(TAG, "onServiceAdded after teardown, ignoring " + service.getUuid());
            return;
        }
        if (mServiceInFlight == null || !mServiceInFlight.getUuid().equals(service.getUuid())) {
            Log.w(TAG, "onServiceAdded for unexpected service " + service.getUuid());
            return;
        }

        ProfileGattService profile = findProfile(service.getUuid());
        if (status != BleGatt.GATT_SUCCESS) {
            mEventLogger.loge(
                    TAG, "Service " + service.getUuid() + " failed to register, status=" + status);
        } else {
            List<UUID> required =
                    profile == null ? GENERIC_ACCESS_CHARACTERISTICS
                            : profile.getRequiredCharacteristics();
            List<UUID> missing = findMissingCharacteristics(service, required);
            if (!missing.isEmpty()) {
                mEventLogger.loge(
                        TAG, "Service " + service.getUuid() + " is MISSING " + missing);
            }
            mRegisteredServices.add(service);
        }
        if (profile != null) {
            profile.dispatch(GattEvent.serviceRegistered(status, service));
        }
        addNextService();
    }

    @VisibleForTesting
    static List<UUID> findMissingCharacteristics(BleGattService service, List<UUID> required) {
        List<UUID> missing = new ArrayList<>();
        for (UUID uuid : required) {
            if (service.getCharacteristic(uuid) == null) {
                missing.add(uuid);
            }
        }
        return missing;
    }

    private ProfileGattService findProfile(UUID serviceUuid) {
        for (ProfileGattService profile : mProfiles) {
            if (profile.getServiceUuid().equals(serviceUuid)) {
                return profile;
            }
        }
        return null;
    }

    private void handleConnect(RemoteDevice device) {
        if (!mPermissionChecker.hasConnectPermission()) {
            mEventLogger.logw(TAG, "connect(" + device + "): missing connect permission");
            return;
        }
        switch (mState) {
            case DISCONNECTING, COOLDOWN_PENDING -> {
                mEventLogger.logd(TAG, "connect(" + device + ") deferred until server restart");
                mPendingConnectDevice = device;
                return;
            }
            case CLIENT_CONNECTING, CONNECTED -> {
                if (!device.equals(mTargetDevice)) {
                    Log.w(TAG, "connect(" + device + "): busy with " + mTargetDevice);
                }
                return;
            }
            default -> {}
        }

        startServer();
        if (!mServerOpen) {
            mEventLogger.loge(TAG, "connect(" + device + "): no GATT server");
            return;
        }
        mTargetDevice = device;
        setState(SessionState.CLIENT_CONNECTING);
        final int generation = mGeneration;
        mClientConnectFuture =
                postDelayed(() -> connectClient(device, generation), mClientConnectDelayMs);
    }

    private void connectClient(RemoteDevice device, int generation) {
        if (generation != mGeneration || mState != SessionState.CLIENT_CONNECTING) {
            Log.d(TAG, "connectClient(" + device + "): stale request dropped");
            return;
        }
        mClientConnectFuture = null;
        if (!mGattClient.connect(device, mClientCallback)) {
            mEventLogger.loge(TAG, "connectClient(" + device + "): connect rejected");
            mTargetDevice = null;
            setState(SessionState.SERVER_READY);
            return;
        }
        mClientActive = true;
        mEventLogger.logd(TAG, "Client connecting to " + device);
    }

    private void handleClientConnectionStateChange(RemoteDevice device, int status, int state) {
        if (!device.equals(mTargetDevice) || !mClientActive) {
            Log.d(TAG, "Client state change for inactive link " + device + ", ignoring");
            return;
        }
        mEventLogger.logd(
                TAG,
                "Client "
                        + device
                        + " "
                        + BleGatt.connectionStateToString(state)
                        + " status="
                        + status);
        if (state == BleGatt.STATE_CONNECTED) {
            setState(SessionState.CONNECTED);
            int bondState = mGattClient.getBondState(device);
            if (bondState == BleGatt.BOND_NONE) {
                mEventLogger.logd(TAG, "Requesting bond with " + device);
                if (!mGattClient.createBond(device)) {
                    Log.w(TAG, "createBond(" + device + ") was not started");
                }
            }
            if (!mGattClient.discoverServices()) {
                Log.w(TAG, "Service discovery on " + device + " was not started");
            }
        } else if (state == BleGatt.STATE_DISCONNECTED) {
            tearDownAndRestart();
        }
    }

    private void handleDisconnect() {
        mPendingConnectDevice = null;
        switch (mState) {
            case IDLE, DISCONNECTING, COOLDOWN_PENDING -> {
                Log.d(TAG, "disconnect: nothing to do in " + mState);
                return;
            }
            default -> {}
        }
        if (mClientActive) {
            mGattClient.disconnect();
        }
        tearDownAndRestart();
    }

    private void handleCleanup() {
        mPendingConnectDevice = null;
        if (mClientActive) {
            mGattClient.disconnect();
        }
        tearDown();
        setState(SessionState.IDLE);
    }

    private void tearDownAndRestart() {
        setState(SessionState.DISCONNECTING);
        tearDown();
        setState(SessionState.COOLDOWN_PENDING);
        final int generation = mGeneration;
        mRestartFuture = postDelayed(() -> restartServer(generation), mRestartCooldownMs);
    }

    private void tearDown() {
        mGeneration++;
        cancel(mClientConnectFuture);
        mClientConnectFuture = null;
        cancel(mRestartFuture);
        mRestartFuture = null;
        for (ScheduledFuture<?> monitor : mSubscriptionMonitors.values()) {
            cancel(monitor);
        }
        mSubscriptionMonitors.clear();

        if (mClientActive) {
            mGattClient.close();
            mClientActive = false;
        }
        mTargetDevice = null;

        for (RemoteDevice device : mRegistry.getConnectedDevices()) {
            dispatchToProfiles(GattEvent.deviceDisconnected(device));
        }
        mRegistry.clear();

        if (mServerOpen) {
            mGattServer.clearServices();
            mGattServer.close();
            mServerOpen = false;
            mEventLogger.logd(TAG, "GATT server closed");
        }
        mPendingServices.clear();
        mRegisteredServices.clear();
        mServiceInFlight = null;
    }

    private void restartServer(int generation) {
        if (generation != mGeneration) {
            Log.d(TAG, "restartServer: stale request dropped");
            return;
        }
        mRestartFuture = null;
        setState(SessionState.IDLE);
        startServer();
        RemoteDevice pending = mPendingConnectDevice;
        mPendingConnectDevice = null;
        if (pending != null) {
            handleConnect(pending);
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private void handleServerConnectionStateChange(RemoteDevice device, int status, int state) {
        if (!mServerOpen) {
            Log.d(TAG, "Server connection change after teardown, ignoring " + device);
            return;
        }
        if (state == BleGatt.STATE_CONNECTED) {
            if (!mRegistry.addDevice(device)) {
                Log.d(TAG, device + " already connected to the server");
                return;
            }
            mEventLogger.logi(TAG, "Peer " + device + " connected to GATT server");
            startSubscriptionMonitor(device);
            post(() -> sendSnapshot(device));
        } else if (state == BleGatt.STATE_DISCONNECTED) {
            if (!mRegistry.removeDevice(device)) {
                return;
            }
            mEventLogger.logi(TAG, "Peer " + device + " disconnected, status=" + status);
            cancel(mSubscriptionMonitors.remove(device));
            dispatchToProfiles(GattEvent.deviceDisconnected(device));
        }
    }

    private void sendSnapshot(RemoteDevice device) {
        if (!mRegistry.isRecentlyConnected(device)) {
            Log.d(TAG, "Snapshot for " + device + " cancelled");
            return;
        }
        if (isRegisteringServices()) {
            mEventLogger.logd(TAG, "Snapshot for " + device + " held until services are added");
            return;
        }
        dispatchToProfiles(GattEvent.deviceConnected(device));
        mRegistry.markSnapshotDelivered(device);
        mEventLogger.logd(TAG, "Snapshot delivered to " + device);
    }

    private void dispatchToProfiles(GattEvent event) {
        for (ProfileGattService profile : mProfiles) {
            profile.dispatch(event);
        }
    }

    private void startSubscriptionMonitor(RemoteDevice device) {
        cancel(mSubscriptionMonitors.remove(device));
        scheduleSubscriptionCheck(device, 1, mGeneration, mMonitorInitialDelayMs);
    }

    private void scheduleSubscriptionCheck(
            RemoteDevice device, int check, int generation, long delayMs) {
        ScheduledFuture<?> future =
                postDelayed(() -> checkSubscriptions(device, check, generation), delayMs);
        if (future != null) {
            mSubscriptionMonitors.put(device, future);
        }
    }

    private void checkSubscriptions(RemoteDevice device, int check, int generation) {
        if (generation != mGeneration || !mRegistry.isConnected(device)) {
            return;
        }
        mSubscriptionMonitors.remove(device);

        List<UUID> missing = new ArrayList<>();
        int notifiable = 0;
        Set<UUID> subscribed = mRegistry.getSubscriptions(device);
        for (BleGattService service : mRegisteredServices) {
            for (BleGattCharacteristic characteristic : service.getCharacteristics()) {
                if (!characteristic.isNotifiable()) {
                    continue;
                }
                notifiable++;
                if (!subscribed.contains(characteristic.getUuid())) {
                    missing.add(characteristic.getUuid());
                }
            }
        }

        if (missing.isEmpty()) {
            mEventLogger.logi(
                    TAG, device + " subscribed to all " + notifiable + " characteristics");
            return;
        }
        Log.d(
                TAG,
                "Subscription check "
                        + check
                        + "/"
                        + mMonitorMaxChecks
                        + ": "
                        + device
                        + " subscribed to "
                        + (notifiable - missing.size())
                        + "/"
                        + notifiable);
        if (check >= mMonitorMaxChecks) {
            mEventLogger.logw(TAG, device + " never subscribed to " + missing);
            return;
        }
        scheduleSubscriptionCheck(device, check + 1, generation, mMonitorIntervalMs);
    }

    private ProfileGattService findOwner(BleGattCharacteristic characteristic) {
        BleGattService service = characteristic.getService();
        return service == null ? null : findProfile(service.getUuid());
    }

    private void handleCharacteristicWrite(
            RemoteDevice device,
            int requestId,
            BleGattCharacteristic characteristic,
            boolean preparedWrite,
            boolean responseNeeded,
            int offset,
            byte[] value) {
        ProfileGattService owner = findOwner(characteristic);
        int status;
        if (owner == null) {
            status = BleGatt.GATT_REQUEST_NOT_SUPPORTED;
        } else if (!characteristic.isWritable()) {
            status = BleGatt.GATT_WRITE_NOT_PERMITTED;
        } else if (preparedWrite) {
            status = BleGatt.GATT_REQUEST_NOT_SUPPORTED;
        } else if (offset != 0) {
            status = BleGatt.GATT_INVALID_OFFSET;
        } else {
            status = BleGatt.GATT_SUCCESS;
        }

        if (responseNeeded) {
            mGattServer.sendResponse(device, requestId, status, offset, value);
        }
        if (status != BleGatt.GATT_SUCCESS) {
            Log.w(
                    TAG,
                    "Write to " + characteristic.getUuid() + " from " + device
                            + " rejected, status=" + status);
            return;
        }
        owner.dispatch(GattEvent.characteristicWritten(device, characteristic, value));
    }

    private void handleCharacteristicRead(
            RemoteDevice device, int requestId, int offset, BleGattCharacteristic characteristic) {
        byte[] value = characteristic.getValue();
        if (offset > value.length) {
            mGattServer.sendResponse(device, requestId, BleGatt.GATT_INVALID_OFFSET, offset, null);
            return;
        }
        mGattServer.sendResponse(
                device,
                requestId,
                BleGatt.GATT_SUCCESS,
                offset,
                Arrays.copyOfRange(value, offset, value.length));
    }

    private void handleDescriptorWrite(
            RemoteDevice device,
            int requestId,
            BleGattDescriptor descriptor,
            boolean responseNeeded,
            int offset,
            byte[] value) {
        int status;
        if (!BleGatt.UUID_CLIENT_CHARACTERISTIC_CONFIGURATION.equals(descriptor.getUuid())) {
            status = BleGatt.GATT_WRITE_NOT_PERMITTED;
        } else if (value == null || value.length != 2) {
            status = BleGatt.GATT_INVALID_ATTRIBUTE_LENGTH;
        } else {
            boolean enabled = !Arrays.equals(value, BleGattDescriptor.DISABLE_NOTIFICATION_VALUE);
            UUID characteristic = descriptor.getCharacteristic().getUuid();
            mRegistry.setSubscribed(device, characteristic, enabled);
            Log.d(
                    TAG,
                    device + (enabled ? " subscribed to " : " unsubscribed from ")
                            + characteristic);
            status = BleGatt.GATT_SUCCESS;
        }
        if (responseNeeded) {
            mGattServer.sendResponse(device, requestId, status, offset, value);
        }
    }

    private void handleDescriptorRead(
            RemoteDevice device, int requestId, int offset, BleGattDescriptor descriptor) {
        byte[] value;
        if (BleGatt.UUID_CLIENT_CHARACTERISTIC_CONFIGURATION.equals(descriptor.getUuid())) {
            boolean subscribed =
                    mRegistry.isSubscribed(device, descriptor.getCharacteristic().getUuid());
            value =
                    subscribed
                            ? BleGattDescriptor.ENABLE_NOTIFICATION_VALUE
                            : BleGattDescriptor.DISABLE_NOTIFICATION_VALUE;
        } else {
            value = descriptor.getValue();
        }
        mGattServer.sendResponse(device, requestId, BleGatt.GATT_SUCCESS, offset, value);
    }

    public void dump(StringBuilder sb) {
        sb.append(TAG).append(":\n");
        sb.append("  State: ").append(mState).append("\n");
        sb.append("  Server open: ").append(mServerOpen).append("\n");
        sb.append("  Client peer: ").append(mTargetDevice).append("\n");
        mRegistry.dump(sb);
        mEventLogger.dump(sb);
        for (ProfileGattService profile : mProfiles) {
            profile.dump(sb);
        }
    }

    private class ServerCallback extends GattServerCallback {
        @Override
        public void onConnectionStateChange(RemoteDevice device, int status, int newState) {
            post(() -> handleServerConnectionStateChange(device, status, newState));
        }

        @Override
        public void onServiceAdded(int status, BleGattService service) {
            post(() -> handleServiceAdded(status, service));
        }

        @Override
        public void onCharacteristicReadRequest(
                RemoteDevice device,
                int requestId,
                int offset,
                BleGattCharacteristic characteristic) {
            post(() -> handleCharacteristicRead(device, requestId, offset, characteristic));
        }

        @Override
        public void onCharacteristicWriteRequest(
                RemoteDevice device,
                int requestId,
                BleGattCharacteristic characteristic,
                boolean preparedWrite,
                boolean responseNeeded,
                int offset,
                byte[] value) {
            post(
                    () ->
                            handleCharacteristicWrite(
                                    device,
                                    requestId,
                                    characteristic,
                                    preparedWrite,
                                    responseNeeded,
                                    offset,
                                    value));
        }

        @Override
        public void onDescriptorReadRequest(
                RemoteDevice device, int requestId, int offset, BleGattDescriptor descriptor) {
            post(() -> handleDescriptorRead(device, requestId, offset, descriptor));
        }

        @Override
        public void onDescriptorWriteRequest(
                RemoteDevice device,
                int requestId,
                BleGattDescriptor descriptor,
                boolean preparedWrite,
                boolean responseNeeded,
                int offset,
                byte[] value) {
            post(
                    () ->
                            handleDescriptorWrite(
                                    device, requestId, descriptor, responseNeeded, offset, value));
        }

        @Override
        public void onNotificationSent(RemoteDevice device, int status) {
            if (status != BleGatt.GATT_SUCCESS) {
                Log.w(TAG, "Notification to " + device + " failed, status=" + status);
            }
        }
    }

    private class ClientCallback extends GattClientCallback {
        @Override
        public void onConnectionStateChange(RemoteDevice device, int status, int newState) {
            post(() -> handleClientConnectionStateChange(device, status, newState));
        }

        @Override
        public void onServicesDiscovered(RemoteDevice device, int status) {
            post(() -> mEventLogger.logd(
                    TAG, "Services discovered on " + device + ", status=" + status));
        }
    }
}
