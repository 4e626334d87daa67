package com.lightwatch.service;

import com.lightwatch.config.AppConfig;
import com.lightwatch.dao.DeviceStore;
import com.lightwatch.domain.ChannelApi;
import com.lightwatch.domain.Device;
import com.lightwatch.security.SecretCryptoService;
import com.lightwatch.security.SecretHashService;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

@Component
public final class DeviceManagementService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceManagementService.class);
    private static final Pattern IMPORTED_KEY = Pattern.compile("^[\\x21-\\x7E]{8,128}$");

    private final DeviceStore deviceStore;
    private final DeviceLocks deviceLocks;
    private final RandomSecretService randomSecretService;
    private final SecretHashService secretHashService;
    private final SecretCryptoService secretCryptoService;
    private final AppConfig appConfig;

    public DeviceManagementService(DeviceStore deviceStore,
                                   DeviceLocks deviceLocks,
                                   RandomSecretService randomSecretService,
                                   SecretHashService secretHashService,
                                   SecretCryptoService secretCryptoService,
                                   AppConfig appConfig) {
        this.deviceStore = deviceStore;
        this.deviceLocks = deviceLocks;
        this.randomSecretService = randomSecretService;
        this.secretHashService = secretHashService;
        this.secretCryptoService = secretCryptoService;
        this.appConfig = appConfig;
    }

    public ChannelApi.ChannelKeyResponse createDevice(long deviceId, long ownerRef) {
        return register(deviceId, ownerRef, randomSecretService.generateChannelKey());
    }

    public ChannelApi.ChannelKeyResponse importDevice(long deviceId, long ownerRef, String channelKey) {
        return register(deviceId, ownerRef, normalizeImportedKey(channelKey));
    }

    public ChannelApi.ChannelKeyResponse getKey(long deviceId) {
        Device device = requireDevice(deviceId);
        return keyResponse(deviceId, secretCryptoService.decrypt(device.encryptedSecret()));
    }

    public ChannelApi.ChannelKeyResponse rotateKey(long deviceId) {
        return changeKey(deviceId, randomSecretService.generateChannelKey());
    }

    public ChannelApi.ChannelKeyResponse replaceKey(long deviceId, String channelKey) {
        return changeKey(deviceId, normalizeImportedKey(channelKey));
    }

    public void setTimezone(long deviceId, String timezone) {
        String zone = normalizeTimezone(timezone);
        deviceLocks.withLock(deviceId, () -> {
            requireDevice(deviceId);
            deviceStore.updateTimezone(deviceId, zone);
            return null;
        });
        logger.info("Channel {} timezone set to {}", deviceId, zone);
    }

    public void setPaused(long deviceId, boolean paused) {
        deviceLocks.withLock(deviceId, () -> {
            requireDevice(deviceId);
            deviceStore.updatePaused(deviceId, paused);
            return null;
        });
        logger.info("Channel {} {}", deviceId, paused ? "paused" : "resumed");
    }

    public void transferOwner(long deviceId, long newOwnerRef) {
        deviceLocks.withLock(deviceId, () -> {
            requireDevice(deviceId);
            deviceStore.updateOwner(deviceId, newOwnerRef);
            return null;
        });
        logger.info("Channel {} transferred to owner {}", deviceId, newOwnerRef);
    }

    public void deleteDevice(long deviceId) {
        boolean deleted = deviceLocks.withLock(deviceId, () -> deviceStore.delete(deviceId));
        if (!deleted) {
            throw ApiException.deviceNotFound();
        }
        deviceLocks.forget(deviceId);
        logger.info("Channel {} deleted with its history", deviceId);
    }

    private ChannelApi.ChannelKeyResponse register(long deviceId, long ownerRef, String channelKey) {
        String secretHash = secretHashService.sha256Hex(channelKey);
        deviceLocks.withLock(deviceId, () -> {
            if (deviceStore.exists(deviceId)) {
                throw ApiException.conflict("device_exists");
            }
            if (deviceStore.secretHashInUse(secretHash)) {
                throw ApiException.conflict("key_in_use");
            }
            deviceStore.insert(new DeviceStore.NewDevice(
                deviceId,
                ownerRef,
                secretHash,
                secretCryptoService.encrypt(channelKey),
                appConfig.monitor().defaultTimezone()
            ));
            return null;
        });
        logger.info("Channel {} registered for owner {}", deviceId, ownerRef);
        return keyResponse(deviceId, channelKey);
    }

    private ChannelApi.ChannelKeyResponse changeKey(long deviceId, String channelKey) {
        String secretHash = secretHashService.sha256Hex(channelKey);
        deviceLocks.withLock(deviceId, () -> {
            Device device = requireDevice(deviceId);
            if (!secretHash.equals(device.secretHash()) && deviceStore.secretHashInUse(secretHash)) {
                throw ApiException.conflict("key_in_use");
            }
            deviceStore.updateSecret(deviceId, secretHash, secretCryptoService.encrypt(channelKey));
            return null;
        });
        logger.info("Channel {} key replaced, previous key revoked", deviceId);
        return keyResponse(deviceId, channelKey);
    }

    private Device requireDevice(long deviceId) {
        return deviceStore.findById(deviceId).orElseThrow(ApiException::deviceNotFound);
    }

    private ChannelApi.ChannelKeyResponse keyResponse(long deviceId, String channelKey) {
        String base = appConfig.publicBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String pingUrl = base + "/channelPing?channel_key=" + URLEncoder.encode(channelKey, StandardCharsets.UTF_8);
        return new ChannelApi.ChannelKeyResponse(deviceId, channelKey, pingUrl);
    }

    private static String normalizeImportedKey(String value) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest("secret_key_required");
        }
        String key = value.trim();
        if (!IMPORTED_KEY.matcher(key).matches()) {
            throw ApiException.badRequest("secret_key_invalid");
        }
        return key;
    }

    private static String normalizeTimezone(String value) {
        if (value == null || value.isBlank()) {
            throw ApiException.badRequest("timezone_required");
        }
        String zone = value.trim();
        if (!ZoneId.getAvailableZoneIds().contains(zone)) {
            throw ApiException.badRequest("invalid_timezone");
        }
        return zone;
    }
}
