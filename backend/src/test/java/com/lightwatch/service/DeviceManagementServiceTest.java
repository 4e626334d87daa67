package com.lightwatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lightwatch.TestAppConfig;
import com.lightwatch.dao.InMemoryDeviceStore;
import com.lightwatch.domain.ChannelApi;
import com.lightwatch.domain.Device;
import com.lightwatch.domain.PowerState;
import com.lightwatch.security.SecretCryptoService;
import com.lightwatch.security.SecretHashService;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DeviceManagementServiceTest {
    private final TestAppConfig config = new TestAppConfig();
    private final InMemoryDeviceStore store = new InMemoryDeviceStore();
    private final SecretHashService hashes = new SecretHashService();
    private final SecretCryptoService crypto = new SecretCryptoService(config);
    private final DeviceLocks locks = new DeviceLocks();
    private final DeviceManagementService service = new DeviceManagementService(
        store, locks, new RandomSecretService(), hashes, crypto, config
    );

    @Test
    void createdChannelStartsUnknownWithRecoverableKey() {
        ChannelApi.ChannelKeyResponse created = service.createDevice(-1001, 42);

        Device device = store.get(-1001);
        assertThat(device.state()).isEqualTo(PowerState.UNKNOWN);
        assertThat(device.ownerRef()).isEqualTo(42L);
        assertThat(device.timezone()).isEqualTo("Europe/Kiev");
        assertThat(device.secretHash()).isEqualTo(hashes.sha256Hex(created.secretKey()));
        assertThat(created.secretKey()).hasSize(43);
        assertThat(created.pingUrl()).isEqualTo(
            "https://light.example.org/channelPing?channel_key=" + created.secretKey());
        assertThat(service.getKey(-1001).secretKey()).isEqualTo(created.secretKey());
    }

    @Test
    void duplicateChannelIsRejected() {
        service.createDevice(5, 1);

        assertThatThrownBy(() -> service.createDevice(5, 2))
            .isInstanceOf(ApiException.class)
            .hasMessageContaining("device_exists");
    }

    @Test
    void importedKeyMustBeUniqueAndPrintable() {
        service.importDevice(5, 1, "existing-key-123");

        assertThatThrownBy(() -> service.importDevice(6, 1, "existing-key-123"))
            .hasMessageContaining("key_in_use");
        assertThatThrownBy(() -> service.importDevice(6, 1, "short"))
            .hasMessageContaining("secret_key_invalid");
        assertThatThrownBy(() -> service.importDevice(6, 1, "has space inside"))
            .hasMessageContaining("secret_key_invalid");
        assertThatThrownBy(() -> service.importDevice(6, 1, " "))
            .hasMessageContaining("secret_key_required");
    }

    @Test
    void rotatedKeyRevokesThePreviousOne() {
        String oldKey = service.createDevice(5, 1).secretKey();

        String newKey = service.rotateKey(5).secretKey();

        assertThat(newKey).isNotEqualTo(oldKey);
        assertThat(store.findBySecretHash(hashes.sha256Hex(oldKey))).isEmpty();
        assertThat(store.findBySecretHash(hashes.sha256Hex(newKey))).isPresent();
        assertThat(service.getKey(5).secretKey()).isEqualTo(newKey);
    }

    @Test
    void replacedKeyIsUrlEncodedInPingUrl() {
        service.createDevice(5, 1);

        ChannelApi.ChannelKeyResponse replaced = service.replaceKey(5, "key&with=chars");

        assertThat(replaced.pingUrl()).endsWith("channel_key=key%26with%3Dchars");
    }

    @Test
    void replacingWithTheCurrentKeyIsAccepted() {
        service.importDevice(5, 1, "current-key-123");

        ChannelApi.ChannelKeyResponse replaced = service.replaceKey(5, "current-key-123");

        assertThat(replaced.secretKey()).isEqualTo("current-key-123");
        assertThat(store.get(5).secretHash()).isEqualTo(hashes.sha256Hex("current-key-123"));
        assertThat(service.getKey(5).secretKey()).isEqualTo("current-key-123");
    }

    @Test
    void replacingWithAnotherChannelsKeyConflicts() {
        service.importDevice(5, 1, "first-key-123");
        service.importDevice(6, 1, "second-key-456");

        assertThatThrownBy(() -> service.replaceKey(5, "second-key-456"))
            .isInstanceOf(ApiException.class)
            .hasMessageContaining("key_in_use");
    }

    @Test
    void timezoneIsValidated() {
        service.createDevice(5, 1);

        service.setTimezone(5, " Europe/Warsaw ");
        assertThat(store.get(5).timezone()).isEqualTo("Europe/Warsaw");

        assertThatThrownBy(() -> service.setTimezone(5, "Mars/Olympus"))
            .hasMessageContaining("invalid_timezone");
        assertThatThrownBy(() -> service.setTimezone(5, ""))
            .hasMessageContaining("timezone_required");
    }

    @Test
    void pauseTransferAndDelete() {
        service.createDevice(5, 1);
        store.log(5, PowerState.ON, Instant.parse("2024-06-15T07:00:00Z"));

        service.setPaused(5, true);
        service.transferOwner(5, 77);
        assertThat(store.get(5).paused()).isTrue();
        assertThat(store.get(5).ownerRef()).isEqualTo(77L);

        service.deleteDevice(5);
        assertThat(store.exists(5)).isFalse();
        assertThat(store.all(5)).isEmpty();
        assertThat(locks.size()).isZero();
    }

    @Test
    void operationsOnMissingChannelFail() {
        assertThatThrownBy(() -> service.rotateKey(404))
            .isInstanceOf(ApiException.class)
            .extracting(e -> ((ApiException) e).status())
            .isEqualTo(404);
        assertThatThrownBy(() -> service.setPaused(404, true)).hasMessageContaining("device_not_found");
        assertThatThrownBy(() -> service.deleteDevice(404)).hasMessageContaining("device_not_found");
    }
}
