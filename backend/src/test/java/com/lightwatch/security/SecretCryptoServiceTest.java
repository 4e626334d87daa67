package com.lightwatch.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lightwatch.TestAppConfig;
import org.junit.jupiter.api.Test;

class SecretCryptoServiceTest {

    @Test
    void encryptDecryptRoundTrip() {
        SecretCryptoService cryptoService = new SecretCryptoService(new TestAppConfig());

        String original = "channel-key-value";
        byte[] encrypted = cryptoService.encrypt(original);
        String decrypted = cryptoService.decrypt(encrypted);

        assertThat(decrypted).isEqualTo(original);
        assertThat(encrypted).isNotEmpty();
        assertThat(cryptoService.encrypt(original)).isNotEqualTo(encrypted);
    }

    @Test
    void tamperedPayloadIsRejected() {
        SecretCryptoService cryptoService = new SecretCryptoService(new TestAppConfig());
        byte[] encrypted = cryptoService.encrypt("channel-key-value");
        encrypted[encrypted.length - 1] ^= 1;

        assertThatThrownBy(() -> cryptoService.decrypt(encrypted)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> cryptoService.decrypt(new byte[4])).hasMessageContaining("truncated");
    }
}
