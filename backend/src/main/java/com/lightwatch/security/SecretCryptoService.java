package com.lightwatch.security;

import com.lightwatch.config.AppConfig;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import ru.tinkoff.kora.common.Component;

@Component
public final class SecretCryptoService {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_BITS = 128;
    private static final int IV_SIZE = 12;

    private final SecretKeySpec key;
    private final SecureRandom secureRandom = new SecureRandom();

    public SecretCryptoService(AppConfig appConfig) {
        byte[] keyBytes = Base64.getDecoder().decode(appConfig.security().encryptionKey());
        if (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32) {
            throw new IllegalStateException("DEVICE_SECRET_ENCRYPTION_KEY must decode to 16/24/32 bytes");
        }
        this.key = new SecretKeySpec(keyBytes, "AES");
    }

    public byte[] encrypt(String channelKey) {
        try {
            byte[] iv = new byte[IV_SIZE];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] encrypted = cipher.doFinal(channelKey.getBytes(StandardCharsets.UTF_8));

            return ByteBuffer.allocate(iv.length + encrypted.length)
                .put(iv)
                .put(encrypted)
                .array();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot encrypt channel key", e);
        }
    }

    public String decrypt(byte[] payload) {
        if (payload == null || payload.length <= IV_SIZE) {
            throw new IllegalStateException("Encrypted channel key is truncated");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, payload, 0, IV_SIZE));
            byte[] decrypted = cipher.doFinal(payload, IV_SIZE, payload.length - IV_SIZE);
            return new String(decrypted, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot decrypt channel key", e);
        }
    }
}
