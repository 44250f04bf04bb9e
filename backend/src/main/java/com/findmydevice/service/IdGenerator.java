package com.findmydevice.service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;
import ru.tinkoff.kora.common.Component;

@Component
public final class IdGenerator {
    private final SecureRandom random = new SecureRandom();

    public String generateId() {
        return UUID.randomUUID().toString();
    }

    public byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    public String randomBase64(int length) {
        return Base64.getEncoder().encodeToString(randomBytes(length));
    }

    public String generateSecret() {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(32));
    }
}
