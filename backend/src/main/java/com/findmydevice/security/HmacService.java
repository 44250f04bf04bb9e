package com.findmydevice.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import ru.tinkoff.kora.common.Component;

@Component
public final class HmacService {
    private static final String HMAC_SHA256 = "HmacSHA256";

    public String signBase64(String data, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            byte[] raw = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(raw);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot calculate hmac", e);
        }
    }

    /** Base64 MACs compare equal when they differ only in trailing '=' padding. */
    public boolean matches(String expected, String provided) {
        if (provided == null || provided.isBlank()) {
            return false;
        }
        byte[] a = stripPadding(expected).getBytes(StandardCharsets.US_ASCII);
        byte[] b = stripPadding(provided.trim()).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(a, b);
    }

    private static String stripPadding(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '=') {
            end--;
        }
        return value.substring(0, end);
    }
}
