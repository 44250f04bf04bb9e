package com.findmydevice.service;

import com.findmydevice.dao.Storage;
import com.findmydevice.metrics.Metrics;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

/**
 * Server-issued single-use nonces.
 *
 * <p>A nonce is {@code key + "." + hex(md5(key + "." + val))} where {@code (key, val)} is stored.
 * The MD5 suffix is an integrity checksum over the stored pair and detects a corrupted or
 * mangled nonce. It is not a security boundary: the unguessable stored value and the
 * delete-on-read lookup are what make a nonce single-use. The format is part of the wire
 * contract, so the digest must stay MD5.
 */
@Component
public final class NonceService {
    private static final Logger logger = LoggerFactory.getLogger(NonceService.class);

    public static final Duration NONCE_TTL = Duration.ofMinutes(5);

    private final Storage storage;
    private final IdGenerator idGenerator;
    private final Metrics metrics;
    private final Clock clock;

    public NonceService(Storage storage, IdGenerator idGenerator, Metrics metrics, Clock clock) {
        this.storage = storage;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    public String issue() {
        String key = idGenerator.generateId();
        String val = idGenerator.generateId();
        storage.insertNonce(key, val, clock.instant());
        metrics.increment("nonce.issued");
        return key + "." + signature(key, val);
    }

    /**
     * Validates a nonce and consumes it. The stored row is removed on lookup whether or not the
     * checksum matches, so a second call with the same value always returns false.
     *
     * @return false for malformed, unknown, expired, consumed or tampered nonces
     * @throws ApiException of kind {@code STORAGE} or {@code STORAGE_TIMEOUT} when the store fails
     */
    public boolean verifyAndConsume(String nonce) {
        Instant cutoff = clock.instant().minus(NONCE_TTL);
        storage.purgeNoncesIssuedBefore(cutoff);

        int dot = nonce == null ? -1 : nonce.indexOf('.');
        if (dot < 0) {
            logger.warn("Invalid nonce {}", nonce);
            metrics.increment("nonce.rejected");
            return false;
        }
        String key = nonce.substring(0, dot);
        String claimed = nonce.substring(dot + 1);

        Optional<String> val = storage.takeNonce(key);
        if (val.isEmpty()) {
            metrics.increment("nonce.rejected");
            return false;
        }
        boolean valid = MessageDigest.isEqual(
            signature(key, val.get()).getBytes(StandardCharsets.US_ASCII),
            claimed.getBytes(StandardCharsets.US_ASCII)
        );
        if (!valid) {
            logger.warn("Nonce checksum mismatch for {}", key);
            metrics.increment("nonce.rejected");
        }
        return valid;
    }

    static String signature(String key, String val) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5")
                .digest((key + "." + val).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot calculate nonce signature", e);
        }
    }
}
