package com.findmydevice.security;

import com.findmydevice.config.AppConfig;
import com.findmydevice.service.ApiException;
import com.findmydevice.service.IdGenerator;
import jakarta.annotation.Nullable;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;

/**
 * Hawk request signing and verification (header scheme only, HMAC-SHA256).
 *
 * <p>Verification covers the MAC alone. Nonce single-use is enforced separately by the caller.
 */
@Component
public final class HawkAuthenticator {
    private static final Logger logger = LoggerFactory.getLogger(HawkAuthenticator.class);
    private static final int NONCE_BYTES = 6;

    /** Resolves the shared secret of a device; throws {@code UNKNOWN_DEVICE} when there is none. */
    @FunctionalInterface
    public interface SecretLookup {
        String secretFor(String deviceId);
    }

    private final HmacService hmacService;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final boolean overridePort;
    private final boolean showHash;

    public HawkAuthenticator(AppConfig appConfig, HmacService hmacService, IdGenerator idGenerator, Clock clock) {
        this.hmacService = hmacService;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.overridePort = appConfig.hawk().overridePort();
        this.showHash = appConfig.hawk().showHash();
    }

    /** Builds the artifacts of an outbound request, generating the timestamp and nonce when not given. */
    public HawkArtifacts artifacts(HawkRequest request,
                                   @Nullable String body,
                                   @Nullable String ext,
                                   @Nullable String ts,
                                   @Nullable String nonce) {
        return buildArtifacts(
            request,
            body,
            ext,
            ts == null || ts.isEmpty() ? Long.toString(clock.instant().getEpochSecond()) : ts,
            nonce == null || nonce.isEmpty() ? idGenerator.randomBase64(NONCE_BYTES) : nonce
        );
    }

    public String mac(HawkArtifacts artifacts, String secret) {
        String marshal = HawkCanonicalizer.headerString(artifacts);
        if (showHash) {
            logger.debug("Header string {}", marshal);
        }
        return hmacService.signBase64(marshal, secret);
    }

    public String sign(HawkRequest request, String id, @Nullable String body, @Nullable String ext, String secret) {
        return sign(request, id, body, ext, secret, null, null);
    }

    /** Returns the value of the Authorization header for an outbound request. */
    public String sign(HawkRequest request,
                       String id,
                       @Nullable String body,
                       @Nullable String ext,
                       String secret,
                       @Nullable String ts,
                       @Nullable String nonce) {
        HawkArtifacts artifacts = artifacts(request, body, ext, ts, nonce);
        return new HawkHeader(
            id,
            artifacts.ts(),
            artifacts.nonce(),
            artifacts.ext(),
            artifacts.hash(),
            mac(artifacts, secret)
        ).render();
    }

    /**
     * Checks the Authorization header of an inbound request. Host, port and path come from the
     * request itself and the payload hash is recomputed from the received body.
     *
     * @return the parsed header of a request whose MAC matches
     * @throws ApiException {@code NOT_HAWK_AUTH} when id, ts, nonce or mac is missing,
     *                      {@code INVALID_SIGNATURE} when the hash or MAC does not match
     */
    public HawkHeader verify(HawkRequest request, @Nullable String body, SecretLookup secrets) {
        HawkHeader header = HawkHeader.parse(request.authorization());
        if (header.id().isEmpty() || header.ts().isEmpty() || header.nonce().isEmpty() || header.mac().isEmpty()) {
            logger.warn("Hawk header without id, ts, nonce or mac: {}", header.id());
            throw ApiException.notHawkAuth();
        }
        String secret = secrets.secretFor(header.id());

        HawkArtifacts artifacts = buildArtifacts(request, body, header.ext(), header.ts(), header.nonce());
        if (!header.hash().isEmpty() && !hmacService.matches(artifacts.hash(), header.hash())) {
            logger.warn("Payload hash of device {} does not match body", header.id());
            throw ApiException.invalidSignature(header.id());
        }
        if (!hmacService.matches(mac(artifacts, secret), header.mac())) {
            logger.warn("Header of device {} does not match signature", header.id());
            throw ApiException.invalidSignature(header.id());
        }
        return header;
    }

    private HawkArtifacts buildArtifacts(HawkRequest request,
                                         @Nullable String body,
                                         @Nullable String ext,
                                         String ts,
                                         String nonce) {
        var hostPort = HawkCanonicalizer.hostAndPort(request, overridePort);
        String hash = HawkCanonicalizer.payloadHash(request.contentType(), body);
        if (showHash) {
            logger.debug("Payload string {} hashed to {}", HawkCanonicalizer.payloadString(request.contentType(), body), hash);
        }
        return new HawkArtifacts(
            ts,
            nonce,
            request.method(),
            request.path(),
            hostPort.host(),
            hostPort.port(),
            hash,
            ext == null ? "" : ext
        );
    }
}
