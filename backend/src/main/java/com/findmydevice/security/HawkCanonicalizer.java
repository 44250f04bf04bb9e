package com.findmydevice.security;

import jakarta.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;

public final class HawkCanonicalizer {
    static final String HEADER_PREFIX = "hawk.1.header";
    static final String PAYLOAD_PREFIX = "hawk.1.payload";
    static final String DEFAULT_CONTENT_TYPE = "text/plain";

    public record HostPort(String host, String port) {}

    private HawkCanonicalizer() {
    }

    /** Content type is cut at the first ';' because proxies append a charset the client never signed. */
    public static String payloadString(@Nullable String contentType, @Nullable String body) {
        String type = contentType == null || contentType.isEmpty() ? DEFAULT_CONTENT_TYPE : contentType;
        int semicolon = type.indexOf(';');
        if (semicolon >= 0) {
            type = type.substring(0, semicolon);
        }
        String escaped = body == null ? "" : body.replace("\\", "\\\\").replace("\n", "\\n");
        return PAYLOAD_PREFIX + "\n" + type + "\n" + escaped + "\n";
    }

    public static String payloadHash(@Nullable String contentType, @Nullable String body) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(payloadString(contentType, body).getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot calculate payload hash", e);
        }
    }

    public static String headerString(HawkArtifacts artifacts) {
        return HEADER_PREFIX + "\n"
            + artifacts.ts() + "\n"
            + artifacts.nonce() + "\n"
            + artifacts.method().toUpperCase(Locale.ROOT) + "\n"
            + artifacts.path() + "\n"
            + artifacts.host().toLowerCase(Locale.ROOT) + "\n"
            + artifacts.port() + "\n"
            + artifacts.hash() + "\n"
            + (artifacts.ext() == null ? "" : artifacts.ext()) + "\n";
    }

    /**
     * Host and port as seen by this server. A missing port, or {@code overridePort}, falls back to
     * the scheme default since a fronting proxy rewrites the Host port.
     */
    public static HostPort hostAndPort(HawkRequest request, boolean overridePort) {
        String[] elements = request.hostHeader().split(":");
        String host = elements[0];
        String port = elements.length == 2 ? elements[1] : "";
        if (port.isEmpty() || overridePort) {
            port = "https".equalsIgnoreCase(request.scheme()) ? "443" : "80";
        }
        return new HostPort(host, port);
    }
}
