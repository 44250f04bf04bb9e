package com.findmydevice.security;

import com.findmydevice.service.ApiException;
import jakarta.annotation.Nullable;
import java.util.Locale;

/**
 * Attributes of a {@code Hawk ...} Authorization header. Missing attributes are empty strings.
 */
public record HawkHeader(String id, String ts, String nonce, String ext, String hash, String mac) {
    private static final String SCHEME = "hawk";

    public static HawkHeader parse(@Nullable String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw ApiException.noAuth();
        }
        String auth = authorization.trim();
        if (auth.length() < SCHEME.length()
            || !auth.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)) {
            throw ApiException.notHawkAuth();
        }

        String id = "";
        String ts = "";
        String nonce = "";
        String ext = "";
        String hash = "";
        String mac = "";
        for (String element : auth.substring(SCHEME.length()).split(",")) {
            String[] kv = element.trim().split("=", 2);
            if (kv.length < 2) {
                continue;
            }
            String val = unquote(kv[1].trim());
            switch (kv[0].trim().toLowerCase(Locale.ROOT)) {
                case "id" -> id = val;
                case "ts" -> ts = val;
                case "nonce" -> nonce = val;
                case "ext" -> ext = val;
                case "hash" -> hash = val;
                case "mac" -> mac = val;
                default -> {
                    // unknown attributes are ignored
                }
            }
        }
        return new HawkHeader(id, ts, nonce, ext, hash, mac);
    }

    /** Values are written verbatim; callers must not pass values containing quotes. */
    public String render() {
        return "Hawk id=\"" + id + "\", ts=\"" + ts + "\", nonce=\"" + nonce + "\", ext=\"" + ext
            + "\", hash=\"" + hash + "\", mac=\"" + mac + "\"";
    }

    private static String unquote(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '"') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '"') {
            end--;
        }
        return value.substring(start, end);
    }
}
