package com.findmydevice.security;

import jakarta.annotation.Nullable;
import java.net.URI;

/**
 * The parts of an HTTP request that take part in Hawk signing.
 *
 * @param method        HTTP method as received
 * @param scheme        {@code http} or {@code https}
 * @param hostHeader    raw Host header, with or without {@code :port}
 * @param path          path with query and fragment, exactly as sent
 * @param contentType   Content-Type header, may be null
 * @param authorization Authorization header, may be null
 */
public record HawkRequest(String method,
                          String scheme,
                          String hostHeader,
                          String path,
                          @Nullable String contentType,
                          @Nullable String authorization) {

    public static HawkRequest of(String method,
                                 URI uri,
                                 @Nullable String hostHeader,
                                 @Nullable String contentType,
                                 @Nullable String authorization) {
        String host = hostHeader;
        if (host == null || host.isBlank()) {
            host = uri.getPort() > 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost();
        }
        return new HawkRequest(method, uri.getScheme(), host, fullPath(uri), contentType, authorization);
    }

    public HawkRequest withAuthorization(String header) {
        return new HawkRequest(method, scheme, hostHeader, path, contentType, header);
    }

    static String fullPath(URI uri) {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            path = path + "?" + uri.getRawQuery();
        }
        if (uri.getRawFragment() != null && !uri.getRawFragment().isEmpty()) {
            path = path + "#" + uri.getRawFragment();
        }
        return path;
    }
}
