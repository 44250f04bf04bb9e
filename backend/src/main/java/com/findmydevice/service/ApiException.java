package com.findmydevice.service;

import java.util.LinkedHashMap;
import java.util.Map;

public final class ApiException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, String> context;

    public ApiException(ErrorKind kind, Map<String, String> context, Throwable cause) {
        super(kind.code() + (context.isEmpty() ? "" : " " + context), cause);
        this.kind = kind;
        this.context = Map.copyOf(context);
    }

    public ErrorKind kind() {
        return kind;
    }

    public int status() {
        return kind.status();
    }

    public String publicMessage() {
        return kind.code();
    }

    public Map<String, String> context() {
        return context;
    }

    public static ApiException noAuth() {
        return new ApiException(ErrorKind.NO_AUTH, Map.of(), null);
    }

    public static ApiException notHawkAuth() {
        return new ApiException(ErrorKind.NOT_HAWK_AUTH, Map.of(), null);
    }

    public static ApiException invalidSignature(String deviceId) {
        return new ApiException(ErrorKind.INVALID_SIGNATURE, Map.of("deviceId", String.valueOf(deviceId)), null);
    }

    public static ApiException unknownDevice(String deviceId) {
        return new ApiException(ErrorKind.UNKNOWN_DEVICE, Map.of("deviceId", String.valueOf(deviceId)), null);
    }

    public static ApiException nonceInvalid(String deviceId) {
        return new ApiException(ErrorKind.NONCE_INVALID, Map.of("deviceId", String.valueOf(deviceId)), null);
    }

    public static ApiException storage(String op, String key, Throwable cause) {
        return new ApiException(ErrorKind.STORAGE, opContext(op, key), cause);
    }

    public static ApiException storageTimeout(String op, String key, Throwable cause) {
        return new ApiException(ErrorKind.STORAGE_TIMEOUT, opContext(op, key), cause);
    }

    private static Map<String, String> opContext(String op, String key) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put("op", op);
        if (key != null) {
            ctx.put("key", key);
        }
        return ctx;
    }
}
