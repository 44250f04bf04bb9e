package com.findmydevice.service;

public enum ErrorKind {
    NO_AUTH(401, "no_auth_header"),
    NOT_HAWK_AUTH(401, "not_hawk_auth"),
    INVALID_SIGNATURE(401, "invalid_signature"),
    UNKNOWN_DEVICE(404, "unknown_device"),
    NONCE_INVALID(403, "nonce_invalid"),
    STORAGE(500, "storage_error"),
    STORAGE_TIMEOUT(503, "storage_timeout");

    private final int status;
    private final String code;

    ErrorKind(int status, String code) {
        this.status = status;
        this.code = code;
    }

    public int status() {
        return status;
    }

    public String code() {
        return code;
    }

    /** Caller-side protocol faults; the request is rejected and never retried. */
    public boolean isProtocolError() {
        return this == NO_AUTH || this == NOT_HAWK_AUTH || this == INVALID_SIGNATURE || this == NONCE_INVALID;
    }
}
