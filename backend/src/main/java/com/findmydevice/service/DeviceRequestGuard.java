package com.findmydevice.service;

import com.findmydevice.metrics.Metrics;
import com.findmydevice.security.HawkAuthenticator;
import com.findmydevice.security.HawkHeader;
import com.findmydevice.security.HawkRequest;
import jakarta.annotation.Nullable;
import ru.tinkoff.kora.common.Component;

/**
 * Admission check for requests coming from devices: Hawk MAC against the registered secret,
 * then single-use consumption of the server-issued nonce carried in the header.
 */
@Component
public final class DeviceRequestGuard {
    private final HawkAuthenticator hawkAuthenticator;
    private final NonceService nonceService;
    private final DeviceRegistryService deviceRegistry;
    private final Metrics metrics;

    public DeviceRequestGuard(HawkAuthenticator hawkAuthenticator,
                              NonceService nonceService,
                              DeviceRegistryService deviceRegistry,
                              Metrics metrics) {
        this.hawkAuthenticator = hawkAuthenticator;
        this.nonceService = nonceService;
        this.deviceRegistry = deviceRegistry;
        this.metrics = metrics;
    }

    /**
     * @return id of the authenticated device
     * @throws ApiException with a protocol kind when the request is rejected
     */
    public String authenticate(HawkRequest request, @Nullable String body) {
        HawkHeader header;
        try {
            header = hawkAuthenticator.verify(request, body, deviceRegistry::secretFor);
        } catch (ApiException e) {
            if (e.kind() == ErrorKind.INVALID_SIGNATURE) {
                metrics.increment("hawk.invalid_signature");
            }
            throw e;
        }

        if (!nonceService.verifyAndConsume(header.nonce())) {
            throw ApiException.nonceInvalid(header.id());
        }
        deviceRegistry.touch(header.id());
        return header.id();
    }
}
