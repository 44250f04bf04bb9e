package com.findmydevice.config;

import ru.tinkoff.kora.config.common.annotation.ConfigSource;
import ru.tinkoff.kora.config.common.annotation.ConfigValueExtractor;

@ConfigSource("app")
@ConfigValueExtractor
public interface AppConfig {
    StorageConfig storage();
    HawkConfig hawk();
    SecurityConfig security();

    @ConfigValueExtractor
    interface StorageConfig {
        String backend();
        int maxDevicesPerUser();
        long positionExpirySec();
        long gcIntervalSec();
        long lockTimeoutMs();
    }

    @ConfigValueExtractor
    interface HawkConfig {
        /** Ignore the port of the Host header and use the scheme default (behind a proxy). */
        boolean overridePort();
        boolean showHash();
    }

    @ConfigValueExtractor
    interface SecurityConfig {
        String encryptionKey();
    }
}
