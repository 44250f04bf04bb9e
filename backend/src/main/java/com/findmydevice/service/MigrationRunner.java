package com.findmydevice.service;

import com.findmydevice.dao.SchemaVersion;
import com.findmydevice.dao.Storage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.common.annotation.Root;

/**
 * Brings the schema up to date at startup and refuses to continue on a version mismatch.
 */
@Component
@Root
public final class MigrationRunner {
    private static final Logger logger = LoggerFactory.getLogger(MigrationRunner.class);

    public MigrationRunner(Storage storage) {
        storage.migrate();

        String version;
        try {
            version = storage.getMeta(SchemaVersion.META_KEY).orElse(null);
        } catch (ApiException e) {
            throw new IllegalStateException("Cannot read schema version", e);
        }
        if (!SchemaVersion.CURRENT.equals(version)) {
            throw new IllegalStateException(
                "Schema version mismatch: expected " + SchemaVersion.CURRENT + " but database has " + version);
        }
        logger.info("Database up to date, version {}", version);
    }
}
