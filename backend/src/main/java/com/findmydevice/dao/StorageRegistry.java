package com.findmydevice.dao;

import com.findmydevice.config.AppConfig;
import com.findmydevice.config.DbConfig;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Storage backends by name. Built once at startup and handed to the application graph.
 */
public final class StorageRegistry {

    @FunctionalInterface
    public interface StorageFactory {
        Storage open();
    }

    private final Map<String, StorageFactory> factories;

    private StorageRegistry(Map<String, StorageFactory> factories) {
        this.factories = Map.copyOf(factories);
    }

    public static StorageRegistry defaults(AppConfig appConfig, DbConfig dbConfig) {
        return builder()
            .register("postgres", () -> new PostgresStorage(new DbClient(dbConfig)))
            .register("memory", () -> new MemoryStorage(Duration.ofMillis(appConfig.storage().lockTimeoutMs())))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> names() {
        return factories.keySet();
    }

    public Storage open(String name) {
        StorageFactory factory = factories.get(name);
        if (factory == null) {
            throw new IllegalStateException("Unknown storage backend '" + name + "', known: " + names());
        }
        return factory.open();
    }

    public static final class Builder {
        private final Map<String, StorageFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String name, StorageFactory factory) {
            if (factories.putIfAbsent(name, factory) != null) {
                throw new IllegalArgumentException("Storage backend already registered: " + name);
            }
            return this;
        }

        public StorageRegistry build() {
            return new StorageRegistry(factories);
        }
    }
}
