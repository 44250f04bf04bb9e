package com.findmydevice;

import com.findmydevice.config.AppConfig;
import com.findmydevice.config.DbConfig;
import com.findmydevice.dao.Storage;
import com.findmydevice.dao.StorageRegistry;
import com.findmydevice.metrics.Metrics;
import com.findmydevice.metrics.MicrometerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import ru.tinkoff.kora.application.graph.KoraApplication;
import ru.tinkoff.kora.common.KoraApp;
import ru.tinkoff.kora.config.hocon.HoconConfigModule;
import ru.tinkoff.kora.logging.logback.LogbackModule;

@KoraApp
public interface Application extends
    HoconConfigModule,
    LogbackModule {

    static void main(String[] args) {
        KoraApplication.run(ApplicationGraph::graph);
    }

    default Clock clock() {
        return Clock.systemUTC();
    }

    default MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    default Metrics metrics(MeterRegistry meterRegistry) {
        return new MicrometerMetrics(meterRegistry);
    }

    default StorageRegistry storageRegistry(AppConfig appConfig, DbConfig dbConfig) {
        return StorageRegistry.defaults(appConfig, dbConfig);
    }

    default Storage storage(StorageRegistry storageRegistry, AppConfig appConfig) {
        return storageRegistry.open(appConfig.storage().backend());
    }
}
