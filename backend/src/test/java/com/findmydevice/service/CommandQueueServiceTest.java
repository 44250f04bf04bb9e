package com.findmydevice.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.findmydevice.TestServices;
import com.findmydevice.domain.DeviceApi;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CommandQueueServiceTest {

    private final TestServices services = new TestServices();

    @BeforeEach
    void registerDevice() {
        services.devices.register("user-1",
            new DeviceApi.DeviceRegistration("dev-1", true, true, "s3cr3t", Set.of("ring", "lock"), "https://push/1"));
    }

    @Test
    void emptyQueueReturnsNothingButTouchesDevice() {
        services.clock.advance(Duration.ofMinutes(3));

        assertThat(services.commands.getPending("dev-1")).isEmpty();
        assertThat(services.devices.getDeviceInfo("dev-1").lastExchange()).isEqualTo(services.clock.instant());
    }

    @Test
    void newerCommandOfSameTypeReplacesOlder() {
        services.commands.storeCommand("dev-1", "{\"ring\":{\"duration\":10}}", "ring");
        services.clock.advance(Duration.ofSeconds(5));
        services.commands.storeCommand("dev-1", "{\"ring\":{\"duration\":30}}", "ring");

        Optional<DeviceApi.PendingCommand> pending = services.commands.getPending("dev-1");

        assertThat(pending).hasValueSatisfying(c -> {
            assertThat(c.type()).isEqualTo("ring");
            assertThat(c.command()).isEqualTo("{\"ring\":{\"duration\":30}}");
        });
        assertThat(services.commands.getPending("dev-1")).isEmpty();
    }

    @Test
    void commandsAreHandedOutOldestFirstAndOnlyOnce() {
        services.commands.storeCommand("dev-1", "{\"lock\":{}}", "lock");
        services.clock.advance(Duration.ofSeconds(1));
        services.commands.storeCommand("dev-1", "{\"ring\":{}}", "ring");
        services.clock.advance(Duration.ofSeconds(9));

        assertThat(services.commands.getPending("dev-1")).map(DeviceApi.PendingCommand::type).hasValue("lock");
        assertThat(services.commands.getPending("dev-1")).map(DeviceApi.PendingCommand::type).hasValue("ring");
        assertThat(services.commands.getPending("dev-1")).isEmpty();

        var timer = services.meterRegistry.timer("fmd.cmd.pending");
        assertThat(timer.count()).isEqualTo(2);
        assertThat(services.meterRegistry.counter("fmd.cmd.stored").count()).isEqualTo(2.0);
    }

    @Test
    void commandsOfOtherDevicesAreUntouched() {
        services.commands.storeCommand("dev-1", "{\"lock\":{}}", "lock");
        services.commands.storeCommand("dev-2", "{\"lock\":{}}", "lock");

        assertThat(services.commands.purgeCommands("dev-1")).isEqualTo(1);
        assertThat(services.commands.getPending("dev-1")).isEmpty();
        assertThat(services.commands.getPending("dev-2")).isPresent();
    }
}
