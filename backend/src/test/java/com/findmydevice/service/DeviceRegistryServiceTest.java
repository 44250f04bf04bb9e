package com.findmydevice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.findmydevice.TestAppConfig;
import com.findmydevice.TestServices;
import com.findmydevice.dao.Storage;
import com.findmydevice.domain.DeviceApi;
import com.findmydevice.metrics.MicrometerMetrics;
import com.findmydevice.security.SecretCryptoService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DeviceRegistryServiceTest {

    private final TestServices services = new TestServices(new TestAppConfig(3, false, TestAppConfig.ENCRYPTION_KEY));

    private static DeviceApi.DeviceRegistration device(String id, String pushUrl) {
        return new DeviceApi.DeviceRegistration(id, true, true, "s3cr3t", Set.of("ring", "lock", "erase"), pushUrl);
    }

    @Test
    void registeredDeviceInfoRoundTrips() {
        services.devices.register("user-1", device("dev-1", "https://push/1"));

        DeviceApi.DeviceInfo info = services.devices.getDeviceInfo("dev-1");

        assertThat(info.userId()).isEqualTo("user-1");
        assertThat(info.secret()).isEqualTo("s3cr3t");
        assertThat(info.lockable()).isTrue();
        assertThat(info.loggedIn()).isTrue();
        assertThat(info.accepts()).containsExactly("erase", "lock", "ring");
        assertThat(info.accessToken()).isNull();
        assertThat(info.lastExchange()).isEqualTo(services.clock.instant());
    }

    @Test
    void secretIsEncryptedAtRest() {
        services.devices.register("user-1", device("dev-1", "https://push/1"));

        assertThat(services.storage.findDeviceInfo("dev-1"))
            .hasValueSatisfying(row -> assertThat(row.secret()).isNotEqualTo("s3cr3t"));
        assertThat(services.devices.secretFor("dev-1")).isEqualTo("s3cr3t");
    }

    @Test
    void deviceWithoutPushUrlIsNotLoggedIn() {
        services.devices.register("user-1", device("dev-1", ""));

        assertThat(services.devices.getDeviceInfo("dev-1").loggedIn()).isFalse();
    }

    @Test
    void blankIdIsGenerated() {
        String id = services.devices.register("user-1", device(" ", "https://push/1"));

        assertThat(id).isNotBlank();
        assertThat(services.devices.getDeviceInfo(id).userId()).isEqualTo("user-1");
    }

    @Test
    void reRegisterUpdatesInPlaceAndKeepsToken() {
        services.devices.register("user-1", device("dev-1", "https://push/1"));
        services.devices.setAccessToken("dev-1", "token-1");
        services.clock.advance(Duration.ofMinutes(1));

        services.devices.register("user-1",
            new DeviceApi.DeviceRegistration("dev-1", false, true, "n3w", Set.of("ring"), "https://push/2"));

        DeviceApi.DeviceInfo info = services.devices.getDeviceInfo("dev-1");
        assertThat(info.secret()).isEqualTo("n3w");
        assertThat(info.lockable()).isFalse();
        assertThat(info.pushUrl()).isEqualTo("https://push/2");
        assertThat(info.accessToken()).isEqualTo("token-1");
        assertThat(services.devices.getDevicesForUser("user-1", null)).hasSize(1);
    }

    @Test
    void registeringAnotherUsersDeviceFails() {
        services.devices.register("user-1", device("dev-1", "https://push/1"));

        assertThatThrownBy(() -> services.devices.register("user-2", device("dev-1", "https://push/1")))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE));
    }

    @Test
    void unknownDeviceIsReported() {
        assertThatThrownBy(() -> services.devices.getDeviceInfo("ghost"))
            .isInstanceOfSatisfying(ApiException.class, e -> {
                assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_DEVICE);
                assertThat(e.status()).isEqualTo(404);
            });
        assertThatThrownBy(() -> services.devices.getUserFromDevice("ghost"))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_DEVICE));
    }

    @Test
    void ownerIsResolvedFromDevice() {
        services.devices.register("user-1", device("dev-1", "https://push/1"));

        assertThat(services.devices.getUserFromDevice("dev-1")).isEqualTo(new DeviceApi.DeviceOwner("user-1", ""));
    }

    @Test
    void listingIsNewestFirstCappedAndNamedById() {
        for (int i = 1; i <= 4; i++) {
            services.devices.register("user-1", device("dev-" + i, "https://push/" + i));
            services.clock.advance(Duration.ofSeconds(1));
        }

        assertThat(services.devices.getDevicesForUser("user-1", null))
            .extracting(DeviceApi.DeviceSummary::id, DeviceApi.DeviceSummary::name)
            .containsExactly(
                tuple("dev-4", "dev-4"),
                tuple("dev-3", "dev-3"),
                tuple("dev-2", "dev-2")
            );
    }

    @Test
    void devicesOfPreviousUserIdAreMoved() {
        services.devices.register("old-user", device("dev-1", "https://push/1"));
        services.devices.register("old-user", device("dev-2", "https://push/2"));

        assertThat(services.devices.getDevicesForUser("new-user", "old-user")).hasSize(2);
        assertThat(services.devices.getDevicesForUser("old-user", null)).isEmpty();
        assertThat(services.devices.getUserFromDevice("dev-1").userId()).isEqualTo("new-user");
        assertThat(services.meterRegistry.counter("fmd.db.UserID.Updated").count()).isEqualTo(2.0);
    }

    @Test
    void listingServedUnderPreviousIdIsNotCountedAsMoved() {
        Storage storage = mock(Storage.class);
        when(storage.listDevicesForUser("new-user", "old-user", 3)).thenReturn(new Storage.DeviceListing(
            List.of(new Storage.DeviceListRow("dev-1", "dev-1")), "old-user", 0));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        DeviceRegistryService devices = new DeviceRegistryService(storage, services.config, services.idGenerator,
            new SecretCryptoService(services.config), new MicrometerMetrics(registry), services.clock);

        assertThat(devices.getDevicesForUser("new-user", "old-user"))
            .containsExactly(new DeviceApi.DeviceSummary("dev-1", "dev-1"));
        assertThat(registry.find("fmd.db.UserID.Updated").counter()).isNull();
    }

    @Test
    void lockFlagAndTokenAreUpdated() {
        services.devices.register("user-1", device("dev-1", "https://push/1"));
        services.clock.advance(Duration.ofMinutes(2));

        services.devices.setDeviceLock("dev-1", false);
        services.devices.setAccessToken("dev-1", "token-2");

        DeviceApi.DeviceInfo info = services.devices.getDeviceInfo("dev-1");
        assertThat(info.lockable()).isFalse();
        assertThat(info.accessToken()).isEqualTo("token-2");
        assertThat(info.lastExchange()).isEqualTo(services.clock.instant());
    }

    @Test
    void deleteRemovesEverythingOfTheDevice() {
        services.devices.register("user-1", device("dev-1", "https://push/1"));
        services.commands.storeCommand("dev-1", "{\"ring\":{}}", "ring");
        services.positions.setDeviceLocation("dev-1", DeviceApi.Position.of(1, 2, 3, 4));

        services.devices.deleteDevice("dev-1");

        assertThat(services.storage.popOldestCommand("dev-1")).isEmpty();
        assertThat(services.positions.getPositions("dev-1")).isEmpty();
        assertThat(services.devices.getDevicesForUser("user-1", null)).isEmpty();
        assertThatThrownBy(() -> services.devices.getDeviceInfo("dev-1")).isInstanceOf(ApiException.class);
    }
}
