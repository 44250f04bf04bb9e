package com.findmydevice.dao;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.findmydevice.service.ApiException;
import com.findmydevice.service.ErrorKind;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MemoryStorageTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final MemoryStorage storage = new MemoryStorage(Duration.ofSeconds(1));
    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private <T> List<T> race(int threads, Callable<T> task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(5, TimeUnit.SECONDS));
        }
        return results;
    }

    @Test
    void concurrentTakeHandsNonceToOneCaller() throws Exception {
        storage.insertNonce("k", "v", T0);

        List<Optional<String>> results = race(8, () -> storage.takeNonce("k"));

        assertThat(results).filteredOn(Optional::isPresent).hasSize(1);
    }

    @Test
    void concurrentPopHandsCommandToOneCaller() throws Exception {
        storage.upsertCommand("dev-1", "ring", "{\"ring\":{}}", T0);

        List<Optional<Storage.CommandRow>> results = race(8, () -> storage.popOldestCommand("dev-1"));

        assertThat(results).filteredOn(Optional::isPresent).hasSize(1);
    }

    @Test
    void upsertKeepsOneRowPerType() {
        storage.upsertCommand("dev-1", "ring", "first", T0);
        storage.upsertCommand("dev-1", "ring", "second", T0.plusSeconds(1));

        assertThat(storage.popOldestCommand("dev-1")).hasValueSatisfying(c -> {
            assertThat(c.command()).isEqualTo("second");
            assertThat(c.createdAt()).isEqualTo(T0.plusSeconds(1));
        });
        assertThat(storage.popOldestCommand("dev-1")).isEmpty();
    }

    @Test
    void sameTimestampPopsInInsertOrder() {
        storage.upsertCommand("dev-1", "lock", "a", T0);
        storage.upsertCommand("dev-1", "ring", "b", T0);

        assertThat(storage.popOldestCommand("dev-1")).map(Storage.CommandRow::type).hasValue("lock");
        assertThat(storage.popOldestCommand("dev-1")).map(Storage.CommandRow::type).hasValue("ring");
    }

    @Test
    void duplicateNonceKeyIsStorageError() {
        storage.insertNonce("k", "v", T0);

        assertThatThrownBy(() -> storage.insertNonce("k", "w", T0))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE));
    }

    @Test
    void purgeRemovesOnlyNoncesIssuedBeforeCutoff() {
        storage.insertNonce("old", "v", T0);
        storage.insertNonce("new", "v", T0.plusSeconds(60));

        assertThat(storage.purgeNoncesIssuedBefore(T0.plusSeconds(1))).isEqualTo(1);
        assertThat(storage.takeNonce("old")).isEmpty();
        assertThat(storage.takeNonce("new")).hasValue("v");
    }

    @Test
    void rekeyMovesMappingsAndListsNewestFirst() {
        storage.registerDevice("old", device("dev-1"), T0);
        storage.registerDevice("old", device("dev-2"), T0.plusSeconds(1));
        storage.registerDevice("new", device("dev-3"), T0.plusSeconds(2));

        Storage.DeviceListing listing = storage.listDevicesForUser("new", "old", 2);

        assertThat(listing.userId()).isEqualTo("new");
        assertThat(listing.rekeyed()).isEqualTo(2);
        assertThat(listing.rows()).extracting(Storage.DeviceListRow::id).containsExactly("dev-3", "dev-2");
        assertThat(storage.findDeviceOwner("dev-1")).hasValueSatisfying(o -> assertThat(o.userId()).isEqualTo("new"));
    }

    @Test
    void deviceOwnedByAnotherUserCannotBeRegistered() {
        storage.registerDevice("user-1", device("dev-1"), T0);

        assertThatThrownBy(() -> storage.registerDevice("user-2", device("dev-1"), T0))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE));
        assertThat(storage.findDeviceOwner("dev-1")).hasValueSatisfying(o -> assertThat(o.userId()).isEqualTo("user-1"));
    }

    @Test
    void positionGcDropsOnlyOldRows() {
        storage.replacePosition("dev-1", new Storage.PositionRow(T0, 1f, 1f, 1f, 1f));
        storage.replacePosition("dev-2", new Storage.PositionRow(T0.plusSeconds(10), 2f, 2f, 2f, 2f));

        assertThat(storage.purgePositionsBefore(T0.plusSeconds(5))).isEqualTo(1);
        assertThat(storage.latestPosition("dev-1")).isEmpty();
        assertThat(storage.latestPosition("dev-2")).isPresent();
    }

    @Test
    void interruptedWaitIsStorageError() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> storage.takeNonce("k"))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE);
                    assertThat(e.getCause()).isInstanceOf(InterruptedException.class);
                });
        } finally {
            Thread.interrupted();
        }
    }

    private static Storage.DeviceRow device(String id) {
        return new Storage.DeviceRow(id, null, true, true, "enc", "", "[]", null, null);
    }
}
