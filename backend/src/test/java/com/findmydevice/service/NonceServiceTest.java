package com.findmydevice.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.findmydevice.MutableClock;
import com.findmydevice.TestServices;
import com.findmydevice.dao.Storage;
import com.findmydevice.metrics.Metrics;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class NonceServiceTest {

    private final TestServices services = new TestServices();

    @Test
    void nonceHasKeyAndMd5Checksum() {
        assertThat(NonceService.signature("k", "v")).isEqualTo("1d3d07a38dc1f813ab80c01188b7afda");

        String nonce = services.nonces.issue();

        assertThat(nonce).matches("[0-9a-f-]{36}\\.[0-9a-f]{32}");
        assertThat(services.meterRegistry.counter("fmd.nonce.issued").count()).isEqualTo(1.0);
    }

    @Test
    void nonceIsConsumedOnce() {
        String nonce = services.nonces.issue();

        assertThat(services.nonces.verifyAndConsume(nonce)).isTrue();
        assertThat(services.nonces.verifyAndConsume(nonce)).isFalse();
    }

    @Test
    void noncesAreIndependentOfIssueOrder() {
        String first = services.nonces.issue();
        String second = services.nonces.issue();

        assertThat(services.nonces.verifyAndConsume(second)).isTrue();
        assertThat(services.nonces.verifyAndConsume(first)).isTrue();
    }

    @Test
    void nonceExpiresAfterFiveMinutes() {
        String fresh = services.nonces.issue();
        String stale = services.nonces.issue();

        services.clock.advance(Duration.ofMinutes(4));
        assertThat(services.nonces.verifyAndConsume(fresh)).isTrue();

        services.clock.advance(Duration.ofMinutes(1).plusSeconds(1));
        assertThat(services.nonces.verifyAndConsume(stale)).isFalse();
    }

    @Test
    void malformedAndUnknownNoncesAreRejected() {
        assertThat(services.nonces.verifyAndConsume("no-separator")).isFalse();
        assertThat(services.nonces.verifyAndConsume("")).isFalse();
        assertThat(services.nonces.verifyAndConsume(null)).isFalse();
        assertThat(services.nonces.verifyAndConsume("unknown.00")).isFalse();
        assertThat(services.meterRegistry.counter("fmd.nonce.rejected").count()).isEqualTo(4.0);
    }

    @Test
    void tamperedChecksumIsRejectedAndStillConsumed() {
        String nonce = services.nonces.issue();
        String key = nonce.substring(0, nonce.indexOf('.'));

        assertThat(services.nonces.verifyAndConsume(key + ".0123456789abcdef0123456789abcdef")).isFalse();
        assertThat(services.nonces.verifyAndConsume(nonce)).isFalse();
    }

    @Test
    void storageFailureIsNotReportedAsInvalidNonce() {
        Storage storage = mock(Storage.class);
        when(storage.purgeNoncesIssuedBefore(any())).thenReturn(0);
        when(storage.takeNonce("key")).thenThrow(ApiException.storageTimeout("takeNonce", "key", null));
        NonceService nonces = new NonceService(storage, new IdGenerator(), mock(Metrics.class),
            new MutableClock(Instant.parse("2024-03-01T10:00:00Z")));

        assertThatThrownBy(() -> nonces.verifyAndConsume("key.abc"))
            .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE_TIMEOUT));
    }
}
