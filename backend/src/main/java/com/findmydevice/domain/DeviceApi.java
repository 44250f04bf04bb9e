package com.findmydevice.domain;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Set;

public final class DeviceApi {
    private DeviceApi() {
    }

    /**
     * Registration payload of a device. A null or blank id asks the server to generate one.
     */
    public record DeviceRegistration(@Nullable String id,
                                     boolean hasPasscode,
                                     boolean loggedIn,
                                     String secret,
                                     Set<String> accepts,
                                     String pushUrl) {
    }

    public record DeviceInfo(String id,
                             String userId,
                             String secret,
                             boolean lockable,
                             boolean loggedIn,
                             @Nullable Instant lastExchange,
                             String pushUrl,
                             Set<String> accepts,
                             @Nullable String accessToken) {
    }

    public record DeviceSummary(String id, String name) {
    }

    public record DeviceOwner(String userId, String name) {
    }

    public record PendingCommand(String command, String type, Instant createdAt) {
    }

    /**
     * A location fix. Coordinates are kept at single precision once stored.
     */
    public record Position(double latitude,
                           double longitude,
                           double altitude,
                           double accuracy,
                           @Nullable Instant time) {

        public static Position of(double latitude, double longitude, double altitude, double accuracy) {
            return new Position(latitude, longitude, altitude, accuracy, null);
        }
    }
}
