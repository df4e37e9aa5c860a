package com.detective.locationtrust.config;

import java.time.Duration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for the location-trust engine. Maps to the 'location-trust' section in
 * application.yml; defaults match the game's tuned values.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "location-trust")
public class LocationTrustProperties {

    @Valid private Reading reading = new Reading();
    @Valid private Discovery discovery = new Discovery();
    @Valid private Radius radius = new Radius();
    @Valid private Spoofing spoofing = new Spoofing();
    @Valid private History history = new History();

    /** Basic sanity limits for a raw fix. */
    @Data
    public static class Reading {
        @DecimalMin("1.0")
        private double maxHorizontalAccuracyMeters = 100.0;

        @Min(1)
        private long maxFixAgeSeconds = 300;

        @DecimalMin("1.0")
        private double maxSpeedMetersPerSecond = 50.0;
    }

    /** The gating decision. */
    @Data
    public static class Discovery {
        @DecimalMin("1.0")
        private double baseRadiusMeters = 50.0;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.7;
    }

    /** Advisory radius bounds. */
    @Data
    public static class Radius {
        @DecimalMin("1.0")
        private double minRadiusMeters = 20.0;

        @DecimalMin("1.0")
        private double maxRadiusMeters = 100.0;
    }

    @Data
    public static class Spoofing {
        private double suspiciousAccuracyMeters = 1.0;
        private double impossibleSpeedMetersPerSecond = 28.0;
        private double jumpWindowSeconds = 5.0;
        private double jumpDistanceMeters = 100.0;
        private double maxWalkingSpeedMetersPerSecond = 5.0;

        @Min(1)
        private int movementLookback = 5;

        @Min(1)
        private int providerWindow = 3;
    }

    @Data
    public static class History {
        @Min(1)
        private int capacityPerPlayer = 10;

        @Min(1)
        private int maxTrackedPlayers = 10_000;

        @NotNull private Duration idleTtl = Duration.ofHours(2);

        @NotNull private Duration purgeInterval = Duration.ofMinutes(5);
    }
}
