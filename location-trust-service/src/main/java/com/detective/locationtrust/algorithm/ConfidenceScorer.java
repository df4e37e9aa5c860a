package com.detective.locationtrust.algorithm;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.detective.locationtrust.algorithm.util.TimeMath;
import com.detective.locationtrust.dto.LocationProvider;
import com.detective.locationtrust.dto.LocationSample;

/**
 * Turns accuracy, distance, fix age and provider into a trust score in [0,1].
 *
 * <p>Formula: {@code score = 1.0 - 0.01*max(0, accuracy-10) - 0.01*max(0, distance-20)
 * - 0.001*max(0, age-10)}, multiplied by the provider factor and clamped to [0,1].
 */
@Component
public class ConfidenceScorer {

    // Deductions start above these values.
    static final double ACCURACY_ALLOWANCE_METERS = 10.0;
    static final double DISTANCE_ALLOWANCE_METERS = 20.0;
    static final double AGE_ALLOWANCE_SECONDS = 10.0;

    static final double ACCURACY_PENALTY_PER_METER = 0.01;
    static final double DISTANCE_PENALTY_PER_METER = 0.01;
    static final double AGE_PENALTY_PER_SECOND = 0.001;

    private static final Map<LocationProvider, Double> PROVIDER_FACTORS =
            new EnumMap<>(LocationProvider.class);

    static {
        PROVIDER_FACTORS.put(LocationProvider.GPS, 1.0);
        PROVIDER_FACTORS.put(LocationProvider.NETWORK, 0.8);
        PROVIDER_FACTORS.put(LocationProvider.PASSIVE, 0.6);
        PROVIDER_FACTORS.put(LocationProvider.UNKNOWN, 0.5);
    }

    private final Clock clock;

    public ConfidenceScorer(Clock clock) {
        this.clock = clock;
    }

    /** Scores a fix against the current clock. */
    public double score(LocationSample sample, double distanceMeters) {
        return score(sample, distanceMeters, secondsSinceFix(sample.accuracy().capturedAt()));
    }

    public double score(LocationSample sample, double distanceMeters, double secondsSinceFix) {
        double accuracy = sample.accuracy().horizontalAccuracyMeters();

        double score = 1.0;
        score -= ACCURACY_PENALTY_PER_METER * Math.max(0.0, accuracy - ACCURACY_ALLOWANCE_METERS);
        score -= DISTANCE_PENALTY_PER_METER * Math.max(0.0, distanceMeters - DISTANCE_ALLOWANCE_METERS);
        score -= AGE_PENALTY_PER_SECOND * Math.max(0.0, secondsSinceFix - AGE_ALLOWANCE_SECONDS);

        score *= providerFactor(sample.provider());

        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    public static double providerFactor(LocationProvider provider) {
        return PROVIDER_FACTORS.getOrDefault(provider, PROVIDER_FACTORS.get(LocationProvider.UNKNOWN));
    }

    /** Age of a fix in seconds; negative for future-dated fixes. */
    public double secondsSinceFix(Instant capturedAt) {
        return TimeMath.secondsBetween(capturedAt, clock.instant());
    }
}
