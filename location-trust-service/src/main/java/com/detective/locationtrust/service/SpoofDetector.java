package com.detective.locationtrust.service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.detective.locationtrust.algorithm.util.GeoMath;
import com.detective.locationtrust.algorithm.util.TimeMath;
import com.detective.locationtrust.config.LocationTrustProperties;
import com.detective.locationtrust.dto.LocationProvider;
import com.detective.locationtrust.dto.LocationSample;
import com.detective.locationtrust.dto.MovementValidation;
import com.detective.locationtrust.dto.SpoofingAssessment;
import com.detective.locationtrust.dto.SpoofingIndicators;
import com.detective.locationtrust.repository.PlayerHistoryStore;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Heuristic detection of fabricated fixes.
 *
 * <p>Each assessment compares the new fix with the player's previous fixes and raises four
 * independent indicators:
 *
 * <ul>
 *   <li><strong>suspiciousAccuracy</strong>: accuracy better than 1 m, which consumer GPS does not
 *       produce
 *   <li><strong>impossibleMovement</strong>: implied speed from the previous fix above 28 m/s
 *       (about 100 km/h)
 *   <li><strong>locationJump</strong>: more than 100 m covered in under 5 s
 *   <li><strong>providerInconsistency</strong>: the last 3 previous fixes mix providers and at
 *       least one of them is GPS
 * </ul>
 *
 * <p>The risk score is the fraction of indicators raised. Every assessment appends the new fix to
 * the player's history. A flag is a soft signal only; nothing here blocks an account.
 *
 * <p>A walking-pace check (5 m/s) is computed from the same history snapshot and returned for
 * diagnostics. It does not feed into the indicators.
 */
@Service
@Slf4j
public class SpoofDetector {

    private final PlayerHistoryStore historyStore;
    private final LocationTrustProperties.Spoofing config;
    private final MeterRegistry meterRegistry;

    private final Counter assessmentCounter;
    private final Counter flaggedCounter;

    public SpoofDetector(
            PlayerHistoryStore historyStore,
            LocationTrustProperties properties,
            MeterRegistry meterRegistry) {
        this.historyStore = historyStore;
        this.config = properties.getSpoofing();
        this.meterRegistry = meterRegistry;

        this.assessmentCounter =
                Counter.builder("location.trust.spoofing.assessments")
                        .description("Number of spoofing assessments performed")
                        .register(meterRegistry);
        this.flaggedCounter =
                Counter.builder("location.trust.spoofing.flagged")
                        .description("Number of fixes flagged as likely spoofed")
                        .register(meterRegistry);
    }

    /**
     * Assesses a fix for the given player and records it in the player's history. A missing fix
     * raises nothing and is not recorded.
     *
     * @throws IllegalArgumentException if playerId is blank
     */
    public SpoofingAssessment assess(LocationSample sample, String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("Player id is required for spoofing assessment");
        }
        if (sample == null || sample.coordinate() == null) {
            // Nothing to compare or record; the reading checks reject it.
            return SpoofingAssessment.from(SpoofingIndicators.none(), MovementValidation.noHistory());
        }

        int lookback = Math.max(config.getMovementLookback(), config.getProviderWindow());
        List<LocationSample> previous = historyStore.recordAndGetPrevious(playerId, sample, lookback);

        boolean suspiciousAccuracy =
                sample.accuracy() != null
                        && sample.accuracy().horizontalAccuracyMeters() < config.getSuspiciousAccuracyMeters();

        boolean impossibleMovement = false;
        boolean locationJump = false;
        if (!previous.isEmpty()) {
            LocationSample last = previous.get(previous.size() - 1);
            Double elapsed = secondsBetween(last, sample);
            if (elapsed != null && elapsed > 0) {
                double distance = GeoMath.distance(last.coordinate(), sample.coordinate());
                impossibleMovement = distance / elapsed > config.getImpossibleSpeedMetersPerSecond();
                locationJump =
                        elapsed < config.getJumpWindowSeconds() && distance > config.getJumpDistanceMeters();
            }
        }

        boolean providerInconsistency = hasMixedProviders(previous);

        SpoofingIndicators indicators =
                new SpoofingIndicators(
                        suspiciousAccuracy, impossibleMovement, locationJump, providerInconsistency);
        SpoofingAssessment assessment =
                SpoofingAssessment.from(indicators, movementValidation(previous, sample));

        record(playerId, assessment);
        return assessment;
    }

    /**
     * Walking-pace check against the most recent previous fix. Informational only.
     *
     * @param previous previous fixes, oldest first
     */
    MovementValidation movementValidation(List<LocationSample> previous, LocationSample current) {
        if (previous.isEmpty()) {
            return MovementValidation.noHistory();
        }
        LocationSample last = previous.get(previous.size() - 1);
        Double elapsed = secondsBetween(last, current);
        if (elapsed == null || elapsed <= 0) {
            return MovementValidation.invalidTime(elapsed == null ? 0.0 : elapsed);
        }
        double distance = GeoMath.distance(last.coordinate(), current.coordinate());
        return MovementValidation.checked(
                distance / elapsed, elapsed, distance, config.getMaxWalkingSpeedMetersPerSecond());
    }

    private boolean hasMixedProviders(List<LocationSample> previous) {
        int window = Math.min(config.getProviderWindow(), previous.size());
        Set<LocationProvider> providers = EnumSet.noneOf(LocationProvider.class);
        for (LocationSample sample : previous.subList(previous.size() - window, previous.size())) {
            providers.add(sample.provider());
        }
        return providers.size() > 1 && providers.contains(LocationProvider.GPS);
    }

    /** Seconds from {@code earlier} to {@code later}, or null when either timestamp is missing. */
    private static Double secondsBetween(LocationSample earlier, LocationSample later) {
        Instant from = earlier.accuracy() == null ? null : earlier.accuracy().capturedAt();
        Instant to = later.accuracy() == null ? null : later.accuracy().capturedAt();
        if (from == null || to == null || earlier.coordinate() == null || later.coordinate() == null) {
            return null;
        }
        return TimeMath.secondsBetween(from, to);
    }

    private void record(String playerId, SpoofingAssessment assessment) {
        assessmentCounter.increment();
        if (!assessment.likelySpoofed()) {
            log.debug("No spoofing indicators for player {}", playerId);
            return;
        }

        flaggedCounter.increment();
        SpoofingIndicators indicators = assessment.indicators();
        countIndicator("suspicious_accuracy", indicators.suspiciousAccuracy());
        countIndicator("impossible_movement", indicators.impossibleMovement());
        countIndicator("location_jump", indicators.locationJump());
        countIndicator("provider_inconsistency", indicators.providerInconsistency());

        log.warn(
                "Possible GPS spoofing for player {}: indicators={}, riskScore={}",
                playerId,
                indicators,
                assessment.riskScore());
    }

    private void countIndicator(String name, boolean raised) {
        if (raised) {
            meterRegistry.counter("location.trust.spoofing.indicator", "indicator", name).increment();
        }
    }
}
