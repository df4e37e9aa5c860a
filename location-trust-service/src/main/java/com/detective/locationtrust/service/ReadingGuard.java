package com.detective.locationtrust.service;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.detective.locationtrust.algorithm.util.TimeMath;
import com.detective.locationtrust.config.LocationTrustProperties;
import com.detective.locationtrust.dto.AccuracyReport;
import com.detective.locationtrust.dto.Coordinate;
import com.detective.locationtrust.dto.LocationSample;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * First-stage sanity checks for a raw player fix.
 *
 * <p>A fix is rejected when:
 *
 * <ul>
 *   <li>latitude or longitude is missing, NaN or out of range
 *   <li>the reported horizontal accuracy is worse than the configured maximum (100 m)
 *   <li>the capture time is more than the configured age (300 s) away from server time, in either
 *       direction
 *   <li>the reported speed exceeds the configured maximum (50 m/s)
 * </ul>
 *
 * <p>The first failing rule wins and its reason is returned; nothing else is evaluated. Missing
 * data fails closed.
 */
@Service
public class ReadingGuard {

    private static final Logger logger = LoggerFactory.getLogger(ReadingGuard.class);

    private final LocationTrustProperties.Reading config;
    private final Clock clock;

    private final Counter acceptedCounter;
    private final Counter rejectedCounter;

    public ReadingGuard(LocationTrustProperties properties, Clock clock, MeterRegistry meterRegistry) {
        if (properties == null) {
            throw new IllegalArgumentException("LocationTrustProperties cannot be null");
        }
        if (meterRegistry == null) {
            throw new IllegalArgumentException("MeterRegistry cannot be null");
        }
        this.config = properties.getReading();
        this.clock = clock;

        this.acceptedCounter =
                Counter.builder("location.trust.reading.accepted")
                        .description("Number of fixes that passed basic sanity checks")
                        .register(meterRegistry);
        this.rejectedCounter =
                Counter.builder("location.trust.reading.rejected")
                        .description("Number of fixes rejected by basic sanity checks")
                        .register(meterRegistry);
    }

    /**
     * Checks a fix against the sanity rules.
     *
     * @param sample the fix to check
     * @return a valid check, or an invalid one carrying the reason of the first failed rule
     */
    public ReadingCheck check(LocationSample sample) {
        ReadingCheck result = evaluate(sample);
        if (result.valid()) {
            acceptedCounter.increment();
        } else {
            rejectedCounter.increment();
            logger.warn("Rejected location reading: {}", result.reason());
        }
        return result;
    }

    private ReadingCheck evaluate(LocationSample sample) {
        if (sample == null || sample.coordinate() == null) {
            return ReadingCheck.invalid("Location is missing");
        }

        Coordinate coordinate = sample.coordinate();
        if (!coordinate.hasValidLatitude()) {
            return ReadingCheck.invalid("Invalid latitude: " + coordinate.lat());
        }
        if (!coordinate.hasValidLongitude()) {
            return ReadingCheck.invalid("Invalid longitude: " + coordinate.lng());
        }

        AccuracyReport accuracy = sample.accuracy();
        if (accuracy == null) {
            return ReadingCheck.invalid("Accuracy report is missing");
        }
        double horizontal = accuracy.horizontalAccuracyMeters();
        if (Double.isNaN(horizontal) || horizontal < 0) {
            return ReadingCheck.invalid("Invalid horizontal accuracy: " + horizontal);
        }
        if (horizontal > config.getMaxHorizontalAccuracyMeters()) {
            return ReadingCheck.invalid(
                    String.format(
                            Locale.ROOT,
                            "Location accuracy %.1fm exceeds threshold %.1fm",
                            horizontal,
                            config.getMaxHorizontalAccuracyMeters()));
        }

        if (accuracy.capturedAt() == null) {
            return ReadingCheck.invalid("Fix timestamp is missing");
        }
        Duration skew = Duration.between(accuracy.capturedAt(), clock.instant()).abs();
        if (skew.compareTo(Duration.ofSeconds(config.getMaxFixAgeSeconds())) > 0) {
            return ReadingCheck.invalid(
                    String.format(
                            Locale.ROOT,
                            "Fix timestamp is %.1fs away from server time (limit %ds)",
                            TimeMath.toSeconds(skew),
                            config.getMaxFixAgeSeconds()));
        }

        Double speed = sample.speedMetersPerSecond();
        if (speed != null && speed > config.getMaxSpeedMetersPerSecond()) {
            return ReadingCheck.invalid(
                    String.format(
                            Locale.ROOT,
                            "Reported speed %.1fm/s exceeds plausible maximum %.1fm/s",
                            speed,
                            config.getMaxSpeedMetersPerSecond()));
        }

        return ReadingCheck.ok();
    }

    /** Result of the sanity check. {@code reason} is null when valid. */
    public record ReadingCheck(boolean valid, String reason) {
        public static ReadingCheck ok() {
            return new ReadingCheck(true, null);
        }

        public static ReadingCheck invalid(String reason) {
            return new ReadingCheck(false, reason);
        }
    }
}
