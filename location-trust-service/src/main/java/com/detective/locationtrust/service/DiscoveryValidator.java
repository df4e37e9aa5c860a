package com.detective.locationtrust.service;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.detective.locationtrust.algorithm.AdaptiveRadiusAdvisor;
import com.detective.locationtrust.algorithm.ConfidenceScorer;
import com.detective.locationtrust.algorithm.util.GeoMath;
import com.detective.locationtrust.config.LocationTrustProperties;
import com.detective.locationtrust.dto.LocationSample;
import com.detective.locationtrust.dto.MovementValidation;
import com.detective.locationtrust.dto.TargetPoint;
import com.detective.locationtrust.dto.ValidationDiagnostics;
import com.detective.locationtrust.dto.ValidationFailure;
import com.detective.locationtrust.dto.ValidationResult;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Decides whether a fix is close and trustworthy enough to discover a target.
 *
 * <p>Flow:
 *
 * <ol>
 *   <li>Basic sanity checks ({@link ReadingGuard}); a failure returns immediately
 *   <li>Great-circle distance to the target
 *   <li>Confidence score from accuracy, distance, fix age and provider
 *   <li>Accuracy-adjusted distance: distance minus reported accuracy, floored at zero
 *   <li>Accept when the adjusted distance is within the fixed discovery radius and the confidence
 *       reaches the minimum
 * </ol>
 *
 * <p>The advisory radius from {@link AdaptiveRadiusAdvisor} is attached to the diagnostics for the
 * player-facing message only. Any unexpected fault rejects the attempt.
 */
@Service
public class DiscoveryValidator {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryValidator.class);

    private static final String ERROR_MALFORMED_TARGET = "Target location is missing or malformed";
    private static final String ERROR_INTERNAL = "Location could not be validated";

    private final ReadingGuard readingGuard;
    private final ConfidenceScorer confidenceScorer;
    private final AdaptiveRadiusAdvisor radiusAdvisor;
    private final LocationTrustProperties.Discovery config;
    private final MeterRegistry meterRegistry;

    public DiscoveryValidator(
            ReadingGuard readingGuard,
            ConfidenceScorer confidenceScorer,
            AdaptiveRadiusAdvisor radiusAdvisor,
            LocationTrustProperties properties,
            MeterRegistry meterRegistry) {
        this.readingGuard = readingGuard;
        this.confidenceScorer = confidenceScorer;
        this.radiusAdvisor = radiusAdvisor;
        this.config = properties.getDiscovery();
        this.meterRegistry = meterRegistry;
    }

    public ValidationResult validate(LocationSample sample, TargetPoint target) {
        return validate(sample, target, null);
    }

    /**
     * Validates a fix against a target.
     *
     * @param sample the player's fix
     * @param target the evidence location
     * @param movement walking-pace check to attach to the diagnostics, may be null
     * @return the decision with distances, confidence and diagnostics
     */
    public ValidationResult validate(
            LocationSample sample, TargetPoint target, MovementValidation movement) {
        ValidationResult result;
        try {
            result = doValidate(sample, target, movement);
        } catch (RuntimeException e) {
            logger.error("Unexpected error validating discovery, rejecting", e);
            result = ValidationResult.rejectedEarly(ValidationFailure.INTERNAL_ERROR, ERROR_INTERNAL);
        }
        record(result);
        return result;
    }

    private ValidationResult doValidate(
            LocationSample sample, TargetPoint target, MovementValidation movement) {
        ReadingGuard.ReadingCheck check = readingGuard.check(sample);
        if (!check.valid()) {
            return ValidationResult.rejectedEarly(ValidationFailure.INVALID_READING, check.reason());
        }

        if (target == null || target.coordinate() == null || !target.coordinate().isValid()) {
            logger.error("{}: {}", ERROR_MALFORMED_TARGET, target);
            return ValidationResult.rejectedEarly(
                    ValidationFailure.INTERNAL_ERROR, ERROR_MALFORMED_TARGET);
        }

        double accuracy = sample.accuracy().horizontalAccuracyMeters();
        double distance = GeoMath.distance(sample.coordinate(), target.coordinate());
        double secondsSinceFix = confidenceScorer.secondsSinceFix(sample.accuracy().capturedAt());
        double confidence = confidenceScorer.score(sample, distance, secondsSinceFix);
        double adjustedDistance = Math.max(0.0, distance - accuracy);

        ValidationDiagnostics diagnostics =
                new ValidationDiagnostics(
                        distance,
                        accuracy,
                        sample.accuracy().isHighAccuracy(),
                        secondsSinceFix,
                        sample.provider(),
                        radiusAdvisor.suggestedRadius(accuracy, target.poiType()),
                        config.getBaseRadiusMeters(),
                        movement);

        logger.debug(
                "Discovery check: distance={}m, adjusted={}m, confidence={}, diagnostics={}",
                distance,
                adjustedDistance,
                confidence,
                diagnostics);

        if (adjustedDistance > config.getBaseRadiusMeters()) {
            return ValidationResult.rejected(
                    ValidationFailure.TOO_FAR,
                    String.format(
                            Locale.ROOT,
                            "Accuracy-adjusted distance %.1fm exceeds discovery radius %.1fm",
                            adjustedDistance,
                            config.getBaseRadiusMeters()),
                    confidence,
                    distance,
                    adjustedDistance,
                    diagnostics);
        }
        if (confidence < config.getMinConfidence()) {
            return ValidationResult.rejected(
                    ValidationFailure.LOW_CONFIDENCE,
                    String.format(
                            Locale.ROOT,
                            "Confidence %.2f is below required %.2f",
                            confidence,
                            config.getMinConfidence()),
                    confidence,
                    distance,
                    adjustedDistance,
                    diagnostics);
        }

        return ValidationResult.accepted(confidence, distance, adjustedDistance, diagnostics);
    }

    private void record(ValidationResult result) {
        String outcome = result.valid() ? "accepted" : result.failure().name().toLowerCase(Locale.ROOT);
        meterRegistry.counter("location.trust.validation", "outcome", outcome).increment();
    }
}
