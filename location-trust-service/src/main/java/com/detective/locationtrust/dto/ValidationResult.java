package com.detective.locationtrust.dto;

/**
 * Outcome of validating one fix against one target.
 *
 * <p>{@code accuracyAdjustedDistanceMeters} is never negative: it is the raw distance minus the
 * reported horizontal accuracy, floored at zero.
 */
public record ValidationResult(
        boolean valid,
        double confidenceScore,
        double distanceToTargetMeters,
        double accuracyAdjustedDistanceMeters,
        ValidationFailure failure,
        String reason,
        ValidationDiagnostics diagnostics) {

    public static ValidationResult accepted(
            double confidenceScore,
            double distance,
            double adjustedDistance,
            ValidationDiagnostics diagnostics) {
        return new ValidationResult(
                true, confidenceScore, distance, adjustedDistance, null, null, diagnostics);
    }

    public static ValidationResult rejected(
            ValidationFailure failure,
            String reason,
            double confidenceScore,
            double distance,
            double adjustedDistance,
            ValidationDiagnostics diagnostics) {
        return new ValidationResult(
                false, confidenceScore, distance, adjustedDistance, failure, reason, diagnostics);
    }

    /** Rejection before any distance was computed (bad reading or internal fault). */
    public static ValidationResult rejectedEarly(ValidationFailure failure, String reason) {
        return new ValidationResult(false, 0.0, 0.0, 0.0, failure, reason, null);
    }

    public boolean isWithinDiscoveryRange() {
        return diagnostics != null
                && accuracyAdjustedDistanceMeters <= diagnostics.discoveryRadiusMeters();
    }
}
