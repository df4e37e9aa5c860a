package com.detective.locationtrust.dto;

/**
 * What the request layer reports back to the player after a discovery attempt.
 *
 * @param success true for a new discovery and for the idempotent already-discovered case
 * @param status classified result
 * @param evidenceId the evidence the attempt targeted
 * @param bonusPoints points awarded by this attempt; zero unless status is DISCOVERED
 * @param nextClueText hint towards the remaining evidence, may be null
 * @param message player-facing message
 * @param distanceMeters raw distance to the evidence, zero when not computed
 * @param validation validation details, null when validation did not run
 * @param sessionUpdate session state captured together with the discovery; null unless DISCOVERED
 */
public record DiscoveryOutcome(
        boolean success,
        DiscoveryStatus status,
        String evidenceId,
        int bonusPoints,
        String nextClueText,
        String message,
        double distanceMeters,
        ValidationResult validation,
        GameSessionUpdate sessionUpdate) {

    public static DiscoveryOutcome discovered(
            String evidenceId,
            int bonusPoints,
            String nextClueText,
            String message,
            ValidationResult validation,
            GameSessionUpdate sessionUpdate) {
        return new DiscoveryOutcome(
                true,
                DiscoveryStatus.DISCOVERED,
                evidenceId,
                bonusPoints,
                nextClueText,
                message,
                validation.distanceToTargetMeters(),
                validation,
                sessionUpdate);
    }

    public static DiscoveryOutcome alreadyDiscovered(String evidenceId, String message) {
        return new DiscoveryOutcome(
                true, DiscoveryStatus.ALREADY_DISCOVERED, evidenceId, 0, null, message, 0.0, null, null);
    }

    public static DiscoveryOutcome failure(
            DiscoveryStatus status, String evidenceId, String message) {
        return new DiscoveryOutcome(false, status, evidenceId, 0, null, message, 0.0, null, null);
    }

    public static DiscoveryOutcome rejected(
            DiscoveryStatus status, String evidenceId, String message, ValidationResult validation) {
        return new DiscoveryOutcome(
                false,
                status,
                evidenceId,
                0,
                null,
                message,
                validation == null ? 0.0 : validation.distanceToTargetMeters(),
                validation,
                null);
    }
}
