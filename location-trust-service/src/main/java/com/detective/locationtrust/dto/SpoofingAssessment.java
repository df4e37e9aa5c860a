package com.detective.locationtrust.dto;

/**
 * Result of inspecting one fix against the player's recent history.
 *
 * @param likelySpoofed true if any indicator was raised
 * @param indicators individual anomaly flags
 * @param riskScore fraction of indicators raised, in [0,1]
 * @param movement informational walking-pace check computed from the same history snapshot
 */
public record SpoofingAssessment(
        boolean likelySpoofed,
        SpoofingIndicators indicators,
        double riskScore,
        MovementValidation movement) {

    public static SpoofingAssessment from(SpoofingIndicators indicators, MovementValidation movement) {
        return new SpoofingAssessment(
                indicators.anyRaised(),
                indicators,
                (double) indicators.countRaised() / SpoofingIndicators.INDICATOR_COUNT,
                movement);
    }
}
