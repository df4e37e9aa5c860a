package com.detective.locationtrust.dto;

/** The four independent anomaly flags raised by spoof detection. */
public record SpoofingIndicators(
        boolean suspiciousAccuracy,
        boolean impossibleMovement,
        boolean locationJump,
        boolean providerInconsistency) {

    public static final int INDICATOR_COUNT = 4;

    public static SpoofingIndicators none() {
        return new SpoofingIndicators(false, false, false, false);
    }

    public int countRaised() {
        int count = 0;
        if (suspiciousAccuracy) count++;
        if (impossibleMovement) count++;
        if (locationJump) count++;
        if (providerInconsistency) count++;
        return count;
    }

    public boolean anyRaised() {
        return countRaised() > 0;
    }
}
