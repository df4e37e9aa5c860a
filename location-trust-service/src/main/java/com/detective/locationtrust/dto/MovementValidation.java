package com.detective.locationtrust.dto;

/**
 * Informational walking-pace check between the current fix and the player's previous one. It is
 * reported in diagnostics and never gates a discovery.
 */
public record MovementValidation(
        Status status,
        boolean withinWalkingSpeed,
        Double impliedSpeedMetersPerSecond,
        Double secondsElapsed,
        Double distanceMovedMeters) {

    public enum Status {
        NO_HISTORY,
        INVALID_TIME,
        MOVEMENT_CHECK
    }

    public static MovementValidation noHistory() {
        return new MovementValidation(Status.NO_HISTORY, true, null, null, null);
    }

    public static MovementValidation invalidTime(double secondsElapsed) {
        return new MovementValidation(Status.INVALID_TIME, false, null, secondsElapsed, null);
    }

    public static MovementValidation checked(
            double impliedSpeed, double secondsElapsed, double distanceMoved, double maxWalkingSpeed) {
        return new MovementValidation(
                Status.MOVEMENT_CHECK,
                impliedSpeed <= maxWalkingSpeed,
                impliedSpeed,
                secondsElapsed,
                distanceMoved);
    }
}
