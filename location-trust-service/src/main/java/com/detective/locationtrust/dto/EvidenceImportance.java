package com.detective.locationtrust.dto;

/** How much an evidence item matters to the case; carries the base discovery score. */
public enum EvidenceImportance {
    CRITICAL(50),
    IMPORTANT(30),
    MISLEADING(20),
    BACKGROUND(10);

    private final int baseScore;

    EvidenceImportance(int baseScore) {
        this.baseScore = baseScore;
    }

    public int baseScore() {
        return baseScore;
    }
}
