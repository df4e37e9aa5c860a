package com.detective.locationtrust.dto;

/** An evidence item placed at a point of interest in the player's surroundings. */
public record Evidence(String evidenceId, String name, String poiName, TargetPoint target) {

    public EvidenceImportance importance() {
        return target == null ? EvidenceImportance.BACKGROUND : target.importance();
    }
}
