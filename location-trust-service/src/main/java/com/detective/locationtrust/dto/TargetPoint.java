package com.detective.locationtrust.dto;

/** Server-held location of an evidence item. Read-only to the engine. */
public record TargetPoint(Coordinate coordinate, PoiType poiType, EvidenceImportance importance) {

    public TargetPoint {
        if (poiType == null) {
            poiType = PoiType.OTHER;
        }
        if (importance == null) {
            importance = EvidenceImportance.BACKGROUND;
        }
    }
}
