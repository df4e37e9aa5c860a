package com.detective.locationtrust.dto;

import java.util.Locale;

/** Category of the point of interest an evidence item is hidden at. */
public enum PoiType {
    RESTAURANT,
    PARK,
    LANDMARK,
    CAFE,
    STATION,
    SHOP,
    OFFICE,
    SCHOOL,
    HOSPITAL,
    LIBRARY,
    OTHER;

    public static PoiType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
