package com.detective.locationtrust.service;

import java.time.Clock;
import java.time.Duration;

import org.springframework.stereotype.Service;

import com.detective.locationtrust.algorithm.AdaptiveRadiusAdvisor;
import com.detective.locationtrust.dto.AccuracyReport;
import com.detective.locationtrust.dto.LocationQualityInfo;
import com.detective.locationtrust.dto.LocationQualityInfo.QualityLevel;
import com.detective.locationtrust.dto.LocationSample;
import com.detective.locationtrust.dto.PoiType;

/** Describes how good a fix is, for the client to show next to the player's position. */
@Service
public class LocationQualityService {

    static final double EXCELLENT_ACCURACY_METERS = 5.0;
    static final double GOOD_ACCURACY_METERS = 10.0;
    static final double FAIR_ACCURACY_METERS = 25.0;
    static final Duration RELIABLE_FIX_AGE = Duration.ofSeconds(30);

    private final AdaptiveRadiusAdvisor radiusAdvisor;
    private final Clock clock;

    public LocationQualityService(AdaptiveRadiusAdvisor radiusAdvisor, Clock clock) {
        this.radiusAdvisor = radiusAdvisor;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if the sample has no accuracy report
     */
    public LocationQualityInfo describe(LocationSample sample) {
        if (sample == null || sample.accuracy() == null) {
            throw new IllegalArgumentException("Sample with an accuracy report is required");
        }
        AccuracyReport accuracy = sample.accuracy();
        double horizontal = accuracy.horizontalAccuracyMeters();

        return new LocationQualityInfo(
                qualityLevel(horizontal),
                horizontal,
                accuracy.provider(),
                accuracy.capturedAt(),
                accuracy.isAcceptableAccuracy() && isRecent(accuracy),
                radiusAdvisor.suggestedRadius(horizontal, PoiType.OTHER));
    }

    static QualityLevel qualityLevel(double horizontalAccuracyMeters) {
        if (horizontalAccuracyMeters <= EXCELLENT_ACCURACY_METERS) {
            return QualityLevel.EXCELLENT;
        }
        if (horizontalAccuracyMeters <= GOOD_ACCURACY_METERS) {
            return QualityLevel.GOOD;
        }
        if (horizontalAccuracyMeters <= FAIR_ACCURACY_METERS) {
            return QualityLevel.FAIR;
        }
        return QualityLevel.POOR;
    }

    private boolean isRecent(AccuracyReport accuracy) {
        if (accuracy.capturedAt() == null) {
            return false;
        }
        Duration age = Duration.between(accuracy.capturedAt(), clock.instant());
        return age.compareTo(RELIABLE_FIX_AGE) < 0;
    }
}
