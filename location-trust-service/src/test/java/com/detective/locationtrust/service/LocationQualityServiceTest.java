package com.detective.locationtrust.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.detective.locationtrust.TestLocations;
import com.detective.locationtrust.algorithm.AdaptiveRadiusAdvisor;
import com.detective.locationtrust.dto.LocationProvider;
import com.detective.locationtrust.dto.LocationQualityInfo;
import com.detective.locationtrust.dto.LocationQualityInfo.QualityLevel;
import com.detective.locationtrust.dto.LocationSample;

@DisplayName("LocationQualityService Tests")
class LocationQualityServiceTest {

    private LocationQualityService qualityService;

    @BeforeEach
    void setUp() {
        qualityService =
                new LocationQualityService(
                        new AdaptiveRadiusAdvisor(TestLocations.defaultProperties()),
                        TestLocations.fixedClock());
    }

    private static LocationSample fix(double accuracy, long ageSeconds) {
        return TestLocations.fix(
                TestLocations.ORIGIN,
                accuracy,
                TestLocations.NOW.minusSeconds(ageSeconds),
                LocationProvider.NETWORK);
    }

    @Test
    @DisplayName("should grade accuracy into four levels")
    void shouldGradeAccuracy() {
        assertEquals(QualityLevel.EXCELLENT, qualityService.describe(fix(3.0, 0)).qualityLevel());
        assertEquals(QualityLevel.EXCELLENT, qualityService.describe(fix(5.0, 0)).qualityLevel());
        assertEquals(QualityLevel.GOOD, qualityService.describe(fix(10.0, 0)).qualityLevel());
        assertEquals(QualityLevel.FAIR, qualityService.describe(fix(25.0, 0)).qualityLevel());
        assertEquals(QualityLevel.POOR, qualityService.describe(fix(26.0, 0)).qualityLevel());
    }

    @Test
    @DisplayName("should describe a fresh acceptable fix as reliable")
    void shouldDescribeReliableFix() {
        LocationQualityInfo info = qualityService.describe(fix(20.0, 5));

        assertTrue(info.reliable());
        assertEquals(20.0, info.accuracyMeters());
        assertEquals(LocationProvider.NETWORK, info.provider());
        assertEquals(TestLocations.NOW.minusSeconds(5), info.capturedAt());
        assertEquals(70.0, info.recommendedRadiusMeters(), 1e-9);
    }

    @Test
    @DisplayName("should not call an old or imprecise fix reliable")
    void shouldRejectOldOrImpreciseFix() {
        assertFalse(qualityService.describe(fix(5.0, 30)).reliable());
        assertFalse(qualityService.describe(fix(60.0, 0)).reliable());
        assertFalse(
                qualityService
                        .describe(TestLocations.fix(TestLocations.ORIGIN, 5.0, null, LocationProvider.GPS))
                        .reliable());
    }

    @Test
    @DisplayName("should require an accuracy report")
    void shouldRequireAccuracy() {
        assertThrows(
                IllegalArgumentException.class,
                () -> qualityService.describe(LocationSample.of(TestLocations.ORIGIN, null)));
    }
}
