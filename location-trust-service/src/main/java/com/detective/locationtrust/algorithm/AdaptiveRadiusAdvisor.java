package com.detective.locationtrust.algorithm;

import java.util.EnumMap;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.detective.locationtrust.config.LocationTrustProperties;
import com.detective.locationtrust.dto.LocationSample;
import com.detective.locationtrust.dto.PoiType;

/**
 * Suggests how close a player should get to a point of interest, taking the fix accuracy and the
 * size of the place into account.
 *
 * <p>The value is guidance for the player ("get within X m"). The accept/reject decision always
 * uses the fixed discovery radius; nothing here feeds into it.
 */
@Component
public class AdaptiveRadiusAdvisor {

    private static final double MAX_ACCURACY_FACTOR = 2.0;
    private static final double ACCURACY_STEP_METERS = 10.0;
    private static final double METERS_PER_ACCURACY_FACTOR = 10.0;
    private static final double DEFAULT_POI_MODIFIER = 1.0;

    // Large open places get a wider radius, small indoor venues a tighter one.
    private static final Map<PoiType, Double> POI_MODIFIERS = new EnumMap<>(PoiType.class);

    static {
        POI_MODIFIERS.put(PoiType.PARK, 1.5);
        POI_MODIFIERS.put(PoiType.LANDMARK, 1.3);
        POI_MODIFIERS.put(PoiType.STATION, 1.2);
        POI_MODIFIERS.put(PoiType.LIBRARY, 1.0);
        POI_MODIFIERS.put(PoiType.CAFE, 0.8);
        POI_MODIFIERS.put(PoiType.RESTAURANT, 0.8);
    }

    private final LocationTrustProperties properties;

    public AdaptiveRadiusAdvisor(LocationTrustProperties properties) {
        this.properties = properties;
    }

    public double suggestedRadius(LocationSample sample, PoiType poiType) {
        return suggestedRadius(sample.accuracy().horizontalAccuracyMeters(), poiType);
    }

    /**
     * @param horizontalAccuracyMeters reported accuracy of the player's fix
     * @param poiType category of the target place, may be null
     * @return advisory radius in meters, always within the configured [min, max] bounds
     */
    public double suggestedRadius(double horizontalAccuracyMeters, PoiType poiType) {
        double accuracyFactor =
                Math.min(MAX_ACCURACY_FACTOR, Math.max(0.0, horizontalAccuracyMeters) / ACCURACY_STEP_METERS);
        double radius =
                properties.getDiscovery().getBaseRadiusMeters()
                        + accuracyFactor * METERS_PER_ACCURACY_FACTOR;

        radius *= poiType == null ? DEFAULT_POI_MODIFIER : modifierFor(poiType);

        LocationTrustProperties.Radius bounds = properties.getRadius();
        if (Double.isNaN(radius)) {
            return bounds.getMinRadiusMeters();
        }
        return Math.max(bounds.getMinRadiusMeters(), Math.min(bounds.getMaxRadiusMeters(), radius));
    }

    static double modifierFor(PoiType poiType) {
        return POI_MODIFIERS.getOrDefault(poiType, DEFAULT_POI_MODIFIER);
    }
}
