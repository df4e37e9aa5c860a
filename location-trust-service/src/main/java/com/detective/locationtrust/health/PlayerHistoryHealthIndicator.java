package com.detective.locationtrust.health;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.detective.locationtrust.config.LocationTrustProperties;
import com.detective.locationtrust.repository.PlayerHistoryStore;

/**
 * Reports how full the player location-history store is.
 *
 * <p>The store evicts the least-recently-active player when it reaches its limit, so a full store
 * stays UP. A warning detail is added from 80% occupancy.
 */
@Component("playerHistory")
public class PlayerHistoryHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(PlayerHistoryHealthIndicator.class);

    static final double WARNING_OCCUPANCY_RATIO = 0.8;

    private final PlayerHistoryStore historyStore;
    private final LocationTrustProperties.History config;

    public PlayerHistoryHealthIndicator(
            PlayerHistoryStore historyStore, LocationTrustProperties properties) {
        this.historyStore = historyStore;
        this.config = properties.getHistory();
    }

    @Override
    public Health health() {
        try {
            int tracked = historyStore.trackedPlayerCount();
            int max = config.getMaxTrackedPlayers();
            double occupancy = (double) tracked / max;

            Health.Builder builder = Health.up();
            if (occupancy >= WARNING_OCCUPANCY_RATIO) {
                builder.withDetail(
                        "warning",
                        String.format(
                                Locale.ROOT,
                                "Tracking %d of %d players (%.1f%%), idle players are evicted at the limit",
                                tracked,
                                max,
                                occupancy * 100));
            }

            return builder
                    .withDetail("trackedPlayers", tracked)
                    .withDetail("maxTrackedPlayers", max)
                    .withDetail("capacityPerPlayer", config.getCapacityPerPlayer())
                    .withDetail("idleTtl", config.getIdleTtl().toString())
                    .build();

        } catch (Exception e) {
            logger.error("Error checking player history store health", e);
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("reason", "Player history store could not be inspected")
                    .build();
        }
    }
}
