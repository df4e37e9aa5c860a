package com.detective.locationtrust.repository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Repository;

import com.detective.locationtrust.config.LocationTrustProperties;
import com.detective.locationtrust.dto.LocationSample;

/**
 * Process-local {@link PlayerHistoryStore}.
 *
 * <p>Each player's history is updated inside {@link ConcurrentHashMap#compute}, which locks only
 * that key, so appends for one player are serialized while different players never contend. The
 * store is bounded in two ways: histories idle for longer than the configured TTL are purged on a
 * schedule, and when the number of tracked players exceeds the configured maximum the
 * least-recently-touched history is dropped.
 */
@Repository
public class InMemoryPlayerHistoryStore implements PlayerHistoryStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPlayerHistoryStore.class);

    private final ConcurrentHashMap<String, PlayerHistory> histories = new ConcurrentHashMap<>();
    private final LocationTrustProperties.History config;
    private final Clock clock;

    public InMemoryPlayerHistoryStore(LocationTrustProperties properties, Clock clock) {
        this.config = properties.getHistory();
        this.clock = clock;
    }

    @Override
    public List<LocationSample> recordAndGetPrevious(
            String playerId, LocationSample sample, int lookback) {
        Instant now = clock.instant();
        AtomicReference<List<LocationSample>> previous = new AtomicReference<>(List.of());

        histories.compute(
                playerId,
                (key, history) -> {
                    PlayerHistory target =
                            history != null ? history : new PlayerHistory(config.getCapacityPerPlayer(), now);
                    previous.set(target.appendAndGetPrevious(sample, lookback, now));
                    return target;
                });

        enforcePlayerLimit();
        return previous.get();
    }

    @Override
    public List<LocationSample> recent(String playerId, int count) {
        PlayerHistory history = histories.get(playerId);
        return history == null ? List.of() : history.recent(count);
    }

    @Override
    public int size(String playerId) {
        PlayerHistory history = histories.get(playerId);
        return history == null ? 0 : history.size();
    }

    @Override
    public void clear(String playerId) {
        histories.remove(playerId);
        logger.debug("Cleared location history for player {}", playerId);
    }

    @Override
    public int trackedPlayerCount() {
        return histories.size();
    }

    /** Drops histories that have not been touched within the idle TTL. */
    @Scheduled(fixedDelayString = "${location-trust.history.purge-interval:PT5M}")
    public void purgeIdleHistories() {
        int removed = purgeIdleHistories(clock.instant());
        if (removed > 0) {
            logger.info(
                    "Purged {} idle player histories, {} still tracked", removed, histories.size());
        }
    }

    int purgeIdleHistories(Instant now) {
        Instant cutoff = now.minus(config.getIdleTtl());
        int removed = 0;
        for (String playerId : histories.keySet()) {
            // Re-checked under the key lock so a concurrent append keeps the history alive.
            PlayerHistory remaining =
                    histories.computeIfPresent(
                            playerId, (key, history) -> history.isIdleSince(cutoff) ? null : history);
            if (remaining == null) {
                removed++;
            }
        }
        return removed;
    }

    private void enforcePlayerLimit() {
        while (histories.size() > config.getMaxTrackedPlayers()) {
            Map.Entry<String, PlayerHistory> oldest = null;
            for (Map.Entry<String, PlayerHistory> entry : histories.entrySet()) {
                if (oldest == null
                        || entry.getValue().lastTouched().isBefore(oldest.getValue().lastTouched())) {
                    oldest = entry;
                }
            }
            if (oldest == null) {
                return;
            }
            if (histories.remove(oldest.getKey(), oldest.getValue())) {
                logger.debug(
                        "Tracked player limit {} reached, evicted history of player {}",
                        config.getMaxTrackedPlayers(),
                        oldest.getKey());
            }
        }
    }
}
