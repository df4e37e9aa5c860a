package com.detective.locationtrust.repository;

import java.util.List;

import com.detective.locationtrust.dto.LocationSample;

/**
 * Keyed store of recent fixes per player, consulted by spoof detection.
 *
 * <p>Implementations must make {@link #recordAndGetPrevious} atomic per player so concurrent
 * requests for the same player (retries, several devices) see a consistent history. A shared
 * low-latency cache can back this interface when the engine runs in more than one process.
 */
public interface PlayerHistoryStore {

    /**
     * Appends a fix to the player's history and returns the fixes that preceded it.
     *
     * @param playerId player key
     * @param sample fix to append
     * @param lookback maximum number of previous fixes to return
     * @return up to {@code lookback} previous fixes, oldest first; empty for a new player
     */
    List<LocationSample> recordAndGetPrevious(String playerId, LocationSample sample, int lookback);

    /** Up to {@code count} of the player's latest fixes, oldest first. */
    List<LocationSample> recent(String playerId, int count);

    int size(String playerId);

    void clear(String playerId);

    int trackedPlayerCount();
}
