package com.detective.locationtrust.repository.impl;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.detective.locationtrust.dto.GameSession;
import com.detective.locationtrust.dto.GameSessionUpdate;
import com.detective.locationtrust.repository.GameSessionRepository;

/**
 * Process-local session store. Holds the live {@link GameSession} instances, so {@link #get}
 * always hands out the authoritative object. Used when no external session store is configured.
 */
public class InMemoryGameSessionRepository implements GameSessionRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGameSessionRepository.class);

    private final Map<String, GameSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, GameSessionUpdate> lastUpdates = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Optional<GameSession>> get(String gameId) {
        if (gameId == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return CompletableFuture.completedFuture(Optional.ofNullable(sessions.get(gameId)));
    }

    @Override
    public CompletableFuture<Void> update(String gameId, GameSessionUpdate update) {
        if (!sessions.containsKey(gameId)) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No session stored for game " + gameId));
        }
        lastUpdates.merge(gameId, update, (stored, incoming) -> newer(gameId, stored, incoming));
        return CompletableFuture.completedFuture(null);
    }

    private static GameSessionUpdate newer(
            String gameId, GameSessionUpdate stored, GameSessionUpdate incoming) {
        if (incoming.discoveredEvidence().size() < stored.discoveredEvidence().size()) {
            logger.debug(
                    "Dropped stale update for game {}: {} items, stored {}",
                    gameId,
                    incoming.discoveredEvidence().size(),
                    stored.discoveredEvidence().size());
            return stored;
        }
        logger.debug("Stored discovery update for game {}: {}", gameId, incoming);
        return incoming;
    }

    /**
     * Stores a session, replacing any previous one with the same game id.
     *
     * @throws IllegalArgumentException if the session or its game id is null
     */
    public void save(GameSession session) {
        if (session == null || session.getGameId() == null) {
            throw new IllegalArgumentException("Session and game id cannot be null");
        }
        sessions.put(session.getGameId(), session);
        lastUpdates.remove(session.getGameId());
    }

    /** Most recent update written for a game, if any. */
    public Optional<GameSessionUpdate> lastUpdate(String gameId) {
        return Optional.ofNullable(lastUpdates.get(gameId));
    }
}
