package com.detective.locationtrust.service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.springframework.stereotype.Service;

import com.detective.locationtrust.algorithm.util.GeoMath;
import com.detective.locationtrust.config.LocationTrustProperties;
import com.detective.locationtrust.dto.Coordinate;
import com.detective.locationtrust.dto.DiscoveryOutcome;
import com.detective.locationtrust.dto.DiscoveryStatus;
import com.detective.locationtrust.dto.Evidence;
import com.detective.locationtrust.dto.GameSession;
import com.detective.locationtrust.dto.GameSessionUpdate;
import com.detective.locationtrust.dto.LocationSample;
import com.detective.locationtrust.exception.DiscoveryPersistenceException;
import com.detective.locationtrust.repository.GameSessionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Session-level entry point for evidence discovery. Loads the session, checks that the game is
 * running and belongs to the player, hands the attempt to {@link DiscoveryCoordinator} and writes
 * a successful discovery back to the session store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscoveryService {

    static final String MESSAGE_GAME_NOT_FOUND = "Game session not found.";
    static final String MESSAGE_PLAYER_MISMATCH = "This game belongs to another player.";
    static final String MESSAGE_GAME_NOT_ACTIVE = "This game has already ended.";

    private final GameSessionRepository sessionRepository;
    private final DiscoveryCoordinator discoveryCoordinator;
    private final LocationTrustProperties properties;

    /**
     * Attempts to discover an evidence item for a player.
     *
     * <p>The returned future completes exceptionally with {@link DiscoveryPersistenceException} when
     * the discovery was accepted but the session store update failed. Retrying is up to the caller.
     *
     * @return future of the classified outcome
     */
    public CompletableFuture<DiscoveryOutcome> discoverEvidence(
            String gameId, String playerId, String evidenceId, LocationSample sample) {
        if (gameId == null || gameId.isBlank()) {
            return CompletableFuture.completedFuture(
                    DiscoveryOutcome.failure(DiscoveryStatus.NOT_FOUND, evidenceId, MESSAGE_GAME_NOT_FOUND));
        }

        return sessionRepository
                .get(gameId)
                .thenCompose(session -> discoverInSession(gameId, session, playerId, evidenceId, sample));
    }

    private CompletableFuture<DiscoveryOutcome> discoverInSession(
            String gameId,
            Optional<GameSession> maybeSession,
            String playerId,
            String evidenceId,
            LocationSample sample) {
        if (maybeSession.isEmpty()) {
            log.warn("Discovery for unknown game {}", gameId);
            return CompletableFuture.completedFuture(
                    DiscoveryOutcome.failure(DiscoveryStatus.NOT_FOUND, evidenceId, MESSAGE_GAME_NOT_FOUND));
        }

        GameSession session = maybeSession.get();
        if (playerId == null || !playerId.equals(session.getPlayerId())) {
            log.warn("Player {} attempted discovery in game {} owned by another player", playerId, gameId);
            return CompletableFuture.completedFuture(
                    DiscoveryOutcome.failure(
                            DiscoveryStatus.PLAYER_MISMATCH, evidenceId, MESSAGE_PLAYER_MISMATCH));
        }
        if (!session.isActive()) {
            return CompletableFuture.completedFuture(
                    DiscoveryOutcome.failure(
                            DiscoveryStatus.GAME_NOT_ACTIVE, evidenceId, MESSAGE_GAME_NOT_ACTIVE));
        }

        DiscoveryOutcome outcome =
                discoveryCoordinator.attemptDiscovery(session, evidenceId, sample, playerId);
        if (outcome.status() != DiscoveryStatus.DISCOVERED) {
            return CompletableFuture.completedFuture(outcome);
        }
        return persist(gameId, outcome.sessionUpdate()).thenApply(ignored -> outcome);
    }

    private CompletableFuture<Void> persist(String gameId, GameSessionUpdate update) {
        CompletableFuture<Void> pending;
        try {
            pending = sessionRepository.update(gameId, update);
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }

        return pending.handle(
                (ignored, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        log.error("Failed to persist discovery for game {}", gameId, cause);
                        throw new DiscoveryPersistenceException(
                                gameId, "Failed to persist discovery for game " + gameId, cause);
                    }
                    log.debug(
                            "Persisted discovery for game {}: {} items, score {}",
                            gameId,
                            update.discoveredEvidence().size(),
                            update.discoveryScore());
                    return null;
                });
    }

    /**
     * Undiscovered evidence within the discovery radius of a position. Unknown games have none.
     *
     * @throws IllegalArgumentException if the position is missing or out of range
     */
    public CompletableFuture<List<Evidence>> findNearbyEvidence(String gameId, Coordinate position) {
        if (position == null || !position.isValid()) {
            throw new IllegalArgumentException("A valid position is required, got " + position);
        }
        double radius = properties.getDiscovery().getBaseRadiusMeters();

        return sessionRepository
                .get(gameId)
                .thenApply(
                        maybeSession ->
                                maybeSession
                                        .map(session -> withinRadius(session.remainingEvidence(), position, radius))
                                        .orElse(List.of()));
    }

    private static List<Evidence> withinRadius(
            List<Evidence> candidates, Coordinate position, double radius) {
        return candidates.stream()
                .filter(e -> e.target() != null && e.target().coordinate() != null)
                .filter(e -> GeoMath.distance(position, e.target().coordinate()) <= radius)
                .toList();
    }
}
