package com.detective.locationtrust.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Game session state owned by the session store. The engine only reads the evidence list and
 * status, and changes the discovered-evidence list and discovery score through {@link
 * #markDiscovered(String, int, Instant)}.
 *
 * <p>Mutators and list views are synchronized on the instance so readers on other threads see a
 * consistent state; serializing whole discovery attempts is the job of {@code
 * DiscoveryCoordinator}.
 */
@Getter
@ToString
public class GameSession {

    private final String gameId;
    private final String playerId;
    private final GameStatus status;
    private final List<Evidence> evidenceList;

    @Getter(AccessLevel.NONE)
    private final List<String> discoveredEvidence;

    private int discoveryScore;
    private Instant updatedAt;

    @Builder
    public GameSession(
            String gameId,
            String playerId,
            GameStatus status,
            List<Evidence> evidenceList,
            List<String> discoveredEvidence,
            int discoveryScore,
            Instant updatedAt) {
        this.gameId = gameId;
        this.playerId = playerId;
        this.status = status == null ? GameStatus.ACTIVE : status;
        this.evidenceList = evidenceList == null ? List.of() : List.copyOf(evidenceList);
        this.discoveredEvidence =
                discoveredEvidence == null ? new ArrayList<>() : new ArrayList<>(discoveredEvidence);
        this.discoveryScore = discoveryScore;
        this.updatedAt = updatedAt;
    }

    public synchronized List<String> getDiscoveredEvidence() {
        return Collections.unmodifiableList(new ArrayList<>(discoveredEvidence));
    }

    public synchronized int getDiscoveryScore() {
        return discoveryScore;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return getStatus() == GameStatus.ACTIVE;
    }

    public synchronized boolean isDiscovered(String evidenceId) {
        return discoveredEvidence.contains(evidenceId);
    }

    public Optional<Evidence> findEvidence(String evidenceId) {
        if (evidenceId == null) {
            return Optional.empty();
        }
        return evidenceList.stream().filter(e -> evidenceId.equals(e.evidenceId())).findFirst();
    }

    /** Evidence not yet discovered, in the order the scenario listed it. */
    public synchronized List<Evidence> remainingEvidence() {
        return evidenceList.stream()
                .filter(e -> !discoveredEvidence.contains(e.evidenceId()))
                .toList();
    }

    /**
     * Marks an evidence item discovered and adds its bonus. One-way: a second call for the same id
     * changes nothing.
     *
     * @return true if the state changed
     */
    public synchronized boolean markDiscovered(String evidenceId, int bonusPoints, Instant now) {
        if (discoveredEvidence.contains(evidenceId)) {
            return false;
        }
        discoveredEvidence.add(evidenceId);
        discoveryScore += bonusPoints;
        updatedAt = now;
        return true;
    }

    /** Partial state to hand to the session store after a discovery. */
    public synchronized GameSessionUpdate toDiscoveryUpdate() {
        return new GameSessionUpdate(List.copyOf(discoveredEvidence), discoveryScore, updatedAt);
    }
}
