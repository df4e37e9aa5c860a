package com.detective.locationtrust.service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.detective.locationtrust.dto.DiscoveryOutcome;
import com.detective.locationtrust.dto.DiscoveryStatus;
import com.detective.locationtrust.dto.Evidence;
import com.detective.locationtrust.dto.GameSession;
import com.detective.locationtrust.dto.LocationSample;
import com.detective.locationtrust.dto.SpoofingAssessment;
import com.detective.locationtrust.dto.ValidationDiagnostics;
import com.detective.locationtrust.dto.ValidationFailure;
import com.detective.locationtrust.dto.ValidationResult;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies a discovery attempt to a game session.
 *
 * <p>Every attempt for a game runs under the lock stripe its game id hashes to, so two concurrent
 * requests for the same evidence resolve to one {@link DiscoveryStatus#DISCOVERED} and one {@link
 * DiscoveryStatus#ALREADY_DISCOVERED}, and points are awarded once. The stripe count is fixed;
 * unrelated games may share a stripe. Steps, in order:
 *
 * <ol>
 *   <li>Evidence already discovered: idempotent success, no points
 *   <li>Evidence not in the session: {@link DiscoveryStatus#NOT_FOUND}
 *   <li>Spoofing assessment; a flagged fix is rejected with a generic message
 *   <li>Location validation; a rejection reports distance, accuracy and the advisory radius
 *   <li>Scoring, next clue, then the state change and a snapshot of the resulting session state
 * </ol>
 *
 * <p>The game-status precondition belongs to the caller ({@link DiscoveryService}).
 */
@Service
@Slf4j
public class DiscoveryCoordinator {

    static final double CLOSE_RANGE_METERS = 10.0;
    static final double NEAR_RANGE_METERS = 30.0;
    static final double STANDARD_RANGE_METERS = 50.0;

    static final double CLOSE_RANGE_MULTIPLIER = 1.5;
    static final double NEAR_RANGE_MULTIPLIER = 1.2;
    static final double STANDARD_RANGE_MULTIPLIER = 1.0;
    static final double FAR_RANGE_MULTIPLIER = 0.8;

    static final String MESSAGE_ALREADY_DISCOVERED = "This evidence has already been discovered.";
    static final String MESSAGE_NOT_FOUND = "The requested evidence does not exist in this game.";
    static final String MESSAGE_LOCATION_ISSUE =
            "There seems to be an issue with your location. Check that location services are"
                    + " enabled and try again.";
    static final String MESSAGE_INTERNAL_ERROR =
            "The discovery could not be processed. Please try again.";
    static final String MESSAGE_ALL_FOUND =
            "All evidence has been found. Time to start your deduction.";

    private static final int MAX_CLUE_LOCATIONS = 2;
    private static final int CLUE_REMAINING_THRESHOLD = 3;

    static final int LOCK_STRIPES = 64;

    private final SpoofDetector spoofDetector;
    private final DiscoveryValidator discoveryValidator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final ReentrantLock[] gameLocks;

    public DiscoveryCoordinator(
            SpoofDetector spoofDetector,
            DiscoveryValidator discoveryValidator,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.spoofDetector = spoofDetector;
        this.discoveryValidator = discoveryValidator;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        this.gameLocks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < gameLocks.length; i++) {
            gameLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Attempts to discover one evidence item.
     *
     * @param session the authoritative session instance for the game
     * @param evidenceId evidence the player claims to have reached
     * @param sample the player's current fix
     * @param playerId player whose location history is consulted
     * @return classified outcome; never null, never thrown for expected conditions
     */
    public DiscoveryOutcome attemptDiscovery(
            GameSession session, String evidenceId, LocationSample sample, String playerId) {
        if (session == null || session.getGameId() == null) {
            log.error("Discovery attempted without a game session for evidence {}", evidenceId);
            return record(DiscoveryOutcome.failure(
                    DiscoveryStatus.INTERNAL_ERROR, evidenceId, MESSAGE_INTERNAL_ERROR));
        }

        String gameId = session.getGameId();
        ReentrantLock lock = lockFor(gameId);

        DiscoveryOutcome outcome;
        lock.lock();
        try {
            outcome = attemptLocked(session, evidenceId, sample, playerId);
        } catch (RuntimeException e) {
            log.error("Unexpected error during discovery of {} in game {}", evidenceId, gameId, e);
            outcome = DiscoveryOutcome.failure(
                    DiscoveryStatus.INTERNAL_ERROR, evidenceId, MESSAGE_INTERNAL_ERROR);
        } finally {
            lock.unlock();
        }

        log.info(
                "Discovery attempt game={} player={} evidence={} -> {}",
                gameId,
                playerId,
                evidenceId,
                outcome.status());
        return record(outcome);
    }

    private DiscoveryOutcome attemptLocked(
            GameSession session, String evidenceId, LocationSample sample, String playerId) {
        if (session.isDiscovered(evidenceId)) {
            return DiscoveryOutcome.alreadyDiscovered(evidenceId, MESSAGE_ALREADY_DISCOVERED);
        }

        Evidence evidence = session.findEvidence(evidenceId).orElse(null);
        if (evidence == null) {
            return DiscoveryOutcome.failure(DiscoveryStatus.NOT_FOUND, evidenceId, MESSAGE_NOT_FOUND);
        }

        SpoofingAssessment assessment = spoofDetector.assess(sample, playerId);
        if (assessment.likelySpoofed()) {
            return DiscoveryOutcome.failure(
                    DiscoveryStatus.LIKELY_SPOOFED, evidenceId, MESSAGE_LOCATION_ISSUE);
        }

        ValidationResult validation =
                discoveryValidator.validate(sample, evidence.target(), assessment.movement());
        if (!validation.valid()) {
            return DiscoveryOutcome.rejected(
                    DiscoveryStatus.fromValidationFailure(validation.failure()),
                    evidenceId,
                    rejectionMessage(validation),
                    validation);
        }

        int bonusPoints = bonusPoints(evidence, validation.distanceToTargetMeters());
        String nextClue = nextClue(session, evidenceId);
        String message =
                String.format(
                        Locale.ROOT,
                        "Evidence \"%s\" discovered! +%d points",
                        evidence.name(),
                        bonusPoints);

        // Last step: nothing above may leave a half-applied discovery behind.
        if (!session.markDiscovered(evidenceId, bonusPoints, clock.instant())) {
            return DiscoveryOutcome.alreadyDiscovered(evidenceId, MESSAGE_ALREADY_DISCOVERED);
        }
        return DiscoveryOutcome.discovered(
                evidenceId, bonusPoints, nextClue, message, validation, session.toDiscoveryUpdate());
    }

    ReentrantLock lockFor(String gameId) {
        return gameLocks[Math.floorMod(gameId.hashCode(), gameLocks.length)];
    }

    int lockCount() {
        return gameLocks.length;
    }

    /** Base score of the evidence importance scaled by how close the player got. */
    static int bonusPoints(Evidence evidence, double distanceMeters) {
        return (int) (evidence.importance().baseScore() * distanceMultiplier(distanceMeters));
    }

    static double distanceMultiplier(double distanceMeters) {
        if (distanceMeters <= CLOSE_RANGE_METERS) {
            return CLOSE_RANGE_MULTIPLIER;
        }
        if (distanceMeters <= NEAR_RANGE_METERS) {
            return NEAR_RANGE_MULTIPLIER;
        }
        if (distanceMeters <= STANDARD_RANGE_METERS) {
            return STANDARD_RANGE_MULTIPLIER;
        }
        return FAR_RANGE_MULTIPLIER;
    }

    /**
     * Hint based on what will remain once {@code discoveredId} is marked.
     *
     * @return the hint, or null when more than three items remain
     */
    static String nextClue(GameSession session, String discoveredId) {
        List<Evidence> remaining =
                session.remainingEvidence().stream()
                        .filter(e -> !discoveredId.equals(e.evidenceId()))
                        .toList();

        if (remaining.isEmpty()) {
            return MESSAGE_ALL_FOUND;
        }
        if (remaining.size() == 1) {
            return "The last piece of evidence seems to be near " + remaining.get(0).poiName() + ".";
        }
        if (remaining.size() <= CLUE_REMAINING_THRESHOLD) {
            String places =
                    remaining.stream()
                            .limit(MAX_CLUE_LOCATIONS)
                            .map(Evidence::poiName)
                            .collect(Collectors.joining(", "));
            return "Search around " + places + " for the remaining evidence.";
        }
        return null;
    }

    static String rejectionMessage(ValidationResult validation) {
        ValidationDiagnostics diagnostics = validation.diagnostics();
        if (diagnostics == null) {
            if (validation.failure() == ValidationFailure.INVALID_READING) {
                return "Your location could not be verified: " + validation.reason();
            }
            return MESSAGE_INTERNAL_ERROR;
        }

        String position =
                String.format(
                        Locale.ROOT,
                        "You are %.1fm from the evidence (GPS accuracy %.1fm). Get within %.1fm to"
                                + " search the area.",
                        diagnostics.rawDistanceMeters(),
                        diagnostics.gpsAccuracyMeters(),
                        diagnostics.advisoryRadiusMeters());
        if (validation.failure() == ValidationFailure.LOW_CONFIDENCE) {
            return "Your location signal is too weak to confirm the discovery. " + position;
        }
        return position;
    }

    private DiscoveryOutcome record(DiscoveryOutcome outcome) {
        meterRegistry
                .counter("location.trust.discovery.outcome", "status", outcome.status().name())
                .increment();
        return outcome;
    }
}
