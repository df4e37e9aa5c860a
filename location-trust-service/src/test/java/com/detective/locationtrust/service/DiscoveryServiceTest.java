package com.detective.locationtrust.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.detective.locationtrust.TestLocations;
import com.detective.locationtrust.dto.Coordinate;
import com.detective.locationtrust.dto.DiscoveryOutcome;
import com.detective.locationtrust.dto.DiscoveryStatus;
import com.detective.locationtrust.dto.Evidence;
import com.detective.locationtrust.dto.EvidenceImportance;
import com.detective.locationtrust.dto.GameSession;
import com.detective.locationtrust.dto.GameSessionUpdate;
import com.detective.locationtrust.dto.GameStatus;
import com.detective.locationtrust.dto.LocationSample;
import com.detective.locationtrust.dto.PoiType;
import com.detective.locationtrust.dto.TargetPoint;
import com.detective.locationtrust.dto.ValidationResult;
import com.detective.locationtrust.exception.DiscoveryPersistenceException;
import com.detective.locationtrust.repository.GameSessionRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("DiscoveryService Tests")
class DiscoveryServiceTest {

    private static final String GAME = "game-1";
    private static final String PLAYER = "player-1";
    private static final String EVIDENCE = "ev-knife";

    @Mock private GameSessionRepository sessionRepository;
    @Mock private DiscoveryCoordinator discoveryCoordinator;

    private DiscoveryService discoveryService;
    private LocationSample sample;

    @BeforeEach
    void setUp() {
        discoveryService =
                new DiscoveryService(
                        sessionRepository, discoveryCoordinator, TestLocations.defaultProperties());
        sample = TestLocations.fix(TestLocations.ORIGIN, 5.0);
    }

    private static Evidence evidenceAt(String id, double metersNorth) {
        return new Evidence(
                id,
                "Evidence " + id,
                "POI " + id,
                new TargetPoint(
                        TestLocations.north(TestLocations.ORIGIN, metersNorth),
                        PoiType.OTHER,
                        EvidenceImportance.IMPORTANT));
    }

    private static GameSession session(GameStatus status) {
        return GameSession.builder()
                .gameId(GAME)
                .playerId(PLAYER)
                .status(status)
                .evidenceList(List.of(evidenceAt(EVIDENCE, 5.0)))
                .build();
    }

    private void givenSession(GameSession session) {
        when(sessionRepository.get(GAME))
                .thenReturn(CompletableFuture.completedFuture(Optional.ofNullable(session)));
    }

    private static DiscoveryOutcome discovered(GameSession session) {
        return DiscoveryOutcome.discovered(
                EVIDENCE,
                45,
                null,
                "found",
                ValidationResult.accepted(1.0, 5.0, 0.0, null),
                session.toDiscoveryUpdate());
    }

    @Nested
    @DisplayName("Preconditions")
    class PreconditionTests {

        @Test
        @DisplayName("should report a missing game as not found")
        void shouldReportMissingGame() {
            givenSession(null);

            DiscoveryOutcome outcome = discoveryService.discoverEvidence(GAME, PLAYER, EVIDENCE, sample).join();

            assertThat(outcome.status()).isEqualTo(DiscoveryStatus.NOT_FOUND);
            verifyNoInteractions(discoveryCoordinator);
        }

        @Test
        @DisplayName("should not query the store for a blank game id")
        void shouldShortCircuitBlankGameId() {
            DiscoveryOutcome outcome = discoveryService.discoverEvidence(" ", PLAYER, EVIDENCE, sample).join();

            assertThat(outcome.status()).isEqualTo(DiscoveryStatus.NOT_FOUND);
            verifyNoInteractions(sessionRepository, discoveryCoordinator);
        }

        @Test
        @DisplayName("should reject a player who does not own the game")
        void shouldRejectPlayerMismatch() {
            givenSession(session(GameStatus.ACTIVE));

            DiscoveryOutcome outcome =
                    discoveryService.discoverEvidence(GAME, "intruder", EVIDENCE, sample).join();

            assertThat(outcome.status()).isEqualTo(DiscoveryStatus.PLAYER_MISMATCH);
            assertThat(outcome.success()).isFalse();
            verifyNoInteractions(discoveryCoordinator);
        }

        @Test
        @DisplayName("should reject discovery in a finished game")
        void shouldRejectInactiveGame() {
            givenSession(session(GameStatus.COMPLETED));

            DiscoveryOutcome outcome = discoveryService.discoverEvidence(GAME, PLAYER, EVIDENCE, sample).join();

            assertThat(outcome.status()).isEqualTo(DiscoveryStatus.GAME_NOT_ACTIVE);
            verifyNoInteractions(discoveryCoordinator);
        }
    }

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @Test
        @DisplayName("should persist a new discovery")
        void shouldPersistDiscovery() {
            GameSession session = session(GameStatus.ACTIVE);
            session.markDiscovered(EVIDENCE, 45, TestLocations.NOW);
            givenSession(session);
            when(discoveryCoordinator.attemptDiscovery(session, EVIDENCE, sample, PLAYER)).thenReturn(discovered(session));
            when(sessionRepository.update(eq(GAME), any())).thenReturn(CompletableFuture.completedFuture(null));

            DiscoveryOutcome outcome = discoveryService.discoverEvidence(GAME, PLAYER, EVIDENCE, sample).join();

            assertThat(outcome.status()).isEqualTo(DiscoveryStatus.DISCOVERED);
            ArgumentCaptor<GameSessionUpdate> update = ArgumentCaptor.forClass(GameSessionUpdate.class);
            verify(sessionRepository).update(eq(GAME), update.capture());
            assertThat(update.getValue().discoveredEvidence()).containsExactly(EVIDENCE);
            assertThat(update.getValue().discoveryScore()).isEqualTo(45);
            assertThat(update.getValue().updatedAt()).isEqualTo(TestLocations.NOW);
        }

        @Test
        @DisplayName("should persist the snapshot taken with the discovery, not later session state")
        void shouldPersistSnapshotFromOutcome() {
            GameSession session =
                    GameSession.builder()
                            .gameId(GAME)
                            .playerId(PLAYER)
                            .evidenceList(List.of(evidenceAt(EVIDENCE, 5.0), evidenceAt("ev-letter", 10.0)))
                            .build();
            session.markDiscovered(EVIDENCE, 45, TestLocations.NOW);
            DiscoveryOutcome outcome = discovered(session);
            // A second discovery lands before this request writes its update.
            session.markDiscovered("ev-letter", 36, TestLocations.NOW.plusSeconds(1));
            givenSession(session);
            when(discoveryCoordinator.attemptDiscovery(session, EVIDENCE, sample, PLAYER)).thenReturn(outcome);
            when(sessionRepository.update(eq(GAME), any())).thenReturn(CompletableFuture.completedFuture(null));

            discoveryService.discoverEvidence(GAME, PLAYER, EVIDENCE, sample).join();

            verify(sessionRepository).update(GAME, outcome.sessionUpdate());
            assertThat(outcome.sessionUpdate().discoveredEvidence()).containsExactly(EVIDENCE);
            assertThat(outcome.sessionUpdate().discoveryScore()).isEqualTo(45);
        }

        @Test
        @DisplayName("should not persist a rejected attempt")
        void shouldNotPersistRejection() {
            GameSession session = session(GameStatus.ACTIVE);
            givenSession(session);
            when(discoveryCoordinator.attemptDiscovery(session, EVIDENCE, sample, PLAYER))
                    .thenReturn(DiscoveryOutcome.failure(DiscoveryStatus.TOO_FAR, EVIDENCE, "too far"));

            DiscoveryOutcome outcome = discoveryService.discoverEvidence(GAME, PLAYER, EVIDENCE, sample).join();

            assertThat(outcome.status()).isEqualTo(DiscoveryStatus.TOO_FAR);
            verify(sessionRepository, never()).update(anyString(), any());
        }

        @Test
        @DisplayName("should not persist an idempotent repeat")
        void shouldNotPersistRepeat() {
            GameSession session = session(GameStatus.ACTIVE);
            givenSession(session);
            when(discoveryCoordinator.attemptDiscovery(session, EVIDENCE, sample, PLAYER))
                    .thenReturn(DiscoveryOutcome.alreadyDiscovered(EVIDENCE, "again"));

            DiscoveryOutcome outcome = discoveryService.discoverEvidence(GAME, PLAYER, EVIDENCE, sample).join();

            assertThat(outcome.success()).isTrue();
            verify(sessionRepository, never()).update(anyString(), any());
        }

        @Test
        @DisplayName("should surface a failed update as a persistence exception")
        void shouldSurfaceFailedUpdate() {
            GameSession session = session(GameStatus.ACTIVE);
            givenSession(session);
            when(discoveryCoordinator.attemptDiscovery(session, EVIDENCE, sample, PLAYER)).thenReturn(discovered(session));
            when(sessionRepository.update(eq(GAME), any()))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("store offline")));

            CompletableFuture<DiscoveryOutcome> future =
                    discoveryService.discoverEvidence(GAME, PLAYER, EVIDENCE, sample);

            assertThatThrownBy(future::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(DiscoveryPersistenceException.class)
                    .hasRootCauseMessage("store offline");
        }

        @Test
        @DisplayName("should surface a synchronously thrown update failure")
        void shouldSurfaceThrownUpdate() {
            GameSession session = session(GameStatus.ACTIVE);
            givenSession(session);
            when(discoveryCoordinator.attemptDiscovery(session, EVIDENCE, sample, PLAYER)).thenReturn(discovered(session));
            when(sessionRepository.update(eq(GAME), any())).thenThrow(new IllegalStateException("connection refused"));

            CompletableFuture<DiscoveryOutcome> future =
                    discoveryService.discoverEvidence(GAME, PLAYER, EVIDENCE, sample);

            assertThatThrownBy(future::join).hasCauseInstanceOf(DiscoveryPersistenceException.class);
            DiscoveryPersistenceException cause =
                    (DiscoveryPersistenceException) future.handle((v, e) -> e.getCause()).join();
            assertThat(cause.getGameId()).isEqualTo(GAME);
        }
    }

    @Nested
    @DisplayName("Nearby Evidence")
    class NearbyEvidenceTests {

        @Test
        @DisplayName("should list undiscovered evidence within the discovery radius")
        void shouldListNearbyEvidence() {
            GameSession session =
                    GameSession.builder()
                            .gameId(GAME)
                            .playerId(PLAYER)
                            .evidenceList(
                                    List.of(
                                            evidenceAt("ev-near", 30.0),
                                            evidenceAt("ev-far", 200.0),
                                            evidenceAt("ev-found", 10.0)))
                            .discoveredEvidence(List.of("ev-found"))
                            .build();
            givenSession(session);

            List<Evidence> nearby = discoveryService.findNearbyEvidence(GAME, TestLocations.ORIGIN).join();

            assertThat(nearby).extracting(Evidence::evidenceId).containsExactly("ev-near");
        }

        @Test
        @DisplayName("should return nothing for an unknown game")
        void shouldReturnNothingForUnknownGame() {
            givenSession(null);

            assertThat(discoveryService.findNearbyEvidence(GAME, TestLocations.ORIGIN).join()).isEmpty();
        }

        @Test
        @DisplayName("should reject an invalid position")
        void shouldRejectInvalidPosition() {
            assertThatThrownBy(() -> discoveryService.findNearbyEvidence(GAME, new Coordinate(100.0, 0.0)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> discoveryService.findNearbyEvidence(GAME, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
