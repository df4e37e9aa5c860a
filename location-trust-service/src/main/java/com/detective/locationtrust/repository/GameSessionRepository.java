package com.detective.locationtrust.repository;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.detective.locationtrust.dto.GameSession;
import com.detective.locationtrust.dto.GameSessionUpdate;

/**
 * Session store collaborator. Implemented outside this engine (the game's datastore); calls may
 * be I/O-bound and may fail. Retrying a failed update is the caller's decision.
 *
 * <p>{@link #get} must return the authoritative in-process instance for a game id, so that the
 * per-game critical section in discovery actually guards the state that gets persisted.
 *
 * <p>Each {@link GameSessionUpdate} is a full snapshot taken inside that critical section, but
 * updates for one game may still arrive out of order. Discovered evidence only grows, so an
 * implementation keeps whichever snapshot lists more discovered items and drops the other.
 */
public interface GameSessionRepository {

    CompletableFuture<Optional<GameSession>> get(String gameId);

    CompletableFuture<Void> update(String gameId, GameSessionUpdate update);
}
