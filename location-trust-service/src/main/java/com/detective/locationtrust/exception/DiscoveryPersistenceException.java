package com.detective.locationtrust.exception;

/**
 * Thrown when an accepted discovery could not be written back to the session store. The
 * in-process session already reflects the discovery, so a retry of the update is safe.
 */
public class DiscoveryPersistenceException extends RuntimeException {

    private final String gameId;

    public DiscoveryPersistenceException(String gameId, String message, Throwable cause) {
        super(message, cause);
        this.gameId = gameId;
    }

    public String getGameId() {
        return gameId;
    }
}
