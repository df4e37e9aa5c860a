package com.detective.locationtrust.dto;

import java.time.Instant;
import java.util.List;

/** Partial session state written back to the session store after a successful discovery. */
public record GameSessionUpdate(
        List<String> discoveredEvidence, int discoveryScore, Instant updatedAt) {}
