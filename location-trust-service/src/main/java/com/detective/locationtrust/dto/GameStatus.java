package com.detective.locationtrust.dto;

public enum GameStatus {
    ACTIVE,
    COMPLETED,
    ABANDONED,
    EXPIRED
}
