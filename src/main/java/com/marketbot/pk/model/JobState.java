package com.marketbot.pk.model;

public enum JobState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
