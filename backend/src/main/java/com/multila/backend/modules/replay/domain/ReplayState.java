package com.multila.backend.modules.replay.domain;

public enum ReplayState {
    UNINITIALIZED,
    AWAITING_CONFIG,
    IDLE,
    PLAYING,
    PAUSED,
    STOPPED
}
