package com.multila.backend.modules.replay.domain;

import java.util.Map;
import java.util.Optional;

/**
 * What the state machine knows about the recording being replayed.
 */
public interface ReplaySource {

    String embedOrigin();

    String controllerOrigin();

    /** Configuration in effect when the session was recorded. */
    Map<String, Object> recordedConfig();

    long eventCount();

    /**
     * The {@code index}-th event in event-time order, ties broken by arrival.
     */
    Optional<Map<String, Object>> event(int index);
}
