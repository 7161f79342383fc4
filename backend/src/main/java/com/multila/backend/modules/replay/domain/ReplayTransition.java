package com.multila.backend.modules.replay.domain;

import java.time.Duration;
import java.util.List;

/**
 * Result of handling one inbound message. An ignored message leaves the state unchanged and produces no
 * outbound messages.
 */
public record ReplayTransition(
        boolean accepted,
        ReplayState state,
        List<OutboundMessage> outbound,
        Duration reloadLiveAfter
) {

    public static ReplayTransition ignored(ReplayState state) {
        return new ReplayTransition(false, state, List.of(), null);
    }

    public static ReplayTransition to(ReplayState state, OutboundMessage... outbound) {
        return new ReplayTransition(true, state, List.of(outbound), null);
    }

    public boolean playing() {
        return state == ReplayState.PLAYING;
    }
}
