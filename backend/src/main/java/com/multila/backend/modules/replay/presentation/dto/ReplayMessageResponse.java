package com.multila.backend.modules.replay.presentation.dto;

import java.util.List;

import com.multila.backend.modules.replay.domain.OutboundMessage;
import com.multila.backend.modules.replay.domain.ReplayState;
import com.multila.backend.modules.replay.domain.ReplayTransition;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReplayMessageResponse(
        ReplayState state,
        boolean accepted,
        boolean playing,
        List<OutboundMessageResponse> outbound,
        @JsonProperty("reload_live_after_ms") Long reloadLiveAfterMs
) {

    public static ReplayMessageResponse from(ReplayTransition transition) {
        return new ReplayMessageResponse(
                transition.state(),
                transition.accepted(),
                transition.playing(),
                transition.outbound().stream().map(OutboundMessageResponse::from).toList(),
                transition.reloadLiveAfter() != null ? transition.reloadLiveAfter().toMillis() : null
        );
    }

    public record OutboundMessageResponse(String target, String msgtype, Object data) {

        static OutboundMessageResponse from(OutboundMessage message) {
            return new OutboundMessageResponse(message.target().name().toLowerCase(), message.msgtype(), message.data());
        }
    }
}
