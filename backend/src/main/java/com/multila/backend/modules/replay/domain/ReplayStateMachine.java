package com.multila.backend.modules.replay.domain;

import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transition table of the replay channel between the controlling surface and the embedded application.
 *
 * <p>Every inbound message is checked against the origin of the side allowed to send it. Messages from
 * any other origin, of unknown type, or not valid in the current state are dropped without a transition
 * and without output.
 */
public class ReplayStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ReplayStateMachine.class);

    private static final Set<ReplayState> SERVING = EnumSet.of(ReplayState.IDLE, ReplayState.PLAYING, ReplayState.PAUSED);

    private final Duration reloadGracePeriod;

    public ReplayStateMachine(Duration reloadGracePeriod) {
        this.reloadGracePeriod = reloadGracePeriod;
    }

    public ReplayTransition handle(ReplayState state, String origin, String msgtype, Object data, ReplaySource source) {
        Optional<ReplayMessageType> parsed = ReplayMessageType.fromWireName(msgtype);
        if (parsed.isEmpty() || parsed.get().expectedSource() == null) {
            log.debug("Ignored replay message of unexpected type '{}'", msgtype);
            return ReplayTransition.ignored(state);
        }
        ReplayMessageType type = parsed.get();
        String expectedOrigin = type.expectedSource() == ReplayMessageType.Source.EMBED
                ? source.embedOrigin()
                : source.controllerOrigin();
        if (origin == null || !origin.equals(expectedOrigin)) {
            log.warn("Ignored replay message '{}' from foreign origin {}", msgtype, origin);
            return ReplayTransition.ignored(state);
        }

        ReplayTransition transition = switch (type) {
            case EMBED_LOADED -> state == ReplayState.UNINITIALIZED
                    ? ReplayTransition.to(ReplayState.AWAITING_CONFIG)
                    : null;
            case INIT -> state == ReplayState.UNINITIALIZED || state == ReplayState.AWAITING_CONFIG
                    ? ReplayTransition.to(ReplayState.IDLE,
                    OutboundMessage.toEmbed(ReplayMessageType.APP_CONFIG, source.recordedConfig()))
                    : null;
            case PULLDATA -> SERVING.contains(state) ? pullData(state, data, source) : null;
            case REPLAY_CTRL_PLAY -> state == ReplayState.IDLE || state == ReplayState.PAUSED
                    ? forward(ReplayState.PLAYING, type, data)
                    : null;
            case REPLAY_CTRL_PAUSE -> state == ReplayState.PLAYING
                    ? forward(ReplayState.PAUSED, type, data)
                    : null;
            case SET_REPLAY_SPEED -> SERVING.contains(state) && data instanceof Number
                    ? forward(state, type, data)
                    : null;
            case REPLAY_CTRL_STOP -> SERVING.contains(state)
                    ? stopped(OutboundMessage.toEmbed(type, data))
                    : null;
            case REPLAY_STOPPED -> SERVING.contains(state)
                    ? stopped(OutboundMessage.toController(type, data))
                    : null;
            default -> null;
        };

        if (transition == null) {
            log.debug("Ignored replay message '{}' in state {}", msgtype, state);
            return ReplayTransition.ignored(state);
        }
        return transition;
    }

    private ReplayTransition pullData(ReplayState state, Object data, ReplaySource source) {
        if (!(data instanceof Number number) || number.doubleValue() != Math.floor(number.doubleValue())
                || number.longValue() < 0) {
            return null;
        }
        long index = number.longValue();
        Optional<Map<String, Object>> event = index < source.eventCount() && index <= Integer.MAX_VALUE
                ? source.event((int) index)
                : Optional.empty();
        if (event.isEmpty()) {
            // past the last event: tell the embed to stop instead of serving stale data
            return ReplayTransition.to(state, OutboundMessage.toEmbed(ReplayMessageType.REPLAY_STOPPED, null));
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("i", index);
        payload.put("n_chunks", source.eventCount());
        payload.put("replaydata", event.get());
        return ReplayTransition.to(state, OutboundMessage.toEmbed(ReplayMessageType.REPLAYDATA, payload));
    }

    private static ReplayTransition forward(ReplayState next, ReplayMessageType type, Object data) {
        return ReplayTransition.to(next, OutboundMessage.toEmbed(type, data));
    }

    private ReplayTransition stopped(OutboundMessage notification) {
        return new ReplayTransition(true, ReplayState.STOPPED, List.of(notification), reloadGracePeriod);
    }
}
