package com.multila.backend.modules.replay.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Message vocabulary of the replay channel and the side each inbound message must come from.
 */
public enum ReplayMessageType {
    EMBED_LOADED("embed_loaded", Source.CONTROLLER),
    INIT("init", Source.EMBED),
    PULLDATA("pulldata", Source.EMBED),
    REPLAYDATA("replaydata", null),
    APP_CONFIG("app_config", null),
    REPLAY_CTRL_PLAY("replay_ctrl_play", Source.CONTROLLER),
    REPLAY_CTRL_PAUSE("replay_ctrl_pause", Source.CONTROLLER),
    REPLAY_CTRL_STOP("replay_ctrl_stop", Source.CONTROLLER),
    SET_REPLAY_SPEED("set_replay_speed", Source.CONTROLLER),
    REPLAY_STOPPED("replay_stopped", Source.EMBED);

    public enum Source {
        EMBED,
        CONTROLLER
    }

    private final String wireName;
    private final Source expectedSource;

    ReplayMessageType(String wireName, Source expectedSource) {
        this.wireName = wireName;
        this.expectedSource = expectedSource;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Side allowed to send this message inbound, or null for outbound-only messages.
     */
    public Source expectedSource() {
        return expectedSource;
    }

    public static Optional<ReplayMessageType> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(type -> type.wireName.equals(wireName)).findFirst();
    }
}
