package com.multila.backend.modules.replay.domain;

public record OutboundMessage(ReplayMessageType.Source target, String msgtype, Object data) {

    public static OutboundMessage toEmbed(ReplayMessageType type, Object data) {
        return new OutboundMessage(ReplayMessageType.Source.EMBED, type.wireName(), data);
    }

    public static OutboundMessage toController(ReplayMessageType type, Object data) {
        return new OutboundMessage(ReplayMessageType.Source.CONTROLLER, type.wireName(), data);
    }
}
