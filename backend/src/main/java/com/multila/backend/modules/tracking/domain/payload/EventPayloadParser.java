package com.multila.backend.modules.tracking.domain.payload;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks an event value against the shape its type requires.
 */
public final class EventPayloadParser {

    private EventPayloadParser() {
    }

    /**
     * @param value decoded JSON value (map, list, scalar) or null. Only known types constrain its shape.
     * @throws MalformedEventException when the value does not fit the shape required by {@code eventType}
     */
    public static EventPayload parse(String eventType, Object value) {
        if (eventType == null || eventType.isBlank()) {
            throw new MalformedEventException(eventType, "event type is required");
        }
        if (MousePayload.TYPE.equals(eventType)) {
            return parseMouse(requireValue(eventType, value));
        }
        if (DeviceInfoUpdatePayload.TYPE.equals(eventType)) {
            return parseDeviceInfoUpdate(requireValue(eventType, value));
        }
        if (VisibilityPayload.TYPE.equals(eventType)) {
            return parseVisibility(requireValue(eventType, value));
        }
        if (ExercisePayload.TYPES.contains(eventType)) {
            Object id = requireValue(eventType, value).get("id");
            if (id == null || id.toString().isBlank()) {
                throw new MalformedEventException(eventType, "exercise id is required");
            }
            return new ExercisePayload(eventType, id.toString());
        }
        return new OpaquePayload(eventType);
    }

    private static MousePayload parseMouse(Map<String, Object> value) {
        if (!(value.get("frames") instanceof List<?> rawFrames)) {
            throw new MalformedEventException(MousePayload.TYPE, "frames must be an array");
        }
        List<List<Object>> frames = new ArrayList<>(rawFrames.size());
        for (Object rawFrame : rawFrames) {
            if (!(rawFrame instanceof List<?> frame) || frame.size() < 2) {
                throw new MalformedEventException(MousePayload.TYPE, "each frame must be an array of at least two items");
            }
            if (!(frame.get(0) instanceof String kind) || kind.length() != 1) {
                throw new MalformedEventException(MousePayload.TYPE, "frame kind must be a single letter");
            }
            if (!(frame.get(frame.size() - 1) instanceof Number)) {
                throw new MalformedEventException(MousePayload.TYPE, "frame must end with a numeric time offset");
            }
            frames.add(new ArrayList<>(frame));
        }
        if (!(value.get("timeElapsed") instanceof Number elapsed) || elapsed.doubleValue() < 0) {
            throw new MalformedEventException(MousePayload.TYPE, "timeElapsed must be a non-negative number");
        }
        return new MousePayload(frames, elapsed.doubleValue());
    }

    private static DeviceInfoUpdatePayload parseDeviceInfoUpdate(Map<String, Object> value) {
        if (!(value.get("window_size") instanceof List<?> size) || size.size() != 2) {
            throw new MalformedEventException(DeviceInfoUpdatePayload.TYPE, "window_size must be [width, height]");
        }
        int width = positiveInt(size.get(0));
        int height = positiveInt(size.get(1));
        return new DeviceInfoUpdatePayload(width, height, optionalString(value, "form_factor"),
                optionalString(value, "user_agent"));
    }

    private static VisibilityPayload parseVisibility(Map<String, Object> value) {
        Object state = value.get("state");
        if ("visible".equals(state)) {
            return new VisibilityPayload(true);
        }
        if ("hidden".equals(state)) {
            return new VisibilityPayload(false);
        }
        throw new MalformedEventException(VisibilityPayload.TYPE, "state must be 'visible' or 'hidden'");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> requireValue(String eventType, Object value) {
        if (value == null) {
            throw new MalformedEventException(eventType, "event value is required for type " + eventType);
        }
        if (!(value instanceof Map)) {
            throw new MalformedEventException(eventType, "event value for type " + eventType + " must be a JSON object");
        }
        return (Map<String, Object>) value;
    }

    private static int positiveInt(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            long number = ((Number) raw).longValue();
            if (number > 0 && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        throw new MalformedEventException(DeviceInfoUpdatePayload.TYPE, "window size must be positive integers");
    }

    private static String optionalString(Map<String, Object> value, String key) {
        Object raw = value.get(key);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof String text)) {
            throw new MalformedEventException(DeviceInfoUpdatePayload.TYPE, key + " must be a string");
        }
        return text;
    }
}
