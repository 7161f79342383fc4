package com.multila.backend.modules.tracking.domain.payload;

import java.util.Set;

/**
 * Learning-exercise events; they only share the requirement of an exercise id.
 */
public record ExercisePayload(String eventType, String exerciseId) implements EventPayload {

    public static final Set<String> TYPES = Set.of("exercise_hint", "exercise_submitted", "exercise_result");
}
