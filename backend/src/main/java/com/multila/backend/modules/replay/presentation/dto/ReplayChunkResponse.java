package com.multila.backend.modules.replay.presentation.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplayChunkResponse(
        Integer i,
        Map<String, Object> replaydata,
        @JsonProperty("n_chunks") Long nChunks
) {
}
