package com.multila.backend.modules.registry.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DefaultSessionResponse(@JsonProperty("sess_code") String sessCode) {
}
