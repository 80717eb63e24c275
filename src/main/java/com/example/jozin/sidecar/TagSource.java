package com.example.jozin.sidecar;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TagSource {
    @JsonProperty("ml")
    ML,
    @JsonProperty("rules")
    RULES,
    @JsonProperty("user")
    USER
}
