package com.example.jozin;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScanAction {
    @JsonProperty("written")
    WRITTEN,
    @JsonProperty("skipped")
    SKIPPED,
    @JsonProperty("failed")
    FAILED
}
