package com.eainde.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoadmapAction(
        @JsonProperty("action")     String action,
        @JsonProperty("reason")     String reason,
        @JsonProperty("effort")     String effort,
        @JsonProperty("validation") String validation
) {}
