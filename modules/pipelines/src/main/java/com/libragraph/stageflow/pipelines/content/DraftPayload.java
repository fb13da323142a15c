package com.libragraph.stageflow.pipelines.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Draft stage input as produced by the outline stage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DraftPayload(
        @JsonProperty("topic") String topic,
        @JsonProperty("sections") List<String> sections
) {}
