package com.libragraph.stageflow.pipelines.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Stage engine reply.
 *
 * @param status              {@code complete}, {@code pending}, {@code recheck} or {@code failed}
 * @param nextPayload         payload for the next stage; the current payload is carried forward when null
 * @param recheckAfterSeconds delay before the stage is polled again, for {@code recheck}
 * @param items               child item keys the stage produced, e.g. draft sections
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineResponse(
        @JsonProperty("status") String status,
        @JsonProperty("output") JsonNode output,
        @JsonProperty("next_payload") JsonNode nextPayload,
        @JsonProperty("recheck_after_seconds") Integer recheckAfterSeconds,
        @JsonProperty("items") List<String> items,
        @JsonProperty("error") String error
) {
    public static final String COMPLETE = "complete";
    public static final String PENDING = "pending";
    public static final String RECHECK = "recheck";
    public static final String FAILED = "failed";
}
