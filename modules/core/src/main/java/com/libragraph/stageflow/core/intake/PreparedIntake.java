package com.libragraph.stageflow.core.intake;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Intake payload after pipeline validation.
 *
 * @param payload  first-stage payload, with any resolved external references filled in
 * @param dedupKey natural key identifying the logical request, or null when the pipeline has none
 */
public record PreparedIntake(JsonNode payload, String dedupKey) {}
