package com.libragraph.stageflow.pipelines.testing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.stage.StageContext;
import com.libragraph.stageflow.types.ItemStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * StageContext that records what a handler did instead of touching a store or queue.
 */
public class RecordingStageContext implements StageContext {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UUID jobId;
    private final String stage;
    private final int attempt;

    public final Map<String, JsonNode> outputs = new LinkedHashMap<>();
    public final Map<String, ItemStatus> items = new LinkedHashMap<>();
    public String advancedTo;
    public JsonNode advancedPayload;
    public JsonNode completedWith;
    public boolean completed;
    public int heartbeats;

    public RecordingStageContext(UUID jobId, String stage, int attempt) {
        this.jobId = jobId;
        this.stage = stage;
        this.attempt = attempt;
    }

    @Override
    public UUID jobId() {
        return jobId;
    }

    @Override
    public String queue() {
        return "test";
    }

    @Override
    public String stage() {
        return stage;
    }

    @Override
    public int attempt() {
        return attempt;
    }

    @Override
    public int maxAttempts() {
        return 5;
    }

    @Override
    public void heartbeat() {
        heartbeats++;
    }

    @Override
    public void saveOutput(Object output) {
        outputs.put(stage, objectMapper.valueToTree(output));
    }

    @Override
    public Optional<JsonNode> output(String stageName) {
        return Optional.ofNullable(outputs.get(stageName));
    }

    @Override
    public void upsertItem(String itemKey, ItemStatus status) {
        items.put(itemKey, status);
    }

    @Override
    public boolean advance(Object nextPayload) {
        return advance("next", nextPayload);
    }

    @Override
    public boolean advance(String nextStage, Object nextPayload) {
        advancedTo = nextStage;
        advancedPayload = objectMapper.valueToTree(nextPayload);
        return true;
    }

    @Override
    public boolean completeJob(Object result) {
        completed = true;
        completedWith = objectMapper.valueToTree(result);
        return true;
    }
}
