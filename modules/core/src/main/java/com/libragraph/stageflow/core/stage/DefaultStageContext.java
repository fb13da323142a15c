package com.libragraph.stageflow.core.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.job.EventType;
import com.libragraph.stageflow.core.job.JobEvent;
import com.libragraph.stageflow.core.job.JobRecord;
import com.libragraph.stageflow.core.job.JobStore;
import com.libragraph.stageflow.core.queue.EnqueueOptions;
import com.libragraph.stageflow.core.queue.MessageQueue;
import com.libragraph.stageflow.core.queue.QueueMessage;
import com.libragraph.stageflow.core.queue.StageMessage;
import com.libragraph.stageflow.types.ItemStatus;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.UUID;

class DefaultStageContext implements StageContext {

    private static final Logger log = Logger.getLogger(DefaultStageContext.class);

    private final JobRecord job;
    private final QueueMessage message;
    private final StageBinding binding;
    private final JobStore store;
    private final MessageQueue queue;
    private final ObjectMapper objectMapper;
    private final String workerId;

    DefaultStageContext(JobRecord job, QueueMessage message, StageBinding binding, JobStore store,
                        MessageQueue queue, ObjectMapper objectMapper, String workerId) {
        this.job = job;
        this.message = message;
        this.binding = binding;
        this.store = store;
        this.queue = queue;
        this.objectMapper = objectMapper;
        this.workerId = workerId;
    }

    @Override
    public UUID jobId() {
        return job.id();
    }

    @Override
    public String queue() {
        return binding.queue();
    }

    @Override
    public String stage() {
        return binding.stage();
    }

    @Override
    public int attempt() {
        return job.attemptCount();
    }

    @Override
    public int maxAttempts() {
        return job.maxAttempts();
    }

    @Override
    public void heartbeat() {
        store.heartbeat(job.id(), workerId, binding.settings().visibility());
        queue.extendVisibility(binding.queue(), message.msgId(), binding.settings().visibility());
    }

    @Override
    public void saveOutput(Object output) {
        store.saveOutput(job.id(), binding.stage(), toJson(output));
    }

    @Override
    public Optional<JsonNode> output(String stage) {
        return store.output(job.id(), stage).map(this::readTree);
    }

    @Override
    public void upsertItem(String itemKey, ItemStatus status) {
        store.upsertItem(job.id(), itemKey, binding.stage(), status);
    }

    @Override
    public boolean advance(Object nextPayload) {
        String next = binding.pipeline().nextStage(binding.stage())
                .orElseThrow(() -> new IllegalStateException(
                        "Stage '" + binding.stage() + "' is the last stage of " + binding.queue()));
        return advance(next, nextPayload);
    }

    @Override
    public boolean advance(String nextStage, Object nextPayload) {
        if (!binding.pipeline().stages().contains(nextStage)) {
            throw new IllegalArgumentException("Unknown stage '" + nextStage + "' in pipeline " + binding.queue());
        }
        JsonNode payload = nextPayload instanceof JsonNode node ? node : objectMapper.valueToTree(nextPayload);
        String payloadJson = toJson(payload);

        boolean advanced = store.advance(job.id(), binding.stage(), nextStage, payloadJson);
        if (!advanced) {
            // A previous delivery may have advanced the job and died before enqueueing.
            Optional<JobRecord> current = store.get(job.id());
            if (current.isEmpty() || current.get().status().isTerminal()
                    || !current.get().stage().equals(nextStage)) {
                log.debugf("Job %s not advanced from %s to %s (moved on)", job.id(), binding.stage(), nextStage);
                return false;
            }
        }

        queue.enqueue(binding.queue(), new StageMessage(job.id(), nextStage, payload),
                EnqueueOptions.priority(job.priority()));
        if (advanced) {
            store.appendEvent(JobEvent.of(job, EventType.QUEUED, "Advanced to " + nextStage).atStage(nextStage));
        }
        return true;
    }

    @Override
    public boolean completeJob(Object result) {
        boolean completed = store.complete(job.id(), binding.stage(), toJson(result));
        if (completed) {
            store.appendEvent(JobEvent.of(job, EventType.COMPLETED, "Job completed"));
        }
        return completed;
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FatalStageException("Failed to serialize: " + value.getClass().getName(), e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FatalStageException("Corrupt stage output for job " + job.id(), e);
        }
    }
}
