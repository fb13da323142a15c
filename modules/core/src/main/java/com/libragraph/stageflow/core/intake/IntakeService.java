package com.libragraph.stageflow.core.intake;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.config.QueueSettings;
import com.libragraph.stageflow.core.job.CreateResult;
import com.libragraph.stageflow.core.job.EventType;
import com.libragraph.stageflow.core.job.JobEvent;
import com.libragraph.stageflow.core.job.JobRecord;
import com.libragraph.stageflow.core.job.JobStore;
import com.libragraph.stageflow.core.job.NewJob;
import com.libragraph.stageflow.core.queue.EnqueueOptions;
import com.libragraph.stageflow.core.queue.MessageQueue;
import com.libragraph.stageflow.core.queue.QueueException;
import com.libragraph.stageflow.core.queue.StageMessage;
import com.libragraph.stageflow.core.stage.PipelineDefinition;
import com.libragraph.stageflow.core.stage.StageBinding;
import com.libragraph.stageflow.core.stage.StageRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.UUID;

/**
 * Admits new jobs into a pipeline.
 *
 * <p>A job is inserted at the pipeline's first stage and its first message enqueued.
 * Resubmitting with the same idempotency key, or while an active job with the same
 * natural key exists, returns the existing job without enqueueing anything.
 */
@ApplicationScoped
public class IntakeService {

    private static final Logger log = Logger.getLogger(IntakeService.class);

    @Inject
    StageRegistry registry;

    @Inject
    JobStore store;

    @Inject
    MessageQueue queue;

    @Inject
    ObjectMapper objectMapper;

    /**
     * @throws ValidationException when the pipeline is unknown or the request is unusable
     * @throws QueueException      when the job was stored but its first message could not be enqueued
     */
    public IntakeResult submit(String pipelineName, IntakeRequest request) {
        PipelineDefinition pipeline = registry.pipeline(pipelineName)
                .orElseThrow(() -> new ValidationException("Unknown pipeline: " + pipelineName));
        if (request == null || request.payload() == null || !request.payload().isObject()) {
            throw new ValidationException("payload must be a JSON object");
        }

        String firstStage = pipeline.firstStage();
        StageBinding binding = registry.binding(pipelineName, firstStage)
                .orElseThrow(() -> new IllegalStateException("No binding for first stage of " + pipelineName));
        QueueSettings settings = binding.settings();

        int priority = request.priority() != null ? request.priority() : 0;
        int maxAttempts = request.maxAttempts() != null ? request.maxAttempts() : settings.maxAttempts();
        int retryDelay = request.retryDelaySeconds() != null
                ? request.retryDelaySeconds() : (int) settings.retryDelay().getSeconds();
        if (maxAttempts <= 0) {
            throw new ValidationException("max_attempts must be positive");
        }
        if (retryDelay < 0) {
            throw new ValidationException("retry_delay_seconds must not be negative");
        }
        String idempotencyKey = blankToNull(request.idempotencyKey());

        PreparedIntake prepared = pipeline.prepareIntake(request.payload());

        CreateResult result = store.createIfAbsent(new NewJob(UUID.randomUUID(), pipelineName, firstStage,
                toJson(prepared.payload()), priority, maxAttempts, retryDelay,
                prepared.dedupKey(), idempotencyKey));
        JobRecord job = result.job();
        if (!result.created()) {
            log.infof("Intake for %s matched existing job %s (status=%s)",
                    pipelineName, job.id(), job.status().label());
            return IntakeResult.of(job, false);
        }

        store.appendEvent(JobEvent.of(job, EventType.QUEUED, "Job created"));
        try {
            queue.enqueue(pipelineName, new StageMessage(job.id(), firstStage, prepared.payload()),
                    EnqueueOptions.priority(priority));
        } catch (QueueException e) {
            log.errorf(e, "Job %s stored but first message not enqueued; rescue will resume it", job.id());
            throw e;
        }
        log.infof("Job %s created in %s at stage %s", job.id(), pipelineName, firstStage);
        return IntakeResult.of(job, true);
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ValidationException("payload is not serializable: " + e.getMessage());
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
