package com.libragraph.stageflow.core.rescue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.intake.ValidationException;
import com.libragraph.stageflow.core.job.JobRecord;
import com.libragraph.stageflow.core.job.JobStore;
import com.libragraph.stageflow.core.queue.EnqueueOptions;
import com.libragraph.stageflow.core.queue.MessageQueue;
import com.libragraph.stageflow.core.queue.QueueException;
import com.libragraph.stageflow.core.queue.StageMessage;
import com.libragraph.stageflow.core.stage.PipelineDefinition;
import com.libragraph.stageflow.core.stage.StageRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Resumes jobs whose heartbeat went stale: their worker died, or their next message
 * was never enqueued.
 *
 * <p>Each job is reset (stage mapped through the pipeline's rescue table, status QUEUED,
 * lease cleared, heartbeat refreshed) and its stage message re-enqueued. The refreshed
 * heartbeat makes a second run within the age window a no-op.
 */
@ApplicationScoped
public class RescueService {

    private static final Logger log = Logger.getLogger(RescueService.class);

    @Inject
    StageRegistry registry;

    @Inject
    JobStore store;

    @Inject
    MessageQueue queue;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    public RescueResult rescue(RescueRequest request) {
        if (request == null || request.jobType() == null || request.jobType().isBlank()) {
            throw new ValidationException("job_type is required");
        }
        PipelineDefinition pipeline = registry.pipeline(request.jobType())
                .orElseThrow(() -> new ValidationException("Unknown job_type: " + request.jobType()));
        int minAge = request.minAgeOrDefault();
        int maxJobs = request.maxJobsOrDefault();
        if (minAge < 0) {
            throw new ValidationException("min_age_minutes must not be negative");
        }
        if (maxJobs <= 0) {
            throw new ValidationException("max_jobs must be positive");
        }

        Instant now = clock.instant();
        Instant staleBefore = now.minus(Duration.ofMinutes(minAge));
        List<JobRecord> rescued = store.rescueStale(pipeline.name(), staleBefore, maxJobs, pipeline::rescueStage);

        List<UUID> ids = new ArrayList<>(rescued.size());
        for (JobRecord job : rescued) {
            ids.add(job.id());
            try {
                queue.enqueue(pipeline.name(), new StageMessage(job.id(), job.stage(), readPayload(job)),
                        EnqueueOptions.priority(job.priority()));
            } catch (QueueException e) {
                log.errorf(e, "Rescued job %s not re-enqueued; it will be picked up again in %d minutes",
                        job.id(), minAge);
            }
            log.infof("Rescued job %s in %s at stage %s", job.id(), pipeline.name(), job.stage());
        }

        String message = rescued.isEmpty()
                ? "No stale jobs found"
                : "Rescued " + rescued.size() + " stale " + pipeline.name() + " jobs";
        if (!rescued.isEmpty()) {
            log.warnf("%s (older than %d minutes)", message, minAge);
        }
        return new RescueResult(true, message,
                new RescueResult.Data(pipeline.name(), rescued.size(), List.copyOf(ids)), now);
    }

    private JsonNode readPayload(JobRecord job) {
        if (job.payload() == null) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(job.payload());
        } catch (JsonProcessingException e) {
            log.warnf("Job %s has unreadable payload; re-enqueued with an empty one", job.id());
            return objectMapper.createObjectNode();
        }
    }
}
