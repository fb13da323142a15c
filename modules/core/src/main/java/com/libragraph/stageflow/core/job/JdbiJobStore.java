package com.libragraph.stageflow.core.job;

import com.libragraph.stageflow.core.dao.JobDao;
import com.libragraph.stageflow.core.dao.JobEventDao;
import com.libragraph.stageflow.core.dao.JobItemDao;
import com.libragraph.stageflow.core.dao.StageLeaseRow;
import com.libragraph.stageflow.core.dao.StageOutputDao;
import com.libragraph.stageflow.types.ItemStatus;
import com.libragraph.stageflow.types.JobStatus;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * PostgreSQL-backed JobStore over {@code pipeline_job}, {@code job_event}, {@code job_item}
 * and {@code stage_output}. Timestamps come from the database clock.
 */
@ApplicationScoped
@IfBuildProperty(name = "stageflow.store.type", stringValue = "postgres", enableIfMissing = true)
public class JdbiJobStore implements JobStore {

    private static final Logger log = Logger.getLogger(JdbiJobStore.class);

    @Inject
    Jdbi jdbi;

    public JdbiJobStore() {
    }

    public JdbiJobStore(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public CreateResult createIfAbsent(NewJob job) {
        return call("create job", () -> jdbi.inTransaction(handle -> {
            JobDao dao = handle.attach(JobDao.class);
            Optional<JobRecord> inserted = dao.insert(job.id(), job.queue(), job.stage(), JobStatus.QUEUED,
                    job.payload(), job.priority(), job.maxAttempts(), job.retryDelaySeconds(),
                    job.dedupKey(), job.idempotencyKey());
            if (inserted.isPresent()) {
                return new CreateResult(inserted.get(), true);
            }
            Optional<JobRecord> existing = job.idempotencyKey() != null
                    ? dao.findByIdempotencyKey(job.queue(), job.idempotencyKey())
                    : Optional.empty();
            if (existing.isEmpty() && job.dedupKey() != null) {
                existing = dao.findActiveByDedupKey(job.queue(), job.dedupKey());
            }
            return existing.map(j -> new CreateResult(j, false))
                    .orElseThrow(() -> new StoreException("Job " + job.id() + " conflicts with an existing row"));
        }));
    }

    @Override
    public Optional<JobRecord> get(UUID id) {
        return call("get job", () -> jdbi.withExtension(JobDao.class, dao -> dao.findById(id)));
    }

    @Override
    public Optional<JobRecord> startStage(UUID id, String stage, String workerId, Duration lease) {
        return call("start stage", () -> jdbi.withExtension(JobDao.class, dao ->
                dao.startStage(id, stage, JobStatus.PROCESSING, workerId, seconds(lease))));
    }

    @Override
    public boolean heartbeat(UUID id, String workerId, Duration lease) {
        return call("heartbeat", () -> jdbi.withExtension(JobDao.class, dao ->
                dao.heartbeat(id, workerId, seconds(lease)) > 0));
    }

    @Override
    public boolean release(UUID id, String workerId) {
        return call("release", () -> jdbi.withExtension(JobDao.class, dao -> dao.release(id, workerId) > 0));
    }

    @Override
    public boolean advance(UUID id, String fromStage, String toStage, String payload) {
        return call("advance", () -> jdbi.withExtension(JobDao.class, dao ->
                dao.advance(id, fromStage, toStage, JobStatus.QUEUED, payload) > 0));
    }

    @Override
    public boolean complete(UUID id, String stage, String result) {
        return call("complete", () -> jdbi.withExtension(JobDao.class, dao ->
                dao.finish(id, stage, JobStatus.COMPLETED, result, null) > 0));
    }

    @Override
    public boolean fail(UUID id, String stage, String error) {
        return call("fail", () -> jdbi.withExtension(JobDao.class, dao ->
                dao.finish(id, stage, JobStatus.FAILED, null, error) > 0));
    }

    @Override
    public boolean recordRetry(UUID id, String stage, String error) {
        return call("record retry", () -> jdbi.withExtension(JobDao.class, dao ->
                dao.recordRetry(id, stage, JobStatus.QUEUED, error) > 0));
    }

    @Override
    public List<JobRecord> rescueStale(String queue, Instant staleBefore, int limit,
                                       UnaryOperator<String> resumeStage) {
        return call("rescue", () -> jdbi.inTransaction(handle -> {
            JobDao jobs = handle.attach(JobDao.class);
            JobItemDao items = handle.attach(JobItemDao.class);
            JobEventDao events = handle.attach(JobEventDao.class);

            List<JobRecord> rescued = new ArrayList<>();
            for (JobRecord stale : jobs.findStale(queue, staleBefore, limit)) {
                String stage = resumeStage.apply(stale.stage());
                JobRecord resumed = jobs.resume(stale.id(), stage, JobStatus.QUEUED);
                int reset = items.resetStatus(stale.id(), ItemStatus.PROCESSING, ItemStatus.PENDING);
                events.insert(stale.id(), queue, stage, EventType.RESCUED,
                        "Resumed from stage " + stale.stage() + " (status " + stale.status().label() + ")",
                        null, null, stale.attemptCount());
                log.debugf("Job %s rescued at stage %s (%d items reset)", stale.id(), stage, reset);
                rescued.add(resumed);
            }
            return rescued;
        }));
    }

    @Override
    public int clearExpiredLeases(Instant now) {
        return call("clear expired leases", () -> jdbi.withExtension(JobDao.class, dao ->
                dao.clearExpiredLeases(now)));
    }

    @Override
    public Map<String, Long> activeLeases(String queue) {
        List<StageLeaseRow> rows = call("count leases", () -> jdbi.withExtension(JobDao.class, dao ->
                dao.activeLeases(queue)));
        Map<String, Long> result = new LinkedHashMap<>();
        for (StageLeaseRow row : rows) {
            result.put(row.stage(), row.leases());
        }
        return result;
    }

    @Override
    public void appendEvent(JobEvent e) {
        call("append event", () -> {
            jdbi.useExtension(JobEventDao.class, dao -> dao.insert(e.jobId(), e.queue(), e.stage(), e.type(),
                    e.message(), e.metadata(), e.durationMs(), e.attempt()));
            return null;
        });
    }

    @Override
    public List<JobEvent> events(UUID jobId) {
        return call("read events", () -> jdbi.withExtension(JobEventDao.class, dao -> dao.findByJob(jobId)));
    }

    @Override
    public List<StageStats> stageStats(String queue, Instant since) {
        return call("stage stats", () -> jdbi.withExtension(JobEventDao.class, dao ->
                dao.stageStats(queue, since)));
    }

    @Override
    public void saveOutput(UUID jobId, String stage, String output) {
        call("save output", () -> {
            jdbi.useExtension(StageOutputDao.class, dao -> dao.upsert(jobId, stage, output));
            return null;
        });
    }

    @Override
    public Optional<String> output(UUID jobId, String stage) {
        return call("read output", () -> jdbi.withExtension(StageOutputDao.class, dao -> dao.find(jobId, stage)));
    }

    @Override
    public void upsertItem(UUID jobId, String itemKey, String stage, ItemStatus status) {
        call("upsert item", () -> {
            jdbi.useExtension(JobItemDao.class, dao -> dao.upsert(jobId, itemKey, stage, status));
            return null;
        });
    }

    @Override
    public List<JobItem> items(UUID jobId) {
        return call("read items", () -> jdbi.withExtension(JobItemDao.class, dao -> dao.findByJob(jobId)));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (JdbiException e) {
            throw new StoreException("Job store " + operation + " failed", e);
        }
    }

    private static double seconds(Duration d) {
        return d.toMillis() / 1000.0;
    }
}
