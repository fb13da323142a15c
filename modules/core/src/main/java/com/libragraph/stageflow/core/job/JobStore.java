package com.libragraph.stageflow.core.job;

import com.libragraph.stageflow.types.ItemStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Durable job table plus its audit trail, child items and stage outputs.
 *
 * <p>Every state change is a narrow, conditional update guarded on the job's current
 * stage and status; a {@code false} or empty return means the precondition no longer
 * held (another worker, Rescue, or a terminal transition got there first).
 * Implementations throw {@link StoreException} when the backing store is unavailable.
 */
public interface JobStore {

    /**
     * Inserts the job unless an active job with the same dedup key, or any job with the
     * same idempotency key, already exists in the queue; in that case returns the existing one.
     */
    CreateResult createIfAbsent(NewJob job);

    Optional<JobRecord> get(UUID id);

    /**
     * Leases the job for {@code stage}: status PROCESSING, attempt_count + 1, heartbeat now,
     * lock owner and lease expiry set. Empty when the job is terminal, at another stage,
     * has used all attempts, or is still leased by anyone (including {@code workerId}).
     */
    Optional<JobRecord> startStage(UUID id, String stage, String workerId, Duration lease);

    /** Refreshes heartbeat and lease expiry while {@code workerId} holds the lease. */
    boolean heartbeat(UUID id, String workerId, Duration lease);

    /** Clears the lock held by {@code workerId} without changing status or stage. */
    boolean release(UUID id, String workerId);

    /**
     * Moves a non-terminal job from {@code fromStage} to {@code toStage}: status QUEUED,
     * attempt_count reset, lock cleared, payload replaced when non-null.
     */
    boolean advance(UUID id, String fromStage, String toStage, String payload);

    boolean complete(UUID id, String stage, String result);

    boolean fail(UUID id, String stage, String error);

    /** Records a failed attempt that will be retried: status QUEUED, error set, lock cleared. */
    boolean recordRetry(UUID id, String stage, String error);

    /**
     * Resumes up to {@code limit} non-terminal jobs of {@code queue} whose heartbeat is older than
     * {@code staleBefore}, oldest first. Each job, its non-terminal items and a RESCUED event are
     * updated together; the stage is mapped through {@code resumeStage}.
     *
     * @return the resumed jobs as stored after the update
     */
    List<JobRecord> rescueStale(String queue, Instant staleBefore, int limit, UnaryOperator<String> resumeStage);

    /** Clears locks whose lease expired before {@code now}. Returns the number released. */
    int clearExpiredLeases(Instant now);

    /** Jobs of {@code queue} currently holding a lease, keyed by stage. */
    Map<String, Long> activeLeases(String queue);

    void appendEvent(JobEvent event);

    List<JobEvent> events(UUID jobId);

    List<StageStats> stageStats(String queue, Instant since);

    /** Upserts the output of {@code stage}; repeated writes replace the previous value. */
    void saveOutput(UUID jobId, String stage, String output);

    Optional<String> output(UUID jobId, String stage);

    void upsertItem(UUID jobId, String itemKey, String stage, ItemStatus status);

    List<JobItem> items(UUID jobId);
}
