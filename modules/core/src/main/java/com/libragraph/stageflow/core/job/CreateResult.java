package com.libragraph.stageflow.core.job;

/**
 * Outcome of {@link JobStore#createIfAbsent}: the stored job and whether this call inserted it.
 */
public record CreateResult(JobRecord job, boolean created) {}
