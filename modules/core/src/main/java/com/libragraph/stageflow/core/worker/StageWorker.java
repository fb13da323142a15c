package com.libragraph.stageflow.core.worker;

import com.libragraph.stageflow.core.queue.MessageQueue;
import com.libragraph.stageflow.core.queue.QueueMessage;
import com.libragraph.stageflow.core.stage.StageBinding;
import com.libragraph.stageflow.core.stage.StageOutcome;
import com.libragraph.stageflow.core.stage.StageRegistry;
import com.libragraph.stageflow.core.stage.StageRunner;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Entry point for a stage worker invocation: lease a batch, then process it.
 */
@ApplicationScoped
public class StageWorker {

    private static final Logger log = Logger.getLogger(StageWorker.class);

    @Inject
    StageRegistry registry;

    @Inject
    MessageQueue queue;

    @Inject
    StageRunner runner;

    @Inject
    BackgroundTaskSupervisor supervisor;

    /**
     * Leases up to {@code batchSize} messages and processes them in the background.
     *
     * @param batchSize overrides the configured batch size when non-null and positive
     * @throws UnknownWorkerException when no stage is registered under {@code workerName}
     * @throws com.libragraph.stageflow.core.queue.QueueException when the dequeue fails
     */
    public TriggerResult trigger(String workerName, Integer batchSize) {
        StageBinding binding = binding(workerName);
        List<QueueMessage> batch = lease(binding, batchSize);
        if (batch.isEmpty()) {
            log.debugf("Worker %s: queue empty", workerName);
            return TriggerResult.empty(workerName);
        }
        supervisor.submit(workerName + "#" + batch.get(0).msgId(), () -> runner.processBatch(binding, batch));
        log.infof("Worker %s: accepted %d messages", workerName, batch.size());
        return TriggerResult.accepted(workerName, batch.size());
    }

    /** Leases and processes one batch in the calling thread. */
    public List<StageOutcome> runOnce(String workerName) {
        StageBinding binding = binding(workerName);
        List<QueueMessage> batch = lease(binding, null);
        if (batch.isEmpty()) {
            return List.of();
        }
        return runner.processBatch(binding, batch);
    }

    private StageBinding binding(String workerName) {
        return registry.worker(workerName).orElseThrow(() -> new UnknownWorkerException(workerName));
    }

    private List<QueueMessage> lease(StageBinding binding, Integer batchSize) {
        int size = batchSize != null && batchSize > 0 ? batchSize : binding.settings().batchSize();
        return queue.dequeueBatch(binding.queue(), binding.settings().visibility(), size);
    }
}
