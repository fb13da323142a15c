package com.libragraph.stageflow.core.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves {@link QueueSettings} per pipeline.
 *
 * <p>Keys are {@code <pipeline>.queue.visibility} (seconds), {@code <pipeline>.queue.batch-size},
 * {@code <pipeline>.stage.max-attempts} and {@code <pipeline>.stage.retry-delay-seconds}, so the
 * content pipeline reads {@code CONTENT_QUEUE_VISIBILITY} etc. from the environment. Missing keys
 * fall back to {@code stageflow.defaults.*}, then to {@link QueueSettings#DEFAULTS}.
 */
@ApplicationScoped
public class PipelineSettings {

    @Inject
    Config config;

    private final Map<String, QueueSettings> resolved = new ConcurrentHashMap<>();

    public QueueSettings forPipeline(String pipeline) {
        return resolved.computeIfAbsent(pipeline, this::resolve);
    }

    private QueueSettings resolve(String pipeline) {
        QueueSettings d = QueueSettings.DEFAULTS;
        String prefix = pipeline.replace('-', '_');
        long visibility = lookup(prefix + ".queue.visibility", "stageflow.defaults.visibility",
                d.visibility().getSeconds());
        long batchSize = lookup(prefix + ".queue.batch-size", "stageflow.defaults.batch-size", d.batchSize());
        long maxAttempts = lookup(prefix + ".stage.max-attempts", "stageflow.defaults.max-attempts",
                d.maxAttempts());
        long retryDelay = lookup(prefix + ".stage.retry-delay-seconds", "stageflow.defaults.retry-delay-seconds",
                d.retryDelay().getSeconds());
        return new QueueSettings(Duration.ofSeconds(visibility), (int) batchSize, (int) maxAttempts,
                Duration.ofSeconds(retryDelay));
    }

    private long lookup(String key, String fallbackKey, long defaultValue) {
        return config.getOptionalValue(key, Long.class)
                .or(() -> config.getOptionalValue(fallbackKey, Long.class))
                .orElse(defaultValue);
    }
}
