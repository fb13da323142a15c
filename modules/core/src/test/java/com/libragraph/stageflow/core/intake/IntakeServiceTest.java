package com.libragraph.stageflow.core.intake;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.stageflow.core.job.EventType;
import com.libragraph.stageflow.core.job.JobEvent;
import com.libragraph.stageflow.core.job.JobRecord;
import com.libragraph.stageflow.core.queue.EnqueueOptions;
import com.libragraph.stageflow.core.queue.InMemoryMessageQueue;
import com.libragraph.stageflow.core.queue.QueueException;
import com.libragraph.stageflow.core.queue.QueueMessage;
import com.libragraph.stageflow.core.queue.StageMessage;
import com.libragraph.stageflow.core.testing.PipelineHarness;
import com.libragraph.stageflow.core.testing.TestPipeline;
import com.libragraph.stageflow.types.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntakeServiceTest {

    PipelineHarness h;
    IntakeService intake;

    @BeforeEach
    void setUp() {
        h = new PipelineHarness();
        h.register(new TestPipeline("content", "research", "outline"));
        intake = service(h.queue);
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    IntakeService service(InMemoryMessageQueue queue) {
        IntakeService s = new IntakeService();
        s.registry = h.registry;
        s.store = h.store;
        s.queue = queue;
        s.objectMapper = h.objectMapper;
        return s;
    }

    ObjectNode payload(String key) {
        return h.objectMapper.createObjectNode().put("key", key).put("topic", "queues");
    }

    @Test
    void submit_createsJobAtFirstStageAndEnqueues() {
        IntakeResult result = intake.submit("content",
                new IntakeRequest(payload("t-1"), 3, null, null, null));

        assertThat(result.success()).isTrue();
        assertThat(result.created()).isTrue();
        assertThat(result.stage()).isEqualTo("research");
        assertThat(result.status()).isEqualTo(JobStatus.QUEUED.label());

        JobRecord job = h.job(result.jobId());
        assertThat(job.maxAttempts()).isEqualTo(5);
        assertThat(job.retryDelaySeconds()).isEqualTo(60);
        assertThat(job.priority()).isEqualTo(3);
        assertThat(job.dedupKey()).isEqualTo("t-1");
        assertThat(h.store.events(job.id())).extracting(JobEvent::type).containsExactly(EventType.QUEUED);

        List<QueueMessage> messages = h.queue.dequeueBatch("content", Duration.ofSeconds(30), 10);
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).priority()).isEqualTo(3);
        assertThat(messages.get(0).body().stage()).isEqualTo("research");
        assertThat(messages.get(0).body().payload().get("topic").asText()).isEqualTo("queues");
    }

    @Test
    void submit_sameNaturalKeyReturnsExistingJob() {
        IntakeResult first = intake.submit("content", IntakeRequest.of(payload("t-1")));
        IntakeResult second = intake.submit("content", IntakeRequest.of(payload("t-1")));

        assertThat(second.created()).isFalse();
        assertThat(second.jobId()).isEqualTo(first.jobId());
        assertThat(h.queue.dequeueBatch("content", Duration.ofSeconds(30), 10)).hasSize(1);
    }

    @Test
    void submit_idempotencyKeyReturnsExistingJob() {
        IntakeResult first = intake.submit("content",
                new IntakeRequest(payload("a"), null, null, null, "req-1"));
        IntakeResult second = intake.submit("content",
                new IntakeRequest(payload("b"), null, null, null, "req-1"));

        assertThat(second.created()).isFalse();
        assertThat(second.jobId()).isEqualTo(first.jobId());
    }

    @Test
    void submit_requestOverridesRetrySettings() {
        IntakeResult result = intake.submit("content",
                new IntakeRequest(payload("t-2"), null, 2, 0, "  "));

        JobRecord job = h.job(result.jobId());
        assertThat(job.maxAttempts()).isEqualTo(2);
        assertThat(job.retryDelaySeconds()).isZero();
        assertThat(job.idempotencyKey()).isNull();
    }

    @Test
    void submit_rejectsUnusableRequests() {
        assertThatThrownBy(() -> intake.submit("nope", IntakeRequest.of(payload("x"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown pipeline");
        assertThatThrownBy(() -> intake.submit("content", IntakeRequest.of(h.objectMapper.createArrayNode())))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> intake.submit("content", IntakeRequest.of(null)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> intake.submit("content", new IntakeRequest(payload("x"), null, 0, null, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("max_attempts");
        assertThatThrownBy(() -> intake.submit("content", new IntakeRequest(payload("x"), null, null, -1, null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("retry_delay_seconds");
        assertThat(h.queue.depth("content")).isEmpty();
    }

    @Test
    void submit_enqueueFailureLeavesJobForRescue() {
        InMemoryMessageQueue broken = new InMemoryMessageQueue(h.clock) {
            @Override
            public synchronized OptionalLong enqueue(String queue, StageMessage message, EnqueueOptions options) {
                throw new QueueException("queue down");
            }
        };
        IntakeService failing = service(broken);

        assertThatThrownBy(() -> failing.submit("content", IntakeRequest.of(payload("t-3"))))
                .isInstanceOf(QueueException.class);

        IntakeResult retry = intake.submit("content", IntakeRequest.of(payload("t-3")));
        assertThat(retry.created()).isFalse();
        assertThat(h.job(retry.jobId()).status()).isEqualTo(JobStatus.QUEUED);
    }
}
