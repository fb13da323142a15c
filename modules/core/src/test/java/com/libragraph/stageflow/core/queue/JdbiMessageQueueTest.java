package com.libragraph.stageflow.core.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.testing.PostgresFixture;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class JdbiMessageQueueTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = PostgresFixture.container();

    static final String Q = "pageperfect";
    static final ObjectMapper MAPPER = new ObjectMapper();
    static Jdbi jdbi;

    JdbiMessageQueue queue;

    @BeforeAll
    static void migrate() {
        jdbi = PostgresFixture.jdbi(POSTGRES, MAPPER);
    }

    @BeforeEach
    void setUp() {
        PostgresFixture.truncate(jdbi);
        queue = new JdbiMessageQueue(jdbi, MAPPER);
    }

    StageMessage message(String stage) {
        return new StageMessage(UUID.randomUUID(), stage, MAPPER.createObjectNode().put("url", "https://a.test"));
    }

    @Test
    void dequeue_leaseHidesMessageAndIncrementsReadCount() {
        StageMessage m = message("submit_crawl");
        queue.enqueue(Q, m, EnqueueOptions.defaults());

        List<QueueMessage> leased = queue.dequeueBatch(Q, Duration.ofMinutes(5), 10);

        assertThat(leased).hasSize(1);
        assertThat(leased.get(0).readCount()).isEqualTo(1);
        assertThat(leased.get(0).body()).isEqualTo(m);
        assertThat(queue.dequeueBatch(Q, Duration.ofMinutes(5), 10)).isEmpty();
    }

    @Test
    void dequeue_expiredLeaseIsRedelivered() throws InterruptedException {
        queue.enqueue(Q, message("submit_crawl"), EnqueueOptions.defaults());
        QueueMessage first = queue.dequeueBatch(Q, Duration.ofSeconds(1), 10).get(0);

        Thread.sleep(1500);
        List<QueueMessage> again = queue.dequeueBatch(Q, Duration.ofSeconds(1), 10);

        assertThat(again).extracting(QueueMessage::msgId).containsExactly(first.msgId());
        assertThat(again.get(0).readCount()).isEqualTo(2);
    }

    @Test
    void enqueue_duplicateLiveMessageIsDropped() {
        StageMessage m = message("submit_crawl");

        assertThat(queue.enqueue(Q, m, EnqueueOptions.defaults())).isPresent();
        assertThat(queue.enqueue(Q, m, EnqueueOptions.defaults())).isEmpty();
    }

    @Test
    void dequeue_priorityOrder() {
        StageMessage low = message("submit_crawl");
        StageMessage high = message("submit_crawl");
        queue.enqueue(Q, low, EnqueueOptions.defaults());
        queue.enqueue(Q, high, EnqueueOptions.priority(9));

        assertThat(queue.dequeueBatch(Q, Duration.ofMinutes(5), 2))
                .extracting(m -> m.body().jobId()).containsExactly(high.jobId(), low.jobId());
    }

    @Test
    void requeue_isAtomicReplacement() {
        StageMessage m = message("wait_crawl");
        queue.enqueue(Q, m, EnqueueOptions.defaults());
        QueueMessage leased = queue.dequeueBatch(Q, Duration.ofMinutes(5), 1).get(0);

        OptionalLong replacement = queue.requeue(Q, leased.msgId(), m, EnqueueOptions.defaults());

        assertThat(replacement).isPresent();
        assertThat(queue.archive(Q, leased.msgId())).isFalse();
        assertThat(queue.dequeueBatch(Q, Duration.ofMinutes(5), 10))
                .extracting(QueueMessage::msgId).containsExactly(replacement.getAsLong());
    }

    @Test
    void deadLetter_keepsMessageAndReason() {
        StageMessage m = message("gap_analysis");
        queue.enqueue(Q, m, EnqueueOptions.defaults());
        QueueMessage leased = queue.dequeueBatch(Q, Duration.ofMinutes(5), 1).get(0);

        queue.deadLetter(Q, leased, "fatal_error", MAPPER.createObjectNode().put("message", "bad page"));

        assertThat(queue.depth(Q)).isEmpty();
        DeadLetter letter = queue.deadLetters(Q, 10).get(0);
        assertThat(letter.msgId()).isEqualTo(leased.msgId());
        assertThat(letter.jobId()).isEqualTo(m.jobId());
        assertThat(letter.reason()).isEqualTo("fatal_error");
        assertThat(letter.error().get("message").asText()).isEqualTo("bad page");
        assertThat(letter.readCount()).isEqualTo(1);
    }

    @Test
    void depth_splitsReadyAndInFlight() {
        queue.enqueue(Q, message("submit_crawl"), EnqueueOptions.defaults());
        queue.enqueue(Q, message("submit_crawl"), EnqueueOptions.defaults());
        queue.enqueue(Q, message("wait_crawl"), EnqueueOptions.defaults().withDelay(Duration.ofMinutes(1)));
        queue.dequeueBatch(Q, Duration.ofMinutes(5), 1);

        assertThat(queue.depth(Q)).containsExactlyInAnyOrder(
                new StageDepth("submit_crawl", 1, 1),
                new StageDepth("wait_crawl", 0, 1));
    }

    @Test
    void dequeue_concurrentConsumersGetDisjointBatches() throws Exception {
        for (int i = 0; i < 100; i++) {
            queue.enqueue(Q, message("segment_embed"), EnqueueOptions.defaults());
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    List<Long> ids = new ArrayList<>();
                    List<QueueMessage> batch;
                    while (!(batch = queue.dequeueBatch(Q, Duration.ofMinutes(5), 10)).isEmpty()) {
                        batch.forEach(m -> ids.add(m.msgId()));
                    }
                    return ids;
                }));
            }
            start.countDown();

            List<Long> all = new ArrayList<>();
            for (Future<List<Long>> f : futures) {
                all.addAll(f.get());
            }
            assertThat(all).hasSize(100);
            assertThat(new HashSet<>(all)).hasSize(100);
        } finally {
            pool.shutdownNow();
        }
    }
}
