package com.libragraph.stageflow;

import com.libragraph.stageflow.core.queue.MessageQueue;
import com.libragraph.stageflow.core.queue.QueueException;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@QuarkusTest
class WorkerTriggerFailureTest {

    @InjectMock
    MessageQueue queue;

    @Test
    void triggerWhenQueueIsUnreachable_returns500() {
        when(queue.dequeueBatch(anyString(), any(Duration.class), anyInt()))
                .thenThrow(new QueueException("connection refused"));

        given()
                .contentType(ContentType.JSON)
                .body("{\"batchSize\":5}")
                .when().post("/workers/pageperfect-gap_analysis")
                .then()
                .statusCode(500)
                .body("error", is("queue_pop_failed"))
                .body("message", containsString("connection refused"));
    }
}
