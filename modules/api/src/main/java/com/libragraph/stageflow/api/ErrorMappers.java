package com.libragraph.stageflow.api;

import com.libragraph.stageflow.core.intake.ValidationException;
import com.libragraph.stageflow.core.job.StoreException;
import com.libragraph.stageflow.core.queue.QueueException;
import com.libragraph.stageflow.core.worker.UnknownWorkerException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Maps domain exceptions to JSON error bodies.
 */
public final class ErrorMappers {

    private static final Logger log = Logger.getLogger(ErrorMappers.class);

    private ErrorMappers() {
    }

    static Response error(Response.Status status, String error, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("success", false, "error", error, "message", String.valueOf(message)))
                .build();
    }

    @Provider
    public static class Validation implements ExceptionMapper<ValidationException> {
        @Override
        public Response toResponse(ValidationException e) {
            return error(Response.Status.BAD_REQUEST, "validation_error", e.getMessage());
        }
    }

    @Provider
    public static class UnknownWorker implements ExceptionMapper<UnknownWorkerException> {
        @Override
        public Response toResponse(UnknownWorkerException e) {
            return error(Response.Status.NOT_FOUND, "unknown_worker", e.getMessage());
        }
    }

    @Provider
    public static class Store implements ExceptionMapper<StoreException> {
        @Override
        public Response toResponse(StoreException e) {
            log.errorf(e, "Job store unavailable");
            return error(Response.Status.SERVICE_UNAVAILABLE, "store_unavailable", e.getMessage());
        }
    }

    @Provider
    public static class Queue implements ExceptionMapper<QueueException> {
        @Override
        public Response toResponse(QueueException e) {
            log.errorf(e, "Queue unavailable");
            return error(Response.Status.SERVICE_UNAVAILABLE, "queue_unavailable", e.getMessage());
        }
    }
}
