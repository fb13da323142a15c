package com.libragraph.stageflow.core.stage;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Serializable failure detail stored on the job and in the dead-letter record.
 */
public record StageError(
        String message,
        String exceptionType,
        String reason,
        String stackTrace,
        boolean retryable
) {
    public static StageError from(Throwable t) {
        var sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));

        boolean retryable = isRetryable(t);
        String reason;
        if (t instanceof StageException) {
            reason = retryable ? "retryable_error" : "fatal_error";
        } else {
            reason = retryable ? "transient_error" : "non_retryable_error";
        }

        return new StageError(
                t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName(),
                t.getClass().getName(),
                reason,
                sw.toString(),
                retryable
        );
    }

    public static StageError of(String message, String reason, boolean retryable) {
        return new StageError(message, null, reason, null, retryable);
    }

    static boolean isRetryable(Throwable t) {
        if (t instanceof FatalStageException || t instanceof IllegalArgumentException) {
            return false;
        }
        if (t instanceof RetryableStageException
                || t instanceof IOException
                || t instanceof UncheckedIOException
                || t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof ProcessingException) {
            return true;
        }
        if (t instanceof WebApplicationException wae) {
            int status = wae.getResponse() != null ? wae.getResponse().getStatus() : 500;
            return status == 429 || status >= 500;
        }
        return true;
    }
}
