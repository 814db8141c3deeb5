package io.telemetry.insights.pipeline.clients_daily_batch.exception;

public class SchemaViolationException extends RuntimeException {

    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
