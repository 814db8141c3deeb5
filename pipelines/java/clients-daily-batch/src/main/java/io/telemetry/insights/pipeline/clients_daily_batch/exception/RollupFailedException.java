package io.telemetry.insights.pipeline.clients_daily_batch.exception;

public class RollupFailedException extends RuntimeException {

    public RollupFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
