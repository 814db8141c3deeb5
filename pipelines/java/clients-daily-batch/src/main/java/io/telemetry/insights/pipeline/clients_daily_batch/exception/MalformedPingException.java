package io.telemetry.insights.pipeline.clients_daily_batch.exception;

public class MalformedPingException extends Exception {

    public MalformedPingException(String message) {
        super(message);
    }

    public MalformedPingException(String message, Throwable cause) {
        super(message, cause);
    }
}
