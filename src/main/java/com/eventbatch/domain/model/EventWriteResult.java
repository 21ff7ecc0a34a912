package com.eventbatch.domain.model;

/**
 * Outcome of writing one event to the event log.
 */
public record EventWriteResult(String eventId, boolean success, String error) {

    public static EventWriteResult ok(String eventId) {
        return new EventWriteResult(eventId, true, null);
    }

    public static EventWriteResult failed(String eventId, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new EventWriteResult(eventId, false, message);
    }
}
