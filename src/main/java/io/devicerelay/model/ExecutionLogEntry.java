package io.devicerelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionLogEntry(int seq, long timestampMs, String event, String message, String data) {
}
