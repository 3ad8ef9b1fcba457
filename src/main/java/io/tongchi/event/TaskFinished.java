package io.tongchi.event;

import java.time.Instant;

public record TaskFinished(String taskId, boolean success, String error, Instant at) implements CoreEvent {
}
