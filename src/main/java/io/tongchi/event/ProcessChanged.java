package io.tongchi.event;

import io.tongchi.model.ProcessView;

import java.time.Instant;

public record ProcessChanged(ProcessView process, Instant at) implements CoreEvent {
}
