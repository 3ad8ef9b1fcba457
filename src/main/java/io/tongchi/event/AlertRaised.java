package io.tongchi.event;

import io.tongchi.model.Alert;

import java.time.Instant;

public record AlertRaised(Alert alert, Instant at) implements CoreEvent {
    public String title() {
        return alert.title();
    }

    public String message() {
        return alert.message();
    }
}
