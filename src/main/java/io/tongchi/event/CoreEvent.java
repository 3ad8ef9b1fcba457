package io.tongchi.event;

import java.time.Instant;

public interface CoreEvent {
    Instant at();
}
