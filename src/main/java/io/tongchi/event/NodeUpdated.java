package io.tongchi.event;

import io.tongchi.model.NodeStatus;

import java.time.Instant;

public record NodeUpdated(String tree, String path, NodeStatus status, Instant at) implements CoreEvent {
}
