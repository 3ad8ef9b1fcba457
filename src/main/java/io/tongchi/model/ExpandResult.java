package io.tongchi.model;

import java.time.Instant;
import java.util.List;

public record ExpandResult(
        String path,
        NodeStatus status,
        List<ChildDescriptor> children,
        String error,
        Instant loadedAt,
        boolean fromCache,
        boolean abandoned,
        boolean stale
) {
    public ExpandResult {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean ok() {
        return status == NodeStatus.LOADED && error == null;
    }

    public static ExpandResult fromSnapshot(NodeSnapshot snapshot, boolean fromCache, boolean abandoned, String error) {
        return new ExpandResult(
                snapshot.path(),
                snapshot.status(),
                snapshot.children(),
                error != null ? error : snapshot.lastError(),
                snapshot.loadedAt(),
                fromCache,
                abandoned,
                snapshot.stale()
        );
    }
}
