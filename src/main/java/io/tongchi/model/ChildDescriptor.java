package io.tongchi.model;

public record ChildDescriptor(
        String path,
        boolean container,
        String displayHint,
        String status
) {
    public ChildDescriptor {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("child path cannot be empty");
        }
        if (displayHint == null || displayHint.isBlank()) {
            displayHint = path;
        }
    }

    public static ChildDescriptor container(String path) {
        return new ChildDescriptor(path, true, null, null);
    }

    public static ChildDescriptor leaf(String path) {
        return new ChildDescriptor(path, false, null, null);
    }

    public static ChildDescriptor of(String path, boolean container, String displayHint) {
        return new ChildDescriptor(path, container, displayHint, null);
    }

    public ChildDescriptor withStatus(String newStatus) {
        return new ChildDescriptor(path, container, displayHint, newStatus);
    }
}
