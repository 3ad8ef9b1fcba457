package io.tongchi.error;

public class ResourceNotFoundException extends Exception {
    private final String path;

    public ResourceNotFoundException(String path) {
        super("Resource not found: " + path);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
