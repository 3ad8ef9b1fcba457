package io.tongchi.tree;

import io.tongchi.concurrent.OperationContext;
import io.tongchi.error.ResourceNotFoundException;
import io.tongchi.error.TransportException;
import io.tongchi.model.ChildDescriptor;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class WorkspaceLister implements Lister {
    private final Path baseDir;

    public WorkspaceLister(Path baseDir) {
        if (baseDir == null) {
            throw new IllegalArgumentException("workspace base directory cannot be null");
        }
        this.baseDir = baseDir.toAbsolutePath().normalize();
    }

    public Path baseDir() {
        return baseDir;
    }

    @Override
    public List<ChildDescriptor> list(String path, OperationContext context) throws Exception {
        Path dir = resolve(path);
        if (!Files.isDirectory(dir)) {
            throw new ResourceNotFoundException(path);
        }
        List<ChildDescriptor> children = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                context.throwIfCancelled();
                String name = entry.getFileName().toString();
                if (name.startsWith(".")) {
                    continue;
                }
                if (Files.isDirectory(entry)) {
                    String kind = workspaceKind(entry);
                    String hint = kind == null ? name : name + " [" + kind + "]";
                    children.add(ChildDescriptor.of(name + "/", true, hint));
                } else {
                    children.add(ChildDescriptor.leaf(name));
                }
            }
        } catch (IOException e) {
            throw new TransportException("failed to list workspace directory " + dir + ": " + e.getMessage(), e);
        }
        children.sort(Comparator.comparing(ChildDescriptor::path));
        return children;
    }

    private Path resolve(String path) throws TransportException {
        String relative = path == null ? "" : path;
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        Path resolved = baseDir.resolve(relative).normalize();
        if (!resolved.startsWith(baseDir)) {
            throw new TransportException("path escapes workspace root: " + path, 400, null);
        }
        return resolved;
    }

    static String workspaceKind(Path dir) throws IOException {
        boolean tofu = false;
        boolean packer = false;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(".pkr.hcl") || name.endsWith(".pkr.json")) {
                    packer = true;
                } else if (name.endsWith(".tf")) {
                    tofu = true;
                }
            }
        }
        if (tofu) {
            return "tofu";
        }
        return packer ? "packer" : null;
    }
}
