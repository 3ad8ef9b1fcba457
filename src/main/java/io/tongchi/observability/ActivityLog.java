package io.tongchi.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.tongchi.security.SensitiveDataMasker;
import io.tongchi.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ActivityLog {
    private final Path activityFile;
    private final Clock clock;

    public ActivityLog(Path activityFile, Clock clock) {
        this.activityFile = activityFile;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        try {
            Files.createDirectories(activityFile.getParent());
            if (!Files.exists(activityFile)) {
                try {
                    Files.createFile(activityFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently by another runtime on the same root.
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize activity log: " + activityFile, e);
        }
    }

    public Path file() {
        return activityFile;
    }

    public synchronized void record(Entry entry) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("action", entry.action());
        row.put("resource", entry.resource());
        row.put("result", entry.result());
        row.put("details", sanitizeDetails(entry.details()));
        try {
            String line = Jsons.toCompactJson(row) + System.lineSeparator();
            Files.writeString(activityFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write activity log", e);
        }
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> rows = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(activityFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    rows.add(Jsons.mapper().readTree(line));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read activity log: " + activityFile, e);
        }
        int from = Math.max(0, rows.size() - Math.max(0, limit));
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record Entry(String action, String resource, String result, Map<String, Object> details) {
        public static Entry of(String action, String resource, String result, Map<String, Object> details) {
            return new Entry(action, resource, result, details == null ? Map.of() : details);
        }
    }
}
