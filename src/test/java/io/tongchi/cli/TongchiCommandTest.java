package io.tongchi.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.tongchi.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class TongchiCommandTest {

    @Test
    void browseListsWorkspaceDirectories() throws Exception {
        Path root = Files.createTempDirectory("tongchi-cli-");
        try {
            Path workspaces = root.resolve("workspaces");
            Files.createDirectories(workspaces.resolve("infra"));
            Files.createDirectories(workspaces.resolve("images"));
            Files.createDirectories(workspaces.resolve(".git"));
            Files.writeString(workspaces.resolve("infra").resolve("main.tf"), "terraform {}\n");
            Files.writeString(workspaces.resolve("images").resolve("app.pkr.hcl"), "source \"docker\" \"app\" {}\n");
            Files.writeString(workspaces.resolve("README.md"), "# infra\n");

            Result result = run("--root", root.toString(), "browse", "--depth", "2");

            Assertions.assertEquals(0, result.exitCode());
            JsonNode listing = Jsons.mapper().readTree(result.stdout());
            Assertions.assertEquals(3, listing.size());
            JsonNode top = listing.get(0);
            Assertions.assertEquals("LOADED", top.get("status").asText());
            Assertions.assertEquals(3, top.get("children").size());
            Assertions.assertEquals("README.md", top.get("children").get(0).get("path").asText());
            Assertions.assertEquals("images [packer]", top.get("children").get(1).get("displayHint").asText());
            Assertions.assertEquals("infra [tofu]", top.get("children").get(2).get("displayHint").asText());
            Assertions.assertEquals("images/", listing.get(1).get("path").asText());
            Assertions.assertEquals("app.pkr.hcl", listing.get(1).get("children").get(0).get("path").asText());
            Assertions.assertFalse(listing.get(1).get("children").get(0).get("container").asBoolean());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void browseOutsideWorkspaceRootFails() throws Exception {
        Path root = Files.createTempDirectory("tongchi-cli-");
        try {
            Path workspaces = Files.createDirectories(root.resolve("ws"));

            Result result = run("--root", root.toString(), "browse", "../", "--workspace-dir", workspaces.toString());

            Assertions.assertEquals(1, result.exitCode());
            JsonNode listing = Jsons.mapper().readTree(result.stdout());
            Assertions.assertEquals("ERROR", listing.get(0).get("status").asText());
            Assertions.assertTrue(listing.get(0).get("error").asText().contains("escapes workspace root"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsAndMetricsPrintCurrentState() throws Exception {
        Path root = Files.createTempDirectory("tongchi-cli-");
        try {
            Result settings = run("--root", root.toString(), "settings");
            Assertions.assertEquals(0, settings.exitCode());
            JsonNode outcome = Jsons.mapper().readTree(settings.stdout());
            Assertions.assertEquals("defaults", outcome.get("message").asText());
            Assertions.assertEquals(15, outcome.get("settings").get("listerTimeoutSeconds").asInt());

            Result metrics = run("--root", root.toString(), "metrics");
            Assertions.assertEquals(0, metrics.exitCode());
            Assertions.assertTrue(metrics.stdout().contains("tongchi_trees 0"));
            Assertions.assertTrue(metrics.stdout().contains("tongchi_scheduled_tasks{enabled=\"true\"} 1"));
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int code = new CommandLine(new TongchiCommand()).execute(args);
            return new Result(code, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int exitCode, String stdout) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
