package com.example.jozin;

import com.example.jozin.sidecar.SidecarJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {
    private final ObjectMapper mapper = SidecarJson.newMapper();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void scanPrintsResponseDocument() throws Exception {
        Path root = Files.createTempDirectory("app-test");
        Files.writeString(root.resolve("image.jpg"), "image");
        Files.writeString(root.resolve("readme.txt"), "text");
        Path config = writeConfig(root, "{\"path\": " + mapper.writeValueAsString(root.toString()) + "}");

        int exitCode = run("scan", config.toString());

        assertEquals(0, exitCode);
        JsonNode response = mapper.readTree(out.toString(StandardCharsets.UTF_8));
        assertTrue(response.has("started_at"));
        assertTrue(response.has("finished_at"));
        assertTrue(response.get("duration_ms").asLong() >= 0);
        JsonNode data = response.get("data");
        assertEquals(2, data.get("total_files").asInt());
        assertEquals(1, data.get("successful").asInt());
        assertEquals(1, data.get("skipped").asInt());
        for (JsonNode file : data.get("scanned_files")) {
            String expected = file.get("path").asText().endsWith("image.jpg") ? "written" : "skipped";
            assertEquals(expected, file.get("action").asText());
        }
        assertTrue(Files.exists(root.resolve("image.jpg.json")));
    }

    @Test
    void cleanupPrintsDeletedFiles() throws Exception {
        Path root = Files.createTempDirectory("app-test");
        Files.writeString(root.resolve("image.jpg"), "image");
        Files.writeString(root.resolve("image.jpg.json"), "{}");
        Path config = writeConfig(root, "{\"path\": " + mapper.writeValueAsString(root.toString()) + "}");

        int exitCode = run("cleanup", config.toString());

        assertEquals(0, exitCode);
        JsonNode data = mapper.readTree(out.toString(StandardCharsets.UTF_8)).get("data");
        assertEquals(1, data.get("total_files").asInt());
        assertEquals("sidecar", data.get("deleted_files").get(0).get("type").asText());
        assertFalse(Files.exists(root.resolve("image.jpg.json")));
    }

    @Test
    void missingRootReportsIoError() throws Exception {
        Path root = Files.createTempDirectory("app-test");
        Path missing = root.resolve("missing");
        Path config = writeConfig(root, "{\"path\": " + mapper.writeValueAsString(missing.toString()) + "}");

        int exitCode = run("scan", config.toString());

        assertEquals(2, exitCode);
        JsonNode error = mapper.readTree(err.toString(StandardCharsets.UTF_8));
        assertEquals("io", error.get("kind").asText());
        assertEquals(2, error.get("exit_code").asInt());
        assertTrue(error.get("message").asText().contains("missing"));
        assertEquals(0, out.size());
    }

    @Test
    void invalidPatternReportsValidationError() throws Exception {
        Path root = Files.createTempDirectory("app-test");
        Path config = writeConfig(root, "{\"path\": " + mapper.writeValueAsString(root.toString())
                + ", \"include\": [\"[invalid\"]}");

        assertEquals(3, run("scan", config.toString()));
        assertEquals("validation", mapper.readTree(err.toString(StandardCharsets.UTF_8)).get("kind").asText());
    }

    @Test
    void missingArgumentsAreAUserError() throws Exception {
        assertEquals(1, run());
        assertEquals("user", mapper.readTree(err.toString(StandardCharsets.UTF_8)).get("kind").asText());
    }

    @Test
    void unknownCommandIsAUserError() throws Exception {
        Path root = Files.createTempDirectory("app-test");
        Path config = writeConfig(root, "{\"path\": " + mapper.writeValueAsString(root.toString()) + "}");

        assertEquals(1, run("index", config.toString()));
        assertTrue(mapper.readTree(err.toString(StandardCharsets.UTF_8)).get("message").asText().contains("index"));
    }

    private int run(String... args) {
        return App.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static Path writeConfig(Path root, String json) throws Exception {
        Path dir = Files.createTempDirectory(root.getParent(), "app-config");
        return Files.writeString(dir.resolve("config.json"), json);
    }
}
