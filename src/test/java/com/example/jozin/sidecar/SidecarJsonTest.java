package com.example.jozin.sidecar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SidecarJsonTest {
    private static final Instant CREATED = Instant.parse("2024-05-01T10:15:30Z");
    private static final Instant UPDATED = Instant.parse("2024-05-02T08:00:00Z");

    private final ObjectMapper mapper = SidecarJson.newMapper();

    @Test
    void writesSnakeCaseKeysInRecordOrder() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(freshSidecar()));

        List<String> keys = new ArrayList<>();
        json.fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of("schema_version", "producer_version", "created_at", "updated_at",
                "pipeline_signature", "source", "faces", "tags", "thumbnails"), keys);
        assertFalse(json.has("image"));
        assertFalse(json.get("pipeline_signature").has("face_model"));
        assertEquals("sha256", json.get("pipeline_signature").get("hash_algorithm").asText());
        assertEquals(15, json.get("source").get("file_size_bytes").asInt());
        assertTrue(json.get("faces").isArray());
    }

    @Test
    void writesTimestampsAsUtcText() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(freshSidecar()));

        assertEquals("2024-05-01T10:15:30Z", json.get("created_at").asText());
        assertTrue(json.get("updated_at").asText().endsWith("Z"));
        assertTrue(json.get("source").get("file_modified_at").asText().endsWith("Z"));
    }

    @Test
    void readsCollaboratorFieldsAndIgnoresUnknownKeys() throws Exception {
        Sidecar sidecar = freshSidecar();
        ObjectNode json = (ObjectNode) mapper.readTree(mapper.writeValueAsString(sidecar));
        json.putObject("image").put("width", 640).put("height", 480).put("format", "jpeg");
        json.putArray("tags").addObject().put("label", "beach").put("score", 0.9).put("source", "ml");
        json.put("future_field", "ignored");

        Sidecar read = mapper.readValue(json.toString(), Sidecar.class);

        assertEquals(640, read.image().width());
        assertEquals("jpeg", read.image().format());
        assertEquals(List.of(new Tag("beach", 0.9, TagSource.ML)), read.tags());
        assertEquals(sidecar.source(), read.source());
        assertEquals(sidecar.createdAt(), read.createdAt());
        assertTrue(read.faces().isEmpty());
    }

    private static Sidecar freshSidecar() {
        SourceInfo source = new SourceInfo("/photos/a.jpg", 15L, "deadbeef", CREATED.minusSeconds(3600));
        return Sidecar.fromScan(source, PipelineSignature.current(CREATED), CREATED, UPDATED);
    }
}
