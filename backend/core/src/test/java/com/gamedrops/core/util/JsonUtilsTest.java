package com.gamedrops.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamedrops.core.model.DispatchOutcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void jsonLineIsSingleLineWithIsoInstantsAndNoNulls() throws Exception {
        String line = JsonUtils.toJsonLine(new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z")));

        assertFalse(line.contains("\n"));
        JsonNode tree = JsonUtils.objectMapper().readTree(line);
        assertEquals("ok", tree.get("name").asText());
        assertEquals("2026-02-01T00:00:00Z", tree.get("createdAt").asText());
        assertFalse(tree.has("optional"));
    }

    @Test
    void outcomesSerializeWithoutReasonOnSuccess() throws Exception {
        JsonNode ok = JsonUtils.objectMapper().readTree(
                JsonUtils.toJsonLine(DispatchOutcome.succeeded("cleanup", "cleanup", 200, 5)));
        JsonNode failed = JsonUtils.objectMapper().readTree(
                JsonUtils.toJsonLine(DispatchOutcome.failed("cleanup", "cleanup", "timeout", 0, 5)));

        assertTrue(ok.get("succeeded").asBoolean());
        assertFalse(ok.has("reason"));
        assertEquals("timeout", failed.get("reason").asText());
    }

    private record Payload(String name, String optional, Instant createdAt) {
    }
}
