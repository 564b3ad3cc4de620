package com.cardtally.bot.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class BotStatusWriterTest {

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("running status is written as JSON")
    void writesRunning() throws Exception {
        Path file = tempDir.resolve("bot_status.json");
        BotStatusWriter writer = new BotStatusWriter(mapper, file.toString(), clock);

        writer.running("Channel c1: counted event 7");

        JsonNode json = mapper.readTree(file.toFile());
        assertTrue(json.get("running").asBoolean());
        assertEquals("Channel c1: counted event 7", json.get("lastMessage").asText());
        assertFalse(json.has("error"));
        assertEquals("2024-05-01T10:00:00Z", json.get("updatedAt").asText());
    }

    @Test
    @DisplayName("later writes replace earlier ones")
    void overwrites() throws Exception {
        Path file = tempDir.resolve("bot_status.json");
        BotStatusWriter writer = new BotStatusWriter(mapper, file.toString(), clock);

        writer.running("first");
        writer.stopped("Stopped", "token missing");

        JsonNode json = mapper.readTree(file.toFile());
        assertFalse(json.get("running").asBoolean());
        assertEquals("token missing", json.get("error").asText());
    }

    @Test
    @DisplayName("unwritable location is ignored")
    void unwritableIgnored() {
        Path file = tempDir.resolve("missing-dir").resolve("bot_status.json");
        BotStatusWriter writer = new BotStatusWriter(mapper, file.toString(), clock);

        assertDoesNotThrow(() -> writer.running("x"));
    }
}
