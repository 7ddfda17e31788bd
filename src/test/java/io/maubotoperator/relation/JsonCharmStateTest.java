package io.maubotoperator.relation;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonCharmStateTest {
    @Test
    void parseShouldReadConfigRelationsAndSecrets() throws Exception {
        JsonCharmState state = JsonCharmState.parse("""
                {
                  "unit": "maubot/1",
                  "app": "maubot",
                  "model": "prod",
                  "config": {"public-url": "https://maubot.example.org"},
                  "secrets": {"secret:1": {"shared-secret": "abc"}},
                  "relations": {
                    "postgresql": [
                      {"id": 7, "app": "pg", "app-data": {"endpoints": "db:5432"}},
                      {"id": 2, "app": "pg-old", "app-data": {}}
                    ],
                    "logging": [
                      {"id": 4, "app": "loki", "units": {"loki/0": {"endpoint": "{}"}}}
                    ]
                  }
                }
                """);

        assertEquals("maubot/1", state.unitName());
        assertEquals("prod", state.modelName());
        assertEquals("https://maubot.example.org", state.config().get("public-url"));
        assertEquals("abc", state.secret("secret:1").orElseThrow().get("shared-secret"));
        assertEquals(2, state.relations("postgresql").get(0).id());
        assertEquals("db:5432", state.relations("postgresql").get(1).appData().get("endpoints"));
        assertEquals("{}", state.relations("logging").get(0).unitData().get("loki/0").get("endpoint"));
        assertTrue(state.relations("ingress").isEmpty());
    }

    @Test
    void loadMissingFileShouldYieldEmptyState() throws Exception {
        Path root = Files.createTempDirectory("maubot-state-missing-");

        JsonCharmState state = JsonCharmState.load(root.resolve("state.json"));

        assertEquals("maubot/0", state.unitName());
        assertTrue(state.config().isEmpty());
        assertTrue(state.relations("postgresql").isEmpty());
    }

    @Test
    void loadInvalidFileShouldThrow() throws Exception {
        Path root = Files.createTempDirectory("maubot-state-invalid-");
        Path file = root.resolve("state.json");
        Files.writeString(file, "{not json");

        assertThrows(IOException.class, () -> JsonCharmState.load(file));
    }
}
