package io.maubotoperator.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.maubotoperator.util.Jsons;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensitiveDataMaskerTest {
    @Test
    void sensitiveKeysShouldBeMasked() {
        JsonNode masked = SensitiveDataMasker.masked(Jsons.mapper().valueToTree(Map.of(
                "MAUBOT_DATABASE_URL", "postgresql://u:p@db:5432/maubot",
                "MAUBOT_HOMESERVER_SECRET", "s3cret",
                "MAUBOT_PUBLIC_URL", "https://maubot.local"
        )));

        assertEquals("***", masked.path("MAUBOT_DATABASE_URL").asText());
        assertEquals("***", masked.path("MAUBOT_HOMESERVER_SECRET").asText());
        assertEquals("https://maubot.local", masked.path("MAUBOT_PUBLIC_URL").asText());
    }

    @Test
    void nestedStructuresShouldBeWalked() {
        JsonNode masked = SensitiveDataMasker.masked(Jsons.mapper().valueToTree(Map.of(
                "homeservers", Map.of("synapse", Map.of("url", "https://m.example", "secret", "s3cret")),
                "layers", List.of(Map.of("command", "https://admin:pw@host/path"))
        )));

        assertEquals("***", masked.path("homeservers").path("synapse").path("secret").asText());
        assertEquals("https://m.example", masked.path("homeservers").path("synapse").path("url").asText());
        assertEquals("https://***@host/path", masked.path("layers").get(0).path("command").asText());
    }

    @Test
    void longOpaqueValuesShouldBeTreatedAsTokens() {
        String json = SensitiveDataMasker.maskedJson(Map.of("note", "abcdefghijklmnopqrstuvwxyz012345"));

        assertFalse(json.contains("abcdefghijklmnopqrstuvwxyz012345"));
        assertTrue(json.contains("***"));
    }

    @Test
    void keyMatchingShouldIgnoreCaseAndDashes() {
        assertTrue(SensitiveDataMasker.isSensitiveKey("root-admin-password"));
        assertTrue(SensitiveDataMasker.isSensitiveKey("Shared_Secret_Id"));
        assertFalse(SensitiveDataMasker.isSensitiveKey("homeserver"));
        assertFalse(SensitiveDataMasker.isSensitiveKey(null));
    }
}
