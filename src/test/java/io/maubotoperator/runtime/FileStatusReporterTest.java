package io.maubotoperator.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.maubotoperator.model.UnitStatus;
import io.maubotoperator.util.Jsons;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileStatusReporterTest {
    @Test
    void reportShouldOverwriteStatusFile() throws Exception {
        Path statusFile = Files.createTempDirectory("maubot-status-test").resolve("nested/status.json");
        FileStatusReporter reporter = new FileStatusReporter(statusFile);
        assertTrue(reporter.read().isEmpty());

        reporter.report(UnitStatus.waiting("database"));
        reporter.report(UnitStatus.blocked("invalid config: public-url"));

        JsonNode row = Jsons.mapper().readTree(statusFile.toFile());
        assertEquals("blocked", row.path("state").asText());
        assertEquals("invalid config: public-url", row.path("reason").asText());
        assertFalse(row.path("updated_at").asText().isBlank());
        assertEquals(UnitStatus.blocked("invalid config: public-url"), reporter.read().orElseThrow());
    }

    @Test
    void statusShouldRenderLikeUnitStatusLine() {
        assertEquals("Waiting(database)", UnitStatus.waiting("database").toString());
        assertEquals("Active", UnitStatus.active().toString());
    }
}
