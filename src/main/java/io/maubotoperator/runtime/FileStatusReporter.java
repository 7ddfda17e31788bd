package io.maubotoperator.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.maubotoperator.model.UnitStatus;
import io.maubotoperator.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class FileStatusReporter implements StatusReporter {
    private final Path statusFile;

    public FileStatusReporter(Path statusFile) {
        this.statusFile = statusFile;
    }

    @Override
    public void report(UnitStatus status) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("state", status.state().name().toLowerCase(Locale.ROOT));
        row.put("reason", status.reason());
        row.put("updated_at", Instant.now().toString());
        try {
            Path parent = statusFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(statusFile, Jsons.toJson(row), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write unit status: " + statusFile, e);
        }
    }

    public Optional<UnitStatus> read() {
        if (!Files.exists(statusFile)) {
            return Optional.empty();
        }
        try {
            StatusFile file = Jsons.mapper().readValue(statusFile.toFile(), StatusFile.class);
            UnitStatus.State state = UnitStatus.State.valueOf(file.state().toUpperCase(Locale.ROOT));
            return Optional.of(new UnitStatus(state, file.reason()));
        } catch (IOException | RuntimeException e) {
            throw new RuntimeException("Failed to read unit status: " + statusFile, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusFile(String state, String reason) {
    }
}
