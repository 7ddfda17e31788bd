package io.maubotoperator.relation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.maubotoperator.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link CharmState} backed by the {@code state.json} snapshot the dispatching runtime writes before each hook.
 */
public final class JsonCharmState implements CharmState {
    private final String unitName;
    private final String appName;
    private final String modelName;
    private final Map<String, String> config;
    private final Map<String, Map<String, String>> secrets;
    private final Map<String, List<RelationSnapshot>> relations;

    JsonCharmState(StateFile file) {
        this.unitName = valueOrDefault(file.unit(), "maubot/0");
        this.appName = valueOrDefault(file.app(), "maubot");
        this.modelName = valueOrDefault(file.model(), "default");
        this.config = file.config() == null ? Map.of() : Map.copyOf(file.config());
        Map<String, Map<String, String>> secretCopy = new LinkedHashMap<>();
        if (file.secrets() != null) {
            file.secrets().forEach((id, content) -> secretCopy.put(id, content == null ? Map.of() : Map.copyOf(content)));
        }
        this.secrets = secretCopy;
        Map<String, List<RelationSnapshot>> relationCopy = new LinkedHashMap<>();
        if (file.relations() != null) {
            file.relations().forEach((name, entries) -> relationCopy.put(name, toSnapshots(entries)));
        }
        this.relations = relationCopy;
    }

    public static JsonCharmState load(Path stateFile) throws IOException {
        if (!Files.exists(stateFile)) {
            return new JsonCharmState(new StateFile(null, null, null, null, null, null));
        }
        StateFile file = Jsons.mapper().readValue(stateFile.toFile(), StateFile.class);
        return new JsonCharmState(file);
    }

    public static JsonCharmState parse(String json) throws IOException {
        return new JsonCharmState(Jsons.mapper().readValue(json, StateFile.class));
    }

    @Override
    public String unitName() {
        return unitName;
    }

    @Override
    public String appName() {
        return appName;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public Map<String, String> config() {
        return config;
    }

    @Override
    public List<RelationSnapshot> relations(String relationName) {
        return relations.getOrDefault(relationName, List.of());
    }

    @Override
    public Optional<Map<String, String>> secret(String secretId) {
        if (secretId == null || secretId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(secrets.get(secretId));
    }

    private static List<RelationSnapshot> toSnapshots(List<RelationEntry> entries) {
        if (entries == null) {
            return List.of();
        }
        List<RelationSnapshot> out = new ArrayList<>();
        for (RelationEntry entry : entries) {
            if (entry != null) {
                out.add(new RelationSnapshot(entry.id(), entry.app(), entry.appData(), entry.units()));
            }
        }
        out.sort(Comparator.comparingInt(RelationSnapshot::id));
        return List.copyOf(out);
    }

    private static String valueOrDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StateFile(
            String unit,
            String app,
            String model,
            Map<String, String> config,
            Map<String, Map<String, String>> secrets,
            Map<String, List<RelationEntry>> relations
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RelationEntry(
            int id,
            String app,
            @JsonProperty("app-data") Map<String, String> appData,
            Map<String, Map<String, String>> units
    ) {
    }
}
