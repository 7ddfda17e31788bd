package io.maubotoperator.workload;

import com.fasterxml.jackson.core.type.TypeReference;
import io.maubotoperator.model.FederationFact;
import io.maubotoperator.model.WorkloadConfig;
import io.maubotoperator.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders the workload's {@code config.yaml}. Generated keys are layered over the bundled base document;
 * key order is fixed so identical inputs always give identical text.
 */
public final class ConfigRenderer {
    static final String BASE_RESOURCE = "/maubot-base-config.yaml";
    static final String ROOT_ADMIN = "root";

    private final Map<String, Object> base;

    public ConfigRenderer() {
        this(loadBase());
    }

    ConfigRenderer(Map<String, Object> base) {
        this.base = base == null ? Map.of() : base;
    }

    public String render(WorkloadConfig config) {
        return Jsons.toYaml(document(config));
    }

    @SuppressWarnings("unchecked")
    Map<String, Object> document(WorkloadConfig config) {
        Map<String, Object> doc = deepCopy(base);
        doc.remove("homeservers");
        doc.remove("logging_sink");
        doc.remove("admins");
        doc.put("database", config.databaseDsn());
        Object rawServer = doc.get("server");
        Map<String, Object> server = rawServer instanceof Map
                ? (Map<String, Object>) rawServer
                : new LinkedHashMap<>();
        server.put("public_url", config.publicUrl());
        doc.put("server", server);
        config.federationBlock().ifPresent(federation -> doc.put("homeservers", homeservers(federation)));
        config.loggingBlock().ifPresent(endpoint -> {
            Map<String, Object> sink = new LinkedHashMap<>();
            sink.put("push_endpoint", endpoint);
            doc.put("logging_sink", sink);
        });
        config.rootAdmin().ifPresent(password -> {
            Map<String, Object> admins = new LinkedHashMap<>();
            admins.put(ROOT_ADMIN, password);
            doc.put("admins", admins);
        });
        return doc;
    }

    private static Map<String, Object> homeservers(FederationFact federation) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("url", federation.homeserverUrl());
        entry.put("secret", federation.sharedSecret());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(federation.homeserverName(), entry);
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object value = entry.getValue();
            out.put(entry.getKey(), value instanceof Map ? deepCopy((Map<String, Object>) value) : value);
        }
        return out;
    }

    private static Map<String, Object> loadBase() {
        try (InputStream in = ConfigRenderer.class.getResourceAsStream(BASE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + BASE_RESOURCE);
            }
            Map<String, Object> loaded = Jsons.yamlMapper().readValue(in, new TypeReference<LinkedHashMap<String, Object>>() {
            });
            return loaded == null ? new LinkedHashMap<>() : loaded;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load base workload configuration", e);
        }
    }
}
