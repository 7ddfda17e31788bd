package io.maubotoperator.relation;

import com.fasterxml.jackson.databind.JsonNode;
import io.maubotoperator.config.OperatorSettings;
import io.maubotoperator.model.DatabaseFact;
import io.maubotoperator.model.DependencyFact;
import io.maubotoperator.model.FactSet;
import io.maubotoperator.model.FederationFact;
import io.maubotoperator.model.IngressFact;
import io.maubotoperator.model.LoggingFact;
import io.maubotoperator.model.RelationKind;
import io.maubotoperator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw relation databags into validated {@link DependencyFact}s.
 *
 * <p>A relation that has not published anything yet is {@code ABSENT}; a relation that published data of the
 * wrong shape is {@code MALFORMED}. Every interface read here allows a single remote application, so the first
 * relation (by id) carrying a valid payload wins.
 */
public final class RelationReader {
    public static final String DEFAULT_HOMESERVER_NAME = "synapse";
    static final int DEFAULT_POSTGRESQL_PORT = 5432;

    private static final Logger log = LoggerFactory.getLogger(RelationReader.class);

    public RelationReadResult read(RelationKind kind, CharmState state) {
        List<RelationSnapshot> relations = state.relations(kind.relationName());
        if (relations.isEmpty()) {
            return RelationReadResult.absent(kind);
        }
        String firstProblem = null;
        for (RelationSnapshot relation : relations) {
            if (!relation.hasRemoteApp() || !relation.hasAnyData()) {
                continue;
            }
            try {
                DependencyFact fact = parse(kind, relation, state);
                if (fact != null) {
                    return RelationReadResult.present(fact);
                }
            } catch (MalformedRelationDataException e) {
                log.warn("relation {} (id={}) published malformed data: {}", kind.relationName(), relation.id(), e.getMessage());
                if (firstProblem == null) {
                    firstProblem = e.getMessage();
                }
            }
        }
        return firstProblem == null
                ? RelationReadResult.absent(kind)
                : RelationReadResult.malformed(kind, firstProblem);
    }

    public Map<RelationKind, RelationReadResult> readAll(CharmState state) {
        Map<RelationKind, RelationReadResult> out = new EnumMap<>(RelationKind.class);
        for (RelationKind kind : RelationKind.values()) {
            out.put(kind, read(kind, state));
        }
        return out;
    }

    public static FactSet presentFacts(Map<RelationKind, RelationReadResult> results) {
        List<DependencyFact> facts = new ArrayList<>();
        for (RelationReadResult result : results.values()) {
            if (result.isPresent()) {
                facts.add(result.fact());
            }
        }
        return FactSet.of(facts);
    }

    private DependencyFact parse(RelationKind kind, RelationSnapshot relation, CharmState state) {
        return switch (kind) {
            case DATABASE -> parseDatabase(relation.appData());
            case INGRESS -> parseIngress(relation.appData());
            case FEDERATION -> parseFederation(relation.appData(), state);
            case LOGGING -> parseLogging(relation.unitData());
        };
    }

    private DatabaseFact parseDatabase(Map<String, String> data) {
        if (data.isEmpty()) {
            return null;
        }
        String endpoints = required(RelationKind.DATABASE, data, "endpoints");
        String database = required(RelationKind.DATABASE, data, "database");
        String username = required(RelationKind.DATABASE, data, "username");
        String password = required(RelationKind.DATABASE, data, "password");
        String primary = endpoints.split(",")[0].trim();
        if (primary.isEmpty()) {
            throw new MalformedRelationDataException(RelationKind.DATABASE, "empty primary endpoint");
        }
        String host = primary;
        int port = DEFAULT_POSTGRESQL_PORT;
        int colon = primary.lastIndexOf(':');
        if (colon >= 0 && primary.indexOf(']') < colon) {
            host = primary.substring(0, colon);
            port = parsePort(primary.substring(colon + 1));
        }
        if (host.isBlank()) {
            throw new MalformedRelationDataException(RelationKind.DATABASE, "empty host in endpoint: " + primary);
        }
        return new DatabaseFact(host, port, username, password, database);
    }

    private IngressFact parseIngress(Map<String, String> data) {
        if (data.isEmpty()) {
            return null;
        }
        String raw = required(RelationKind.INGRESS, data, "ingress");
        String url = urlMember(RelationKind.INGRESS, raw);
        return new IngressFact(OperatorSettings.stripTrailingSlash(url));
    }

    private FederationFact parseFederation(Map<String, String> data, CharmState state) {
        if (data.isEmpty()) {
            return null;
        }
        String homeserver = required(RelationKind.FEDERATION, data, "homeserver");
        if (!OperatorSettings.isHttpUrl(homeserver)) {
            throw new MalformedRelationDataException(RelationKind.FEDERATION, "homeserver is not an http(s) URL");
        }
        String secret = sharedSecret(data, state);
        String name = data.get("homeserver_name");
        if (name == null || name.isBlank()) {
            name = DEFAULT_HOMESERVER_NAME;
        } else if (!name.trim().matches("^[A-Za-z0-9_.-]+$")) {
            throw new MalformedRelationDataException(RelationKind.FEDERATION, "invalid homeserver_name: " + name);
        }
        return new FederationFact(name.trim(), OperatorSettings.stripTrailingSlash(homeserver), secret);
    }

    private String sharedSecret(Map<String, String> data, CharmState state) {
        String inline = data.get("shared_secret");
        if (inline != null && !inline.isBlank()) {
            return inline;
        }
        String secretId = data.get("shared_secret_id");
        if (secretId == null || secretId.isBlank()) {
            throw new MalformedRelationDataException(RelationKind.FEDERATION, "missing shared_secret or shared_secret_id");
        }
        String content = state.secret(secretId.trim())
                .map(values -> values.get("shared-secret"))
                .orElse(null);
        if (content == null || content.isBlank()) {
            throw new MalformedRelationDataException(RelationKind.FEDERATION, "shared secret " + secretId + " cannot be resolved");
        }
        return content;
    }

    private LoggingFact parseLogging(Map<String, Map<String, String>> units) {
        String firstProblem = null;
        boolean anyEndpoint = false;
        for (Map.Entry<String, Map<String, String>> unit : units.entrySet()) {
            String raw = unit.getValue().get("endpoint");
            if (raw == null) {
                continue;
            }
            anyEndpoint = true;
            try {
                return new LoggingFact(urlMember(RelationKind.LOGGING, raw));
            } catch (MalformedRelationDataException e) {
                if (firstProblem == null) {
                    firstProblem = unit.getKey() + ": " + e.getMessage();
                }
            }
        }
        if (anyEndpoint) {
            throw new MalformedRelationDataException(RelationKind.LOGGING, firstProblem);
        }
        return null;
    }

    private static String urlMember(RelationKind kind, String rawJson) {
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(rawJson);
        } catch (IOException e) {
            throw new MalformedRelationDataException(kind, "payload is not valid JSON");
        }
        if (node == null || !node.isObject()) {
            throw new MalformedRelationDataException(kind, "payload is not a JSON object");
        }
        JsonNode url = node.get("url");
        if (url == null || !url.isTextual() || !OperatorSettings.isHttpUrl(url.asText())) {
            throw new MalformedRelationDataException(kind, "url is missing or not an http(s) URL");
        }
        return url.asText().trim();
    }

    private static String required(RelationKind kind, Map<String, String> data, String key) {
        String value = data.get(key);
        if (value == null || value.isBlank()) {
            throw new MalformedRelationDataException(kind, "missing or empty field: " + key);
        }
        return value.trim();
    }

    private static int parsePort(String raw) {
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 1 || port > 65_535) {
                throw new MalformedRelationDataException(RelationKind.DATABASE, "port out of range: " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new MalformedRelationDataException(RelationKind.DATABASE, "unparseable port: " + raw);
        }
    }
}
