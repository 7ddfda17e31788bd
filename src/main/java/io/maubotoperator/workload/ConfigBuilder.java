package io.maubotoperator.workload;

import io.maubotoperator.config.OperatorSettings;
import io.maubotoperator.model.DatabaseFact;
import io.maubotoperator.model.FactSet;
import io.maubotoperator.model.RelationKind;
import io.maubotoperator.model.WorkloadConfig;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

public final class ConfigBuilder {

    public ConfigBuildResult build(FactSet facts, OperatorSettings settings) {
        // Database is the only hard dependency and is reported before anything else.
        Optional<DatabaseFact> database = facts.database();
        if (database.isEmpty()) {
            return ConfigBuildResult.notReady(RelationKind.DATABASE);
        }
        String invalidKey = settings.invalidKey();
        if (invalidKey != null) {
            return ConfigBuildResult.invalid(invalidKey);
        }
        String publicUrl = facts.ingress()
                .map(ingress -> ingress.externalUrl())
                .orElse(settings.publicUrl());
        return ConfigBuildResult.ready(new WorkloadConfig(
                OperatorSettings.stripTrailingSlash(publicUrl),
                dsn(database.get()),
                facts.federation().orElse(null),
                facts.logging().map(logging -> logging.endpoint()).orElse(null),
                settings.rootAdminPassword()
        ));
    }

    static String dsn(DatabaseFact fact) {
        return "postgresql://"
                + encodeUserInfo(fact.user())
                + ":"
                + encodeUserInfo(fact.password())
                + "@"
                + fact.host()
                + ":"
                + fact.port()
                + "/"
                + fact.databaseName();
    }

    private static String encodeUserInfo(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
