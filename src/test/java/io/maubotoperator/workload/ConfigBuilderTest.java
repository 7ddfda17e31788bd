package io.maubotoperator.workload;

import io.maubotoperator.config.OperatorSettings;
import io.maubotoperator.model.DatabaseFact;
import io.maubotoperator.model.FactSet;
import io.maubotoperator.model.FederationFact;
import io.maubotoperator.model.IngressFact;
import io.maubotoperator.model.LoggingFact;
import io.maubotoperator.model.RelationKind;
import io.maubotoperator.model.WorkloadConfig;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigBuilderTest {
    private static final DatabaseFact DATABASE = new DatabaseFact("db", 5432, "u", "p", "maubot");

    private final ConfigBuilder builder = new ConfigBuilder();

    @Test
    void missingDatabaseShouldBeReportedFirst() {
        FactSet facts = FactSet.of(
                new IngressFact("https://bots.example.org"),
                new FederationFact("synapse", "https://matrix.example.org", "s"),
                new LoggingFact("http://loki:3100/loki/api/v1/push")
        );
        OperatorSettings invalid = OperatorSettings.fromConfig(Map.of(OperatorSettings.PUBLIC_URL, "not a url"));

        ConfigBuildResult result = builder.build(facts, invalid);

        assertEquals(ConfigBuildResult.Verdict.NOT_READY, result.verdict());
        assertEquals(RelationKind.DATABASE, result.missing());
    }

    @Test
    void databaseOnlyShouldProduceDsn() {
        ConfigBuildResult result = builder.build(FactSet.of(DATABASE), OperatorSettings.defaults());

        assertTrue(result.isReady());
        assertEquals("postgresql://u:p@db:5432/maubot", result.config().databaseDsn());
        assertEquals(OperatorSettings.DEFAULT_PUBLIC_URL, result.config().publicUrl());
        assertTrue(result.config().federationBlock().isEmpty());
        assertTrue(result.config().loggingBlock().isEmpty());
    }

    @Test
    void ingressShouldWinOverStaticPublicUrl() {
        FactSet facts = FactSet.of(DATABASE, new IngressFact("https://bots.example.org"));
        OperatorSettings settings = OperatorSettings.fromConfig(Map.of(OperatorSettings.PUBLIC_URL, "https://maubot.local"));

        WorkloadConfig config = builder.build(facts, settings).config();

        assertEquals("https://bots.example.org", config.publicUrl());
    }

    @Test
    void staticPublicUrlShouldBeFallback() {
        OperatorSettings settings = OperatorSettings.fromConfig(Map.of(OperatorSettings.PUBLIC_URL, "https://bots.internal/"));

        WorkloadConfig config = builder.build(FactSet.of(DATABASE), settings).config();

        assertEquals("https://bots.internal", config.publicUrl());
    }

    @Test
    void invalidPublicUrlShouldBeReported() {
        OperatorSettings settings = OperatorSettings.fromConfig(Map.of(OperatorSettings.PUBLIC_URL, "maubot.local"));

        ConfigBuildResult result = builder.build(FactSet.of(DATABASE), settings);

        assertEquals(ConfigBuildResult.Verdict.INVALID, result.verdict());
        assertEquals(OperatorSettings.PUBLIC_URL, result.invalidKey());
        assertNull(result.config());
    }

    @Test
    void credentialsShouldBePercentEncoded() {
        DatabaseFact fact = new DatabaseFact("db", 5432, "bot user", "p@ss:word/1", "maubot");

        assertEquals("postgresql://bot%20user:p%40ss%3Aword%2F1@db:5432/maubot", ConfigBuilder.dsn(fact));
    }

    @Test
    void identicalInputsShouldBuildEqualConfigs() {
        FactSet facts = FactSet.of(DATABASE, new FederationFact("synapse", "https://matrix.example.org", "s"));

        assertEquals(
                builder.build(facts, OperatorSettings.defaults()),
                builder.build(facts, OperatorSettings.defaults())
        );
    }
}
