package io.maubotoperator.workload;

import io.maubotoperator.model.FederationFact;
import io.maubotoperator.model.LayerDefinition;
import io.maubotoperator.model.LayerPlan;
import io.maubotoperator.model.RestartPolicy;
import io.maubotoperator.model.WorkloadConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LayerPlannerTest {
    private static final String DSN = "postgresql://u:p@db:5432/maubot";

    private final LayerPlanner planner = new LayerPlanner();

    @Test
    void workloadLayerShouldCarryDsn() {
        LayerPlan plan = planner.plan(new WorkloadConfig("https://maubot.local", DSN, null, null, null));

        LayerDefinition workload = plan.workload();
        assertEquals("maubot", workload.name());
        assertEquals("python3 -m maubot -c /data/config.yaml", workload.command());
        assertEquals("/data", workload.workingDir());
        assertEquals(DSN, workload.environment().get(LayerPlanner.ENV_DATABASE_URL));
        assertEquals(RestartPolicy.RESTART, workload.onFailure());
    }

    @Test
    void withoutFederationEnvironmentShouldHaveNoHomeserverKeys() {
        LayerPlan plan = planner.plan(new WorkloadConfig("https://maubot.local", DSN, null, null, null));

        for (String key : plan.workload().environment().keySet()) {
            assertFalse(key.contains("HOMESERVER"), key);
        }
    }

    @Test
    void withFederationEnvironmentShouldCarryHomeserver() {
        FederationFact federation = new FederationFact("synapse", "https://matrix.example.org", "s3cret");
        LayerPlan plan = planner.plan(new WorkloadConfig("https://maubot.local", DSN, federation, "http://loki/push", null));

        Map<String, String> env = plan.workload().environment();
        assertEquals("synapse", env.get(LayerPlanner.ENV_HOMESERVER_NAME));
        assertEquals("https://matrix.example.org", env.get(LayerPlanner.ENV_HOMESERVER_URL));
        assertEquals("s3cret", env.get(LayerPlanner.ENV_HOMESERVER_SECRET));
        assertEquals("http://loki/push", env.get(LayerPlanner.ENV_LOG_PUSH_ENDPOINT));
    }

    @Test
    void proxyShouldServeFixedHealthPathAfterWorkload() {
        LayerDefinition proxy = planner.plan(new WorkloadConfig("https://maubot.local", DSN, null, null, null)).proxy();

        assertEquals("nginx", proxy.name());
        assertEquals(List.of("maubot"), proxy.after());
        assertEquals("http://localhost:8080/health", proxy.readinessCheck().url());
    }

    @Test
    void probeCheckFailureShouldNotRestart() {
        LayerPlan plan = planner.plan(new WorkloadConfig("https://maubot.local", DSN, null, null, null));

        assertEquals(RestartPolicy.IGNORE, plan.probe().onCheckFailure());
        assertEquals(RestartPolicy.RESTART, plan.workload().onCheckFailure());
        assertTrue(plan.probe().command().startsWith("/usr/bin/blackbox_exporter"));
    }

    @Test
    void planShouldBeStableForEqualConfigs() {
        WorkloadConfig config = new WorkloadConfig("https://maubot.local", DSN, null, null, null);

        assertEquals(planner.plan(config), planner.plan(config));
        assertEquals(List.of("maubot", "nginx", "blackbox"), List.copyOf(planner.plan(config).byName().keySet()));
    }
}
