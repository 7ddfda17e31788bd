package io.maubotoperator.supervisor;

import io.maubotoperator.config.OperatorConfig;
import io.maubotoperator.model.FederationFact;
import io.maubotoperator.model.LayerDefinition;
import io.maubotoperator.model.LayerPlan;
import io.maubotoperator.model.WorkloadConfig;
import io.maubotoperator.workload.LayerPlanner;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalDirectorySupervisorTest {
    private static final String DSN = "postgresql://u:p@db:5432/maubot";

    @Test
    void canConnectShouldFollowReadyMarker() throws Exception {
        OperatorConfig config = config();
        LocalDirectorySupervisor supervisor = new LocalDirectorySupervisor(config);
        assertFalse(supervisor.canConnect());

        Files.createDirectories(config.supervisorDir());
        Files.writeString(config.readyMarker(), "");

        assertTrue(supervisor.canConnect());
    }

    @Test
    void filesShouldBeWrittenUnderContainerRoot() throws Exception {
        OperatorConfig config = config();
        LocalDirectorySupervisor supervisor = new LocalDirectorySupervisor(config);

        assertTrue(supervisor.readFile("/data/config.yaml").isEmpty());
        supervisor.makeDirectories(List.of("/data/plugins"));
        supervisor.writeFile("/data/config.yaml", "database: x\n");

        assertTrue(Files.isDirectory(config.containerRoot().resolve("data/plugins")));
        assertEquals("database: x\n", Files.readString(config.containerRoot().resolve("data/config.yaml")));
        assertEquals("database: x\n", supervisor.readFile("/data/config.yaml").orElseThrow());
    }

    @Test
    void pathsOutsideContainerRootShouldBeRejected() throws Exception {
        LocalDirectorySupervisor supervisor = new LocalDirectorySupervisor(config());

        assertThrows(ApplyFailedException.class, () -> supervisor.writeFile("/../escape.txt", "x"));
    }

    @Test
    void appliedLayersShouldRoundTripToEqualDefinitions() throws Exception {
        LocalDirectorySupervisor supervisor = new LocalDirectorySupervisor(config());
        LayerPlan plan = new LayerPlanner().plan(new WorkloadConfig(
                "https://maubot.local",
                DSN,
                new FederationFact("synapse", "https://matrix.example.org", "s"),
                null,
                null
        ));

        supervisor.replaceLayers(plan);
        Map<String, LayerDefinition> applied = supervisor.appliedLayers();

        assertEquals(plan.byName(), applied);
    }

    @Test
    void replaceShouldKeepLayersOutsideThePlan() throws Exception {
        OperatorConfig config = config();
        LocalDirectorySupervisor supervisor = new LocalDirectorySupervisor(config);
        LayerPlanner planner = new LayerPlanner();
        supervisor.replaceLayers(planner.plan(new WorkloadConfig("https://a.example", DSN, null, null, null)));

        supervisor.replaceLayers(planner.plan(new WorkloadConfig("https://b.example", DSN, null, null, null)));

        Map<String, LayerDefinition> applied = supervisor.appliedLayers();
        assertEquals(3, applied.size());
        assertEquals("https://b.example", applied.get("maubot").environment().get(LayerPlanner.ENV_PUBLIC_URL));
        try (Stream<Path> listing = Files.list(config.supervisorDir())) {
            assertTrue(listing.noneMatch(path -> path.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void servicesShouldStartAndCountRestarts() throws Exception {
        LocalDirectorySupervisor supervisor = new LocalDirectorySupervisor(config());
        supervisor.replaceLayers(new LayerPlanner().plan(new WorkloadConfig("https://maubot.local", DSN, null, null, null)));

        supervisor.start(List.of("maubot"));
        assertTrue(supervisor.isRunning("maubot"));
        assertFalse(supervisor.isRunning("nginx"));

        supervisor.restart(List.of("maubot", "nginx"));
        assertEquals(1, supervisor.restartCount("maubot"));
        assertEquals(0, supervisor.restartCount("nginx"));
        assertTrue(supervisor.isRunning("nginx"));
    }

    @Test
    void stopShouldSkipMissingServices() throws Exception {
        LocalDirectorySupervisor supervisor = new LocalDirectorySupervisor(config());
        supervisor.stop(List.of("maubot"));
        supervisor.replaceLayers(new LayerPlanner().plan(new WorkloadConfig("https://maubot.local", DSN, null, null, null)));
        supervisor.start(List.of("maubot", "nginx"));

        supervisor.stop(List.of("maubot", "unknown"));

        assertFalse(supervisor.isRunning("maubot"));
        assertTrue(supervisor.isRunning("nginx"));
        supervisor.start(List.of("maubot"));
        assertTrue(supervisor.isRunning("maubot"));
    }

    @Test
    void unknownServiceShouldFail() throws Exception {
        LocalDirectorySupervisor supervisor = new LocalDirectorySupervisor(config());

        ApplyFailedException error = assertThrows(ApplyFailedException.class, () -> supervisor.restart(List.of("maubot")));
        assertTrue(error.getMessage().contains("maubot"));
    }

    private static OperatorConfig config() throws Exception {
        Path root = Files.createTempDirectory("maubot-supervisor-test");
        return new OperatorConfig(root.resolve("state"), root.resolve("container"));
    }
}
