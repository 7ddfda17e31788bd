package io.maubotoperator.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class OperatorConfig {
    public static final String DEFAULT_STATE_DIR = "state";
    public static final String DEFAULT_CONTAINER_ROOT = "container";
    public static final String CONTAINER_NAME = "maubot";
    public static final String WORKLOAD_CONFIG_PATH = "/data/config.yaml";
    public static final String WORKLOAD_DATA_DIR = "/data";
    public static final int WORKLOAD_PORT = 29316;
    public static final int PROXY_PORT = 8080;
    public static final int PROBE_PORT = 9115;
    public static final String WORKLOAD_BASE_PATH = "/_matrix/maubot";

    private final Path stateDir;
    private final Path containerRoot;

    public OperatorConfig(Path stateDir, Path containerRoot) {
        this.stateDir = stateDir;
        this.containerRoot = containerRoot;
    }

    public static OperatorConfig fromRoots(String stateDir, String containerRoot) {
        return new OperatorConfig(resolve(stateDir, DEFAULT_STATE_DIR), resolve(containerRoot, DEFAULT_CONTAINER_ROOT));
    }

    private static Path resolve(String raw, String fallback) {
        Path resolved = raw == null || raw.isBlank()
                ? Paths.get(fallback)
                : Paths.get(raw);
        return resolved.toAbsolutePath().normalize();
    }

    public Path stateDir() {
        return stateDir;
    }

    public Path containerRoot() {
        return containerRoot;
    }

    public Path stateFile() {
        return stateDir.resolve("state.json");
    }

    public Path statusFile() {
        return stateDir.resolve("status.json");
    }

    public Path supervisorDir() {
        return containerRoot.resolve(".supervisor");
    }

    public Path layersFile() {
        return supervisorDir().resolve("layers.json");
    }

    public Path servicesFile() {
        return supervisorDir().resolve("services.json");
    }

    public Path readyMarker() {
        return supervisorDir().resolve("ready");
    }
}
