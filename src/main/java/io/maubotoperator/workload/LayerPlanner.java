package io.maubotoperator.workload;

import io.maubotoperator.config.OperatorConfig;
import io.maubotoperator.model.LayerDefinition;
import io.maubotoperator.model.LayerPlan;
import io.maubotoperator.model.ReadinessCheck;
import io.maubotoperator.model.RestartPolicy;
import io.maubotoperator.model.WorkloadConfig;

import java.util.List;
import java.util.TreeMap;

public final class LayerPlanner {
    public static final String WORKLOAD_NAME = "maubot";
    public static final String PROXY_NAME = "nginx";
    public static final String PROBE_NAME = "blackbox";
    public static final String PROXY_HEALTH_PATH = "/health";

    public static final String ENV_CONFIG = "MAUBOT_CONFIG";
    public static final String ENV_DATABASE_URL = "MAUBOT_DATABASE_URL";
    public static final String ENV_PUBLIC_URL = "MAUBOT_PUBLIC_URL";
    public static final String ENV_HOMESERVER_NAME = "MAUBOT_HOMESERVER_NAME";
    public static final String ENV_HOMESERVER_URL = "MAUBOT_HOMESERVER_URL";
    public static final String ENV_HOMESERVER_SECRET = "MAUBOT_HOMESERVER_SECRET";
    public static final String ENV_LOG_PUSH_ENDPOINT = "MAUBOT_LOG_PUSH_ENDPOINT";

    public LayerPlan plan(WorkloadConfig config) {
        return new LayerPlan(workloadLayer(config), proxyLayer(), probeLayer());
    }

    private LayerDefinition workloadLayer(WorkloadConfig config) {
        TreeMap<String, String> env = new TreeMap<>();
        env.put(ENV_CONFIG, OperatorConfig.WORKLOAD_CONFIG_PATH);
        env.put(ENV_DATABASE_URL, config.databaseDsn());
        env.put(ENV_PUBLIC_URL, config.publicUrl());
        config.federationBlock().ifPresent(federation -> {
            env.put(ENV_HOMESERVER_NAME, federation.homeserverName());
            env.put(ENV_HOMESERVER_URL, federation.homeserverUrl());
            env.put(ENV_HOMESERVER_SECRET, federation.sharedSecret());
        });
        config.loggingBlock().ifPresent(endpoint -> env.put(ENV_LOG_PUSH_ENDPOINT, endpoint));
        return new LayerDefinition(
                WORKLOAD_NAME,
                "maubot",
                "python3 -m maubot -c " + OperatorConfig.WORKLOAD_CONFIG_PATH,
                env,
                OperatorConfig.WORKLOAD_DATA_DIR,
                List.of(),
                ReadinessCheck.http(
                        "maubot-ready",
                        "http://localhost:" + OperatorConfig.WORKLOAD_PORT + OperatorConfig.WORKLOAD_BASE_PATH + "/"
                ),
                RestartPolicy.RESTART,
                RestartPolicy.RESTART
        );
    }

    private LayerDefinition proxyLayer() {
        return new LayerDefinition(
                PROXY_NAME,
                "nginx",
                "/usr/sbin/nginx",
                new TreeMap<>(),
                null,
                List.of(WORKLOAD_NAME),
                ReadinessCheck.http("nginx-ready", "http://localhost:" + OperatorConfig.PROXY_PORT + PROXY_HEALTH_PATH),
                RestartPolicy.RESTART,
                RestartPolicy.RESTART
        );
    }

    private LayerDefinition probeLayer() {
        // Probe failures surface as metrics; they never restart anything.
        return new LayerDefinition(
                PROBE_NAME,
                "blackbox-exporter",
                "/usr/bin/blackbox_exporter --config.file=/etc/blackbox.yaml",
                new TreeMap<>(),
                null,
                List.of(),
                ReadinessCheck.http("blackbox-ready", "http://localhost:" + OperatorConfig.PROBE_PORT + "/-/healthy"),
                RestartPolicy.RESTART,
                RestartPolicy.IGNORE
        );
    }
}
