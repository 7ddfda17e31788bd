package io.maubotoperator.workload;

import io.maubotoperator.config.OperatorConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scrape job published on the metrics-endpoint relation so Prometheus drives the blackbox probe.
 */
public final class ProbeScrapeJob {
    public static final String JOB_NAME = "blackbox_maubot";

    private ProbeScrapeJob() {
    }

    public static List<Map<String, Object>> jobs(String unitName, String appName, String modelName) {
        String unit = unitName.replace('/', '-');
        String endpointAddress = unit + "." + appName + "-endpoints." + modelName + ".svc.cluster.local";

        Map<String, Object> probe = new LinkedHashMap<>();
        probe.put("job_name", JOB_NAME);
        probe.put("metrics_path", "/probe");
        probe.put("params", Map.of("module", List.of("http_2xx")));
        probe.put("static_configs", List.of(Map.of("targets", List.of(
                "http://127.0.0.1:" + OperatorConfig.WORKLOAD_PORT + OperatorConfig.WORKLOAD_BASE_PATH + "/"
        ))));
        probe.put("relabel_configs", List.of(
                relabel(List.of("__address__"), "__param_target", null),
                relabel(List.of("__param_target"), "instance", null),
                relabel(List.of("__param_target"), "probe_target", null),
                relabel(null, "__address__", endpointAddress + ":" + OperatorConfig.PROBE_PORT)
        ));
        return List.of(probe);
    }

    private static Map<String, Object> relabel(List<String> sourceLabels, String targetLabel, String replacement) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (sourceLabels != null) {
            out.put("source_labels", sourceLabels);
        }
        out.put("target_label", targetLabel);
        if (replacement != null) {
            out.put("replacement", replacement);
        }
        return out;
    }
}
