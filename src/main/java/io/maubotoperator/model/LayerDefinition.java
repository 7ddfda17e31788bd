package io.maubotoperator.model;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

public record LayerDefinition(
        String name,
        String summary,
        String command,
        SortedMap<String, String> environment,
        String workingDir,
        List<String> after,
        ReadinessCheck readinessCheck,
        RestartPolicy onFailure,
        RestartPolicy onCheckFailure
) {
    public LayerDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("layer name cannot be empty");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("layer command cannot be empty: " + name);
        }
        environment = environment == null
                ? new TreeMap<>()
                : new TreeMap<>(environment);
        after = after == null ? List.of() : List.copyOf(after);
        onFailure = onFailure == null ? RestartPolicy.RESTART : onFailure;
        onCheckFailure = onCheckFailure == null ? RestartPolicy.RESTART : onCheckFailure;
    }

    public static LayerDefinition of(String name, String summary, String command, Map<String, String> environment) {
        return new LayerDefinition(
                name,
                summary,
                command,
                environment == null ? null : new TreeMap<>(environment),
                null,
                List.of(),
                null,
                RestartPolicy.RESTART,
                RestartPolicy.RESTART
        );
    }

    @Override
    public SortedMap<String, String> environment() {
        return new TreeMap<>(environment);
    }
}
