package io.maubotoperator.supervisor;

import io.maubotoperator.model.LayerDefinition;
import io.maubotoperator.model.LayerPlan;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The workload container as seen by the operator: its file system, its supervisor layers and its services.
 *
 * <p>Mutating calls throw {@link ApplyFailedException} when the container rejects the change.
 */
public interface Supervisor {
    boolean canConnect();

    Optional<String> readFile(String path);

    void writeFile(String path, String content);

    void makeDirectories(List<String> paths);

    Map<String, LayerDefinition> appliedLayers();

    /**
     * Replaces every layer named in {@code plan} in one step. Either all layers are replaced or none are.
     */
    void replaceLayers(LayerPlan plan);

    boolean isRunning(String service);

    void start(List<String> services);

    void restart(List<String> services);

    /**
     * Stops the named services. Services that do not exist or are already stopped are skipped.
     */
    void stop(List<String> services);
}
