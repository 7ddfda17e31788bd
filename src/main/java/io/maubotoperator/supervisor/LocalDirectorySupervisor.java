package io.maubotoperator.supervisor;

import com.fasterxml.jackson.core.type.TypeReference;
import io.maubotoperator.config.OperatorConfig;
import io.maubotoperator.model.LayerDefinition;
import io.maubotoperator.model.LayerPlan;
import io.maubotoperator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link Supervisor} over a directory that mirrors the container file system.
 *
 * <p>Layers and service state live under {@code .supervisor/}; each file is replaced through a temp file and an
 * atomic move so readers never observe a half-written plan.
 */
public final class LocalDirectorySupervisor implements Supervisor {
    private static final Logger log = LoggerFactory.getLogger(LocalDirectorySupervisor.class);

    private final OperatorConfig config;

    public LocalDirectorySupervisor(OperatorConfig config) {
        this.config = config;
    }

    @Override
    public boolean canConnect() {
        return Files.exists(config.readyMarker());
    }

    @Override
    public Optional<String> readFile(String path) {
        Path file = containerPath(path);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ApplyFailedException("Failed to read container file: " + path, e);
        }
    }

    @Override
    public void writeFile(String path, String content) {
        Path file = containerPath(path);
        try {
            writeAtomically(file, content);
        } catch (IOException e) {
            throw new ApplyFailedException("Failed to write container file: " + path, e);
        }
    }

    @Override
    public void makeDirectories(List<String> paths) {
        for (String path : paths) {
            try {
                Files.createDirectories(containerPath(path));
            } catch (IOException e) {
                throw new ApplyFailedException("Failed to create container directory: " + path, e);
            }
        }
    }

    @Override
    public Map<String, LayerDefinition> appliedLayers() {
        Path file = config.layersFile();
        if (!Files.exists(file)) {
            return Map.of();
        }
        try {
            List<LayerDefinition> layers = Jsons.mapper().readValue(file.toFile(), new TypeReference<List<LayerDefinition>>() {
            });
            Map<String, LayerDefinition> out = new LinkedHashMap<>();
            for (LayerDefinition layer : layers) {
                out.put(layer.name(), layer);
            }
            return out;
        } catch (IOException e) {
            throw new ApplyFailedException("Failed to read supervisor layers", e);
        }
    }

    @Override
    public void replaceLayers(LayerPlan plan) {
        Map<String, LayerDefinition> merged = new LinkedHashMap<>(appliedLayers());
        merged.putAll(plan.byName());
        try {
            writeAtomically(config.layersFile(), Jsons.toJson(List.copyOf(merged.values())));
        } catch (IOException e) {
            throw new ApplyFailedException("Failed to replace supervisor layers", e);
        }
        log.debug("replaced supervisor layers {}", plan.byName().keySet());
    }

    @Override
    public boolean isRunning(String service) {
        ServiceState state = services().get(service);
        return state != null && state.running();
    }

    @Override
    public void start(List<String> services) {
        updateServices(services, false);
    }

    @Override
    public void restart(List<String> services) {
        updateServices(services, true);
    }

    @Override
    public void stop(List<String> services) {
        Map<String, ServiceState> current = new LinkedHashMap<>(services());
        boolean changed = false;
        for (String name : services) {
            ServiceState previous = current.get(name);
            if (previous == null || !previous.running()) {
                continue;
            }
            current.put(name, new ServiceState(false, previous.restarts()));
            changed = true;
        }
        if (!changed) {
            return;
        }
        try {
            writeAtomically(config.servicesFile(), Jsons.toJson(current));
        } catch (IOException e) {
            throw new ApplyFailedException("Failed to stop services " + services, e);
        }
    }

    public int restartCount(String service) {
        ServiceState state = services().get(service);
        return state == null ? 0 : state.restarts();
    }

    private void updateServices(List<String> names, boolean restart) {
        Map<String, LayerDefinition> layers = appliedLayers();
        Map<String, ServiceState> current = new LinkedHashMap<>(services());
        for (String name : names) {
            if (!layers.containsKey(name)) {
                throw new ApplyFailedException("service \"" + name + "\" does not exist");
            }
            ServiceState previous = current.getOrDefault(name, new ServiceState(false, 0));
            int restarts = restart && previous.running() ? previous.restarts() + 1 : previous.restarts();
            current.put(name, new ServiceState(true, restarts));
        }
        try {
            writeAtomically(config.servicesFile(), Jsons.toJson(current));
        } catch (IOException e) {
            throw new ApplyFailedException("Failed to update services " + names, e);
        }
    }

    private Map<String, ServiceState> services() {
        Path file = config.servicesFile();
        if (!Files.exists(file)) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(file.toFile(), new TypeReference<LinkedHashMap<String, ServiceState>>() {
            });
        } catch (IOException e) {
            throw new ApplyFailedException("Failed to read service state", e);
        }
    }

    private Path containerPath(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        Path resolved = config.containerRoot().resolve(relative).normalize();
        if (!resolved.startsWith(config.containerRoot())) {
            throw new ApplyFailedException("Path escapes container root: " + path);
        }
        return resolved;
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    record ServiceState(boolean running, int restarts) {
    }
}
