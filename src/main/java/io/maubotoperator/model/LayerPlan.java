package io.maubotoperator.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record LayerPlan(
        LayerDefinition workload,
        LayerDefinition proxy,
        LayerDefinition probe
) {
    public LayerPlan {
        if (workload == null || proxy == null || probe == null) {
            throw new IllegalArgumentException("layer plan requires workload, proxy and probe layers");
        }
    }

    public List<LayerDefinition> layers() {
        return List.of(workload, proxy, probe);
    }

    public Map<String, LayerDefinition> byName() {
        Map<String, LayerDefinition> out = new LinkedHashMap<>();
        for (LayerDefinition layer : layers()) {
            out.put(layer.name(), layer);
        }
        return out;
    }
}
