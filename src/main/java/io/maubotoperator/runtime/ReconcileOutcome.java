package io.maubotoperator.runtime;

import io.maubotoperator.model.UnitStatus;

import java.util.List;

public record ReconcileOutcome(
        String event,
        UnitStatus status,
        boolean configWritten,
        boolean layersReplaced,
        List<String> servicesRestarted,
        List<String> servicesStarted
) {
    public ReconcileOutcome {
        servicesRestarted = servicesRestarted == null ? List.of() : List.copyOf(servicesRestarted);
        servicesStarted = servicesStarted == null ? List.of() : List.copyOf(servicesStarted);
    }

    public static ReconcileOutcome stopped(String event, UnitStatus status) {
        return new ReconcileOutcome(event, status, false, false, List.of(), List.of());
    }

    public boolean changed() {
        return configWritten || layersReplaced;
    }
}
