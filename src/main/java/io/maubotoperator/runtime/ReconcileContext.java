package io.maubotoperator.runtime;

import io.maubotoperator.config.OperatorSettings;
import io.maubotoperator.model.FactSet;
import io.maubotoperator.model.RelationKind;
import io.maubotoperator.relation.CharmState;
import io.maubotoperator.relation.RelationReadResult;

import java.util.Map;

/**
 * Everything one reconciliation knows. Built when a hook arrives and dropped when it completes.
 */
public record ReconcileContext(
        String event,
        CharmState state,
        OperatorSettings settings,
        Map<RelationKind, RelationReadResult> reads,
        FactSet facts
) {
}
