package io.maubotoperator.relation;

import io.maubotoperator.model.DependencyFact;
import io.maubotoperator.model.RelationKind;

public record RelationReadResult(
        RelationKind kind,
        Outcome outcome,
        DependencyFact fact,
        String reason
) {
    public enum Outcome {
        PRESENT,
        ABSENT,
        MALFORMED
    }

    public static RelationReadResult present(DependencyFact fact) {
        return new RelationReadResult(fact.kind(), Outcome.PRESENT, fact, null);
    }

    public static RelationReadResult absent(RelationKind kind) {
        return new RelationReadResult(kind, Outcome.ABSENT, null, null);
    }

    public static RelationReadResult malformed(RelationKind kind, String reason) {
        return new RelationReadResult(kind, Outcome.MALFORMED, null, reason);
    }

    public boolean isPresent() {
        return outcome == Outcome.PRESENT;
    }

    public boolean isMalformed() {
        return outcome == Outcome.MALFORMED;
    }
}
