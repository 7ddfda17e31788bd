package io.maubotoperator.model;

public record LoggingFact(String endpoint) implements DependencyFact {
    @Override
    public RelationKind kind() {
        return RelationKind.LOGGING;
    }
}
