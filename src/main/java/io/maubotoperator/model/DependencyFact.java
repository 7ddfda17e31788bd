package io.maubotoperator.model;

public interface DependencyFact {
    RelationKind kind();
}
