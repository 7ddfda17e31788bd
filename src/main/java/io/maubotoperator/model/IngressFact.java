package io.maubotoperator.model;

public record IngressFact(String externalUrl) implements DependencyFact {
    @Override
    public RelationKind kind() {
        return RelationKind.INGRESS;
    }
}
