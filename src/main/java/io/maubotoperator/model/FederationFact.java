package io.maubotoperator.model;

public record FederationFact(
        String homeserverName,
        String homeserverUrl,
        String sharedSecret
) implements DependencyFact {
    @Override
    public RelationKind kind() {
        return RelationKind.FEDERATION;
    }

    @Override
    public String toString() {
        return "FederationFact[homeserverName=" + homeserverName + ", homeserverUrl=" + homeserverUrl
                + ", sharedSecret=***]";
    }
}
