package io.maubotoperator.model;

public enum RelationKind {
    DATABASE("postgresql", "database"),
    INGRESS("ingress", "ingress"),
    FEDERATION("matrix-auth", "federation"),
    LOGGING("logging", "logging");

    private final String relationName;
    private final String label;

    RelationKind(String relationName, String label) {
        this.relationName = relationName;
        this.label = label;
    }

    public String relationName() {
        return relationName;
    }

    public String label() {
        return label;
    }
}
