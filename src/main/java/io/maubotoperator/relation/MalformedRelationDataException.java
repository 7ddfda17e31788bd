package io.maubotoperator.relation;

import io.maubotoperator.model.RelationKind;

public final class MalformedRelationDataException extends RuntimeException {
    private final RelationKind kind;

    public MalformedRelationDataException(RelationKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RelationKind kind() {
        return kind;
    }
}
