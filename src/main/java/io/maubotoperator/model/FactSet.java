package io.maubotoperator.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Facts available for one reconciliation, at most one per {@link RelationKind}.
 */
public final class FactSet {
    private static final FactSet EMPTY = new FactSet(new EnumMap<>(RelationKind.class));

    private final Map<RelationKind, DependencyFact> facts;

    private FactSet(EnumMap<RelationKind, DependencyFact> facts) {
        this.facts = Collections.unmodifiableMap(facts);
    }

    public static FactSet empty() {
        return EMPTY;
    }

    public static FactSet of(DependencyFact... facts) {
        EnumMap<RelationKind, DependencyFact> out = new EnumMap<>(RelationKind.class);
        for (DependencyFact fact : facts) {
            if (fact != null) {
                out.put(fact.kind(), fact);
            }
        }
        return new FactSet(out);
    }

    public static FactSet of(Collection<? extends DependencyFact> facts) {
        return of(facts.toArray(new DependencyFact[0]));
    }

    public Optional<DatabaseFact> database() {
        return get(RelationKind.DATABASE, DatabaseFact.class);
    }

    public Optional<IngressFact> ingress() {
        return get(RelationKind.INGRESS, IngressFact.class);
    }

    public Optional<FederationFact> federation() {
        return get(RelationKind.FEDERATION, FederationFact.class);
    }

    public Optional<LoggingFact> logging() {
        return get(RelationKind.LOGGING, LoggingFact.class);
    }

    public boolean contains(RelationKind kind) {
        return facts.containsKey(kind);
    }

    public int size() {
        return facts.size();
    }

    private <T extends DependencyFact> Optional<T> get(RelationKind kind, Class<T> type) {
        DependencyFact fact = facts.get(kind);
        return type.isInstance(fact) ? Optional.of(type.cast(fact)) : Optional.empty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FactSet)) {
            return false;
        }
        return facts.equals(((FactSet) other).facts);
    }

    @Override
    public int hashCode() {
        return facts.hashCode();
    }

    @Override
    public String toString() {
        return "FactSet" + facts.keySet();
    }
}
