package io.maubotoperator.model;

import java.util.Locale;

public record UnitStatus(State state, String reason) {
    public enum State {
        WAITING,
        BLOCKED,
        ACTIVE
    }

    public UnitStatus {
        if (state == null) {
            throw new IllegalArgumentException("status state cannot be null");
        }
        reason = reason == null ? "" : reason;
    }

    public static UnitStatus waiting(String reason) {
        return new UnitStatus(State.WAITING, reason);
    }

    public static UnitStatus blocked(String reason) {
        return new UnitStatus(State.BLOCKED, reason);
    }

    public static UnitStatus active() {
        return new UnitStatus(State.ACTIVE, "");
    }

    @Override
    public String toString() {
        String label = state.name().charAt(0) + state.name().substring(1).toLowerCase(Locale.ROOT);
        return reason.isEmpty() ? label : label + "(" + reason + ")";
    }
}
