package io.maubotoperator.runtime;

import io.maubotoperator.model.UnitStatus;

@FunctionalInterface
public interface StatusReporter {
    void report(UnitStatus status);
}
