package io.maubotoperator.relation;

import java.io.IOException;

@FunctionalInterface
public interface CharmStateSource {
    CharmState load() throws IOException;
}
