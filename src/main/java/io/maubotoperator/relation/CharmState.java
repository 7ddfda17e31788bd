package io.maubotoperator.relation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface CharmState {
    String unitName();

    String appName();

    String modelName();

    Map<String, String> config();

    List<RelationSnapshot> relations(String relationName);

    Optional<Map<String, String>> secret(String secretId);
}
