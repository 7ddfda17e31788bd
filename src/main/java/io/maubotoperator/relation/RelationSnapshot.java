package io.maubotoperator.relation;

import java.util.Map;
import java.util.TreeMap;

/**
 * Data currently visible on one relation: the remote application databag plus each remote unit's databag.
 */
public record RelationSnapshot(
        int id,
        String remoteApp,
        Map<String, String> appData,
        Map<String, Map<String, String>> unitData
) {
    public RelationSnapshot {
        appData = appData == null ? Map.of() : Map.copyOf(appData);
        TreeMap<String, Map<String, String>> units = new TreeMap<>();
        if (unitData != null) {
            unitData.forEach((unit, data) -> units.put(unit, data == null ? Map.of() : Map.copyOf(data)));
        }
        unitData = units;
    }

    public static RelationSnapshot ofAppData(int id, String remoteApp, Map<String, String> appData) {
        return new RelationSnapshot(id, remoteApp, appData, Map.of());
    }

    public boolean hasRemoteApp() {
        return remoteApp != null && !remoteApp.isBlank();
    }

    public boolean hasAnyData() {
        if (!appData.isEmpty()) {
            return true;
        }
        for (Map<String, String> data : unitData.values()) {
            if (!data.isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
