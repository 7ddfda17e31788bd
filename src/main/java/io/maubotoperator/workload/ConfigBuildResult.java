package io.maubotoperator.workload;

import io.maubotoperator.model.RelationKind;
import io.maubotoperator.model.WorkloadConfig;

public record ConfigBuildResult(
        Verdict verdict,
        WorkloadConfig config,
        RelationKind missing,
        String invalidKey
) {
    public enum Verdict {
        READY,
        NOT_READY,
        INVALID
    }

    public static ConfigBuildResult ready(WorkloadConfig config) {
        return new ConfigBuildResult(Verdict.READY, config, null, null);
    }

    public static ConfigBuildResult notReady(RelationKind missing) {
        return new ConfigBuildResult(Verdict.NOT_READY, null, missing, null);
    }

    public static ConfigBuildResult invalid(String key) {
        return new ConfigBuildResult(Verdict.INVALID, null, null, key);
    }

    public boolean isReady() {
        return verdict == Verdict.READY;
    }
}
