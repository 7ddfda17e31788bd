package io.maubotoperator.model;

import java.util.Optional;

public record WorkloadConfig(
        String publicUrl,
        String databaseDsn,
        FederationFact federation,
        String loggingEndpoint,
        String rootAdminPassword
) {
    public Optional<FederationFact> federationBlock() {
        return Optional.ofNullable(federation);
    }

    public Optional<String> loggingBlock() {
        return Optional.ofNullable(loggingEndpoint);
    }

    public Optional<String> rootAdmin() {
        return Optional.ofNullable(rootAdminPassword);
    }

    @Override
    public String toString() {
        return "WorkloadConfig[publicUrl=" + publicUrl
                + ", federation=" + (federation != null)
                + ", logging=" + (loggingEndpoint != null)
                + ", rootAdmin=" + (rootAdminPassword != null) + "]";
    }
}
