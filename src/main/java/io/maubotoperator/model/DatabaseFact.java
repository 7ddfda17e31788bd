package io.maubotoperator.model;

public record DatabaseFact(
        String host,
        int port,
        String user,
        String password,
        String databaseName
) implements DependencyFact {
    @Override
    public RelationKind kind() {
        return RelationKind.DATABASE;
    }

    @Override
    public String toString() {
        return "DatabaseFact[host=" + host + ", port=" + port + ", user=" + user
                + ", password=***, databaseName=" + databaseName + "]";
    }
}
