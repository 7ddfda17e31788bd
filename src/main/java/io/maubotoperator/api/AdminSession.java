package io.maubotoperator.api;

/**
 * Bearer token obtained from one login. Lives for a single action invocation.
 */
public record AdminSession(String username, String token) {
    public String authorizationHeader() {
        return "Bearer " + token;
    }

    @Override
    public String toString() {
        return "AdminSession[username=" + username + ", token=***]";
    }
}
