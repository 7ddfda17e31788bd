package io.maubotoperator.api;

public record RegisteredAccount(
        String userId,
        String accessToken,
        String deviceId
) {
    @Override
    public String toString() {
        return "RegisteredAccount[userId=" + userId + ", accessToken=***, deviceId=" + deviceId + "]";
    }
}
