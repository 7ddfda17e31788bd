package io.maubotoperator.model;

public record ReadinessCheck(
        String name,
        String url,
        int periodSeconds,
        int threshold
) {
    public static ReadinessCheck http(String name, String url) {
        return new ReadinessCheck(name, url, 10, 3);
    }
}
