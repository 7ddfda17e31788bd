package io.maubotoperator.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;

/**
 * User-facing charm configuration, parsed from the raw key/value map delivered with every event.
 *
 * <p>Values are kept as given; {@link #invalidKey()} reports the first key whose value cannot be used.
 */
public record OperatorSettings(
        String publicUrl,
        String rootAdminPassword,
        String apiRootUrl,
        long apiTimeoutMs
) {
    public static final String PUBLIC_URL = "public-url";
    public static final String ROOT_ADMIN_PASSWORD = "root-admin-password";
    public static final String API_ROOT_URL = "api-root-url";
    public static final String API_TIMEOUT_MS = "api-timeout-ms";

    public static final String DEFAULT_PUBLIC_URL = "https://maubot.local";
    public static final String DEFAULT_API_ROOT_URL =
            "http://localhost:" + OperatorConfig.WORKLOAD_PORT + OperatorConfig.WORKLOAD_BASE_PATH;
    public static final long DEFAULT_API_TIMEOUT_MS = 5_000L;

    public static OperatorSettings defaults() {
        return new OperatorSettings(DEFAULT_PUBLIC_URL, null, DEFAULT_API_ROOT_URL, DEFAULT_API_TIMEOUT_MS);
    }

    public static OperatorSettings fromConfig(Map<String, String> raw) {
        if (raw == null || raw.isEmpty()) {
            return defaults();
        }
        String publicUrl = trimToNull(raw.get(PUBLIC_URL));
        String rootPassword = trimToNull(raw.get(ROOT_ADMIN_PASSWORD));
        String apiRoot = trimToNull(raw.get(API_ROOT_URL));
        return new OperatorSettings(
                publicUrl == null ? DEFAULT_PUBLIC_URL : publicUrl,
                rootPassword,
                apiRoot == null ? DEFAULT_API_ROOT_URL : stripTrailingSlash(apiRoot),
                parseTimeout(raw.get(API_TIMEOUT_MS))
        );
    }

    public String invalidKey() {
        if (!isHttpUrl(publicUrl)) {
            return PUBLIC_URL;
        }
        if (!isHttpUrl(apiRootUrl)) {
            return API_ROOT_URL;
        }
        if (apiTimeoutMs <= 0L) {
            return API_TIMEOUT_MS;
        }
        return null;
    }

    public static boolean isHttpUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null || uri.getHost().isBlank()) {
                return false;
            }
            String normalized = scheme.toLowerCase(Locale.ROOT);
            return "http".equals(normalized) || "https".equals(normalized);
        } catch (URISyntaxException e) {
            return false;
        }
    }

    public static String stripTrailingSlash(String raw) {
        String value = raw.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static long parseTimeout(String raw) {
        String value = trimToNull(raw);
        if (value == null) {
            return DEFAULT_API_TIMEOUT_MS;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private static String trimToNull(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim();
    }

    @Override
    public String toString() {
        return "OperatorSettings[publicUrl=" + publicUrl
                + ", rootAdminPassword=" + (rootAdminPassword == null ? "unset" : "***")
                + ", apiRootUrl=" + apiRootUrl
                + ", apiTimeoutMs=" + apiTimeoutMs + "]";
    }
}
