package io.maubotoperator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.maubotoperator.config.OperatorSettings;
import io.maubotoperator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Blocking client for the maubot management API. Every method performs exactly one request and never retries.
 */
public final class MaubotApiClient {
    private static final Logger log = LoggerFactory.getLogger(MaubotApiClient.class);

    private final String rootUrl;
    private final Duration timeout;
    private final HttpClient http;

    public MaubotApiClient(String rootUrl, Duration timeout) {
        this(rootUrl, timeout, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build());
    }

    public MaubotApiClient(String rootUrl, Duration timeout, HttpClient http) {
        this.rootUrl = OperatorSettings.stripTrailingSlash(rootUrl);
        this.timeout = timeout;
        this.http = http;
    }

    public static MaubotApiClient fromSettings(OperatorSettings settings) {
        return new MaubotApiClient(settings.apiRootUrl(), Duration.ofMillis(settings.apiTimeoutMs()));
    }

    public String rootUrl() {
        return rootUrl;
    }

    public AdminSession login(String username, String password) throws MaubotApiException {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("username", username);
        payload.put("password", password);
        JsonNode body = send("POST", "/v1/auth/login", payload, null);
        String token = body.path("token").asText("");
        if (token.isBlank()) {
            throw new MaubotApiException("token not found in Maubot API response");
        }
        return new AdminSession(username, token);
    }

    public void createAdmin(AdminSession session, String name, String password) throws MaubotApiException {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("password", password);
        send("PUT", "/v1/admin/" + pathSegment(name), payload, session);
    }

    public RegisteredAccount registerAccount(
            AdminSession session,
            String homeserver,
            String username,
            String password
    ) throws MaubotApiException {
        ObjectNode payload = Jsons.mapper().createObjectNode();
        payload.put("username", username);
        payload.put("password", password);
        JsonNode body = send("POST", "/v1/client/auth/" + pathSegment(homeserver) + "/register", payload, session);
        String userId = body.path("user_id").asText("");
        String accessToken = body.path("access_token").asText("");
        if (userId.isBlank() || accessToken.isBlank()) {
            throw new MaubotApiException("user_id or access_token missing in Maubot API response");
        }
        return new RegisteredAccount(userId, accessToken, body.path("device_id").asText(""));
    }

    private JsonNode send(String method, String path, JsonNode payload, AdminSession session) throws MaubotApiException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(URI.create(rootUrl + path));
        } catch (IllegalArgumentException e) {
            throw new MaubotApiException("invalid Maubot API URL: " + rootUrl + path, e);
        }
        builder = builder
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(payload), StandardCharsets.UTF_8));
        if (session != null) {
            builder.header("Authorization", session.authorizationHeader());
        }
        HttpResponse<String> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("request {} {} failed: {}", method, path, e.toString());
            throw new MaubotApiException("error while interacting with Maubot API: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MaubotApiException("interrupted while interacting with Maubot API", e);
        }
        int status = response.statusCode();
        if (status / 100 != 2) {
            log.warn("request {} {} returned status={}", method, path, status);
            throw new MaubotApiException(method + " " + path + " failed status=" + status, status);
        }
        String raw = response.body();
        if (raw == null || raw.isBlank()) {
            return Jsons.mapper().createObjectNode();
        }
        try {
            JsonNode node = Jsons.mapper().readTree(raw);
            if (node == null || !node.isObject()) {
                throw new MaubotApiException("malformed Maubot API response for " + path, status);
            }
            return node;
        } catch (IOException e) {
            throw new MaubotApiException("malformed Maubot API response for " + path, e);
        }
    }

    private static String pathSegment(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
