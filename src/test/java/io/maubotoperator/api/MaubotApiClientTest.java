package io.maubotoperator.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MaubotApiClientTest {
    @Test
    void loginShouldReturnBearerSession() throws Exception {
        try (FakeMaubotApi api = new FakeMaubotApi().user("root", "pw")) {
            MaubotApiClient client = new MaubotApiClient(api.rootUrl() + "/", Duration.ofSeconds(5));

            AdminSession session = client.login("root", "pw");

            assertEquals("Bearer tok-root", session.authorizationHeader());
            assertTrue(session.toString().contains("***"));
            assertEquals(api.rootUrl(), client.rootUrl());
        }
    }

    @Test
    void rejectedLoginShouldCarryStatusCode() throws Exception {
        try (FakeMaubotApi api = new FakeMaubotApi().user("root", "pw")) {
            MaubotApiClient client = new MaubotApiClient(api.rootUrl(), Duration.ofSeconds(5));

            MaubotApiException error = assertThrows(MaubotApiException.class, () -> client.login("root", "wrong"));

            assertEquals(401, error.statusCode());
        }
    }

    @Test
    void loginWithoutTokenShouldFail() throws Exception {
        try (FakeMaubotApi api = new FakeMaubotApi().user("root", "pw").loginBody("{\"ok\":true}")) {
            MaubotApiClient client = new MaubotApiClient(api.rootUrl(), Duration.ofSeconds(5));

            assertThrows(MaubotApiException.class, () -> client.login("root", "pw"));
        }
    }

    @Test
    void nonObjectResponseShouldBeMalformed() throws Exception {
        try (FakeMaubotApi api = new FakeMaubotApi().user("root", "pw").loginBody("[1,2,3]")) {
            MaubotApiClient client = new MaubotApiClient(api.rootUrl(), Duration.ofSeconds(5));

            MaubotApiException error = assertThrows(MaubotApiException.class, () -> client.login("root", "pw"));
            assertTrue(error.getMessage().contains("malformed"));
        }
    }

    @Test
    void createAdminShouldAcceptEmptyBody() throws Exception {
        try (FakeMaubotApi api = new FakeMaubotApi().user("root", "pw")) {
            MaubotApiClient client = new MaubotApiClient(api.rootUrl(), Duration.ofSeconds(5));

            client.createAdmin(client.login("root", "pw"), "alice", "secret");

            assertEquals(List.of("alice"), api.createdAdmins());
        }
    }

    @Test
    void registrationWithoutAccessTokenShouldFail() throws Exception {
        try (FakeMaubotApi api = new FakeMaubotApi().user("alice", "pw").registerBody("{\"user_id\":\"@bot:example.org\"}")) {
            MaubotApiClient client = new MaubotApiClient(api.rootUrl(), Duration.ofSeconds(5));
            AdminSession session = client.login("alice", "pw");

            assertThrows(MaubotApiException.class, () -> client.registerAccount(session, "synapse", "bot", "x"));
        }
    }

    @Test
    void unusableRootUrlShouldBecomeApiException() {
        MaubotApiClient client = new MaubotApiClient("http://local host/x", Duration.ofSeconds(2));

        MaubotApiException error = assertThrows(MaubotApiException.class, () -> client.login("root", "pw"));

        assertEquals(-1, error.statusCode());
        assertTrue(error.getMessage().startsWith("invalid Maubot API URL"));
    }

    @Test
    void unreachableServerShouldReportNoStatus() {
        MaubotApiClient client = new MaubotApiClient("http://127.0.0.1:1/_matrix/maubot", Duration.ofSeconds(2));

        MaubotApiException error = assertThrows(MaubotApiException.class, () -> client.login("root", "pw"));

        assertEquals(-1, error.statusCode());
    }
}
