package org.fmrest.dataapi.tests;

import org.fmrest.dataapi.model.DataSource;
import org.fmrest.dataapi.model.ServerSettings;
import org.fmrest.dataapi.rest.FileMakerErrorCode;
import org.fmrest.dataapi.rest.FileMakerServer;
import org.fmrest.dataapi.rest.SessionState;
import org.fmrest.dataapi.rest.exception.AuthException;
import org.fmrest.dataapi.rest.exception.NotAuthenticatedException;
import org.fmrest.dataapi.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Login, logout and close, and the session states they lead to.
 */
public class SessionLifecycleTest extends BaseTest {

    private static final String BASIC_AUTH = "Basic YWRtaW46c2VjcmV0";

    @Override
    protected String getTestResourceDirectory() {
        return "SessionLifecycleTest";
    }

    @Test
    @DisplayName("Login: Basic auth, empty body, token used as Bearer afterwards")
    public void testLoginThenBearer() throws Exception {
        stubLogin();
        stubGet(DB_PATH + "/layouts", "layouts.json");

        FileMakerServer server = createServer();
        assertEquals(SessionState.NO_TOKEN, server.getSessionState());

        assertEquals(TOKEN, server.login());
        assertEquals(SessionState.VALID, server.getSessionState());
        assertTrue(server.isLoggedIn());

        assertEquals(List.of("Contacts", "Invoices"), server.getLayouts());

        getWireMockServer().verify(1, postRequestedFor(urlEqualTo(SESSIONS_PATH))
            .withHeader("Authorization", equalTo(BASIC_AUTH))
            .withHeader("Content-Type", containing("application/json"))
            .withRequestBody(equalToJson("{}")));
        getWireMockServer().verify(1, getRequestedFor(urlEqualTo(DB_PATH + "/layouts"))
            .withHeader("Authorization", equalTo("Bearer " + TOKEN)));
    }

    @Test
    @DisplayName("Login: data sources are sent as fmDataSource")
    public void testLoginWithDataSources() throws Exception {
        stubLogin();

        ServerSettings settings = settings();
        settings.setDataSources(List.of(new DataSource("Invoices", "inv", "pw")));
        createServer(settings).login();

        getWireMockServer().verify(1, postRequestedFor(urlEqualTo(SESSIONS_PATH))
            .withRequestBody(equalToJson(
                "{\"fmDataSource\": [{\"database\": \"Invoices\", \"username\": \"inv\", \"password\": \"pw\"}]}")));
    }

    @Test
    @DisplayName("Login: token taken from X-FM-Data-Access-Token when the body has none")
    public void testLoginTokenFromHeader() throws Exception {
        getWireMockServer().stubFor(post(urlEqualTo(SESSIONS_PATH))
            .willReturn(okJson(loadStaticResponse("login-header-token.json"))
                .withHeader("X-FM-Data-Access-Token", "header-token")));

        assertEquals("header-token", createServer().login());
    }

    @Test
    @DisplayName("Login: rejected credentials raise AuthException with code 212")
    public void testBadCredentials() throws Exception {
        stubError(post(urlEqualTo(SESSIONS_PATH)), 401, "bad-credentials.json");

        FileMakerServer server = createServer();
        AuthException e = assertThrows(AuthException.class, server::login);

        assertEquals(212, e.getCode());
        assertEquals(FileMakerErrorCode.INVALID_USER_PASSWORD, e.getErrorCode());
        assertEquals(SessionState.NO_TOKEN, server.getSessionState());
    }

    @Test
    @DisplayName("Login: unreachable host raises AuthException")
    public void testUnreachableHost() {
        FileMakerServer server = createServer(new ServerSettings("http://localhost:1", DATABASE, LAYOUT));

        assertThrows(AuthException.class, server::login);
        assertEquals(SessionState.NO_TOKEN, server.getSessionState());
    }

    @Test
    @DisplayName("Logout: DELETE sessions/{token}, state NO_TOKEN")
    public void testLogout() throws Exception {
        FileMakerServer server = loggedInServer();
        stubLogout();

        server.logout();

        assertEquals(SessionState.NO_TOKEN, server.getSessionState());
        getWireMockServer().verify(1, deleteRequestedFor(urlEqualTo(SESSIONS_PATH + "/" + TOKEN)));
    }

    @Test
    @DisplayName("Logout: remote failure still leaves NO_TOKEN, then raises AuthException")
    public void testLogoutRemoteFailure() throws Exception {
        FileMakerServer server = loggedInServer();
        stubError(delete(urlEqualTo(SESSIONS_PATH + "/" + TOKEN)), 401, "logout-failed.json");

        AuthException e = assertThrows(AuthException.class, server::logout);

        assertEquals(952, e.getCode());
        assertEquals(SessionState.NO_TOKEN, server.getSessionState());
    }

    @Test
    @DisplayName("Logout: without a token nothing is sent")
    public void testLogoutWithoutToken() {
        FileMakerServer server = createServer();

        server.logout();

        assertEquals(0, requestCount());
    }

    @Test
    @DisplayName("Calls before login fail without sending a request")
    public void testCallWithoutLogin() {
        FileMakerServer server = createServer();

        assertThrows(NotAuthenticatedException.class, server::getLayouts);
        assertThrows(NotAuthenticatedException.class, () -> server.getRecord(1));
        assertEquals(0, requestCount());
    }

    @Test
    @DisplayName("Re-login: previous token is revoked, session stays VALID")
    public void testRelogin() throws Exception {
        FileMakerServer server = loggedInServer();
        stubLogout();

        server.login();

        assertEquals(SessionState.VALID, server.getSessionState());
        getWireMockServer().verify(2, postRequestedFor(urlEqualTo(SESSIONS_PATH)));
        getWireMockServer().verify(1, deleteRequestedFor(urlEqualTo(SESSIONS_PATH + "/" + TOKEN)));
    }

    @Test
    @DisplayName("Re-login: a failed revoke of the previous token does not fail the login")
    public void testReloginRevokeFails() throws Exception {
        FileMakerServer server = loggedInServer();
        stubError(delete(urlEqualTo(SESSIONS_PATH + "/" + TOKEN)), 401, "logout-failed.json");

        assertEquals(TOKEN, server.login());
        assertEquals(SessionState.VALID, server.getSessionState());
    }

    @Test
    @DisplayName("Close: logs out, no further login accepted")
    public void testCloseInvalidates() throws Exception {
        stubLogin();
        stubLogout();

        try (FileMakerServer server = createServer()) {
            server.login();
            fms = server;
        }

        assertEquals(SessionState.INVALIDATED, fms.getSessionState());
        getWireMockServer().verify(1, deleteRequestedFor(urlEqualTo(SESSIONS_PATH + "/" + TOKEN)));
        assertThrows(IllegalStateException.class, fms::login);
        assertThrows(NotAuthenticatedException.class, fms::getLayouts);
    }

    @Test
    @DisplayName("Close: a failed logout does not prevent closing")
    public void testCloseWithFailedLogout() throws Exception {
        FileMakerServer server = loggedInServer();
        stubError(delete(urlEqualTo(SESSIONS_PATH + "/" + TOKEN)), 500, "logout-failed.json");

        server.close();

        assertEquals(SessionState.INVALIDATED, server.getSessionState());
    }
}
