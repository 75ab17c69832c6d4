package org.fmrest.dataapi.tests;

import org.fmrest.dataapi.rest.FileMakerServer;
import org.fmrest.dataapi.rest.SessionState;
import org.fmrest.dataapi.rest.exception.RequestTimeoutException;
import org.fmrest.dataapi.tests.base.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Request timeouts, using WireMock's fixed response delay.
 */
public class TimeoutTest extends BaseTest {

    private static final String LAYOUTS_PATH = DB_PATH + "/layouts";

    @Override
    protected String getTestResourceDirectory() {
        return "TimeoutTest";
    }

    @Test
    @DisplayName("Slow response: RequestTimeoutException, session stays valid")
    public void testTimeoutKeepsSession() throws Exception {
        FileMakerServer server = loggedInServer();
        server.setTimeout(Duration.ofMillis(300));
        getWireMockServer().stubFor(get(urlEqualTo(LAYOUTS_PATH))
            .willReturn(okJson(loadStaticResponse("layouts.json")).withFixedDelay(1500)));

        assertThrows(RequestTimeoutException.class, server::getLayouts);
        assertEquals(SessionState.VALID, server.getSessionState());

        stubGet(LAYOUTS_PATH, "layouts.json");
        assertEquals(List.of("Contacts"), server.getLayouts());
    }

    @Test
    @DisplayName("Slow login: RequestTimeoutException, no session")
    public void testLoginTimeout() throws Exception {
        getWireMockServer().stubFor(post(urlEqualTo(SESSIONS_PATH))
            .willReturn(okJson(loadCommonResponse("login.json")).withFixedDelay(1500)));
        FileMakerServer server = createServer();
        server.setTimeout(Duration.ofMillis(300));

        assertThrows(RequestTimeoutException.class, server::login);
        assertEquals(SessionState.NO_TOKEN, server.getSessionState());
    }

    @Test
    @DisplayName("Timeout can be raised again after a timeout")
    public void testRaiseTimeout() throws Exception {
        FileMakerServer server = loggedInServer();
        getWireMockServer().stubFor(get(urlEqualTo(LAYOUTS_PATH))
            .willReturn(okJson(loadStaticResponse("layouts.json")).withFixedDelay(500)));

        server.setTimeout(Duration.ofMillis(100));
        assertThrows(RequestTimeoutException.class, server::getLayouts);

        server.setTimeout(Duration.ofSeconds(5));
        assertEquals(Duration.ofSeconds(5), server.getTimeout());
        assertEquals(List.of("Contacts"), server.getLayouts());
    }

    @Test
    @DisplayName("Timeout must be positive")
    public void testInvalidTimeout() {
        FileMakerServer server = createServer();

        assertThrows(IllegalArgumentException.class, () -> server.setTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> server.setTimeout(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> server.setTimeout(null));
        assertEquals(Duration.ofSeconds(10), server.getTimeout());
    }
}
