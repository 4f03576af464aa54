package org.fuwapachi.security;

import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AllowedOriginHandshakeInterceptorTest {

    private final AllowedOrigins origins = new AllowedOrigins("http://localhost:8080,http://127.0.0.1:8080");
    private final AllowedOriginHandshakeInterceptor interceptor = new AllowedOriginHandshakeInterceptor(origins);
    private final WebSocketHandler wsHandler = mock(WebSocketHandler.class);

    private boolean handshake(String origin, MockHttpServletResponse servletResponse, Map<String, Object> attributes) {
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws");
        if (origin != null) servletRequest.addHeader("Origin", origin);
        return interceptor.beforeHandshake(
                new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(servletResponse),
                wsHandler,
                attributes);
    }

    @Test
    void beforeHandshake_shouldAcceptAllowedOrigin() {
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, Object> attributes = new HashMap<>();

        assertThat(handshake("http://localhost:8080", response, attributes)).isTrue();
        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(attributes).isEmpty();
    }

    @Test
    void beforeHandshake_shouldRefuseUnknownOriginWith403() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(handshake("http://forbidden.example.com", response, new HashMap<>())).isFalse();
        assertThat(response.getStatus()).isEqualTo(403);
    }

    @Test
    void beforeHandshake_shouldRefuseMissingOrigin() {
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(handshake(null, response, new HashMap<>())).isFalse();
        assertThat(response.getStatus()).isEqualTo(403);
    }

    @Test
    void beforeHandshake_shouldRefusePrefixOfAllowedOrigin() {
        assertThat(handshake("http://localhost:8080.attacker.io", new MockHttpServletResponse(), new HashMap<>()))
                .isFalse();
    }

    @Test
    void beforeHandshake_shouldRefuseEverythingWhenNoOriginConfigured() {
        AllowedOriginHandshakeInterceptor closed = new AllowedOriginHandshakeInterceptor(new AllowedOrigins(""));
        MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/ws");
        servletRequest.addHeader("Origin", "http://localhost:8080");

        boolean accepted = closed.beforeHandshake(new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(new MockHttpServletResponse()), wsHandler, new HashMap<>());

        assertThat(accepted).isFalse();
    }
}
