// src/main/java/org/fuwapachi/security/AllowedOriginHandshakeInterceptor.java
package org.fuwapachi.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

@Slf4j
@Component
public class AllowedOriginHandshakeInterceptor implements HandshakeInterceptor {

    private final AllowedOrigins allowedOrigins;

    public AllowedOriginHandshakeInterceptor(AllowedOrigins allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        String origin = request.getHeaders().getOrigin();

        // refus avant toute création de connexion : le registre n'est pas touché
        if (!allowedOrigins.isAllowed(origin)) {
            log.warn("[WebSocket] Upgrade refused for origin {} from {}", origin, request.getRemoteAddress());
            response.setStatusCode(HttpStatus.FORBIDDEN);
            return false;
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               @Nullable Exception ex) {
        if (ex != null) {
            log.warn("[WebSocket] Upgrade error: {}", ex.getMessage());
        }
    }
}
