package org.fuwapachi.ws;

import jakarta.websocket.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Point d'abonnement /ws. L'origine est déjà validée par
 * {@link org.fuwapachi.security.AllowedOriginHandshakeInterceptor} quand on arrive ici.
 *
 * <p>Cycle de vie : connexion établie → enregistrée ; trames entrantes ignorées
 * (keep-alive) ; fermeture ou erreur de transport → retirée une seule fois.
 */
@Slf4j
@Component
public class SubscriptionHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTRIBUTE = "fuwapachi.connection";

    private final ConnectionRegistry registry;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeBytes;
    private final int maxTextMessageBytes;
    private final long idleTimeoutMs;

    public SubscriptionHandler(ConnectionRegistry registry,
                               @Value("${app.ws.send-time-limit-ms:15000}") int sendTimeLimitMs,
                               @Value("${app.ws.send-buffer-size-bytes:524288}") int sendBufferSizeBytes,
                               @Value("${app.ws.max-text-message-bytes:65536}") int maxTextMessageBytes,
                               @Value("${app.ws.idle-timeout-ms:0}") long idleTimeoutMs) {
        this.registry = registry;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.sendBufferSizeBytes = sendBufferSizeBytes;
        this.maxTextMessageBytes = maxTextMessageBytes;
        this.idleTimeoutMs = idleTimeoutMs;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        applyTransportLimits(session);

        Connection connection = new Connection(
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeBytes));
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);

        int total = registry.register(connection);
        log.info("[WebSocket] New connection {} from {}. Total clients: {}",
                session.getId(), session.getRemoteAddress(), total);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // keep-alive uniquement, contenu ignoré
        log.trace("[WebSocket] Keep-alive from {}", session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("[WebSocket] Transport error on {}: {}", session.getId(), exception.getMessage());
        teardown(session, CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        teardown(session, status);
    }

    private void teardown(WebSocketSession session, CloseStatus status) {
        Object attr = session.getAttributes().get(CONNECTION_ATTRIBUTE);
        if (!(attr instanceof Connection connection)) return;

        // le dispatcher a pu fermer la connexion le premier : il s'est alors chargé du retrait
        if (connection.close(status)) {
            int remaining = registry.deregister(connection);
            log.info("[WebSocket] Client {} disconnected ({}). Total clients: {}",
                    session.getId(), status.getCode(), remaining);
        }
    }

    private void applyTransportLimits(WebSocketSession session) {
        session.setTextMessageSizeLimit(maxTextMessageBytes);
        if (idleTimeoutMs > 0 && session instanceof NativeWebSocketSession nws) {
            Session nativeSession = nws.getNativeSession(Session.class);
            if (nativeSession != null) nativeSession.setMaxIdleTimeout(idleTimeoutMs);
        }
    }
}
