package org.fuwapachi.ws;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.EOFException;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SubscriptionHandlerTest {

    @Mock
    private WebSocketSession session;

    private final Map<String, Object> attributes = new HashMap<>();
    private ConnectionRegistry registry;
    private SubscriptionHandler handler;

    @BeforeEach
    void init() {
        registry = new ConnectionRegistry();
        handler = new SubscriptionHandler(registry, 15_000, 512 * 1024, 64 * 1024, 0L);
        lenient().when(session.getAttributes()).thenReturn(attributes);
        lenient().when(session.getId()).thenReturn("s1");
    }

    @Test
    void afterConnectionEstablished_shouldRegisterConnection() {
        handler.afterConnectionEstablished(session);

        assertThat(registry.size()).isEqualTo(1);
        assertThat(attributes.get(SubscriptionHandler.CONNECTION_ATTRIBUTE)).isInstanceOf(Connection.class);
        verify(session).setTextMessageSizeLimit(64 * 1024);
    }

    @Test
    void handleTextMessage_shouldIgnoreIncomingFrame() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"ping\":true}"));

        assertThat(registry.size()).isEqualTo(1);
        verify(session, never()).sendMessage(any());
    }

    @Test
    void afterConnectionClosed_shouldDeregisterConnection() {
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(registry.size()).isZero();
    }

    @Test
    void handleTransportError_shouldDeregisterOnlyOnceWhenFollowedByClose() {
        handler.afterConnectionEstablished(session);
        Connection other = new Connection(mock(WebSocketSession.class));
        registry.register(other);

        handler.handleTransportError(session, new EOFException("client gone"));
        handler.afterConnectionClosed(session, CloseStatus.NO_CLOSE_FRAME);

        assertThat(registry.snapshot()).containsExactly(other);
    }

    @Test
    void afterConnectionClosed_shouldNotConflictWithDispatcherClose() {
        handler.afterConnectionEstablished(session);
        Connection connection = (Connection) attributes.get(SubscriptionHandler.CONNECTION_ATTRIBUTE);

        // chemin du dispatcher : écriture en échec
        assertThat(connection.close(CloseStatus.SERVER_ERROR)).isTrue();
        registry.deregister(connection);

        handler.afterConnectionClosed(session, CloseStatus.SERVER_ERROR);

        assertThat(registry.size()).isZero();
    }

    @Test
    void afterConnectionClosed_shouldDoNothingWithoutRegistration() {
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(registry.size()).isZero();
    }
}
