package org.fuwapachi.ws;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Un abonné WebSocket vivant.
 *
 * <p>La fermeture peut venir de deux côtés en même temps : le conteneur (lecture en
 * échec, déconnexion du client) ou le dispatcher (écriture en échec). {@link #close}
 * ne fait effet qu'une fois ; l'appelant qui obtient {@code true} se charge du
 * désenregistrement.
 */
@Slf4j
public class Connection {

    private final WebSocketSession session;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Connection(WebSocketSession session) {
        this.session = session;
    }

    public String getId() {
        return session.getId();
    }

    public void send(TextMessage message) throws IOException {
        if (closed.get()) {
            throw new IOException("Connection " + getId() + " already closed");
        }
        session.sendMessage(message);
    }

    /**
     * @return true pour le premier appelant seulement
     */
    public boolean close(CloseStatus status) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        try {
            session.close(status);
        } catch (IOException | RuntimeException e) {
            log.debug("[WebSocket] Close of {} failed: {}", getId(), e.getMessage());
        }
        return true;
    }

    @Override
    public String toString() {
        return "Connection[" + getId() + "]";
    }
}
