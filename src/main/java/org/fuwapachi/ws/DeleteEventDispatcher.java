package org.fuwapachi.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fuwapachi.dto.DeleteEvent;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Boucle unique qui vide la {@link DeleteEventQueue} et diffuse chaque événement
 * à un instantané du {@link ConnectionRegistry}.
 *
 * <p>Démarrée avec le contexte Spring, arrêtée avec lui. Aucune erreur d'envoi ne
 * l'interrompt : la connexion fautive est fermée et retirée, les autres reçoivent
 * l'événement normalement.
 */
@Slf4j
@Component
public class DeleteEventDispatcher implements SmartLifecycle {

    private final DeleteEventQueue queue;
    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;
    private final CustomizableThreadFactory threadFactory;

    private volatile Thread worker;

    public DeleteEventDispatcher(DeleteEventQueue queue, ConnectionRegistry registry, ObjectMapper objectMapper) {
        this.queue = queue;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.threadFactory = new CustomizableThreadFactory("ws-dispatch-");
        this.threadFactory.setDaemon(true);
    }

    @Override
    public synchronized void start() {
        if (worker != null) return;
        worker = threadFactory.newThread(this::run);
        worker.start();
        log.info("[Broadcast] Dispatcher started (queue capacity {})", queue.getCapacity());
    }

    @Override
    public void stop() {
        Thread t;
        synchronized (this) {
            t = worker;
            worker = null;
        }
        if (t == null) return;
        t.interrupt();
        try {
            t.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Broadcast] Dispatcher stopped");
    }

    @Override
    public boolean isRunning() {
        Thread t = worker;
        return t != null && t.isAlive();
    }

    private void run() {
        while (!Thread.currentThread().isInterrupted()) {
            DeleteEvent event;
            try {
                event = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                dispatch(event);
            } catch (RuntimeException e) {
                log.error("[Broadcast] Unexpected failure while dispatching {}", event, e);
            }
        }
    }

    /**
     * Diffuse un événement à toutes les connexions présentes au moment de l'instantané.
     *
     * @return nombre de connexions ayant reçu l'événement
     */
    public int dispatch(DeleteEvent event) {
        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("[Broadcast] Could not serialize {}", event, e);
            return 0;
        }

        List<Connection> targets = registry.snapshot();
        int delivered = 0;
        for (Connection connection : targets) {
            try {
                connection.send(frame);
                delivered++;
            } catch (Exception e) {
                log.warn("[Broadcast] Write to {} failed, dropping it: {}", connection, e.getMessage());
                if (connection.close(CloseStatus.SERVER_ERROR)) {
                    int remaining = registry.deregister(connection);
                    log.info("[WebSocket] Client removed after write failure. Total clients: {}", remaining);
                }
            }
        }
        log.info("[Broadcast] Delete event for message {} delivered to {}/{} clients",
                event.getId(), delivered, targets.size());
        return delivered;
    }
}
