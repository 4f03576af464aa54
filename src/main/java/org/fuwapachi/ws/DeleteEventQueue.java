package org.fuwapachi.ws;

import lombok.extern.slf4j.Slf4j;
import org.fuwapachi.dto.DeleteEvent;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * File bornée (FIFO) entre les requêtes DELETE et le dispatcher.
 * Quand elle est pleine, {@link #enqueue} bloque l'appelant plutôt que de grossir.
 */
@Slf4j
@Component
public class DeleteEventQueue {

    private final BlockingQueue<DeleteEvent> events;
    private final int capacity;

    public DeleteEventQueue(@Value("${app.broadcast.queue-capacity:100}") int capacity) {
        this.capacity = capacity;
        this.events = new ArrayBlockingQueue<>(capacity);
    }

    public void enqueue(DeleteEvent event) {
        if (events.remainingCapacity() == 0) {
            log.warn("[Broadcast] Event queue full ({}), waiting for dispatcher", capacity);
        }
        try {
            events.put(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while queueing delete event for message " + event.getId(), e);
        }
    }

    public DeleteEvent take() throws InterruptedException {
        return events.take();
    }

    public int size() {
        return events.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
