package org.fuwapachi.ws;

import org.fuwapachi.dto.DeleteEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeleteEventQueueTest {

    private static DeleteEvent event(String id) {
        return new DeleteEvent(id, Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void take_shouldReturnEventsInArrivalOrder() throws Exception {
        DeleteEventQueue queue = new DeleteEventQueue(100);
        for (int i = 1; i <= 5; i++) queue.enqueue(event(String.valueOf(i)));

        assertThat(queue.size()).isEqualTo(5);
        for (int i = 1; i <= 5; i++) {
            assertThat(queue.take().getId()).isEqualTo(String.valueOf(i));
        }
    }

    @Test
    void enqueue_shouldBlockWhileQueueIsFull() throws Exception {
        DeleteEventQueue queue = new DeleteEventQueue(1);
        queue.enqueue(event("1"));

        ExecutorService producer = Executors.newSingleThreadExecutor();
        Future<?> blocked = producer.submit(() -> queue.enqueue(event("2")));

        // toujours bloqué tant que personne ne consomme
        assertThatThrownBy(() -> blocked.get(200, TimeUnit.MILLISECONDS))
                .isInstanceOf(TimeoutException.class);

        assertThat(queue.take().getId()).isEqualTo("1");
        blocked.get(5, TimeUnit.SECONDS);
        assertThat(queue.take().getId()).isEqualTo("2");
        producer.shutdownNow();
    }

    @Test
    void enqueue_shouldThrowAndKeepInterruptFlagWhenInterrupted() throws Exception {
        DeleteEventQueue queue = new DeleteEventQueue(1);
        queue.enqueue(event("1"));

        ExecutorService producer = Executors.newSingleThreadExecutor();
        Future<Boolean> result = producer.submit(() -> {
            Thread.currentThread().interrupt();
            try {
                queue.enqueue(event("2"));
                return false;
            } catch (IllegalStateException e) {
                return Thread.currentThread().isInterrupted();
            }
        });

        assertThat(result.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(queue.size()).isEqualTo(1);
        producer.shutdownNow();
    }
}
