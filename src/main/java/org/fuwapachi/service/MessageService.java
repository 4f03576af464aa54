// src/main/java/org/fuwapachi/service/MessageService.java
package org.fuwapachi.service;

import lombok.extern.slf4j.Slf4j;
import org.fuwapachi.dto.DeleteEvent;
import org.fuwapachi.dto.MessageDto;
import org.fuwapachi.model.Message;
import org.fuwapachi.repo.MessageRepository;
import org.fuwapachi.ws.DeleteEventQueue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.NoSuchElementException;

@Slf4j
@Service
public class MessageService {

    public static final String NOT_FOUND = "Message not found";

    private final MessageRepository repo;
    private final DeleteEventQueue eventQueue;
    private final int listLimit;

    public MessageService(MessageRepository repo,
                          DeleteEventQueue eventQueue,
                          @Value("${app.messages.list-limit:10}") int listLimit) {
        this.repo = repo;
        this.eventQueue = eventQueue;
        this.listLimit = listLimit;
    }

    // ---- API Service ----

    /** Jusqu'à {@code listLimit} messages actifs, tirés au hasard. */
    public List<MessageDto> listActive() {
        return repo.findRandomActive(listLimit).stream()
                .filter(m -> !m.isDeleted())
                .map(MessageDto::from)
                .toList();
    }

    public MessageDto create(String content) {
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("content is required");
        }

        // id, created_at et deleted_at sont toujours fixés côté serveur
        Message m = new Message();
        m.setContent(content);
        m.setCreatedAt(now());
        m.setDeletedAt(null);

        Message saved = repo.save(m);
        log.info("[Messages] Created message: ID={}, length={}", saved.getId(), content.length());
        return MessageDto.from(saved);
    }

    /**
     * Suppression logique puis mise en file de l'événement. L'écriture est validée
     * avant la mise en file ; le DELETE n'attend pas la diffusion.
     *
     * @throws NoSuchElementException si l'id est inconnu ou déjà supprimé
     */
    public DeleteEvent delete(String id) {
        Long key = parseId(id);
        if (key == null) {
            throw new NoSuchElementException(NOT_FOUND);
        }

        Instant deletedAt = now();
        int updated = repo.softDeleteIfActive(key, deletedAt);
        if (updated == 0) {
            throw new NoSuchElementException(NOT_FOUND);
        }
        log.info("[Messages] Soft-deleted message {}", key);

        DeleteEvent event = new DeleteEvent(String.valueOf(key), deletedAt);
        eventQueue.enqueue(event);
        log.info("[Broadcast] Queued delete event for message {}", key);
        return event;
    }

    // précision de la colonne en base : l'événement doit porter la valeur stockée
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private static Long parseId(String id) {
        if (id == null) return null;
        try {
            return Long.parseLong(id.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
