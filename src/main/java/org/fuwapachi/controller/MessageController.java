// src/main/java/org/fuwapachi/controller/MessageController.java
package org.fuwapachi.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.fuwapachi.dto.CreateMessageRequest;
import org.fuwapachi.dto.MessageDto;
import org.fuwapachi.security.AllowedOrigins;
import org.fuwapachi.service.MessageService;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/messages")
public class MessageController {

    private final MessageService messageService;
    private final AllowedOrigins allowedOrigins;
    private final ObjectMapper objectMapper;

    public MessageController(MessageService messageService,
                             AllowedOrigins allowedOrigins,
                             ObjectMapper objectMapper) {
        this.messageService = messageService;
        this.allowedOrigins = allowedOrigins;
        this.objectMapper = objectMapper;
    }

    // ---------- GET /messages : échantillon aléatoire de messages actifs ----------

    @GetMapping
    public ResponseEntity<?> list(@RequestHeader(value = HttpHeaders.ORIGIN, required = false) String origin,
                                  @RequestHeader(value = HttpHeaders.REFERER, required = false) String referer,
                                  HttpServletRequest request) {
        log.info("[GET /messages] Request received from {}", request.getRemoteAddr());

        Optional<String> caller = allowedOrigins.callerOrigin(origin, referer);
        if (caller.isEmpty() || !allowedOrigins.isAllowed(caller.get())) {
            log.warn("[GET /messages] Forbidden: origin={} referer={}", origin, referer);
            return error(HttpStatus.FORBIDDEN, "Forbidden");
        }

        try {
            List<MessageDto> messages = messageService.listActive();
            log.info("[GET /messages] Returned {} messages (random selection)", messages.size());
            return ResponseEntity.ok(messages);
        } catch (DataAccessException e) {
            log.error("[GET /messages] Database error", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Database error");
        }
    }

    // ---------- POST /messages ----------

    @PostMapping
    public ResponseEntity<?> create(@RequestBody String body, HttpServletRequest request) {
        log.info("[POST /messages] Request received from {}", request.getRemoteAddr());

        CreateMessageRequest payload;
        try {
            payload = objectMapper.readValue(body, CreateMessageRequest.class);
        } catch (JsonProcessingException e) {
            log.warn("[POST /messages] Bad Request: {}", e.getOriginalMessage());
            return error(HttpStatus.BAD_REQUEST, "Invalid request body");
        }
        if (payload == null) {
            return error(HttpStatus.BAD_REQUEST, "Invalid request body");
        }

        try {
            MessageDto saved = messageService.create(payload.getContent());
            return ResponseEntity.status(HttpStatus.CREATED).body(saved);
        } catch (IllegalArgumentException e) {
            log.warn("[POST /messages] Bad Request: {}", e.getMessage());
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (DataAccessException e) {
            log.error("[POST /messages] Database error", e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to create message");
        }
    }

    // ---------- DELETE /messages/{id} : suppression logique + diffusion WebSocket ----------

    @DeleteMapping("/{id}")
    public ResponseEntity<?> delete(@PathVariable String id, HttpServletRequest request) {
        log.info("[DELETE /messages/{}] Request received from {}", id, request.getRemoteAddr());
        try {
            messageService.delete(id);
            return ResponseEntity.noContent().build();
        } catch (NoSuchElementException e) {
            log.warn("[DELETE /messages/{}] Not Found", id);
            return error(HttpStatus.NOT_FOUND, MessageService.NOT_FOUND);
        } catch (DataAccessException e) {
            log.error("[DELETE /messages/{}] Database error", id, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to delete message");
        }
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
