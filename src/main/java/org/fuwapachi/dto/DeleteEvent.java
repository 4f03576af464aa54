// src/main/java/org/fuwapachi/dto/DeleteEvent.java
package org.fuwapachi.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Evénement poussé aux abonnés WebSocket après une suppression logique.
 * Jamais persisté : il vit entre la file d'événements et le dispatcher.
 */
@Getter
@ToString
@RequiredArgsConstructor
@JsonPropertyOrder({"type", "id", "deleted_at"})
public class DeleteEvent {

    public static final String TYPE = "message_deleted";

    private final String type = TYPE;

    private final String id;

    @JsonProperty("deleted_at")
    private final Instant deletedAt; // même horodatage que celui écrit en base
}
