// src/main/java/org/fuwapachi/dto/MessageDto.java
package org.fuwapachi.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.Setter;
import org.fuwapachi.model.Message;

import java.time.Instant;

@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "content", "created_at", "deleted_at"})
public class MessageDto {
    private String id;
    private String content;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("deleted_at")
    private Instant deletedAt; // absent du JSON tant que null

    public static MessageDto from(Message m) {
        MessageDto dto = new MessageDto();
        dto.setId(m.getId() != null ? String.valueOf(m.getId()) : null);
        dto.setContent(m.getContent());
        dto.setCreatedAt(m.getCreatedAt());
        dto.setDeletedAt(m.getDeletedAt());
        return dto;
    }
}
