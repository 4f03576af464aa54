// src/main/java/org/fuwapachi/dto/CreateMessageRequest.java
package org.fuwapachi.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

/**
 * Corps de POST /messages. Seul "content" est lu : id, created_at et deleted_at
 * envoyés par le client sont ignorés.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateMessageRequest {
    private String content;
}
