package org.fuwapachi.security;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.DefaultCorsProcessor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Règle CORS de Spring, sauf pour les requêtes réelles : une origine ou une méthode
 * non admise n'ajoute simplement pas les en-têtes CORS et la requête continue vers
 * le handler. Seuls les préflights sont refusés, avec le corps JSON habituel de l'API.
 *
 * <p>Le contrôle d'origine bloquant reste dans {@code MessageController#list} et le
 * handshake WebSocket.
 */
public class ForbiddenJsonCorsProcessor extends DefaultCorsProcessor {

    static final String BODY = "{\"error\":\"Forbidden\"}";

    @Override
    protected boolean handleInternal(ServerHttpRequest request, ServerHttpResponse response,
                                     CorsConfiguration config, boolean preFlightRequest) throws IOException {
        if (!preFlightRequest) {
            String allowOrigin = checkOrigin(config, request.getHeaders().getOrigin());
            if (allowOrigin == null || checkMethods(config, request.getMethod()) == null) {
                return true;
            }
        }
        return super.handleInternal(request, response, config, preFlightRequest);
    }

    @Override
    protected void rejectRequest(ServerHttpResponse response) throws IOException {
        response.setStatusCode(HttpStatus.FORBIDDEN);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getBody().write(BODY.getBytes(StandardCharsets.UTF_8));
        response.flush();
    }
}
