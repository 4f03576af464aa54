package org.fuwapachi.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Origines autorisées (env ALLOWED_ORIGINS), partagées par le CORS, la liste des
 * messages et le handshake WebSocket. Comparaison exacte, jamais par préfixe.
 */
@Component
public class AllowedOrigins {

    private final Map<String, Boolean> allowed = new LinkedHashMap<>();

    public AllowedOrigins(@Value("${app.cors.allowed-origins:http://localhost:3000,http://127.0.0.1:3000}") String allowedOriginsProp) {
        if (allowedOriginsProp != null) {
            Arrays.stream(allowedOriginsProp.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .forEach(o -> allowed.put(o, Boolean.TRUE));
        }
    }

    public boolean isAllowed(String origin) {
        if (origin == null || origin.isEmpty()) return false;
        return allowed.getOrDefault(origin, Boolean.FALSE);
    }

    public List<String> asList() {
        return List.copyOf(allowed.keySet());
    }

    public boolean isEmpty() {
        return allowed.isEmpty();
    }

    /**
     * Origine déclarée par l'appelant : l'en-tête Origin s'il est présent, sinon
     * scheme://host[:port] extrait du Referer. Vide si aucun des deux n'est exploitable.
     */
    public Optional<String> callerOrigin(String originHeader, String refererHeader) {
        if (originHeader != null && !originHeader.isEmpty()) {
            return Optional.of(originHeader);
        }
        if (refererHeader == null || refererHeader.isEmpty()) {
            return Optional.empty();
        }
        // analyse tolérante : espaces ou '|' dans le chemin ou la requête sont acceptés, pas dans l'hôte
        try {
            UriComponents uri = UriComponentsBuilder.fromUriString(refererHeader).build();
            String host = uri.getHost();
            if (!StringUtils.hasLength(uri.getScheme()) || !StringUtils.hasLength(host)
                    || StringUtils.containsWhitespace(host)) {
                return Optional.empty();
            }
            String origin = uri.getScheme() + "://" + host;
            if (uri.getPort() != -1) origin += ":" + uri.getPort();
            return Optional.of(origin);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
