package org.fuwapachi.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fuwapachi.security.AllowedOrigins;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartupBanner {

    private final Environment env;
    private final AllowedOrigins allowedOrigins;

    @EventListener
    public void onReady(ApplicationReadyEvent e) {
        String port = env.getProperty("local.server.port", env.getProperty("server.port", "8080"));

        log.info("========================================");
        log.info("  Fuwapachi API Server");
        log.info("========================================");
        log.info("  Environment: {}", env.getProperty("app.env", "development"));
        log.info("  Server: http://localhost:{}", port);
        log.info("  WebSocket: ws://localhost:{}/ws", port);
        databaseSummary().ifPresent(db -> log.info("  Database: {}", db));
        log.info("  Allowed Origins: {}", allowedOrigins.asList());
        if (allowedOrigins.isEmpty()) {
            log.warn("  No allowed origin configured: listing and WebSocket subscriptions will be refused");
        }
        log.info("========================================");
    }

    /** user@host:port/name, seulement si une base est nommée (DB_NAME). */
    Optional<String> databaseSummary() {
        String dbName = env.getProperty("app.db.name", "");
        if (dbName.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(env.getProperty("app.db.user", "") + "@"
                + env.getProperty("app.db.host", "localhost") + ":"
                + env.getProperty("app.db.port", "3306") + "/" + dbName);
    }
}
