package org.fuwapachi.config;

import org.fuwapachi.security.AllowedOriginHandshakeInterceptor;
import org.fuwapachi.security.AllowedOrigins;
import org.fuwapachi.ws.SubscriptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WsConfig implements WebSocketConfigurer {

    private final SubscriptionHandler subscriptionHandler;
    private final AllowedOriginHandshakeInterceptor originInterceptor;
    private final AllowedOrigins allowedOrigins;

    public WsConfig(SubscriptionHandler subscriptionHandler,
                    AllowedOriginHandshakeInterceptor originInterceptor,
                    AllowedOrigins allowedOrigins) {
        this.subscriptionHandler = subscriptionHandler;
        this.originInterceptor = originInterceptor;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // mêmes origines que CORS ; notre intercepteur passe avant celui de Spring
        registry.addHandler(subscriptionHandler, "/ws")
                .addInterceptors(originInterceptor)
                .setAllowedOrigins(allowedOrigins.asList().toArray(new String[0]));
    }
}
