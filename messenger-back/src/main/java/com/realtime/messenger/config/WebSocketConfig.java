package com.realtime.messenger.config;

import com.realtime.messenger.live.handler.LiveSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final LiveSocketHandler liveSocketHandler;
    private final LiveProps liveProps;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // 클라이언트는 ws://host{endpoint} 로 붙은 뒤 join 이벤트로 신원을 알린다
        registry.addHandler(liveSocketHandler, liveProps.getEndpoint())
                .setAllowedOriginPatterns(liveProps.getAllowedOrigins().toArray(String[]::new));
    }
}
