package com.realtime.messenger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "app.live")
@Data
public class LiveProps {
    private String endpoint = "/ws/live";
    private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    /** 연결당 전송 제한 시간. 넘기면 죽은 연결로 간주 */
    private int sendTimeLimitMs = 5000;
    /** 연결당 대기 버퍼 한도(bytes) */
    private int bufferSizeLimit = 512 * 1024;
    /** join 시 JWT 필수 여부 (subject == userId) */
    private boolean requireToken = false;
}
