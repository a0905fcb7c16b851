package com.realtime.messenger.auth;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/** key = active:sid:{userId}, value = sid (TTL 은 기록하는 쪽이 정한다) */
@Component
@RequiredArgsConstructor
public class RedisSessionStore implements SessionStore {

    static final String KEY_PREFIX = "active:sid:";

    private final StringRedisTemplate redis;

    @Override
    public String getActiveSid(String userId) {
        return userId == null ? null : redis.opsForValue().get(KEY_PREFIX + userId);
    }
}
