package com.realtime.messenger.security;

import com.realtime.messenger.user.entity.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;

@Component
public class JwtProviderImpl implements JwtProvider {

    private static final String HMAC_ALG = "HmacSHA256"; // HS256 기준
    private final SecretKey accessKey;
    private final long accessExpMs;

    public JwtProviderImpl(
            @Value("${jwt.secret}") String accessSecret,
            @Value("${jwt.secret-base64:false}") boolean accessBase64,
            @Value("${jwt.expiration-ms}") long accessExpMs
    ) {
        byte[] aBytes = accessBase64
                ? Base64.getDecoder().decode(accessSecret)
                : accessSecret.getBytes(StandardCharsets.UTF_8);

        if (aBytes.length < 32) {
            throw new IllegalArgumentException("JWT secret length must be >= 32 bytes (256 bits).");
        }

        this.accessKey = new SecretKeySpec(aBytes, HMAC_ALG);
        this.accessExpMs = accessExpMs;
    }

    @Override
    public String createAccessToken(User user) {
        return builder(user).compact();
    }

    @Override
    public String createAccessToken(User user, String sid) {
        return builder(user).claim("sid", sid).compact();
    }

    private JwtBuilder builder(User user) {
        Instant now = Instant.now();
        Instant exp = now.plusMillis(accessExpMs);
        return Jwts.builder()
                .subject(user.getId().toString())
                .claim("name", user.getName())
                .issuedAt(Date.from(now))
                .expiration(Date.from(exp))
                .signWith(accessKey); // 0.12.x: 알고리즘은 키에서 유추(HS256)
    }

    @Override
    public Claims parseAccessClaims(String accessToken) {
        try {
            return Jwts.parser()
                    .verifyWith(accessKey)
                    .build()
                    .parseSignedClaims(accessToken)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new SecurityException("Invalid access token", e);
        }
    }
}
