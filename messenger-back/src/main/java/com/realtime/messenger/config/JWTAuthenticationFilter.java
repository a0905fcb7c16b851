package com.realtime.messenger.config;

import com.realtime.messenger.auth.SessionStore;
import com.realtime.messenger.security.JwtProvider;
import io.jsonwebtoken.Claims;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JWTAuthenticationFilter extends OncePerRequestFilter {

    private final JwtProvider jwtProvider;
    private final SessionStore sessionStore;   // 싱글세션(선택)

    private static final String BEARER = "Bearer ";

    /** 인증이 필요 없는 경로는 필터를 아예 건너뜁니다. */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getServletPath();
        return p.startsWith("/ws/")                 // live 소켓 핸드셰이크 (신원은 join 이벤트로 결정)
                || "OPTIONS".equalsIgnoreCase(request.getMethod()); // CORS preflight
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String h = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (h != null && h.startsWith(BEARER)) {
            String token = h.substring(BEARER.length());
            try {
                Claims c = jwtProvider.parseAccessClaims(token);

                // subject = 사용자 UUID 문자열
                String userId = c.getSubject();

                // 선택: 싱글세션 강제용 sid 클레임(없으면 스킵)
                String sid = c.get("sid", String.class);
                if (sid != null && !sessionStore.isActiveSid(userId, sid)) {
                    // 이전/무효 토큰: 인증 세팅 안 함 (보호 리소스 접근 시 401)
                    res.setHeader("X-Session-Expired", "true");
                    chain.doFilter(req, res);
                    return;
                }

                if (SecurityContextHolder.getContext().getAuthentication() == null) {
                    var auth = new UsernamePasswordAuthenticationToken(userId, null, List.of());
                    SecurityContextHolder.getContext().setAuthentication(auth);
                }
            } catch (SecurityException e) {
                log.warn("Invalid JWT(access): {}", e.getMessage());
                // 그냥 통과 → 보호 리소스면 이후 체인에서 401 처리됨
            } catch (DataAccessException e) {
                log.error("session store unavailable, request stays anonymous", e);
            }
        }
        chain.doFilter(req, res);
    }
}
