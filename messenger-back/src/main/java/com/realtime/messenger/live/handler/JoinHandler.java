package com.realtime.messenger.live.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.realtime.messenger.common.Ids;
import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.config.LiveProps;
import com.realtime.messenger.live.event.InboundEvent;
import com.realtime.messenger.live.event.LiveEvent;
import com.realtime.messenger.live.event.OutboundEvent;
import com.realtime.messenger.live.event.Payloads;
import com.realtime.messenger.live.service.DeliveryRouter;
import com.realtime.messenger.live.service.LiveFrameCodec;
import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.presence.model.PresenceView;
import com.realtime.messenger.presence.service.PresenceTracker;
import com.realtime.messenger.security.JwtProvider;
import com.realtime.messenger.user.service.UserDirectory;
import io.jsonwebtoken.Claims;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/**
 * join: 핸드셰이크는 인증이 없으므로 여기서 연결을 사용자에 묶는다.
 * app.live.require-token=true 면 token(subject == userId) 필수.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JoinHandler implements LiveCommandHandler {

    private final LiveFrameCodec codec;
    private final PresenceTracker presenceTracker;
    private final UserDirectory userDirectory;
    private final JwtProvider jwtProvider;
    private final DeliveryRouter router;
    private final LiveProps liveProps;

    @Override
    public Set<InboundEvent> events() {
        return Set.of(InboundEvent.JOIN);
    }

    @Override
    public void handle(InboundEvent event, LiveContext ctx, JsonNode data) {
        // join("<userId>") 처럼 값만 보내는 클라이언트도 받는다
        Payloads.Join p = (data != null && data.isTextual())
                ? new Payloads.Join(data.asText(), null)
                : codec.read(data, Payloads.Join.class);
        UUID userId = Ids.parse(p.userId(), "userId");

        if (liveProps.isRequireToken()) {
            verifyToken(p.token(), userId);
        }
        if (ctx.userId() != null && !ctx.userId().equals(userId)) {
            throw MessengerException.forbidden("connection already joined as another user");
        }
        if (!userDirectory.exists(userId)) {
            throw MessengerException.notFound("User not found");
        }

        presenceTracker.connect(userId, ctx.connection());
        PresenceStatus status = presenceTracker.view(userId).map(PresenceView::status).orElse(PresenceStatus.ONLINE);
        log.info("live: {} joined as {}", ctx.connection().id(), userId);
        router.deliver(ctx.connection(), LiveEvent.of(OutboundEvent.JOINED, new Payloads.Joined(userId, status)));
    }

    private void verifyToken(String token, UUID userId) {
        if (token == null || token.isBlank()) {
            throw MessengerException.forbidden("token is required");
        }
        Claims claims;
        try {
            claims = jwtProvider.parseAccessClaims(token);
        } catch (SecurityException e) {
            throw MessengerException.forbidden("invalid token");
        }
        if (!userId.toString().equals(claims.getSubject())) {
            throw MessengerException.forbidden("token does not match userId");
        }
    }
}
