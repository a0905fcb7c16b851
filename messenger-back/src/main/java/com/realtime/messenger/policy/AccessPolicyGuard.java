package com.realtime.messenger.policy;

import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.user.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 송신 허용 여부 판단. durable 전송, live 전송, 타이핑, 통화 시그널링이 모두 이 검사를 거친다.
 * 차단 목록은 사용자 모듈 소유이며 여기서는 읽기만 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessPolicyGuard {

    private final UserDirectory userDirectory;

    /** receiver 의 차단 목록에 sender 가 있으면 BLOCKED */
    public PolicyDecision canSend(UUID senderId, UUID receiverId) {
        return userDirectory.hasBlocked(receiverId, senderId)
                ? PolicyDecision.BLOCKED
                : PolicyDecision.ALLOWED;
    }

    public void requireCanSend(UUID senderId, UUID receiverId) {
        if (!canSend(senderId, receiverId).allowed()) {
            log.debug("send blocked: {} -> {}", senderId, receiverId);
            throw MessengerException.forbidden("You cannot send messages to this user");
        }
    }
}
