package com.realtime.messenger.presence.service;

import com.realtime.messenger.presence.event.PresenceChangedEvent;
import com.realtime.messenger.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 프레즌스 전이를 users 테이블에 반영 (재시작 후 lastSeen 조회용).
 * live 경로가 스토리지 I/O 를 기다리지 않도록 별도 executor 에서 처리한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PresencePersistenceListener {

    private final UserRepository userRepo;

    @Async("presenceExecutor")
    @EventListener
    @Transactional
    public void onPresenceChanged(PresenceChangedEvent e) {
        try {
            int updated = e.lastSeenChanged()
                    ? userRepo.updateStatusAndLastSeen(e.userId(), e.status(), e.lastSeen(), e.at())
                    : userRepo.updateStatus(e.userId(), e.status(), e.at());
            if (updated == 0) {
                log.debug("presence persist skipped (stale or unknown user): {}", e.userId());
            }
        } catch (DataAccessException ex) {
            // 메모리 상태가 기준이므로 다음 전이 때 다시 기록된다
            log.warn("presence persist failed for {}: {}", e.userId(), ex.getMessage());
        }
    }
}
