package com.realtime.messenger.message.service;

import com.realtime.messenger.message.dto.ConversationSummaryDto;
import com.realtime.messenger.message.entity.ChatMessage;
import com.realtime.messenger.message.repository.ChatMessageRepository;
import com.realtime.messenger.message.repository.projection.UnreadCountProjection;
import com.realtime.messenger.presence.dto.PresenceDto;
import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.presence.service.PresenceService;
import com.realtime.messenger.user.dto.UserBriefDto;
import com.realtime.messenger.user.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 최근 대화 목록 (요청 시점에 메시지 저장소에서 재계산, 별도 저장 없음).
 * 상대별 최신 메시지 1건 + 상대가 보낸 안 읽은 메시지 수.
 */
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ChatMessageRepository messageRepo;
    private final UserDirectory userDirectory;
    private final PresenceService presenceService;

    @Transactional(readOnly = true)
    public List<ConversationSummaryDto> recentChats(UUID me) {
        // 최신순 스캔이므로 상대별 첫 등장 = 최신 메시지
        Map<UUID, ChatMessage> latest = new LinkedHashMap<>();
        for (ChatMessage m : messageRepo.findAllInvolving(me)) {
            latest.putIfAbsent(m.counterpartOf(me), m);
        }
        if (latest.isEmpty()) return List.of();

        Map<UUID, Long> unread = messageRepo.countUnreadBySender(me).stream()
                .collect(Collectors.toMap(UnreadCountProjection::getSenderId,
                        p -> p.getCount() == null ? 0L : p.getCount(), Long::sum));

        Map<UUID, UserBriefDto> briefs = userDirectory.findBriefs(latest.keySet());

        return latest.entrySet().stream()
                .map(e -> {
                    UUID peerId = e.getKey();
                    ChatMessage m = e.getValue();
                    UserBriefDto b = briefs.getOrDefault(peerId, UserBriefDto.unknown(peerId));
                    Optional<PresenceDto> p = presenceService.find(peerId);

                    var counterpart = new ConversationSummaryDto.Counterpart(
                            peerId, b.name(), b.avatar(),
                            p.map(PresenceDto::status).orElse(PresenceStatus.OFFLINE),
                            p.map(PresenceDto::lastSeen).orElse(null));
                    var last = new ConversationSummaryDto.LastMessage(
                            m.getMessageId(),
                            m.isDeleted() ? MessageService.TOMBSTONE_TEXT : m.getText(),
                            m.getMessageType(),
                            m.getCreatedAt(),
                            m.isRead(),
                            m.getSenderId());
                    return new ConversationSummaryDto(counterpart, last, unread.getOrDefault(peerId, 0L));
                })
                .sorted(Comparator.comparing((ConversationSummaryDto s) -> s.lastMessage().createdAt()).reversed())
                .toList();
    }
}
