package com.realtime.messenger.message.service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.message.dto.*;
import com.realtime.messenger.message.entity.ChatMessage;
import com.realtime.messenger.message.entity.Reaction;
import com.realtime.messenger.message.repository.ChatMessageRepository;
import com.realtime.messenger.policy.AccessPolicyGuard;
import com.realtime.messenger.user.dto.UserBriefDto;
import com.realtime.messenger.user.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 메시지 저장소 연산.
 * 변경 연산은 모두 해당 메시지 행을 잠근 뒤 "값 설정" 또는 "집합 멤버십 토글"로만 상태를 바꾼다
 * (같은 이벤트가 중복 도착해도 증분 누적이 없음).
 * live 전파는 호출 측이 트랜잭션 종료 후 수행한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageService {

    public static final String TOMBSTONE_TEXT = "This message was deleted";
    static final int MAX_PAGE = 500;
    static final int MAX_TEXT = 4000;
    static final int MAX_MEDIA_URL = 1024;

    private final ChatMessageRepository messageRepo;
    private final UserDirectory userDirectory;
    private final AccessPolicyGuard accessPolicyGuard;

    // ─────────────────────────────────────────────────────────────────────────────
    //    전송: 수신자 확인 → 차단 검사 → 저장 (생성 시각은 서버 기준)
    // ─────────────────────────────────────────────────────────────────────────────
    @Transactional
    public MessageDto send(SendCommand cmd) {
        if (cmd.senderId() == null) throw MessengerException.badRequest("sender is required");
        if (cmd.receiverId() == null) throw MessengerException.badRequest("receiver is required");
        if (cmd.text() == null || cmd.text().isBlank()) throw MessengerException.badRequest("text is required");
        if (cmd.text().length() > MAX_TEXT) throw MessengerException.badRequest("text is too long");
        String mediaUrl = blankToNull(cmd.mediaUrl());
        if (mediaUrl != null && mediaUrl.length() > MAX_MEDIA_URL) {
            throw MessengerException.badRequest("mediaUrl is too long");
        }
        if (cmd.senderId().equals(cmd.receiverId())) {
            throw MessengerException.badRequest("cannot send a message to yourself");
        }

        if (!userDirectory.exists(cmd.receiverId())) {
            throw MessengerException.notFound("Receiver not found");
        }
        accessPolicyGuard.requireCanSend(cmd.senderId(), cmd.receiverId());

        // 답장 대상은 같은 두 사람 사이의 메시지여야 하고, 발신자가 숨긴 메시지면 안 된다
        if (cmd.replyTo() != null) {
            boolean visible = messageRepo.findByMessageId(cmd.replyTo())
                    .filter(r -> r.isParticipant(cmd.senderId()) && r.isParticipant(cmd.receiverId()))
                    .filter(r -> !r.getDeletedFor().contains(cmd.senderId()))
                    .isPresent();
            if (!visible) throw MessengerException.notFound("Reply target not found");
        }

        ChatMessage m = ChatMessage.builder()
                .messageId(UUID.randomUUID())
                .senderId(cmd.senderId())
                .receiverId(cmd.receiverId())
                .text(cmd.text())
                .messageType(cmd.messageType())
                .mediaUrl(mediaUrl)
                .replyTo(cmd.replyTo())
                .oneTimeView(cmd.oneTimeView())
                .createdAt(now())
                .build();

        m = messageRepo.save(m);
        log.debug("message {} stored: {} -> {}", m.getMessageId(), m.getSenderId(), m.getReceiverId());
        return toDtos(List.of(m)).get(0);
    }

    /**
     * requester 관점의 대화 목록 (과거 → 현재).
     * 부수효과: counterpart → requester 방향의 안 읽은 메시지를 읽음 처리한다.
     * before/limit 이 없으면 전체, 있으면 해당 구간의 최신 limit 개.
     */
    @Transactional
    public ConversationView listBetween(UUID requester, UUID counterpart,
                                        @Nullable Instant before, @Nullable Integer limit) {
        if (requester == null || counterpart == null) throw MessengerException.badRequest("Invalid user ID");

        List<ReadReceipt> receipts = new ArrayList<>();
        for (UUID unreadId : messageRepo.findUnreadIds(counterpart, requester)) {
            ReadReceipt r = markRead(unreadId, requester);
            if (r.changed()) receipts.add(r);
        }

        List<ChatMessage> msgs;
        if (before == null && limit == null) {
            msgs = messageRepo.findConversation(requester, counterpart);
        } else {
            int capped = Math.min(MAX_PAGE, Math.max(1, limit == null ? 50 : limit));
            var page = PageRequest.of(0, capped);
            List<ChatMessage> desc = (before == null)
                    ? messageRepo.findConversationLatest(requester, counterpart, page)
                    : messageRepo.findConversationBefore(requester, counterpart, before, page);
            msgs = new ArrayList<>(desc);
            Collections.reverse(msgs);
        }
        return new ConversationView(toDtos(msgs), receipts);
    }

    /** 단건 조회. 참여자가 아니거나 내가 숨긴 메시지는 없는 것으로 본다 */
    @Transactional(readOnly = true)
    public MessageDto get(UUID messageId, UUID requester) {
        ChatMessage m = messageRepo.findByMessageId(messageId)
                .orElseThrow(() -> MessengerException.notFound("Message not found"));
        if (!m.isParticipant(requester) || m.getDeletedFor().contains(requester)) {
            throw MessengerException.notFound("Message not found");
        }
        return toDtos(List.of(m)).get(0);
    }

    /** 수신자만 가능. 이미 읽은 메시지는 no-op (readAt 유지) */
    @Transactional
    public ReadReceipt markRead(UUID messageId, UUID actor) {
        ChatMessage m = lockMessage(messageId);
        if (!m.getReceiverId().equals(actor)) {
            throw MessengerException.forbidden("Not authorized to mark this message as read");
        }

        boolean changed = false;
        Instant now = now();
        if (!m.isRead()) {
            m.setRead(true);
            m.setReadAt(now);
            changed = true;
        }
        // 1회 열람 메시지는 첫 열람 시각만 기록
        if (m.isOneTimeView() && m.getViewedAt() == null) {
            m.setViewedAt(now);
        }
        return new ReadReceipt(m.getMessageId(), actor, m.getSenderId(), m.getReadAt(), changed);
    }

    /**
     * (actor, emoji) 멤버십 토글. 참여자 여부는 검사하지 않는다 (인증된 사용자면 누구나).
     */
    @Transactional
    public ReactionUpdate toggleReaction(UUID messageId, UUID actor, String emoji) {
        if (emoji == null || emoji.isBlank()) {
            throw MessengerException.badRequest("Emoji is required");
        }
        String e = emoji.trim();
        if (e.length() > 32) throw MessengerException.badRequest("Emoji is too long");

        ChatMessage m = lockMessage(messageId);
        Reaction key = new Reaction(actor, e);
        boolean added;
        if (m.getReactions().contains(key)) {
            m.getReactions().remove(key);
            added = false;
        } else {
            m.getReactions().add(key);
            added = true;
        }
        return new ReactionUpdate(m.getMessageId(), actor, e, added, reactionsOf(m),
                m.getSenderId(), m.getReceiverId());
    }

    /**
     * forEveryone: 발신자만, tombstone 처리 (본문 교체, 미디어 제거, 위치 유지).
     * 그 외: actor 의 로컬 숨김 집합에 추가. 두 방식은 서로 영향을 주지 않는다.
     */
    @Transactional
    public DeleteOutcome delete(UUID messageId, UUID actor, boolean forEveryone) {
        ChatMessage m = lockMessage(messageId);
        boolean isSender = m.getSenderId().equals(actor);
        boolean isReceiver = m.getReceiverId().equals(actor);

        if (!isSender && !isReceiver) {
            throw MessengerException.forbidden("Not authorized to delete this message");
        }

        if (forEveryone) {
            if (!isSender) {
                throw MessengerException.forbidden("Only the sender can delete a message for everyone");
            }
            if (!m.isDeleted()) {
                m.setDeleted(true);
                m.setText(TOMBSTONE_TEXT);
                m.setMediaUrl(null);
            }
            return new DeleteOutcome(m.getMessageId(), actor, m.getSenderId(), m.getReceiverId(), true, TOMBSTONE_TEXT);
        }

        m.getDeletedFor().add(actor);
        return new DeleteOutcome(m.getMessageId(), actor, m.getSenderId(), m.getReceiverId(), false, null);
    }

    private ChatMessage lockMessage(UUID messageId) {
        if (messageId == null) throw MessengerException.badRequest("messageId is required");
        return messageRepo.findByMessageIdForUpdate(messageId)
                .orElseThrow(() -> MessengerException.notFound("Message not found"));
    }

    // ─────────────────────────────────────────────────────────────────────────────
    //    DTO 매핑: 프로필/답장 대상은 한 번에 IN 조회
    // ─────────────────────────────────────────────────────────────────────────────
    List<MessageDto> toDtos(List<ChatMessage> msgs) {
        if (msgs.isEmpty()) return List.of();

        Map<UUID, ChatMessage> replies = Collections.emptyMap();
        Set<UUID> replyIds = msgs.stream()
                .map(ChatMessage::getReplyTo)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (!replyIds.isEmpty()) {
            replies = messageRepo.findByMessageIdIn(replyIds).stream()
                    .collect(Collectors.toMap(ChatMessage::getMessageId, Function.identity(), (a, b) -> a));
        }

        Set<UUID> userIds = new HashSet<>();
        msgs.forEach(m -> { userIds.add(m.getSenderId()); userIds.add(m.getReceiverId()); });
        replies.values().forEach(r -> userIds.add(r.getSenderId()));
        Map<UUID, UserBriefDto> briefs = userDirectory.findBriefs(userIds);

        Map<UUID, ChatMessage> replyIndex = replies;
        return msgs.stream().map(m -> MessageDto.builder()
                .id(m.getMessageId())
                .sender(brief(briefs, m.getSenderId()))
                .receiver(brief(briefs, m.getReceiverId()))
                .text(m.getText())
                .messageType(m.getMessageType())
                .mediaUrl(m.getMediaUrl())
                .replyTo(replyPreview(replyIndex.get(m.getReplyTo()), briefs))
                .read(m.isRead())
                .readAt(m.getReadAt())
                .reactions(reactionsOf(m))
                .deleted(m.isDeleted())
                .oneTimeView(m.isOneTimeView())
                .viewedAt(m.getViewedAt())
                .createdAt(m.getCreatedAt())
                .build()
        ).toList();
    }

    private static ReplyPreviewDto replyPreview(@Nullable ChatMessage r, Map<UUID, UserBriefDto> briefs) {
        if (r == null) return null;
        return new ReplyPreviewDto(r.getMessageId(), r.getText(), r.getMessageType(), brief(briefs, r.getSenderId()));
    }

    private static UserBriefDto brief(Map<UUID, UserBriefDto> briefs, UUID id) {
        UserBriefDto b = briefs.get(id);
        return b != null ? b : UserBriefDto.unknown(id);
    }

    private static List<ReactionDto> reactionsOf(ChatMessage m) {
        return m.getReactions().stream()
                .map(r -> new ReactionDto(r.getUserId(), r.getEmoji()))
                .toList();
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
