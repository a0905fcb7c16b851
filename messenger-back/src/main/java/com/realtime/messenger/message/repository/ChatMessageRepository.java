package com.realtime.messenger.message.repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.realtime.messenger.message.entity.ChatMessage;
import com.realtime.messenger.message.repository.projection.UnreadCountProjection;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    Optional<ChatMessage> findByMessageId(UUID messageId);

    List<ChatMessage> findByMessageIdIn(Collection<UUID> messageIds);

    /** 변경 연산용: 메시지 행 단위 잠금 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from ChatMessage m where m.messageId = :messageId")
    Optional<ChatMessage> findByMessageIdForUpdate(@Param("messageId") UUID messageId);

    // 두 사용자 간 전체 대화 (과거 → 현재), 내가 숨긴 메시지 제외
    @Query("""
        select m from ChatMessage m
        where ((m.senderId = :me and m.receiverId = :peer) or (m.senderId = :peer and m.receiverId = :me))
          and :me not member of m.deletedFor
        order by m.createdAt asc, m.id asc
        """)
    List<ChatMessage> findConversation(@Param("me") UUID me, @Param("peer") UUID peer);

    // 최신 N개 (현재 → 과거)
    @Query("""
        select m from ChatMessage m
        where ((m.senderId = :me and m.receiverId = :peer) or (m.senderId = :peer and m.receiverId = :me))
          and :me not member of m.deletedFor
        order by m.createdAt desc, m.id desc
        """)
    List<ChatMessage> findConversationLatest(@Param("me") UUID me, @Param("peer") UUID peer, Pageable pageable);

    // 커서(특정 시각 이전) 기준으로 N개 (현재 → 과거)
    @Query("""
        select m from ChatMessage m
        where ((m.senderId = :me and m.receiverId = :peer) or (m.senderId = :peer and m.receiverId = :me))
          and :me not member of m.deletedFor
          and m.createdAt < :before
        order by m.createdAt desc, m.id desc
        """)
    List<ChatMessage> findConversationBefore(@Param("me") UUID me, @Param("peer") UUID peer,
                                             @Param("before") Instant before, Pageable pageable);

    /** sender → receiver 방향의 안 읽은 메시지 id (receiver 가 숨긴 것 제외) */
    @Query("""
        select m.messageId from ChatMessage m
        where m.senderId = :sender and m.receiverId = :receiver
          and m.read = false
          and :receiver not member of m.deletedFor
        order by m.createdAt asc, m.id asc
        """)
    List<UUID> findUnreadIds(@Param("sender") UUID sender, @Param("receiver") UUID receiver);

    /** 내가 보냈거나 받은 모든 메시지 (현재 → 과거), 내가 숨긴 것 제외 */
    @Query("""
        select m from ChatMessage m
        where (m.senderId = :me or m.receiverId = :me)
          and :me not member of m.deletedFor
        order by m.createdAt desc, m.id desc
        """)
    List<ChatMessage> findAllInvolving(@Param("me") UUID me);

    @Query("""
        select m.senderId as senderId, count(m) as count
        from ChatMessage m
        where m.receiverId = :me
          and m.read = false
          and :me not member of m.deletedFor
        group by m.senderId
        """)
    List<UnreadCountProjection> countUnreadBySender(@Param("me") UUID me);
}
