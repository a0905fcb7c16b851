package com.realtime.messenger.message.service;

import com.realtime.messenger.message.dto.ConversationSummaryDto;
import com.realtime.messenger.message.entity.ChatMessage;
import com.realtime.messenger.message.repository.ChatMessageRepository;
import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.presence.service.PresenceTracker;
import com.realtime.messenger.support.RecordingConnection;
import com.realtime.messenger.support.TestUsers;
import com.realtime.messenger.user.entity.User;
import com.realtime.messenger.user.repository.UserRepository;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Transactional
class ConversationServiceTest {

    @Autowired ConversationService conversationService;
    @Autowired MessageService messageService;
    @Autowired ChatMessageRepository messageRepository;
    @Autowired UserRepository userRepository;
    @Autowired PresenceTracker presenceTracker;
    @Autowired EntityManager em;

    User alice;
    User bob;
    User carol;
    final Instant base = Instant.parse("2026-03-01T09:00:00Z");

    @BeforeEach
    void setUp() {
        alice = TestUsers.create(userRepository, "alice");
        bob = TestUsers.create(userRepository, "bob");
        carol = TestUsers.create(userRepository, "carol");
    }

    @AfterEach
    void tearDown() {
        presenceTracker.disconnect("carol-tab");
    }

    private ChatMessage store(User from, User to, String text, long minutes, boolean read) {
        return messageRepository.save(ChatMessage.builder()
                .messageId(UUID.randomUUID())
                .senderId(from.getId())
                .receiverId(to.getId())
                .text(text)
                .createdAt(base.plus(minutes, ChronoUnit.MINUTES))
                .read(read)
                .build());
    }

    @Test
    void 상대별_최신_메시지를_최신순으로() {
        store(alice, bob, "hi bob", 1, true);
        store(bob, alice, "hey", 2, false);
        store(bob, alice, "you there?", 3, false);
        store(carol, alice, "lunch?", 5, false);
        store(alice, carol, "sure", 6, false);

        List<ConversationSummaryDto> chats = conversationService.recentChats(alice.getId());

        assertThat(chats).hasSize(2);
        ConversationSummaryDto first = chats.get(0);
        assertThat(first.user().id()).isEqualTo(carol.getId());
        assertThat(first.user().name()).isEqualTo("carol");
        assertThat(first.lastMessage().text()).isEqualTo("sure");
        assertThat(first.lastMessage().sender()).isEqualTo(alice.getId());
        assertThat(first.unreadCount()).isEqualTo(1);

        ConversationSummaryDto second = chats.get(1);
        assertThat(second.user().id()).isEqualTo(bob.getId());
        assertThat(second.lastMessage().text()).isEqualTo("you there?");
        assertThat(second.unreadCount()).isEqualTo(2);
    }

    @Test
    void 대화가_없으면_빈_목록() {
        assertThat(conversationService.recentChats(alice.getId())).isEmpty();
    }

    @Test
    void 삭제된_최신_메시지는_tombstone_문구로() {
        store(alice, bob, "first", 1, false);
        ChatMessage last = store(bob, alice, "regret", 2, false);
        messageService.delete(last.getMessageId(), bob.getId(), true);
        em.flush();
        em.clear();

        ConversationSummaryDto chat = conversationService.recentChats(alice.getId()).get(0);
        assertThat(chat.lastMessage().text()).isEqualTo(MessageService.TOMBSTONE_TEXT);
    }

    @Test
    void 내가_숨긴_메시지는_요약에서_빠진다() {
        store(bob, alice, "older", 1, true);
        ChatMessage newest = store(bob, alice, "hide me", 2, false);
        messageService.delete(newest.getMessageId(), alice.getId(), false);
        em.flush();
        em.clear();

        ConversationSummaryDto chat = conversationService.recentChats(alice.getId()).get(0);
        assertThat(chat.lastMessage().text()).isEqualTo("older");
        assertThat(chat.unreadCount()).isZero();

        // 상대 쪽 요약은 그대로
        ConversationSummaryDto theirs = conversationService.recentChats(bob.getId()).get(0);
        assertThat(theirs.lastMessage().text()).isEqualTo("hide me");
    }

    @Test
    void 상대_상태는_프레즌스_트래커에서() {
        store(carol, alice, "ping", 1, false);
        store(bob, alice, "pong", 2, false);
        presenceTracker.connect(carol.getId(), new RecordingConnection("carol-tab"));

        List<ConversationSummaryDto> chats = conversationService.recentChats(alice.getId());

        assertThat(chats).extracting(c -> c.user().status())
                .containsExactly(PresenceStatus.OFFLINE, PresenceStatus.ONLINE);
    }

    @Test
    void 트래커에_없는_상대는_저장된_lastSeen_을_쓴다() {
        Instant seen = base.minus(1, ChronoUnit.DAYS);
        bob.setStatus(PresenceStatus.ONLINE);
        bob.setLastSeen(seen);
        userRepository.save(bob);
        store(bob, alice, "from yesterday", 1, false);
        em.flush();
        em.clear();

        ConversationSummaryDto chat = conversationService.recentChats(alice.getId()).get(0);

        // 재시작 전 online 기록은 offline 으로 본다
        assertThat(chat.user().status()).isEqualTo(PresenceStatus.OFFLINE);
        assertThat(chat.user().lastSeen()).isEqualTo(seen);
    }
}
