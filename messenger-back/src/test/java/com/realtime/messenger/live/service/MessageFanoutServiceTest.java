package com.realtime.messenger.live.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.realtime.messenger.message.dto.DeleteOutcome;
import com.realtime.messenger.message.dto.MessageDto;
import com.realtime.messenger.message.dto.ReactionDto;
import com.realtime.messenger.message.dto.ReactionUpdate;
import com.realtime.messenger.message.dto.ReadReceipt;
import com.realtime.messenger.message.entity.MessageKind;
import com.realtime.messenger.presence.service.PresenceTracker;
import com.realtime.messenger.support.RecordingConnection;
import com.realtime.messenger.user.dto.UserBriefDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class MessageFanoutServiceTest {

    private final ObjectMapper mapper = Jackson2ObjectMapperBuilder.json().build();
    private PresenceTracker tracker;
    private MessageFanoutService fanout;
    private FriendEventRelay friends;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private RecordingConnection aliceTab;
    private RecordingConnection bobPhone;

    @BeforeEach
    void setUp() {
        tracker = new PresenceTracker(event -> { });
        DeliveryRouter router = new DeliveryRouter(tracker, new LiveFrameCodec(mapper));
        fanout = new MessageFanoutService(router);
        friends = new FriendEventRelay(router);

        aliceTab = new RecordingConnection("alice-tab");
        bobPhone = new RecordingConnection("bob-phone");
        tracker.connect(alice, aliceTab);
        tracker.connect(bob, bobPhone);
    }

    @Test
    void 새_메시지는_양쪽에() throws Exception {
        MessageDto dto = MessageDto.builder()
                .id(UUID.randomUUID())
                .sender(new UserBriefDto(alice, "alice", null))
                .receiver(new UserBriefDto(bob, "bob", null))
                .text("hi")
                .messageType(MessageKind.TEXT)
                .reactions(List.of())
                .createdAt(Instant.now())
                .build();

        fanout.newMessage(dto);

        JsonNode atBob = only(bobPhone);
        assertThat(atBob.get("event").asText()).isEqualTo("newMessage");
        assertThat(atBob.at("/data/isRead").asBoolean()).isFalse();
        assertThat(aliceTab.frames()).hasSize(1);
    }

    @Test
    void 읽음은_바뀐_경우에만_발신자에게() throws Exception {
        UUID messageId = UUID.randomUUID();
        Instant readAt = Instant.parse("2026-05-01T10:15:30.123Z");

        fanout.messagesRead(List.of(
                new ReadReceipt(messageId, bob, alice, readAt, true),
                new ReadReceipt(UUID.randomUUID(), bob, alice, readAt, false)));

        JsonNode frame = only(aliceTab);
        assertThat(frame.get("event").asText()).isEqualTo("messageReadUpdate");
        assertThat(frame.at("/data/messageId").asText()).isEqualTo(messageId.toString());
        assertThat(frame.at("/data/readAt").asText()).isEqualTo("2026-05-01T10:15:30.123Z");
        assertThat(bobPhone.frames()).isEmpty();
    }

    @Test
    void 반응은_양쪽에_내부_id_는_숨긴다() throws Exception {
        fanout.reactionChanged(new ReactionUpdate(UUID.randomUUID(), bob, "👍", true,
                List.of(new ReactionDto(bob, "👍")), alice, bob));

        JsonNode frame = only(aliceTab);
        assertThat(frame.get("event").asText()).isEqualTo("reactionUpdate");
        assertThat(frame.get("data").has("senderId")).isFalse();
        assertThat(frame.at("/data/reactions/0/emoji").asText()).isEqualTo("👍");
        assertThat(bobPhone.frames()).hasSize(1);
    }

    @Test
    void 나에게서만_삭제는_본인에게만() {
        UUID messageId = UUID.randomUUID();

        fanout.messageDeleted(new DeleteOutcome(messageId, bob, alice, bob, false, null));
        assertThat(aliceTab.frames()).isEmpty();
        assertThat(bobPhone.frames()).hasSize(1);

        fanout.messageDeleted(new DeleteOutcome(messageId, alice, alice, bob, true, "This message was deleted"));
        assertThat(aliceTab.frames()).hasSize(1);
        assertThat(bobPhone.frames()).hasSize(2);
    }

    @Test
    void 친구_요청_통지는_양쪽에() throws Exception {
        friends.requestSent(alice, bob, Map.of("requestId", 42));

        JsonNode frame = only(bobPhone);
        assertThat(frame.get("event").asText()).isEqualTo("friendRequestSent");
        assertThat(frame.at("/data/type").asText()).isEqualTo("FRIEND_REQUEST_SENT");
        assertThat(frame.at("/data/payload/requestId").asInt()).isEqualTo(42);
        assertThat(aliceTab.frames()).hasSize(1);

        friends.requestResponded(alice, bob, "ACCEPTED", null);
        JsonNode responded = mapper.readTree(aliceTab.frames().get(1));
        assertThat(responded.get("event").asText()).isEqualTo("friendRequestResponded");
        assertThat(responded.at("/data/type").asText()).isEqualTo("FRIEND_REQUEST_ACCEPTED");
        assertThat(responded.at("/data/from").asText()).isEqualTo(bob.toString());
    }

    private JsonNode only(RecordingConnection c) throws Exception {
        assertThat(c.frames()).hasSize(1);
        return mapper.readTree(c.frames().get(0));
    }
}
