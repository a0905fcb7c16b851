package com.realtime.messenger.live.service;

import com.realtime.messenger.live.event.LiveEvent;
import com.realtime.messenger.live.event.OutboundEvent;
import com.realtime.messenger.live.event.Payloads;
import com.realtime.messenger.message.dto.DeleteOutcome;
import com.realtime.messenger.message.dto.MessageDto;
import com.realtime.messenger.message.dto.ReactionUpdate;
import com.realtime.messenger.message.dto.ReadReceipt;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * 저장이 끝난 상태 변경을 상대/본인 연결에 통지.
 * 반드시 durable 트랜잭션이 끝난 뒤 호출한다 (저장 → 전파 순서).
 */
@Service
@RequiredArgsConstructor
public class MessageFanoutService {

    private final DeliveryRouter router;

    /** 수신자와 발신자(다른 탭/기기) 모두에게 */
    public void newMessage(MessageDto msg) {
        LiveEvent event = LiveEvent.of(OutboundEvent.NEW_MESSAGE, msg);
        router.route(msg.getReceiver().id(), event);
        router.route(msg.getSender().id(), event);
    }

    /** 원 발신자에게 읽음 시각 통지. 상태가 바뀐 경우만 */
    public void messageRead(ReadReceipt receipt) {
        if (!receipt.changed()) return;
        router.route(receipt.senderId(), LiveEvent.of(OutboundEvent.MESSAGE_READ_UPDATE,
                new Payloads.MessageReadUpdate(receipt.messageId(), receipt.readAt(), receipt.readerId())));
    }

    public void messagesRead(Collection<ReadReceipt> receipts) {
        receipts.forEach(this::messageRead);
    }

    public void reactionChanged(ReactionUpdate update) {
        LiveEvent event = LiveEvent.of(OutboundEvent.REACTION_UPDATE, update);
        router.route(update.senderId(), event);
        router.route(update.receiverId(), event);
    }

    /** 모두에게 삭제는 양쪽, 나에게서만 삭제는 본인의 다른 연결에만 */
    public void messageDeleted(DeleteOutcome outcome) {
        LiveEvent event = LiveEvent.of(OutboundEvent.MESSAGE_DELETED,
                new Payloads.MessageDeleted(outcome.messageId(), outcome.forEveryone(), outcome.text()));
        if (outcome.forEveryone()) {
            router.route(outcome.senderId(), event);
            router.route(outcome.receiverId(), event);
        } else {
            router.route(outcome.actorId(), event);
        }
    }
}
