package com.realtime.messenger.live.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.realtime.messenger.common.Ids;
import com.realtime.messenger.live.event.InboundEvent;
import com.realtime.messenger.live.event.Payloads;
import com.realtime.messenger.live.service.LiveFrameCodec;
import com.realtime.messenger.live.service.MessageFanoutService;
import com.realtime.messenger.message.dto.MessageDto;
import com.realtime.messenger.message.dto.ReadReceipt;
import com.realtime.messenger.message.dto.SendCommand;
import com.realtime.messenger.message.entity.MessageKind;
import com.realtime.messenger.message.service.MessageService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;

/** live 경로의 전송/읽음. durable 경로와 같은 서비스(검사 포함)를 거친 뒤 전파한다 */
@Component
@RequiredArgsConstructor
public class MessageCommandHandler implements LiveCommandHandler {

    private final LiveFrameCodec codec;
    private final MessageService messageService;
    private final MessageFanoutService fanout;

    @Override
    public Set<InboundEvent> events() {
        return Set.of(InboundEvent.SEND_MESSAGE, InboundEvent.MESSAGE_READ);
    }

    @Override
    public void handle(InboundEvent event, LiveContext ctx, JsonNode data) {
        switch (event) {
            case SEND_MESSAGE -> send(ctx, codec.read(data, Payloads.SendMessage.class));
            case MESSAGE_READ -> read(ctx, codec.read(data, Payloads.MessageRead.class));
            default -> throw new IllegalArgumentException("unsupported event " + event);
        }
    }

    private void send(LiveContext ctx, Payloads.SendMessage p) {
        UUID sender = ctx.requireActor(p.sender() == null ? null : Ids.parse(p.sender(), "sender"));
        SendCommand cmd = new SendCommand(
                sender,
                Ids.parse(p.receiver(), "receiver"),
                p.text(),
                MessageKind.from(p.messageType()),
                p.mediaUrl(),
                p.replyTo() == null || p.replyTo().isBlank() ? null : Ids.parse(p.replyTo(), "replyTo"),
                Boolean.TRUE.equals(p.oneTimeView()));

        MessageDto saved = messageService.send(cmd);
        fanout.newMessage(saved);
    }

    private void read(LiveContext ctx, Payloads.MessageRead p) {
        UUID reader = ctx.requireActor(p.readerId() == null ? null : Ids.parse(p.readerId(), "readerId"));
        ReadReceipt receipt = messageService.markRead(Ids.parse(p.messageId(), "messageId"), reader);
        fanout.messageRead(receipt);
    }
}
