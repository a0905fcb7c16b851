package com.realtime.messenger.message.controller;

import com.realtime.messenger.common.Ids;
import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.live.service.MessageFanoutService;
import com.realtime.messenger.message.dto.*;
import com.realtime.messenger.message.entity.MessageKind;
import com.realtime.messenger.message.service.ConversationService;
import com.realtime.messenger.message.service.MessageService;
import com.realtime.messenger.security.CurrentUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * durable 메시지 API. 저장(트랜잭션) 완료 후 live 전파.
 * 행위자는 항상 인증 principal 이며 본문의 sender 같은 값은 받지 않는다.
 */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private final MessageService messageService;
    private final ConversationService conversationService;
    private final MessageFanoutService fanout;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MessageDto send(@Valid @RequestBody SendMessageRequest req, Authentication auth) {
        UUID me = CurrentUser.id(auth);
        SendCommand cmd = new SendCommand(
                me,
                Ids.parse(req.getReceiver(), "receiver"),
                req.getText(),
                MessageKind.from(req.getMessageType()),
                req.getMediaUrl(),
                req.getReplyTo() == null || req.getReplyTo().isBlank() ? null : Ids.parse(req.getReplyTo(), "replyTo"),
                Boolean.TRUE.equals(req.getOneTimeView()));

        MessageDto saved = messageService.send(cmd);
        fanout.newMessage(saved);
        return saved;
    }

    /** 최근 대화 목록 */
    @GetMapping("/chats")
    public List<ConversationSummaryDto> chats(Authentication auth) {
        return conversationService.recentChats(CurrentUser.id(auth));
    }

    /**
     * 상대와의 대화 (과거 → 현재). 조회하면서 상대가 보낸 안 읽은 메시지는 읽음 처리되고
     * 상대에게 messageReadUpdate 가 간다.
     * before: epoch millis, 이 시각 이전 메시지만
     */
    @GetMapping("/{userId}")
    public List<MessageDto> conversation(@PathVariable("userId") String userId,
                                         @RequestParam(value = "before", required = false) Long before,
                                         @RequestParam(value = "limit", required = false) Integer limit,
                                         Authentication auth) {
        UUID me = CurrentUser.id(auth);
        UUID peer = Ids.parse(userId, "user ID");
        if (limit != null && limit <= 0) throw MessengerException.badRequest("limit must be positive");

        ConversationView view = messageService.listBetween(me, peer,
                before == null ? null : Instant.ofEpochMilli(before), limit);
        fanout.messagesRead(view.receipts());
        return view.messages();
    }

    @GetMapping("/item/{messageId}")
    public MessageDto get(@PathVariable("messageId") String messageId, Authentication auth) {
        return messageService.get(Ids.parse(messageId, "messageId"), CurrentUser.id(auth));
    }

    @PutMapping("/{messageId}/read")
    public ReadAck markRead(@PathVariable("messageId") String messageId, Authentication auth) {
        ReadReceipt receipt = messageService.markRead(Ids.parse(messageId, "messageId"), CurrentUser.id(auth));
        fanout.messageRead(receipt);
        return ReadAck.of(receipt);
    }

    @DeleteMapping("/{messageId}")
    public Map<String, Object> delete(@PathVariable("messageId") String messageId,
                                      @RequestParam(value = "deleteForEveryone", defaultValue = "false") boolean deleteForEveryone,
                                      Authentication auth) {
        DeleteOutcome outcome = messageService.delete(
                Ids.parse(messageId, "messageId"), CurrentUser.id(auth), deleteForEveryone);
        fanout.messageDeleted(outcome);
        return Map.of(
                "messageId", outcome.messageId(),
                "deleteForEveryone", outcome.forEveryone(),
                "message", "Message deleted successfully");
    }

    @PostMapping("/{messageId}/react")
    public ReactionUpdate react(@PathVariable("messageId") String messageId,
                                @RequestBody ReactionRequest req,
                                Authentication auth) {
        ReactionUpdate update = messageService.toggleReaction(
                Ids.parse(messageId, "messageId"), CurrentUser.id(auth), req == null ? null : req.emoji());
        fanout.reactionChanged(update);
        return update;
    }
}
