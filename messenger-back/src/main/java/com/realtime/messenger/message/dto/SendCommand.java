package com.realtime.messenger.message.dto;

import com.realtime.messenger.message.entity.MessageKind;

import java.util.UUID;

/** durable/live 양쪽 전송 요청을 정규화한 형태 */
public record SendCommand(UUID senderId, UUID receiverId, String text, MessageKind messageType,
                          String mediaUrl, UUID replyTo, boolean oneTimeView) {}
