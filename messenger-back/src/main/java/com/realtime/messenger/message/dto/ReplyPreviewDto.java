package com.realtime.messenger.message.dto;

import com.realtime.messenger.message.entity.MessageKind;
import com.realtime.messenger.user.dto.UserBriefDto;

import java.util.UUID;

/** 답장 대상 요약 (원문이 tombstone 이면 tombstone 문구) */
public record ReplyPreviewDto(UUID id, String text, MessageKind messageType, UserBriefDto sender) {}
