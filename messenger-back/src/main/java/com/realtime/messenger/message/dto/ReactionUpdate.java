package com.realtime.messenger.message.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.UUID;

/**
 * 토글 결과. reactions 는 토글 후 전체 집합.
 * added: 이번 토글로 추가됐으면 true, 제거됐으면 false
 */
public record ReactionUpdate(UUID messageId, UUID userId, String emoji, boolean added,
                             List<ReactionDto> reactions,
                             @JsonIgnore UUID senderId, @JsonIgnore UUID receiverId) {}
