package com.realtime.messenger.message.dto;

import java.util.UUID;

/** forEveryone 이면 text 는 tombstone 문구, 아니면 null */
public record DeleteOutcome(UUID messageId, UUID actorId, UUID senderId, UUID receiverId,
                            boolean forEveryone, String text) {}
