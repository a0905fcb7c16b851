package com.realtime.messenger.message.dto;

import java.time.Instant;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.realtime.messenger.message.entity.MessageKind;
import com.realtime.messenger.presence.model.PresenceStatus;

public record ConversationSummaryDto(Counterpart user, LastMessage lastMessage, long unreadCount) {

    public record Counterpart(UUID id, String name, String avatar, PresenceStatus status, Instant lastSeen) {}

    public record LastMessage(UUID id, String text, MessageKind messageType, Instant createdAt,
                              @JsonProperty("isRead") boolean read, UUID sender) {}
}
