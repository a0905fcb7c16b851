package com.realtime.messenger.message.dto;

import java.util.UUID;

public record ReactionDto(UUID userId, String emoji) {}
