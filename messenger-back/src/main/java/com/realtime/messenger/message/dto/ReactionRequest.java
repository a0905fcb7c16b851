package com.realtime.messenger.message.dto;

public record ReactionRequest(String emoji) {}
