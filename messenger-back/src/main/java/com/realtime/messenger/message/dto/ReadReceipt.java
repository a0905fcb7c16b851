package com.realtime.messenger.message.dto;

import java.time.Instant;
import java.util.UUID;

/** changed: 이번 호출로 read 상태가 바뀌었는지 (이미 읽은 메시지면 false) */
public record ReadReceipt(UUID messageId, UUID readerId, UUID senderId, Instant readAt, boolean changed) {}
