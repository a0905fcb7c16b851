package com.realtime.messenger.message.dto;

import java.time.Instant;
import java.util.UUID;

public record ReadAck(
        UUID messageId,
        Instant readAt,
        boolean ok       // 이번 호출로 실제 반영됐는지 (재호출이면 false)
) {
    public static ReadAck of(ReadReceipt r) {
        return new ReadAck(r.messageId(), r.readAt(), r.changed());
    }
}
