package com.realtime.messenger.message.dto;

import java.util.List;

/** 대화 조회 결과 + 조회 부수효과로 읽음 처리된 영수증(상대에게 통지할 것) */
public record ConversationView(List<MessageDto> messages, List<ReadReceipt> receipts) {}
