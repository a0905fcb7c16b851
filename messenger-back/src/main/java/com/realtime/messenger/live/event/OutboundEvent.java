package com.realtime.messenger.live.event;

/** 서버 → 클라이언트 live 이벤트 (닫힌 목록) */
public enum OutboundEvent {
    JOINED("joined"),
    NEW_MESSAGE("newMessage"),
    MESSAGE_ERROR("messageError"),
    USER_TYPING("userTyping"),
    USER_STOP_TYPING("userStopTyping"),
    USER_STATUS_UPDATE("userStatusUpdate"),
    MESSAGE_READ_UPDATE("messageReadUpdate"),
    REACTION_UPDATE("reactionUpdate"),
    MESSAGE_DELETED("messageDeleted"),
    CALL_INCOMING("callIncoming"),
    CALL_ACCEPTED("callAccepted"),
    CALL_ENDED("callEnded"),
    FRIEND_REQUEST_SENT("friendRequestSent"),
    FRIEND_REQUEST_RESPONDED("friendRequestResponded");

    private final String wireName;

    OutboundEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
