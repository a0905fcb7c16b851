package com.realtime.messenger.common;

import lombok.Getter;

@Getter
public class MessengerException extends RuntimeException {

    private final ErrorKind kind;

    public MessengerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MessengerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static MessengerException notFound(String message) {
        return new MessengerException(ErrorKind.NOT_FOUND, message);
    }

    public static MessengerException forbidden(String message) {
        return new MessengerException(ErrorKind.FORBIDDEN, message);
    }

    public static MessengerException badRequest(String message) {
        return new MessengerException(ErrorKind.BAD_REQUEST, message);
    }
}
