package com.realtime.messenger.common;

import org.springframework.http.HttpStatus;

/**
 * 메시지/프레즌스 연산 실패 분류.
 * durable 경로에서는 HTTP 상태로, live 경로에서는 messageError 이벤트의 kind 로 내려간다.
 */
public enum ErrorKind {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    TRANSIENT(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
