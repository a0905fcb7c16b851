package com.realtime.messenger.live.connection;

public class LiveDeliveryException extends RuntimeException {

    public LiveDeliveryException(String message) {
        super(message);
    }

    public LiveDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
