package com.realtime.messenger.message.repository.projection;

import java.util.UUID;

public interface UnreadCountProjection {
    UUID getSenderId();
    Long getCount();
}
