package com.realtime.messenger.live.handler;

import com.realtime.messenger.common.MessengerException;
import com.realtime.messenger.live.connection.LiveConnection;

import java.util.UUID;

/** 이벤트를 보낸 연결과 join 으로 묶인 사용자 (join 전이면 null) */
public record LiveContext(LiveConnection connection, UUID userId) {

    public UUID requireUser() {
        if (userId == null) throw MessengerException.forbidden("join first");
        return userId;
    }

    /** 페이로드에 행위자 id 가 있으면 join 한 사용자와 같아야 한다 */
    public UUID requireActor(UUID claimed) {
        UUID me = requireUser();
        if (claimed != null && !claimed.equals(me)) {
            throw MessengerException.forbidden("actor does not match joined user");
        }
        return me;
    }
}
