package com.realtime.messenger.auth;

/**
 * 사용자별 활성 세션 SID 조회 (싱글 세션 강제용).
 * 기록은 로그인을 담당하는 인증 모듈이 같은 키로 한다. 여기서는 읽기만.
 */
public interface SessionStore {

    /** userId의 현재 활성 sid (없으면 null) */
    String getActiveSid(String userId);

    /** 현재 활성 sid와 같은지 여부 (없으면 false) */
    default boolean isActiveSid(String userId, String sid) {
        String active = getActiveSid(userId);
        return active != null && active.equals(sid);
    }
}
