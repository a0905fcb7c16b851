package com.realtime.messenger.security;

import com.realtime.messenger.user.entity.User;
import io.jsonwebtoken.Claims;

public interface JwtProvider {

    /** 토큰 발급은 인증 모듈 몫이지만, 협력 모듈과 테스트를 위해 열어둔다 */
    String createAccessToken(User user);

    /** sid 클레임 포함(싱글 세션 강제용) */
    String createAccessToken(User user, String sid);

    /** 액세스 토큰의 클레임 파싱(서명+만료 검증 포함) */
    Claims parseAccessClaims(String accessToken);
}
