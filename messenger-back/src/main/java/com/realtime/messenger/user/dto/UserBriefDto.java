package com.realtime.messenger.user.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.realtime.messenger.user.entity.User;

import java.util.UUID;

/** 메시지 응답에 채워 넣는 최소 프로필 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserBriefDto(UUID id, String name, String avatar) {

    public static UserBriefDto of(User u) {
        return new UserBriefDto(u.getId(), u.getName(), u.getAvatarUrl());
    }

    /** 탈퇴 등으로 프로필을 찾을 수 없을 때 */
    public static UserBriefDto unknown(UUID id) {
        return new UserBriefDto(id, null, null);
    }
}
