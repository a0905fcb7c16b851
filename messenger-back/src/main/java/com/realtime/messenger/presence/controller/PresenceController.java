package com.realtime.messenger.presence.controller;

import com.realtime.messenger.common.Ids;
import com.realtime.messenger.presence.dto.PresenceDto;
import com.realtime.messenger.presence.dto.StatusRequest;
import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.presence.service.PresenceService;
import com.realtime.messenger.security.CurrentUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/presence")
@RequiredArgsConstructor
public class PresenceController {

    private final PresenceService presenceService;

    @GetMapping("/{userId}")
    public PresenceDto get(@PathVariable("userId") String userId) {
        return presenceService.get(Ids.parse(userId, "user id"));
    }

    /** 명시적 상태 변경 (away/busy 등, 로그아웃 직전 offline) */
    @PutMapping("/me")
    public PresenceDto setMine(@Valid @RequestBody StatusRequest req, Authentication auth) {
        return presenceService.setStatus(CurrentUser.id(auth), PresenceStatus.from(req.status()));
    }
}
