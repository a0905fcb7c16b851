package com.realtime.messenger.user.service;

import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.user.dto.UserBriefDto;
import com.realtime.messenger.user.entity.User;
import com.realtime.messenger.user.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaUserDirectory implements UserDirectory {

    private final UserRepository userRepo;

    @Override
    public boolean exists(UUID userId) {
        return userId != null && userRepo.existsById(userId);
    }

    @Override
    public Map<UUID, UserBriefDto> findBriefs(Collection<UUID> userIds) {
        if (userIds == null || userIds.isEmpty()) return Map.of();
        return userRepo.findAllById(userIds).stream()
                .map(UserBriefDto::of)
                .collect(Collectors.toMap(UserBriefDto::id, Function.identity(), (a, b) -> a));
    }

    @Override
    public boolean hasBlocked(UUID ownerId, UUID targetId) {
        if (ownerId == null || targetId == null) return false;
        return userRepo.hasBlocked(ownerId, targetId);
    }

    @Override
    public Optional<StoredPresence> storedPresence(UUID userId) {
        if (userId == null) return Optional.empty();
        return userRepo.findById(userId)
                .map(u -> new StoredPresence(
                        u.getStatus() == null ? PresenceStatus.OFFLINE : u.getStatus(),
                        u.getLastSeen()));
    }
}
