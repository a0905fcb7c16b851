package com.realtime.messenger.user.repository;

import com.realtime.messenger.presence.model.PresenceStatus;
import com.realtime.messenger.user.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    @Query("""
        select case when count(u) > 0 then true else false end
        from User u
        where u.id = :ownerId and :targetId member of u.blockedUsers
        """)
    boolean hasBlocked(@Param("ownerId") UUID ownerId, @Param("targetId") UUID targetId);

    /** changedAt 이 기존 값보다 최신일 때만 반영 (비동기 리스너 간 역전 방지) */
    @Modifying(clearAutomatically = true)
    @Query("""
        update User u
           set u.status = :status,
               u.statusChangedAt = :changedAt
         where u.id = :id
           and (u.statusChangedAt is null or u.statusChangedAt <= :changedAt)
        """)
    int updateStatus(@Param("id") UUID id,
                     @Param("status") PresenceStatus status,
                     @Param("changedAt") Instant changedAt);

    @Modifying(clearAutomatically = true)
    @Query("""
        update User u
           set u.status = :status,
               u.lastSeen = :lastSeen,
               u.statusChangedAt = :changedAt
         where u.id = :id
           and (u.statusChangedAt is null or u.statusChangedAt <= :changedAt)
        """)
    int updateStatusAndLastSeen(@Param("id") UUID id,
                                @Param("status") PresenceStatus status,
                                @Param("lastSeen") Instant lastSeen,
                                @Param("changedAt") Instant changedAt);
}
