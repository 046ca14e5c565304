package com.makrcave.backend.modules.accesscontrol.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.makrcave.backend.modules.accesscontrol.domain.UserSession;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    List<UserSession> findByMember_IdOrderByLastActivityDesc(UUID memberId);

    @Query("""
            select s from UserSession s
             where s.member.id = :memberId
               and s.active = true
               and s.expiresAt > :now
             order by s.lastActivity desc
            """)
    List<UserSession> findLiveByMemberId(@Param("memberId") UUID memberId, @Param("now") OffsetDateTime now);

    Optional<UserSession> findBySessionToken(String sessionToken);

    @Query("select count(s) from UserSession s where s.active = true and s.expiresAt > :now")
    long countLive(@Param("now") OffsetDateTime now);

    @Query("""
            select count(s) from UserSession s
             where s.member.makerspaceId = :makerspaceId
               and s.active = true
               and s.expiresAt > :now
            """)
    long countLiveInMakerspace(@Param("makerspaceId") UUID makerspaceId, @Param("now") OffsetDateTime now);
}
