package com.makrcave.backend.modules.member.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.makrcave.backend.modules.member.domain.Member;

public interface MemberRepository extends JpaRepository<Member, UUID>, MemberRepositoryCustom {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from Member m where m.id = :id")
    Optional<Member> findByIdForUpdate(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"roles"})
    @Query("select m from Member m where m.id = :id")
    Optional<Member> findWithRolesById(@Param("id") UUID id);

    Optional<Member> findByEmailIgnoreCase(String email);
}
