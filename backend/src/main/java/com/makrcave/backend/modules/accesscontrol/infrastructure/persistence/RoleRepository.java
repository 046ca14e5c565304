package com.makrcave.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.makrcave.backend.modules.accesscontrol.domain.Role;
import com.makrcave.backend.modules.member.domain.Member;

public interface RoleRepository extends JpaRepository<Role, UUID>, RoleRepositoryCustom {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Role r where r.id = :id")
    Optional<Role> findByIdForUpdate(@Param("id") UUID id);

    @Query("select count(m) from Member m join m.roles r where r.id = :roleId")
    long countHolders(@Param("roleId") UUID roleId);

    @Query("select m from Member m join m.roles r where r.id = :roleId order by m.email")
    List<Member> findHolders(@Param("roleId") UUID roleId);

    boolean existsByParentRole_Id(UUID parentRoleId);

    boolean existsByNameIgnoreCaseAndMakerspaceId(String name, UUID makerspaceId);

    boolean existsByNameIgnoreCaseAndMakerspaceIdIsNull(String name);

    Optional<Role> findByNameIgnoreCaseAndMakerspaceId(String name, UUID makerspaceId);

    Optional<Role> findByNameIgnoreCaseAndMakerspaceIdIsNull(String name);
}
