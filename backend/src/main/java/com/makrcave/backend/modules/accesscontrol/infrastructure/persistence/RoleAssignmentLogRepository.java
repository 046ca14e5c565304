package com.makrcave.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.makrcave.backend.modules.accesscontrol.domain.RoleAssignmentLog;

public interface RoleAssignmentLogRepository extends JpaRepository<RoleAssignmentLog, UUID> {

    Page<RoleAssignmentLog> findByMember_IdOrderByCreatedAtDesc(UUID memberId, Pageable pageable);

    Page<RoleAssignmentLog> findByRoleIdOrderByCreatedAtDesc(UUID roleId, Pageable pageable);

    Page<RoleAssignmentLog> findByMember_IdAndRoleIdOrderByCreatedAtDesc(UUID memberId, UUID roleId, Pageable pageable);

    Page<RoleAssignmentLog> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
