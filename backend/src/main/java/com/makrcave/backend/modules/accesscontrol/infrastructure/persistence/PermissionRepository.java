package com.makrcave.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.makrcave.backend.modules.accesscontrol.domain.AccessScope;
import com.makrcave.backend.modules.accesscontrol.domain.Permission;
import com.makrcave.backend.modules.accesscontrol.domain.PermissionType;

public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findByCodename(String codename);

    boolean existsByCodename(String codename);

    boolean existsByNameIgnoreCase(String name);

    List<Permission> findByCodenameIn(Collection<String> codenames);

    long countByActiveTrue();

    @Query(value = """
            select p from Permission p
             where (:type is null or p.permissionType = :type)
               and (:scope is null or p.accessScope = :scope)
               and (:active is null or p.active = :active)
             order by p.permissionType, p.codename
            """,
            countQuery = """
            select count(p) from Permission p
             where (:type is null or p.permissionType = :type)
               and (:scope is null or p.accessScope = :scope)
               and (:active is null or p.active = :active)
            """)
    Page<Permission> search(
            @Param("type") PermissionType type,
            @Param("scope") AccessScope scope,
            @Param("active") Boolean active,
            Pageable pageable
    );
}
