package com.makrcave.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.makrcave.backend.modules.accesscontrol.domain.PasswordPolicy;

public interface PasswordPolicyRepository extends JpaRepository<PasswordPolicy, UUID> {

    Optional<PasswordPolicy> findFirstByMakerspaceIdAndActiveTrueOrderByCreatedAtDesc(UUID makerspaceId);

    Optional<PasswordPolicy> findFirstByMakerspaceIdIsNullAndActiveTrueOrderByCreatedAtDesc();

    /**
     * Policies of a makerspace first, then global ones.
     */
    @Query("""
            select p from PasswordPolicy p
             where p.makerspaceId = :makerspaceId or p.makerspaceId is null
             order by case when p.makerspaceId is null then 1 else 0 end, p.createdAt desc
            """)
    List<PasswordPolicy> findVisibleTo(@Param("makerspaceId") UUID makerspaceId);
}
