package com.makrcave.backend.modules.audit.infrastructure;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.makrcave.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID>, AuditLogRepositoryCustom {

    long countByActionTypeAndCreatedAtGreaterThanEqual(String actionType, OffsetDateTime since);

    long countByActionTypeAndSuccessFalseAndCreatedAtGreaterThanEqual(String actionType, OffsetDateTime since);

    long countByActionTypeAndResourceKey(String actionType, String resourceKey);

    @Query("""
            select a.ipAddress as ipAddress,
                   count(a) as attempts,
                   min(a.createdAt) as firstAttemptAt,
                   max(a.createdAt) as lastAttemptAt
              from AuditLog a
             where a.actionType = :actionType
               and a.success = false
               and a.ipAddress is not null
               and a.createdAt >= :since
             group by a.ipAddress
            having count(a) >= :threshold
             order by count(a) desc
            """)
    List<FailedAttemptCluster> findFailedAttemptClusters(
            @Param("actionType") String actionType,
            @Param("since") OffsetDateTime since,
            @Param("threshold") long threshold
    );

    interface FailedAttemptCluster {

        String getIpAddress();

        long getAttempts();

        OffsetDateTime getFirstAttemptAt();

        OffsetDateTime getLastAttemptAt();
    }
}
