package com.makrcave.backend.modules.audit.infrastructure;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import com.makrcave.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepositoryCustom {

    Page<AuditLog> searchLogs(AuditLogSearchCondition condition, Pageable pageable);
}
