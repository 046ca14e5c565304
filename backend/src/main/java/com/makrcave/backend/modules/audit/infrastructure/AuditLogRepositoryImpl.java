package com.makrcave.backend.modules.audit.infrastructure;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import jakarta.persistence.TypedQuery;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.makrcave.backend.modules.audit.domain.AuditLog;

@Repository
public class AuditLogRepositoryImpl implements AuditLogRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<AuditLog> searchLogs(AuditLogSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (condition.actorUserId() != null) {
            whereClauses.add("a.actor.id = :actorUserId");
            params.put("actorUserId", condition.actorUserId());
        }
        if (condition.makerspaceId() != null) {
            whereClauses.add("a.makerspaceId = :makerspaceId");
            params.put("makerspaceId", condition.makerspaceId());
        }
        if (StringUtils.hasText(condition.actionType())) {
            whereClauses.add("a.actionType = :actionType");
            params.put("actionType", condition.actionType().trim().toUpperCase());
        }
        if (StringUtils.hasText(condition.resourceType())) {
            whereClauses.add("a.resourceType = :resourceType");
            params.put("resourceType", condition.resourceType().trim().toUpperCase());
        }
        if (condition.from() != null) {
            whereClauses.add("a.createdAt >= :from");
            params.put("from", condition.from());
        }
        if (condition.to() != null) {
            whereClauses.add("a.createdAt <= :to");
            params.put("to", condition.to());
        }
        if (condition.success() != null) {
            whereClauses.add("a.success = :success");
            params.put("success", condition.success());
        }
        if (StringUtils.hasText(condition.ipAddress())) {
            whereClauses.add("a.ipAddress = :ipAddress");
            params.put("ipAddress", condition.ipAddress().trim());
        }

        String whereJpql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);

        Query countQuery = entityManager.createQuery("select count(a) from AuditLog a" + whereJpql);
        params.forEach(countQuery::setParameter);
        long total = ((Number) countQuery.getSingleResult()).longValue();
        if (total == 0) {
            return new PageImpl<>(List.of(), pageable, 0);
        }

        TypedQuery<AuditLog> dataQuery = entityManager.createQuery(
                "select a from AuditLog a left join fetch a.actor" + whereJpql + " order by a.createdAt desc, a.id",
                AuditLog.class);
        params.forEach(dataQuery::setParameter);
        dataQuery.setFirstResult((int) pageable.getOffset());
        dataQuery.setMaxResults(pageable.getPageSize());

        return new PageImpl<>(dataQuery.getResultList(), pageable, total);
    }
}
