package com.makrcave.backend.modules.accesscontrol.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import com.makrcave.backend.modules.accesscontrol.domain.Role;

@Repository
public class RoleRepositoryImpl implements RoleRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Role> searchRoles(RoleSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (condition.roleType() != null) {
            whereClauses.add("r.roleType = :roleType");
            params.put("roleType", condition.roleType());
        }
        if (condition.active() != null) {
            whereClauses.add("r.active = :active");
            params.put("active", condition.active());
        }
        if (condition.assignable() != null) {
            whereClauses.add("r.assignable = :assignable");
            params.put("assignable", condition.assignable());
        }
        if (condition.makerspaceId() != null) {
            whereClauses.add(condition.includeGlobal()
                    ? "(r.makerspaceId = :makerspaceId or r.makerspaceId is null)"
                    : "r.makerspaceId = :makerspaceId");
            params.put("makerspaceId", condition.makerspaceId());
        }

        String whereJpql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);
        TypedQuery<Role> query = entityManager.createQuery(
                "select distinct r from Role r left join fetch r.permissions" + whereJpql
                        + " order by r.priorityLevel desc, r.name",
                Role.class);
        params.forEach(query::setParameter);
        return query.getResultList();
    }

    @Override
    public long countRoles(UUID makerspaceId, Boolean system) {
        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        if (makerspaceId != null) {
            whereClauses.add("(r.makerspaceId = :makerspaceId or r.makerspaceId is null)");
            params.put("makerspaceId", makerspaceId);
        }
        if (system != null) {
            whereClauses.add("r.system = :system");
            params.put("system", system);
        }
        String whereJpql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);
        Query query = entityManager.createQuery("select count(r) from Role r" + whereJpql);
        params.forEach(query::setParameter);
        return ((Number) query.getSingleResult()).longValue();
    }
}
