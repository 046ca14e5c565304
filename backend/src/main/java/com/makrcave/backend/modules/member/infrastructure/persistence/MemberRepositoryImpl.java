package com.makrcave.backend.modules.member.infrastructure.persistence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import jakarta.persistence.TypedQuery;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import com.makrcave.backend.modules.member.domain.Member;

@Repository
public class MemberRepositoryImpl implements MemberRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<Member> searchMembers(MemberSearchCondition condition, Pageable pageable) {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(pageable, "pageable must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (!CollectionUtils.isEmpty(condition.memberIds())) {
            whereClauses.add("m.id in :memberIds");
            params.put("memberIds", condition.memberIds());
        }
        if (condition.makerspaceId() != null) {
            whereClauses.add("m.makerspaceId = :makerspaceId");
            params.put("makerspaceId", condition.makerspaceId());
        }
        if (condition.active() != null) {
            whereClauses.add("m.active = :active");
            params.put("active", condition.active());
        }
        if (condition.roleId() != null) {
            whereClauses.add("exists (select 1 from Member mr join mr.roles r where mr = m and r.id = :roleId)");
            params.put("roleId", condition.roleId());
        }
        if (condition.hasActiveSession() != null) {
            Objects.requireNonNull(condition.now(), "now is required when filtering by active session");
            String liveSession = "exists (select 1 from UserSession s where s.member = m and s.active = true and s.expiresAt > :now)";
            whereClauses.add(condition.hasActiveSession() ? liveSession : "not " + liveSession);
            params.put("now", condition.now());
        }
        if (StringUtils.hasText(condition.search())) {
            whereClauses.add("""
                    (lower(m.email) like :keyword
                     or lower(m.firstName) like :keyword
                     or lower(m.lastName) like :keyword)
                    """);
            params.put("keyword", "%" + condition.search().trim().toLowerCase(Locale.ROOT) + "%");
        }

        String whereJpql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);

        Query countQuery = entityManager.createQuery("select count(m) from Member m" + whereJpql);
        params.forEach(countQuery::setParameter);
        long total = ((Number) countQuery.getSingleResult()).longValue();
        if (total == 0) {
            return new PageImpl<>(List.of(), pageable, 0);
        }

        TypedQuery<UUID> idQuery = entityManager.createQuery(
                "select m.id from Member m" + whereJpql + " order by m.createdAt desc, m.id",
                UUID.class);
        params.forEach(idQuery::setParameter);
        idQuery.setFirstResult((int) pageable.getOffset());
        idQuery.setMaxResults(pageable.getPageSize());
        List<UUID> ids = idQuery.getResultList();
        if (ids.isEmpty()) {
            return new PageImpl<>(List.of(), pageable, total);
        }

        // fetch roles in a second query so paging stays in the database
        List<Member> members = entityManager.createQuery("""
                        select distinct m from Member m
                          left join fetch m.roles
                         where m.id in :ids
                        """, Member.class)
                .setParameter("ids", ids)
                .getResultList();
        Map<UUID, Member> byId = new HashMap<>();
        members.forEach(member -> byId.put(member.getId(), member));
        List<Member> ordered = ids.stream().map(byId::get).filter(Objects::nonNull).toList();

        return new PageImpl<>(ordered, pageable, total);
    }

    @Override
    public MemberAccessStats summarize(UUID makerspaceId) {
        String where = makerspaceId == null ? "" : " where m.makerspaceId = :makerspaceId";
        Query query = entityManager.createQuery("""
                select count(m),
                       sum(case when m.active = true then 1 else 0 end),
                       sum(case when m.accountLocked = true then 1 else 0 end),
                       sum(case when m.requiresPasswordChange = true then 1 else 0 end),
                       sum(case when m.twoFactorEnabled = true then 1 else 0 end)
                  from Member m
                """ + where);
        if (makerspaceId != null) {
            query.setParameter("makerspaceId", makerspaceId);
        }
        Object[] row = (Object[]) query.getSingleResult();
        return new MemberAccessStats(
                toLong(row[0]),
                toLong(row[1]),
                toLong(row[2]),
                toLong(row[3]),
                toLong(row[4])
        );
    }

    private static long toLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
