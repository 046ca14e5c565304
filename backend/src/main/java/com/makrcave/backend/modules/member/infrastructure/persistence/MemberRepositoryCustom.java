package com.makrcave.backend.modules.member.infrastructure.persistence;

import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import com.makrcave.backend.modules.member.domain.Member;

public interface MemberRepositoryCustom {

    Page<Member> searchMembers(MemberSearchCondition condition, Pageable pageable);

    MemberAccessStats summarize(UUID makerspaceId);
}
