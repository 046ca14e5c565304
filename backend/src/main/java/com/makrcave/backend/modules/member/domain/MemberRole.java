package com.makrcave.backend.modules.member.domain;

/**
 * Legacy single-valued role kept for display. Authorization always uses the member's role set.
 */
public enum MemberRole {
    MAKER,
    SERVICE_PROVIDER,
    ADMIN,
    MAKERSPACE_ADMIN,
    SUPER_ADMIN
}
