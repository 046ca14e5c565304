package com.makrcave.backend.modules.member.infrastructure.persistence;

public record MemberAccessStats(
        long totalUsers,
        long activeUsers,
        long lockedUsers,
        long usersRequiringPasswordChange,
        long usersWithTwoFactor
) {
}
