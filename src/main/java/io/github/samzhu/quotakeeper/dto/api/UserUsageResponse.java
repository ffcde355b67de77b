package io.github.samzhu.quotakeeper.dto.api;

import java.time.Instant;

import io.github.samzhu.quotakeeper.document.User;

/**
 * 單一用戶用量（監控列表使用）。
 */
public record UserUsageResponse(
    String userId,
    long usageCount,
    long dailyUsage,
    long weeklyUsage,
    long monthlyUsage,
    String tier,
    Instant createdAt,
    Instant lastActiveAt
) {

    public static UserUsageResponse from(User user) {
        return new UserUsageResponse(
            user.id(),
            user.usageCount() != null ? user.usageCount() : 0L,
            user.dailyUsage(),
            user.weeklyUsage(),
            user.monthlyUsage(),
            user.tier(),
            user.createdAt(),
            user.lastActiveAt()
        );
    }
}
