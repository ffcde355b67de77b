package io.github.samzhu.quotakeeper.dto.api;

import java.time.Instant;

/**
 * 全體用量摘要回應。
 *
 * @param totalUsers 用戶文件總數
 * @param trackedUsers 已啟用追蹤的用戶數
 * @param proUsers Pro 用戶數
 * @param freeUsers 非 Pro 用戶數
 * @param totalUsage 累計使用次數總和
 * @param averageUsagePerUser 平均每位用戶使用次數（四捨五入）
 * @param timestamp 產生時間
 */
public record UsageSummaryResponse(
    long totalUsers,
    long trackedUsers,
    long proUsers,
    long freeUsers,
    long totalUsage,
    long averageUsagePerUser,
    Instant timestamp
) {}
