package io.github.samzhu.quotakeeper.dto;

import java.time.Instant;

/**
 * 配額檢查結果。
 *
 * @param allowed 是否允許本次請求
 * @param reason 拒絕原因（如 {@code daily_limit_exceeded}）或 {@code unlimited}，一般允許時為 null
 * @param tier 方案 (free / pro / admin)
 * @param current 目前用量
 * @param limit 適用上限，-1 表示無限制
 * @param remaining 剩餘額度，無法計算時為 null
 * @param resetTime 下一次重置時間，匿名配額不會自動重置時為 null
 */
public record QuotaCheckResult(
    boolean allowed,
    String reason,
    String tier,
    long current,
    long limit,
    Long remaining,
    Instant resetTime
) {

    public static QuotaCheckResult unlimited(String tier, long current) {
        return new QuotaCheckResult(true, "unlimited", tier, current, -1, null, null);
    }

    public static QuotaCheckResult allowed(String tier, long current, long limit) {
        return new QuotaCheckResult(true, null, tier, current, limit, Math.max(0, limit - current), null);
    }

    public static QuotaCheckResult denied(String reason, String tier, long current, long limit, Instant resetTime) {
        return new QuotaCheckResult(false, reason, tier, current, limit, 0L, resetTime);
    }
}
