package io.github.samzhu.quotakeeper.dto;

import java.time.Instant;

import io.github.samzhu.quotakeeper.document.HealthStatus;

/**
 * 健康檢查結果。
 *
 * @param status {@code healthy} 或 {@code warning}
 * @param checkedAt 檢查時間
 * @param lastDailyReset 最近一次完成的每日重置，查無或查詢失敗時為 null
 * @param nextDaily 預期下一次每日重置
 * @param nextWeekly 預期下一次每週重置
 * @param nextMonthly 預期下一次每月重置
 * @param error 檢查本身失敗時的原因
 */
public record HealthReport(
    String status,
    Instant checkedAt,
    Instant lastDailyReset,
    Instant nextDaily,
    Instant nextWeekly,
    Instant nextMonthly,
    String error
) {

    public boolean isHealthy() {
        return HealthStatus.STATUS_HEALTHY.equals(status);
    }

    public static HealthReport fromStatus(HealthStatus status) {
        return new HealthReport(
            status.status(),
            status.lastHealthCheck(),
            status.lastDailyReset(),
            status.nextDailyReset(),
            status.nextWeeklyReset(),
            status.nextMonthlyReset(),
            null
        );
    }
}
