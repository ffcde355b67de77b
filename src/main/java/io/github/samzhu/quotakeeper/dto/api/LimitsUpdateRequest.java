package io.github.samzhu.quotakeeper.dto.api;

import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

/**
 * 配額設定更新請求，未提供的欄位不修改。
 *
 * @param anonymousLimit 匿名配額上限
 * @param resetHour 每日重置預定小時 (UTC)
 * @param tiers 各方案週期上限
 */
public record LimitsUpdateRequest(
    @Positive Integer anonymousLimit,
    @Min(0) @Max(23) Integer resetHour,
    Map<String, @Valid TierLimitRequest> tiers
) {

    /**
     * 單一方案上限，{@code -1} 表示無限制。
     */
    public record TierLimitRequest(
        @Min(-1) int dailyLimit,
        @Min(-1) int weeklyLimit,
        @Min(-1) int monthlyLimit
    ) {}
}
