package io.github.samzhu.quotakeeper.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 用戶用量文件，每個被追蹤的帳號（匿名或註冊）一筆。
 *
 * <p>欄位分類：
 * <ul>
 *   <li>累計用量 - {@code usageCount}，欄位存在即代表帳號已啟用用量追蹤</li>
 *   <li>週期用量 - 每日 / 每週 / 每月計數，只會被對應的重置歸零，其餘寫入者只會累加</li>
 *   <li>重置時間 - 各週期最後一次重置的時間</li>
 *   <li>方案 - {@code isPro} / {@code isAdmin}，影響配額上限，不影響重置邏輯</li>
 * </ul>
 *
 * <p>{@code usageCount} 為 {@code null} 的文件尚未啟用追蹤，任何重置都不得修改。
 *
 * @see io.github.samzhu.quotakeeper.service.EligibilityFilter
 */
@Document(collection = "users")
public record User(
    @Id String id,

    // ========== 累計用量 ==========
    /** 歷史累計使用次數，null 表示尚未啟用追蹤 */
    Long usageCount,

    // ========== 週期用量 ==========
    /** 今日使用次數 */
    long dailyUsage,
    /** 本週使用次數 */
    long weeklyUsage,
    /** 本月使用次數 */
    long monthlyUsage,

    // ========== 重置時間 ==========
    Instant lastDailyReset,
    Instant lastWeeklyReset,
    Instant lastMonthlyReset,

    // ========== 方案 ==========
    boolean isPro,
    boolean isAdmin,

    // ========== 時間戳記 ==========
    Instant createdAt,
    Instant lastActiveAt
) {

    /**
     * 是否已啟用用量追蹤。
     */
    public boolean isTracked() {
        return usageCount != null;
    }

    /**
     * 取得指定種類的週期用量。
     *
     * @param kind 重置種類
     * @return 該週期用量
     */
    public long usageFor(ResetKind kind) {
        return switch (kind) {
            case DAILY -> dailyUsage;
            case WEEKLY -> weeklyUsage;
            case MONTHLY -> monthlyUsage;
        };
    }

    /**
     * 取得方案名稱：{@code admin}、{@code pro} 或 {@code free}。
     */
    public String tier() {
        if (isAdmin) {
            return "admin";
        }
        return isPro ? "pro" : "free";
    }

    /**
     * 建立尚未有任何用量的新用戶（用於查無文件時的預設值）。
     *
     * @param id 用戶 ID
     * @return 未追蹤的用戶
     */
    public static User untracked(String id) {
        return new User(id, null, 0, 0, 0, null, null, null, false, false, null, null);
    }
}
