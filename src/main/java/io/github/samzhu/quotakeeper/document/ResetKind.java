package io.github.samzhu.quotakeeper.document;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import io.github.samzhu.quotakeeper.exception.InvalidResetTypeException;
import io.github.samzhu.quotakeeper.util.ResetCalendar;

/**
 * 重置種類，決定一次重置作用於哪一個週期用量欄位。
 *
 * <p>文件中以 {@link #value()} 字串儲存（{@code daily} / {@code weekly} / {@code monthly}），
 * 不直接持久化 Enum。
 */
public enum ResetKind {

    DAILY("daily", "dailyUsage", "lastDailyReset"),
    WEEKLY("weekly", "weeklyUsage", "lastWeeklyReset"),
    MONTHLY("monthly", "monthlyUsage", "lastMonthlyReset");

    /** 手動觸發時代表全部種類的值 */
    public static final String ALL = "all";

    private final String value;
    private final String usageField;
    private final String lastResetField;

    ResetKind(String value, String usageField, String lastResetField) {
        this.value = value;
        this.usageField = usageField;
        this.lastResetField = lastResetField;
    }

    public String value() {
        return value;
    }

    /**
     * 此種類要歸零的 {@code users} 欄位。
     */
    public String usageField() {
        return usageField;
    }

    /**
     * 此種類要蓋上時間戳記的 {@code users} 欄位。
     */
    public String lastResetField() {
        return lastResetField;
    }

    /**
     * 計算此種類下一次預期的觸發時間 (UTC)。
     *
     * @param now 目前時間
     * @return 下一次週期邊界
     */
    public Instant nextResetAfter(Instant now) {
        return switch (this) {
            case DAILY -> ResetCalendar.nextDailyReset(now);
            case WEEKLY -> ResetCalendar.nextWeeklyReset(now);
            case MONTHLY -> ResetCalendar.nextMonthlyReset(now);
        };
    }

    /**
     * 從字串解析單一重置種類（不分大小寫）。
     *
     * @param value 種類字串
     * @return 對應的種類
     * @throws InvalidResetTypeException 無法辨識時
     */
    public static ResetKind fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ResetKind kind : values()) {
                if (kind.value.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new InvalidResetTypeException(value);
    }

    /**
     * 解析手動觸發的重置類型，{@code all} 展開為全部種類。
     *
     * @param resetType {@code daily|weekly|monthly|all}
     * @return 要執行的種類清單
     * @throws InvalidResetTypeException 無法辨識時
     */
    public static List<ResetKind> resolve(String resetType) {
        if (resetType != null && ALL.equals(resetType.trim().toLowerCase(Locale.ROOT))) {
            return Arrays.asList(values());
        }
        return List.of(fromValue(resetType));
    }
}
