package io.github.samzhu.quotakeeper.util;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/**
 * 重置週期日曆工具類。
 *
 * <p>提供各重置種類下一次週期邊界的純日曆計算，所有時間計算均使用 UTC 時區。
 * 結果僅為預期值，實際觸發由排程器決定。
 */
public final class ResetCalendar {

    private ResetCalendar() {
        // 工具類不允許實例化
    }

    /**
     * 下一個 UTC 午夜。
     *
     * @param now 目前時間
     * @return 明天 00:00:00 UTC
     */
    public static Instant nextDailyReset(Instant now) {
        return today(now).plusDays(1)
            .atStartOfDay(ZoneOffset.UTC)
            .toInstant();
    }

    /**
     * 下一個 UTC 週一午夜。
     *
     * <p>若今天是週一，回傳下週一（嚴格晚於今天 00:00）。
     *
     * @param now 目前時間
     * @return 下一個週一 00:00:00 UTC
     */
    public static Instant nextWeeklyReset(Instant now) {
        return today(now).with(TemporalAdjusters.next(DayOfWeek.MONDAY))
            .atStartOfDay(ZoneOffset.UTC)
            .toInstant();
    }

    /**
     * 下個月 1 號 UTC 午夜。
     *
     * @param now 目前時間
     * @return 下個月 1 號 00:00:00 UTC
     */
    public static Instant nextMonthlyReset(Instant now) {
        return today(now).with(TemporalAdjusters.firstDayOfNextMonth())
            .atStartOfDay(ZoneOffset.UTC)
            .toInstant();
    }

    private static LocalDate today(Instant now) {
        return LocalDate.ofInstant(now, ZoneOffset.UTC);
    }
}
