package io.github.samzhu.quotakeeper.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import io.github.samzhu.quotakeeper.document.ResetKind;

/**
 * 重置排程觸發器。
 *
 * <p>四個獨立排程，Cron 表達式由 {@code quota-keeper.schedule.*-cron} 配置，皆以 UTC 解讀，
 * 未設定時使用下列預設值，設為 {@code "-"} 停用該排程：
 * <ul>
 *   <li>每日重置 - 預設每天 00:00</li>
 *   <li>每週重置 - 預設週一 00:00</li>
 *   <li>每月重置 - 預設每月 1 號 00:00</li>
 *   <li>健康檢查 - 預設每 6 小時</li>
 * </ul>
 *
 * <p>此類別只負責觸發，重置與檢查邏輯不依賴排程時間，只使用注入的 Clock。
 * 設定 {@code quota-keeper.schedule.enabled=false} 可停用（例如由外部排程器呼叫 API）。
 */
@Component
@ConditionalOnProperty(name = "quota-keeper.schedule.enabled", havingValue = "true", matchIfMissing = true)
public class ResetScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResetScheduler.class);

    static final String DEFAULT_DAILY_CRON = "0 0 0 * * *";
    static final String DEFAULT_WEEKLY_CRON = "0 0 0 * * MON";
    static final String DEFAULT_MONTHLY_CRON = "0 0 0 1 * *";
    static final String DEFAULT_HEALTH_CRON = "0 0 */6 * * *";

    private final ResetExecutor resetExecutor;
    private final HealthMonitor healthMonitor;

    public ResetScheduler(ResetExecutor resetExecutor, HealthMonitor healthMonitor) {
        this.resetExecutor = resetExecutor;
        this.healthMonitor = healthMonitor;
    }

    @Scheduled(cron = "${quota-keeper.schedule.daily-cron:" + DEFAULT_DAILY_CRON + "}", zone = "UTC")
    public void resetDailyUsage() {
        log.debug("Scheduled daily reset triggered");
        resetExecutor.runReset(ResetKind.DAILY);
    }

    @Scheduled(cron = "${quota-keeper.schedule.weekly-cron:" + DEFAULT_WEEKLY_CRON + "}", zone = "UTC")
    public void resetWeeklyUsage() {
        log.debug("Scheduled weekly reset triggered");
        resetExecutor.runReset(ResetKind.WEEKLY);
    }

    @Scheduled(cron = "${quota-keeper.schedule.monthly-cron:" + DEFAULT_MONTHLY_CRON + "}", zone = "UTC")
    public void resetMonthlyUsage() {
        log.debug("Scheduled monthly reset triggered");
        resetExecutor.runReset(ResetKind.MONTHLY);
    }

    @Scheduled(cron = "${quota-keeper.schedule.health-cron:" + DEFAULT_HEALTH_CRON + "}", zone = "UTC")
    public void resetSystemHealthCheck() {
        log.debug("Scheduled health check triggered");
        healthMonitor.checkHealth();
    }
}
