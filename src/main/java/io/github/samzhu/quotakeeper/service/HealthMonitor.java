package io.github.samzhu.quotakeeper.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotakeeper.config.QuotaKeeperProperties;
import io.github.samzhu.quotakeeper.document.HealthAlert;
import io.github.samzhu.quotakeeper.document.HealthStatus;
import io.github.samzhu.quotakeeper.document.ResetKind;
import io.github.samzhu.quotakeeper.document.ResetLog;
import io.github.samzhu.quotakeeper.dto.HealthReport;
import io.github.samzhu.quotakeeper.repository.HealthAlertRepository;
import io.github.samzhu.quotakeeper.repository.HealthStatusRepository;
import io.github.samzhu.quotakeeper.repository.ResetLogRepository;
import io.github.samzhu.quotakeeper.util.ResetCalendar;

/**
 * 重置系統健康檢查服務，{@code health_alerts} 與 {@code health_status} 的唯一寫入者。
 *
 * <p>檢查流程：
 * <ol>
 *   <li>計算窗口：24 小時 + {@code quota-keeper.health.window-buffer}</li>
 *   <li>查詢窗口內是否至少有一筆 completed 的每日重置紀錄</li>
 *   <li>沒有 → 狀態 warning，寫入一筆 {@code missing_daily_reset} 告警</li>
 *   <li>無論結果，覆寫 {@code health_status/latest}，附上各種類的預期下次觸發時間</li>
 * </ol>
 *
 * <p>查詢或寫入失敗時寫入 {@code health_check_failure} 告警，不往上拋出。
 */
@Service
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ResetLogRepository resetLogRepository;
    private final HealthAlertRepository healthAlertRepository;
    private final HealthStatusRepository healthStatusRepository;
    private final Duration dailyWindow;
    private final Clock clock;

    public HealthMonitor(
            ResetLogRepository resetLogRepository,
            HealthAlertRepository healthAlertRepository,
            HealthStatusRepository healthStatusRepository,
            QuotaKeeperProperties properties,
            Clock clock) {
        this.resetLogRepository = resetLogRepository;
        this.healthAlertRepository = healthAlertRepository;
        this.healthStatusRepository = healthStatusRepository;
        this.dailyWindow = properties.health().dailyWindow();
        this.clock = clock;
    }

    public HealthReport checkHealth() {
        return checkHealth(clock.instant());
    }

    /**
     * 執行健康檢查。此方法不會拋出例外。
     *
     * @param now 檢查時間
     * @return 檢查結果
     */
    public HealthReport checkHealth(Instant now) {
        log.info("Running reset system health check...");

        Instant since = now.minus(dailyWindow);
        Instant nextDaily = ResetCalendar.nextDailyReset(now);
        Instant nextWeekly = ResetCalendar.nextWeeklyReset(now);
        Instant nextMonthly = ResetCalendar.nextMonthlyReset(now);

        try {
            boolean found = resetLogRepository.existsByKindAndStatusAndTimestampGreaterThanEqual(
                ResetKind.DAILY.value(), ResetLog.STATUS_COMPLETED, since);
            Instant lastDaily = resetLogRepository
                .findFirstByKindAndStatusOrderByTimestampDesc(ResetKind.DAILY.value(), ResetLog.STATUS_COMPLETED)
                .map(ResetLog::timestamp)
                .orElse(null);

            String status;
            if (found) {
                status = HealthStatus.STATUS_HEALTHY;
                log.info("Reset system is functioning normally (last daily reset: {})", lastDaily);
            } else {
                status = HealthStatus.STATUS_WARNING;
                log.warn("No daily resets found since {} (last daily reset: {})", since, lastDaily);
                healthAlertRepository.save(HealthAlert.missingDailyReset(now,
                    "Daily reset function may not be working: no completed daily reset since " + since));
            }

            healthStatusRepository.save(new HealthStatus(
                HealthStatus.DOCUMENT_ID, now, status, lastDaily, nextDaily, nextWeekly, nextMonthly));

            return new HealthReport(status, now, lastDaily, nextDaily, nextWeekly, nextMonthly, null);
        } catch (Exception e) {
            log.error("Health check failed: {}", e.getMessage(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            recordFailure(now, error);
            return new HealthReport(HealthStatus.STATUS_WARNING, now, null, nextDaily, nextWeekly, nextMonthly, error);
        }
    }

    private void recordFailure(Instant now, String error) {
        try {
            healthAlertRepository.save(HealthAlert.checkFailure(now, error));
        } catch (Exception alertError) {
            log.error("Failed to record health check failure alert: {}", alertError.getMessage(), alertError);
        }
    }
}
