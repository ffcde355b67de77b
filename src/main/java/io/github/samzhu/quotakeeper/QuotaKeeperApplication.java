package io.github.samzhu.quotakeeper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Quota Keeper - 圖片分析服務的用量配額追蹤與週期重置服務。
 *
 * <p>此服務負責：
 * <ul>
 *   <li>接收分析後端發送的 CloudEvents 用量事件，原子累加用戶用量</li>
 *   <li>依排程重置每日 / 每週 / 每月用量計數器</li>
 *   <li>重置每日匿名配額上限</li>
 *   <li>監控重置排程是否漏跑並記錄告警</li>
 *   <li>提供管理員手動觸發重置的 API（API Key 驗證，不使用帳號密碼登入）</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Analysis API (Publisher) → Pub/Sub → Quota Keeper Consumer → MongoDB (users)
 *
 * Scheduler ─┬─ daily   (00:00 UTC)        ─┐
 *            ├─ weekly  (Mon 00:00 UTC)     ├→ ResetExecutor → users / config / reset_logs
 *            ├─ monthly (1st 00:00 UTC)    ─┘
 *            └─ health  (every 6 hours)     → HealthMonitor → health_alerts / health_status
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-framework/reference/integration/scheduling.html">Spring Task Scheduling</a>
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableScheduling
public class QuotaKeeperApplication {

    private static final Logger log = LoggerFactory.getLogger(QuotaKeeperApplication.class);

    public static void main(String[] args) {
        log.info("Starting Quota Keeper - usage quota reset service");
        SpringApplication.run(QuotaKeeperApplication.class, args);
    }
}
