package io.github.samzhu.quotakeeper.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 健康檢查告警文件，只新增、不修改。
 *
 * <p>{@code severity} 區分 warning（漏跑重置）與 error（檢查本身失敗）。
 */
@Document(collection = "health_alerts")
public record HealthAlert(
    @Id String id,
    Instant timestamp,
    /** warning / error */
    String severity,
    /** missing_daily_reset / health_check_failure */
    String type,
    String message
) {

    public static final String SEVERITY_WARNING = "warning";
    public static final String SEVERITY_ERROR = "error";

    public static final String TYPE_MISSING_DAILY_RESET = "missing_daily_reset";
    public static final String TYPE_HEALTH_CHECK_FAILURE = "health_check_failure";

    public static HealthAlert missingDailyReset(Instant timestamp, String message) {
        return new HealthAlert(null, timestamp, SEVERITY_WARNING, TYPE_MISSING_DAILY_RESET, message);
    }

    public static HealthAlert checkFailure(Instant timestamp, String error) {
        return new HealthAlert(null, timestamp, SEVERITY_ERROR, TYPE_HEALTH_CHECK_FAILURE, error);
    }
}
