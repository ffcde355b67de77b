package io.github.samzhu.quotakeeper.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.quotakeeper.document.HealthAlert;
import io.github.samzhu.quotakeeper.document.HealthStatus;
import io.github.samzhu.quotakeeper.document.QuotaLimits;
import io.github.samzhu.quotakeeper.document.ResetLog;
import io.github.samzhu.quotakeeper.document.User;
import io.github.samzhu.quotakeeper.dto.AnalysisUsageEvent;
import io.github.samzhu.quotakeeper.dto.HealthReport;
import io.github.samzhu.quotakeeper.dto.QuotaCheckResult;
import io.github.samzhu.quotakeeper.dto.api.LimitsUpdateRequest;
import io.github.samzhu.quotakeeper.dto.api.ManualResetRequest;
import io.github.samzhu.quotakeeper.dto.api.ManualResetResponse;
import io.github.samzhu.quotakeeper.dto.api.UsageSummaryResponse;
import io.github.samzhu.quotakeeper.dto.api.UserUsageResponse;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>註冊需要反射存取的類別：
 * <ul>
 *   <li>{@link AnalysisUsageEvent} - CloudEvent data payload，由 Jackson 反序列化</li>
 *   <li>MongoDB 文件 - 由 Spring Data 映射</li>
 *   <li>API 請求 / 回應 DTO - 由 Jackson 序列化</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.QuotaKeeperRuntimeHints.class)
public class NativeHintsConfig {

    static class QuotaKeeperRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // 事件 payload
            hints.reflection()
                .registerType(AnalysisUsageEvent.class, MemberCategory.values());

            // MongoDB 文件
            hints.reflection()
                .registerType(User.class, MemberCategory.values())
                .registerType(QuotaLimits.class, MemberCategory.values())
                .registerType(QuotaLimits.TierLimit.class, MemberCategory.values())
                .registerType(ResetLog.class, MemberCategory.values())
                .registerType(HealthAlert.class, MemberCategory.values())
                .registerType(HealthStatus.class, MemberCategory.values());

            // API DTO
            hints.reflection()
                .registerType(ManualResetRequest.class, MemberCategory.values())
                .registerType(ManualResetResponse.class, MemberCategory.values())
                .registerType(LimitsUpdateRequest.class, MemberCategory.values())
                .registerType(LimitsUpdateRequest.TierLimitRequest.class, MemberCategory.values())
                .registerType(UsageSummaryResponse.class, MemberCategory.values())
                .registerType(QuotaCheckResult.class, MemberCategory.values())
                .registerType(UserUsageResponse.class, MemberCategory.values())
                .registerType(HealthReport.class, MemberCategory.values());
        }
    }
}
