package io.github.samzhu.quotakeeper.function;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.quotakeeper.dto.AnalysisUsageEvent;
import io.github.samzhu.quotakeeper.service.UsageTrackingService;

/**
 * CloudEvents 分析用量消費者函式配置。
 *
 * <p>分析後端以 Structured Mode ({@code application/cloudevents+json}) 發送事件，
 * Spring Cloud Stream 解析後 CloudEvent attributes 放在 Message Headers，
 * data 轉換為 {@link AnalysisUsageEvent}。
 *
 * <p>欄位缺少時的替代來源：
 * <ul>
 *   <li>{@code userId} → CloudEvent {@code subject}</li>
 *   <li>{@code eventTime} → CloudEvent {@code time}，再退回接收時間</li>
 * </ul>
 *
 * <p>只有 {@code status=success} 的事件會計入用量。
 *
 * <p>Binding name: {@code analysisUsageConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class AnalysisUsageFunction {

    private static final Logger log = LoggerFactory.getLogger(AnalysisUsageFunction.class);

    private final UsageTrackingService usageTrackingService;
    private final Clock clock;

    public AnalysisUsageFunction(UsageTrackingService usageTrackingService, Clock clock) {
        this.usageTrackingService = usageTrackingService;
        this.clock = clock;
    }

    /**
     * 分析用量事件消費者 Bean。
     *
     * <p>錯誤處理：不重新拋出例外，避免訊息重複投遞造成重複累加。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<AnalysisUsageEvent>> analysisUsageConsumer() {
        return message -> {
            try {
                AnalysisUsageEvent data = message.getPayload();
                String userId = data.userId() != null ? data.userId() : CloudEventMessageUtils.getSubject(message);

                log.debug("CloudEvent received: id={}, type={}, userId={}, status={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    userId,
                    data.status());

                if (userId == null || userId.isBlank()) {
                    log.warn("Analysis usage event without userId ignored: id={}", CloudEventMessageUtils.getId(message));
                    return;
                }
                if (!data.isSuccess()) {
                    log.debug("Analysis did not succeed, usage not counted: userId={}, status={}", userId, data.status());
                    return;
                }

                usageTrackingService.recordUsage(userId, resolveEventTime(data, message));
            } catch (Exception e) {
                log.error("Failed to process CloudEvent: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
            }
        };
    }

    private Instant resolveEventTime(AnalysisUsageEvent data, Message<?> message) {
        if (data.eventTime() != null) {
            return data.eventTime();
        }
        OffsetDateTime time = CloudEventMessageUtils.getTime(message);
        return time != null ? time.toInstant() : clock.instant();
    }
}
