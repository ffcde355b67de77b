package io.github.samzhu.quotakeeper.function;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verify;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.cloud.stream.binder.test.InputDestination;
import org.springframework.cloud.stream.binder.test.TestChannelBinderConfiguration;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.util.MimeTypeUtils;

import io.github.samzhu.quotakeeper.service.UsageTrackingService;

/**
 * Integration test for AnalysisUsageFunction using the Spring Cloud Stream Test Binder.
 *
 * <p>The analysis back end publishes CloudEvents in Structured Mode; Spring Cloud Stream
 * presents them to the consumer with attributes in headers and the data field as payload,
 * which is the shape these messages simulate.
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/spring_integration_test_binder.html">Test Binder</a>
 */
class AnalysisUsageFunctionTest {

    private static final Instant RECEIVED_AT = Instant.parse("2025-06-18T12:00:00Z");

    private static ConfigurableApplicationContext context;
    private static InputDestination inputDestination;
    private static UsageTrackingService mockTrackingService;

    @BeforeAll
    static void setupContext() {
        mockTrackingService = mock(UsageTrackingService.class);

        context = new SpringApplicationBuilder(
            TestChannelBinderConfiguration.getCompleteConfiguration(TestConfig.class))
            .web(WebApplicationType.NONE)
            .run(
                "--spring.cloud.function.definition=analysisUsageConsumer",
                "--spring.cloud.stream.default-binder=integration",
                "--spring.jmx.enabled=false"
            );

        inputDestination = context.getBean(InputDestination.class);
    }

    @AfterAll
    static void closeContext() {
        if (context != null) {
            context.close();
        }
    }

    @BeforeEach
    void resetMock() {
        reset(mockTrackingService);
    }

    @Test
    void shouldRecordSuccessfulAnalysis() {
        // Given
        String payload = """
            {"userId":"user-abc-123","eventTime":"2025-06-18T09:15:00Z","engine":"vision-pro","imageCount":2,"status":"success"}
            """;

        // When
        inputDestination.send(cloudEvent(payload, "user-abc-123", null));

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockTrackingService).recordUsage("user-abc-123", Instant.parse("2025-06-18T09:15:00Z")));
    }

    @Test
    void shouldFallBackToCloudEventSubjectAndTime() {
        // Given: data 缺少 userId 與 eventTime
        OffsetDateTime eventTime = OffsetDateTime.of(2025, 6, 18, 10, 0, 0, 0, ZoneOffset.UTC);
        String payload = """
            {"engine":"vision-basic","imageCount":1,"status":"SUCCESS"}
            """;

        // When
        inputDestination.send(cloudEvent(payload, "anon-uid-42", eventTime));

        // Then
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockTrackingService).recordUsage("anon-uid-42", eventTime.toInstant()));
    }

    @Test
    void shouldUseReceiveTimeWhenNoTimeAvailable() {
        String payload = """
            {"userId":"user-no-time","engine":"vision-basic","imageCount":1,"status":"success"}
            """;

        inputDestination.send(cloudEvent(payload, null, null));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
            verify(mockTrackingService).recordUsage("user-no-time", RECEIVED_AT));
    }

    @Test
    void shouldNotCountFailedAnalysis() {
        // Given
        String payload = """
            {"userId":"error-user","eventTime":"2025-06-18T09:15:00Z","engine":"vision-pro","imageCount":1,"status":"error"}
            """;

        // When: test binder 為同步投遞
        inputDestination.send(cloudEvent(payload, "error-user", null));

        // Then
        verify(mockTrackingService, never()).recordUsage(anyString(), any(Instant.class));
    }

    @Test
    void shouldSwallowRecordingFailure() {
        // Given
        doThrow(new IllegalStateException("mongo down"))
            .when(mockTrackingService).recordUsage(eq("user-fail"), any(Instant.class));
        String payload = """
            {"userId":"user-fail","eventTime":"2025-06-18T09:15:00Z","engine":"vision-pro","imageCount":1,"status":"success"}
            """;

        // When & Then
        assertThatCode(() -> inputDestination.send(cloudEvent(payload, "user-fail", null)))
            .doesNotThrowAnyException();
        verify(mockTrackingService).recordUsage(eq("user-fail"), any(Instant.class));
    }

    private static Message<byte[]> cloudEvent(String payload, String subject, OffsetDateTime time) {
        MessageBuilder<byte[]> builder = MessageBuilder.withPayload(payload.trim().getBytes(StandardCharsets.UTF_8))
            .setHeader(MessageHeaders.CONTENT_TYPE, MimeTypeUtils.APPLICATION_JSON)
            .setHeader(CloudEventMessageUtils.ID, UUID.randomUUID().toString())
            .setHeader(CloudEventMessageUtils.SOURCE, URI.create("https://analyzer.example.com/api"))
            .setHeader(CloudEventMessageUtils.TYPE, "io.github.samzhu.analyzer.usage.v1")
            .setHeader(CloudEventMessageUtils.SPECVERSION, "1.0");
        if (subject != null) {
            builder.setHeader(CloudEventMessageUtils.SUBJECT, subject);
        }
        if (time != null) {
            builder.setHeader(CloudEventMessageUtils.TIME, time);
        }
        return builder.build();
    }

    @Configuration
    @EnableAutoConfiguration(exclude = {
        MongoAutoConfiguration.class,
        MongoDataAutoConfiguration.class
    }, excludeName = {
        "com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.pubsub.GcpPubSubReactiveAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.pubsub.stream.GcpPubSubBinderAutoConfiguration",
        "com.google.cloud.spring.autoconfigure.core.GcpContextAutoConfiguration"
    })
    @Import(AnalysisUsageFunction.class)
    static class TestConfig {

        @Bean
        public UsageTrackingService usageTrackingService() {
            return mockTrackingService;
        }

        @Bean
        public Clock clock() {
            return Clock.fixed(RECEIVED_AT, ZoneOffset.UTC);
        }
    }
}
