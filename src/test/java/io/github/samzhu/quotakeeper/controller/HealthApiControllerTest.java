package io.github.samzhu.quotakeeper.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import io.github.samzhu.quotakeeper.config.QuotaKeeperProperties;
import io.github.samzhu.quotakeeper.config.SecurityConfig;
import io.github.samzhu.quotakeeper.document.HealthAlert;
import io.github.samzhu.quotakeeper.document.HealthStatus;
import io.github.samzhu.quotakeeper.dto.HealthReport;
import io.github.samzhu.quotakeeper.repository.HealthAlertRepository;
import io.github.samzhu.quotakeeper.repository.HealthStatusRepository;
import io.github.samzhu.quotakeeper.service.HealthMonitor;

@WebMvcTest(HealthApiController.class)
@Import({SecurityConfig.class, HealthApiControllerTest.TestConfig.class})
class HealthApiControllerTest {

    private static final String ADMIN = "Bearer health-admin";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealthMonitor healthMonitor;

    @MockBean
    private HealthStatusRepository healthStatusRepository;

    @MockBean
    private HealthAlertRepository healthAlertRepository;

    @Test
    void shouldReturnLatestStatus() throws Exception {
        when(healthStatusRepository.findById(HealthStatus.DOCUMENT_ID)).thenReturn(Optional.of(new HealthStatus(
            HealthStatus.DOCUMENT_ID,
            Instant.parse("2025-06-18T06:00:00Z"),
            HealthStatus.STATUS_HEALTHY,
            Instant.parse("2025-06-18T00:00:03Z"),
            Instant.parse("2025-06-19T00:00:00Z"),
            Instant.parse("2025-06-23T00:00:00Z"),
            Instant.parse("2025-07-01T00:00:00Z"))));

        mockMvc.perform(get("/api/v1/admin/health").header(HttpHeaders.AUTHORIZATION, ADMIN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void shouldReturnNotFoundBeforeFirstCheck() throws Exception {
        when(healthStatusRepository.findById(HealthStatus.DOCUMENT_ID)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/admin/health").header(HttpHeaders.AUTHORIZATION, ADMIN))
            .andExpect(status().isNotFound());
    }

    @Test
    void shouldRunCheckOnDemand() throws Exception {
        when(healthMonitor.checkHealth()).thenReturn(new HealthReport(HealthStatus.STATUS_WARNING,
            Instant.parse("2025-06-18T06:00:00Z"), null, null, null, null, null));

        mockMvc.perform(post("/api/v1/admin/health/check").header(HttpHeaders.AUTHORIZATION, ADMIN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("warning"));
    }

    @Test
    void shouldListAlerts() throws Exception {
        when(healthAlertRepository.findAllByOrderByTimestampDesc(any(Pageable.class))).thenReturn(List.of(
            HealthAlert.missingDailyReset(Instant.parse("2025-06-18T06:00:00Z"), "no daily reset")));

        mockMvc.perform(get("/api/v1/admin/health/alerts").header(HttpHeaders.AUTHORIZATION, ADMIN))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].type").value("missing_daily_reset"));
    }

    @Test
    void shouldRejectAnonymousCaller() throws Exception {
        mockMvc.perform(post("/api/v1/admin/health/check"))
            .andExpect(status().isForbidden());

        verifyNoInteractions(healthMonitor);
    }

    @TestConfiguration
    static class TestConfig {

        @Bean
        QuotaKeeperProperties quotaKeeperProperties() {
            return new QuotaKeeperProperties(null, null, null, null,
                new QuotaKeeperProperties.AdminConfig(List.of("health-admin")));
        }
    }
}
