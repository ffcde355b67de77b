package io.github.samzhu.quotakeeper.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import io.github.samzhu.quotakeeper.config.QuotaKeeperProperties;
import io.github.samzhu.quotakeeper.config.SecurityConfig;
import io.github.samzhu.quotakeeper.dto.QuotaCheckResult;
import io.github.samzhu.quotakeeper.dto.api.UsageSummaryResponse;
import io.github.samzhu.quotakeeper.dto.api.UserUsageResponse;
import io.github.samzhu.quotakeeper.service.UsageTrackingService;

@WebMvcTest(UsageApiController.class)
@Import({SecurityConfig.class, UsageApiControllerTest.TestConfig.class})
class UsageApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UsageTrackingService usageTrackingService;

    @Test
    void shouldReturnQuotaDecision() throws Exception {
        when(usageTrackingService.checkQuota("pro-1")).thenReturn(QuotaCheckResult.denied(
            "daily_limit_exceeded", "pro", 100, 100, Instant.parse("2025-06-19T00:00:00Z")));

        mockMvc.perform(get("/api/v1/usage/users/pro-1/quota"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.allowed").value(false))
            .andExpect(jsonPath("$.reason").value("daily_limit_exceeded"))
            .andExpect(jsonPath("$.remaining").value(0));
    }

    @Test
    void shouldReturnSummary() throws Exception {
        when(usageTrackingService.usageSummary()).thenReturn(
            new UsageSummaryResponse(4, 3, 1, 3, 30, 8, Instant.parse("2025-06-18T12:00:00Z")));

        mockMvc.perform(get("/api/v1/usage/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalUsers").value(4))
            .andExpect(jsonPath("$.averageUsagePerUser").value(8));
    }

    @Test
    void shouldListTopUsersWithClampedLimit() throws Exception {
        // Given
        when(usageTrackingService.topUsers(500)).thenReturn(List.of(
            new UserUsageResponse("pro-1", 42, 5, 12, 30, "pro",
                Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-06-18T11:00:00Z"))));

        // When & Then
        mockMvc.perform(get("/api/v1/usage/users").param("limit", "9999"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].userId").value("pro-1"))
            .andExpect(jsonPath("$[0].usageCount").value(42))
            .andExpect(jsonPath("$[0].tier").value("pro"));
        verify(usageTrackingService).topUsers(500);
    }

    @TestConfiguration
    static class TestConfig {

        @Bean
        QuotaKeeperProperties quotaKeeperProperties() {
            return new QuotaKeeperProperties(null, null, null, null, null);
        }
    }
}
