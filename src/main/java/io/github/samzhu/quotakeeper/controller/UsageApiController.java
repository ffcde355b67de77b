package io.github.samzhu.quotakeeper.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.quotakeeper.dto.QuotaCheckResult;
import io.github.samzhu.quotakeeper.dto.api.UsageSummaryResponse;
import io.github.samzhu.quotakeeper.dto.api.UserUsageResponse;
import io.github.samzhu.quotakeeper.service.UsageTrackingService;

/**
 * 用量查詢 API 控制器。
 *
 * <ul>
 *   <li>{@code GET /api/v1/usage/users/{userId}/quota} - 用戶配額檢查</li>
 *   <li>{@code GET /api/v1/usage/summary} - 全體用量摘要</li>
 *   <li>{@code GET /api/v1/usage/users} - 累計用量排行</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/usage")
public class UsageApiController {

    private static final Logger log = LoggerFactory.getLogger(UsageApiController.class);

    private final UsageTrackingService usageTrackingService;

    public UsageApiController(UsageTrackingService usageTrackingService) {
        this.usageTrackingService = usageTrackingService;
    }

    @GetMapping("/users/{userId}/quota")
    public ResponseEntity<QuotaCheckResult> checkQuota(@PathVariable String userId) {
        log.debug("API request: quota check, userId={}", userId);
        return ResponseEntity.ok(usageTrackingService.checkQuota(userId));
    }

    @GetMapping("/summary")
    public ResponseEntity<UsageSummaryResponse> getSummary() {
        log.debug("API request: usage summary");
        return ResponseEntity.ok(usageTrackingService.usageSummary());
    }

    @GetMapping("/users")
    public ResponseEntity<List<UserUsageResponse>> getTopUsers(
            @RequestParam(defaultValue = "100") int limit) {
        log.debug("API request: top users, limit={}", limit);
        return ResponseEntity.ok(usageTrackingService.topUsers(Math.max(1, Math.min(limit, 500))));
    }
}
