package io.github.samzhu.quotakeeper.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.quotakeeper.document.HealthAlert;
import io.github.samzhu.quotakeeper.document.HealthStatus;
import io.github.samzhu.quotakeeper.dto.HealthReport;
import io.github.samzhu.quotakeeper.repository.HealthAlertRepository;
import io.github.samzhu.quotakeeper.repository.HealthStatusRepository;
import io.github.samzhu.quotakeeper.service.HealthMonitor;

/**
 * 重置系統健康狀態 API 控制器，位於 {@code /api/v1/admin/**} 之下，需管理員 API Key。
 */
@RestController
@RequestMapping("/api/v1/admin/health")
public class HealthApiController {

    private static final Logger log = LoggerFactory.getLogger(HealthApiController.class);

    private final HealthMonitor healthMonitor;
    private final HealthStatusRepository healthStatusRepository;
    private final HealthAlertRepository healthAlertRepository;

    public HealthApiController(
            HealthMonitor healthMonitor,
            HealthStatusRepository healthStatusRepository,
            HealthAlertRepository healthAlertRepository) {
        this.healthMonitor = healthMonitor;
        this.healthStatusRepository = healthStatusRepository;
        this.healthAlertRepository = healthAlertRepository;
    }

    /**
     * 取得最近一次健康檢查結果，尚未執行過時回應 404。
     */
    @GetMapping
    public ResponseEntity<HealthReport> getLatest() {
        return healthStatusRepository.findById(HealthStatus.DOCUMENT_ID)
            .map(HealthReport::fromStatus)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * 立即執行一次健康檢查。
     */
    @PostMapping("/check")
    public ResponseEntity<HealthReport> runCheck() {
        log.debug("API request: on-demand health check");
        return ResponseEntity.ok(healthMonitor.checkHealth());
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<HealthAlert>> getAlerts(
            @RequestParam(required = false) String severity,
            @RequestParam(defaultValue = "20") int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, 100)));
        List<HealthAlert> alerts = severity == null || severity.isBlank()
            ? healthAlertRepository.findAllByOrderByTimestampDesc(page)
            : healthAlertRepository.findBySeverityOrderByTimestampDesc(severity, page);
        return ResponseEntity.ok(alerts);
    }
}
