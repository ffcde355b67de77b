package io.github.samzhu.quotakeeper.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.quotakeeper.document.QuotaLimits;
import io.github.samzhu.quotakeeper.document.ResetKind;
import io.github.samzhu.quotakeeper.document.ResetLog;
import io.github.samzhu.quotakeeper.dto.CallerClaims;
import io.github.samzhu.quotakeeper.dto.ManualResetResult;
import io.github.samzhu.quotakeeper.dto.api.LimitsUpdateRequest;
import io.github.samzhu.quotakeeper.dto.api.ManualResetRequest;
import io.github.samzhu.quotakeeper.dto.api.ManualResetResponse;
import io.github.samzhu.quotakeeper.repository.ResetLogRepository;
import io.github.samzhu.quotakeeper.service.ConfigUpdater;
import io.github.samzhu.quotakeeper.service.ManualResetService;

/**
 * 重置管理 API 控制器。
 *
 * <p>所有端點皆需 {@code Authorization: Bearer <admin api key>}，由 {@code SecurityConfig} 驗證：
 * <ul>
 *   <li>{@code POST /api/v1/admin/resets} - 手動觸發重置</li>
 *   <li>{@code GET /api/v1/admin/resets/logs} - 查詢重置紀錄</li>
 *   <li>{@code GET /api/v1/admin/limits} - 查詢配額設定</li>
 *   <li>{@code PUT /api/v1/admin/limits} - 更新配額設定</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/admin")
public class ResetAdminController {

    private static final Logger log = LoggerFactory.getLogger(ResetAdminController.class);

    private static final int MAX_LIMIT = 100;

    private final ManualResetService manualResetService;
    private final ResetLogRepository resetLogRepository;
    private final ConfigUpdater configUpdater;

    public ResetAdminController(
            ManualResetService manualResetService,
            ResetLogRepository resetLogRepository,
            ConfigUpdater configUpdater) {
        this.manualResetService = manualResetService;
        this.resetLogRepository = resetLogRepository;
        this.configUpdater = configUpdater;
    }

    // ========== 手動重置 ==========

    /**
     * 手動觸發重置。憑證明確傳入 {@link ManualResetService}，由其依序檢查授權與重置類型。
     *
     * <p>子重置失敗時仍回應 200，{@code success=false}。
     */
    @PostMapping("/resets")
    public ResponseEntity<ManualResetResponse> triggerReset(
            Authentication authentication,
            @RequestBody ManualResetRequest request) {

        CallerClaims claims = CallerClaims.from(authentication);
        log.debug("API request: manual reset, resetType={}, caller={}", request.resetType(), claims.subject());

        ManualResetResult result = manualResetService.manualReset(request.resetType(), claims);
        return ResponseEntity.ok(ManualResetResponse.from(result));
    }

    // ========== 重置紀錄 ==========

    /**
     * 查詢最近的重置紀錄。
     *
     * @param kind daily / weekly / monthly，省略時查詢全部
     * @param limit 筆數，上限 100
     */
    @GetMapping("/resets/logs")
    public ResponseEntity<List<ResetLog>> getResetLogs(
            @RequestParam(required = false) String kind,
            @RequestParam(defaultValue = "20") int limit) {

        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIMIT)));

        List<ResetLog> logs = kind == null || kind.isBlank()
            ? resetLogRepository.findAllByOrderByTimestampDesc(page)
            : resetLogRepository.findByKindOrderByTimestampDesc(ResetKind.fromValue(kind).value(), page);
        return ResponseEntity.ok(logs);
    }

    // ========== 配額設定 ==========

    @GetMapping("/limits")
    public ResponseEntity<QuotaLimits> getLimits() {
        return ResponseEntity.ok(configUpdater.loadConfig());
    }

    /**
     * 更新配額設定，只修改請求中提供的欄位。
     */
    @PutMapping("/limits")
    public ResponseEntity<QuotaLimits> updateLimits(
            Authentication authentication,
            @Validated @RequestBody LimitsUpdateRequest request) {

        log.info("Limits update requested by {}", authentication.getName());
        return ResponseEntity.ok(configUpdater.updateLimits(request));
    }
}
