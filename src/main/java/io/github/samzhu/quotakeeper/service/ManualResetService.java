package io.github.samzhu.quotakeeper.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotakeeper.config.AsyncConfig;
import io.github.samzhu.quotakeeper.document.ResetKind;
import io.github.samzhu.quotakeeper.document.ResetLog;
import io.github.samzhu.quotakeeper.dto.CallerClaims;
import io.github.samzhu.quotakeeper.dto.ManualResetResult;
import io.github.samzhu.quotakeeper.dto.ResetOutcome;
import io.github.samzhu.quotakeeper.exception.InvalidResetTypeException;
import io.github.samzhu.quotakeeper.exception.ResetAuthorizationException;

/**
 * 手動重置服務，供管理員在排程之外強制執行重置。
 *
 * <p>前置檢查（皆在存取資料庫之前）：
 * <ul>
 *   <li>呼叫者必須具備管理員權限，否則拋出 {@link ResetAuthorizationException}</li>
 *   <li>{@code resetType} 必須為 daily / weekly / monthly / all，否則拋出 {@link InvalidResetTypeException}</li>
 * </ul>
 *
 * <p>{@code all} 會將三種重置並行送入 {@link AsyncConfig#RESET_EXECUTOR}，全部 completed 才算成功；
 * 任一失敗時回報失敗，但不回滾已成功的種類。
 *
 * @see ResetExecutor
 */
@Service
public class ManualResetService {

    private static final Logger log = LoggerFactory.getLogger(ManualResetService.class);

    private final ResetExecutor resetExecutor;
    private final Executor executor;

    public ManualResetService(
            ResetExecutor resetExecutor,
            @Qualifier(AsyncConfig.RESET_EXECUTOR) Executor executor) {
        this.resetExecutor = resetExecutor;
        this.executor = executor;
    }

    /**
     * 手動觸發重置。
     *
     * @param resetType daily / weekly / monthly / all
     * @param claims 呼叫者憑證
     * @return 執行結果
     * @throws ResetAuthorizationException 呼叫者不是管理員
     * @throws InvalidResetTypeException 重置類型無效
     */
    public ManualResetResult manualReset(String resetType, CallerClaims claims) {
        if (claims == null || !claims.admin()) {
            String subject = claims != null ? claims.subject() : null;
            log.warn("Manual reset rejected: caller {} is not an admin", subject);
            throw new ResetAuthorizationException(subject);
        }

        List<ResetKind> kinds = ResetKind.resolve(resetType);
        log.info("Manual reset triggered by {}: resetType={}", claims.subject(), resetType);

        List<ResetOutcome> outcomes = kinds.size() == 1
            ? List.of(resetExecutor.runReset(kinds.get(0), ResetLog.TRIGGER_MANUAL))
            : runConcurrently(kinds);

        List<ResetOutcome> failed = outcomes.stream()
            .filter(outcome -> !outcome.isCompleted())
            .toList();

        if (failed.isEmpty()) {
            log.info("Manual reset completed: resetType={}, usersReset={}", resetType,
                outcomes.stream().map(o -> o.kind().value() + "=" + o.usersReset()).collect(Collectors.joining(", ")));
            return new ManualResetResult(true, resetType + " reset completed", outcomes);
        }

        String detail = failed.stream()
            .map(o -> o.kind().value() + ": " + o.error())
            .collect(Collectors.joining("; "));
        log.error("Manual reset failed: resetType={}, failures=[{}]", resetType, detail);
        return new ManualResetResult(false, "Reset failed: " + detail, outcomes);
    }

    private List<ResetOutcome> runConcurrently(List<ResetKind> kinds) {
        List<CompletableFuture<ResetOutcome>> futures = kinds.stream()
            .map(this::submit)
            .toList();

        return futures.stream()
            .map(CompletableFuture::join)
            .toList();
    }

    /**
     * 送出單一種類的重置。執行緒池拒絕時直接回傳 failed 結果，其餘已送出的種類照常執行。
     */
    private CompletableFuture<ResetOutcome> submit(ResetKind kind) {
        try {
            return CompletableFuture
                .supplyAsync(() -> resetExecutor.runReset(kind, ResetLog.TRIGGER_MANUAL), executor)
                .exceptionally(ex -> {
                    log.error("Manual {} reset did not complete: {}", kind.value(), ex.getMessage(), ex);
                    return ResetOutcome.failed(kind, 0, 0, ex.getMessage());
                });
        } catch (RejectedExecutionException e) {
            log.error("Manual {} reset rejected by {}: {}", kind.value(), AsyncConfig.RESET_EXECUTOR, e.getMessage(), e);
            return CompletableFuture.completedFuture(
                ResetOutcome.failed(kind, 0, 0, "Reset rejected: " + e.getMessage()));
        }
    }
}
