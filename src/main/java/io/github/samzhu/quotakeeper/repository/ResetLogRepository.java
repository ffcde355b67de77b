package io.github.samzhu.quotakeeper.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quotakeeper.document.ResetLog;

/**
 * 重置執行紀錄資料存取介面。
 *
 * <p>紀錄為只新增資料，建立後不會修改或刪除。
 *
 * @see io.github.samzhu.quotakeeper.document.ResetLog
 */
public interface ResetLogRepository extends MongoRepository<ResetLog, String> {

    /**
     * 檢查指定時間之後是否有某種類、某狀態的紀錄（健康檢查使用）。
     *
     * @param kind 重置種類
     * @param status 狀態
     * @param since 窗口起點（含）
     * @return true 表示窗口內至少有一筆
     */
    boolean existsByKindAndStatusAndTimestampGreaterThanEqual(String kind, String status, Instant since);

    /**
     * 查詢某種類最近一筆指定狀態的紀錄。
     *
     * @param kind 重置種類
     * @param status 狀態
     * @return 最新紀錄（如存在）
     */
    Optional<ResetLog> findFirstByKindAndStatusOrderByTimestampDesc(String kind, String status);

    /**
     * 分頁查詢某種類的紀錄，最新的在前。
     *
     * @param kind 重置種類
     * @param pageable 分頁參數
     * @return 紀錄清單
     */
    List<ResetLog> findByKindOrderByTimestampDesc(String kind, Pageable pageable);

    /**
     * 分頁查詢所有紀錄，最新的在前。
     *
     * @param pageable 分頁參數
     * @return 紀錄清單
     */
    List<ResetLog> findAllByOrderByTimestampDesc(Pageable pageable);
}
