package io.github.samzhu.quotakeeper.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotakeeper.config.QuotaKeeperProperties;
import io.github.samzhu.quotakeeper.document.QuotaLimits;
import io.github.samzhu.quotakeeper.document.ResetKind;
import io.github.samzhu.quotakeeper.document.ResetLog;
import io.github.samzhu.quotakeeper.document.User;
import io.github.samzhu.quotakeeper.dto.ResetOutcome;
import io.github.samzhu.quotakeeper.repository.ResetLogRepository;

/**
 * 週期用量重置服務，{@code users} 週期用量欄位與 {@code reset_logs} 的唯一寫入者。
 *
 * <p>處理流程：
 * <ol>
 *   <li>讀取 {@code config/limits} 一次（每日重置使用 {@code anonymousLimit} 與 {@code resetHour}），
 *       讀取失敗時整次重置記為 failed</li>
 *   <li>以 {@link UserPageCursor} 逐頁掃描符合 {@link EligibilityFilter} 的用戶</li>
 *   <li>每頁一個 bulk write：將對應的週期用量設為 0，並蓋上 {@code lastXReset}</li>
 *   <li>批次依序提交，每批獨立提交，後續批次失敗不會回滾已提交的批次</li>
 *   <li>每日重置額外由 {@link ConfigUpdater} 還原匿名配額</li>
 *   <li>寫入一筆 {@link ResetLog}（completed 或 failed）</li>
 * </ol>
 *
 * <p>錯誤處理：任何失敗都寫成 failed 紀錄而不往上拋出，避免排程器重試時
 * 重跑已提交的批次。重複執行同一種類結果相同（0 寫兩次仍為 0），但會多一筆紀錄。
 *
 * <p>已知限制：重置使用直接設為 0 的寫入，若用量累加發生在讀取快照之後、
 * 該批提交之前，該次累加會被覆蓋。
 *
 * @see EligibilityFilter
 * @see ConfigUpdater
 */
@Service
public class ResetExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResetExecutor.class);

    private final MongoTemplate mongoTemplate;
    private final ResetLogRepository resetLogRepository;
    private final EligibilityFilter eligibilityFilter;
    private final ConfigUpdater configUpdater;
    private final Clock clock;
    private final int batchSize;

    public ResetExecutor(
            MongoTemplate mongoTemplate,
            ResetLogRepository resetLogRepository,
            EligibilityFilter eligibilityFilter,
            ConfigUpdater configUpdater,
            QuotaKeeperProperties properties,
            Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.resetLogRepository = resetLogRepository;
        this.eligibilityFilter = eligibilityFilter;
        this.configUpdater = configUpdater;
        this.clock = clock;
        this.batchSize = properties.reset().batchSize();
    }

    /**
     * 以目前時間執行排程重置。
     *
     * @param kind 重置種類
     * @return 執行結果
     */
    public ResetOutcome runReset(ResetKind kind) {
        return runReset(kind, clock.instant(), ResetLog.TRIGGER_SCHEDULED);
    }

    /**
     * 以目前時間執行重置。
     *
     * @param kind 重置種類
     * @param trigger scheduled 或 manual
     * @return 執行結果
     */
    public ResetOutcome runReset(ResetKind kind, String trigger) {
        return runReset(kind, clock.instant(), trigger);
    }

    /**
     * 執行一次重置。此方法不會拋出例外，失敗一律反映在回傳結果與 failed 紀錄中。
     *
     * @param kind 重置種類
     * @param now 重置時間，寫入 {@code lastXReset} 與紀錄
     * @param trigger scheduled 或 manual
     * @return 執行結果
     */
    public ResetOutcome runReset(ResetKind kind, Instant now, String trigger) {
        log.info("Starting {} usage reset (trigger={}, batchSize={})", kind.value(), trigger, batchSize);
        long startTime = System.currentTimeMillis();

        int usersReset = 0;
        int batchesCommitted = 0;
        Integer anonymousLimitReset = null;

        try {
            QuotaLimits config = configUpdater.readConfig();
            if (kind == ResetKind.DAILY) {
                log.info("Daily reset scheduled for {}:00 UTC", config.resetHour());
            }

            UserPageCursor cursor = new UserPageCursor(mongoTemplate, eligibilityFilter.criteria(), batchSize);
            while (cursor.hasNext()) {
                List<User> eligible = eligibilityFilter.filter(cursor.next());
                if (eligible.isEmpty()) {
                    continue;
                }
                commitBatch(kind, eligible, now);
                usersReset += eligible.size();
                batchesCommitted++;
                log.debug("Reset batch {} committed: kind={}, users={}, lastId={}",
                    batchesCommitted, kind.value(), eligible.size(), cursor.lastSeenId());
            }

            if (kind == ResetKind.DAILY) {
                anonymousLimitReset = configUpdater.applyDailyReset(config, now);
            }
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            log.error("Error in {} reset after {} batches ({} users) in {}ms: {}",
                kind.value(), batchesCommitted, usersReset, duration, e.getMessage(), e);
            ResetOutcome outcome = ResetOutcome.failed(kind, usersReset, batchesCommitted, describe(e));
            writeLog(ResetLog.failed(kind, now, usersReset, batchesCommitted, trigger, outcome.error()));
            return outcome;
        }

        long duration = System.currentTimeMillis() - startTime;
        if (usersReset == 0) {
            log.info("No users found to reset for {}", kind.value());
        }
        log.info("{} reset completed: {} users in {} batches, {}ms{}",
            kind.value(), usersReset, batchesCommitted, duration,
            anonymousLimitReset != null ? ", anonymous limit reset to " + anonymousLimitReset : "");

        writeLog(ResetLog.completed(kind, now, usersReset, batchesCommitted, anonymousLimitReset, trigger));
        return ResetOutcome.completed(kind, usersReset, batchesCommitted);
    }

    /**
     * 提交一批用戶的重置。
     *
     * <p>篩選條件再次套用追蹤欄位條件，避免快照後被移除追蹤的文件被寫入欄位。
     */
    private void commitBatch(ResetKind kind, List<User> users, Instant now) {
        BulkOperations bulkOps = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, User.class);
        for (User user : users) {
            Query query = Query.query(EligibilityFilter.trackedCriteria(
                Criteria.where("_id").is(user.id()).and(EligibilityFilter.TRACKING_FIELD)));
            Update update = new Update()
                .set(kind.usageField(), 0L)
                .set(kind.lastResetField(), now);
            bulkOps.updateOne(query, update);
        }
        bulkOps.execute();
    }

    private void writeLog(ResetLog entry) {
        try {
            resetLogRepository.save(entry);
        } catch (Exception e) {
            log.error("Failed to write {} reset log (status={}, usersReset={}): {}",
                entry.kind(), entry.status(), entry.usersReset(), e.getMessage(), e);
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
