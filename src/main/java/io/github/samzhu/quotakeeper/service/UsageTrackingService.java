package io.github.samzhu.quotakeeper.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotakeeper.document.QuotaLimits;
import io.github.samzhu.quotakeeper.document.QuotaLimits.TierLimit;
import io.github.samzhu.quotakeeper.document.ResetKind;
import io.github.samzhu.quotakeeper.document.User;
import io.github.samzhu.quotakeeper.dto.QuotaCheckResult;
import io.github.samzhu.quotakeeper.dto.api.UsageSummaryResponse;
import io.github.samzhu.quotakeeper.dto.api.UserUsageResponse;
import io.github.samzhu.quotakeeper.repository.UserRepository;

/**
 * 用量追蹤服務：即時累加、配額檢查與全體摘要。
 *
 * <p>即時累加是週期用量唯一會增加的寫入路徑，使用 upsert + {@code $inc} 原子操作，
 * 首次使用時建立用戶文件並啟用追蹤。週期用量歸零只由 {@link ResetExecutor} 執行。
 *
 * <p>配額檢查規則：
 * <ul>
 *   <li>admin，或方案上限為 {@code -1} → 無限制</li>
 *   <li>非 Pro 非 admin → 累計用量與匿名配額比較，匿名配額不會自動重置</li>
 *   <li>Pro → 依序檢查每日、每週、每月上限，超過時回傳對應的下次重置時間</li>
 * </ul>
 * 檢查失敗時放行（fail-open）並記錄錯誤，避免資料庫異常阻擋所有分析請求。
 */
@Service
public class UsageTrackingService {

    private static final Logger log = LoggerFactory.getLogger(UsageTrackingService.class);

    private final MongoTemplate mongoTemplate;
    private final UserRepository userRepository;
    private final ConfigUpdater configUpdater;
    private final Clock clock;

    public UsageTrackingService(
            MongoTemplate mongoTemplate,
            UserRepository userRepository,
            ConfigUpdater configUpdater,
            Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.userRepository = userRepository;
        this.configUpdater = configUpdater;
        this.clock = clock;
    }

    // ========== 即時累加 ==========

    /**
     * 記錄一次使用，原子累加累計與各週期用量。
     *
     * @param userId 用戶 ID
     * @param at 使用時間
     */
    public void recordUsage(String userId, Instant at) {
        Query query = Query.query(Criteria.where("_id").is(userId));
        Update update = new Update()
            .inc(EligibilityFilter.TRACKING_FIELD, 1L)
            .inc(ResetKind.DAILY.usageField(), 1L)
            .inc(ResetKind.WEEKLY.usageField(), 1L)
            .inc(ResetKind.MONTHLY.usageField(), 1L)
            .set("lastActiveAt", at)
            .setOnInsert("createdAt", at)
            .setOnInsert("isPro", false)
            .setOnInsert("isAdmin", false);

        mongoTemplate.upsert(query, update, User.class);
        log.debug("Usage recorded: userId={}, at={}", userId, at);
    }

    // ========== 配額檢查 ==========

    public QuotaCheckResult checkQuota(String userId) {
        return checkQuota(userId, clock.instant());
    }

    /**
     * 檢查用戶是否仍有配額。
     *
     * @param userId 用戶 ID
     * @param now 檢查時間，用於計算下次重置時間
     * @return 檢查結果；檢查本身失敗時放行
     */
    public QuotaCheckResult checkQuota(String userId, Instant now) {
        try {
            User user = userRepository.findById(userId).orElseGet(() -> User.untracked(userId));
            QuotaLimits config = configUpdater.currentLimits();
            String tier = user.tier();
            long total = user.usageCount() != null ? user.usageCount() : 0L;

            TierLimit limit = configUpdater.tierLimit(config, tier);
            if (user.isAdmin() || limit.isUnlimited()) {
                return QuotaCheckResult.unlimited(tier, total);
            }

            if (!user.isPro()) {
                int anonymousLimit = configUpdater.resolveAnonymousLimit(config);
                if (total >= anonymousLimit) {
                    log.info("Quota exceeded: userId={}, tier={}, usage={}/{}", userId, tier, total, anonymousLimit);
                    return QuotaCheckResult.denied("anonymous_limit_exceeded", tier, total, anonymousLimit, null);
                }
                return QuotaCheckResult.allowed(tier, total, anonymousLimit);
            }

            for (ResetKind kind : ResetKind.values()) {
                int periodLimit = limit.limitFor(kind);
                long periodUsage = user.usageFor(kind);
                if (periodLimit > 0 && periodUsage >= periodLimit) {
                    log.info("Quota exceeded: userId={}, tier={}, {} usage={}/{}",
                        userId, tier, kind.value(), periodUsage, periodLimit);
                    return QuotaCheckResult.denied(kind.value() + "_limit_exceeded", tier,
                        periodUsage, periodLimit, kind.nextResetAfter(now));
                }
            }
            return QuotaCheckResult.allowed(tier, user.dailyUsage(), limit.dailyLimit());
        } catch (Exception e) {
            log.error("Error checking quota for userId={}, allowing request: {}", userId, e.getMessage(), e);
            return new QuotaCheckResult(true, "check_failed", null, 0, -1, null, null);
        }
    }

    // ========== 摘要 ==========

    /**
     * 統計全體用量摘要。
     *
     * @return 用量摘要
     */
    public UsageSummaryResponse usageSummary() {
        long totalUsers = userRepository.count();
        long trackedUsers = userRepository.countTracked();
        long proUsers = userRepository.countPro();

        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.group().sum(EligibilityFilter.TRACKING_FIELD).as("totalUsage")
        );
        AggregationResults<Document> results = mongoTemplate.aggregate(aggregation, User.class, Document.class);
        Document total = results.getUniqueMappedResult();
        long totalUsage = total != null && total.get("totalUsage") instanceof Number n ? n.longValue() : 0L;

        long average = totalUsers > 0 ? Math.round((double) totalUsage / totalUsers) : 0L;
        log.debug("Usage summary: users={}, tracked={}, pro={}, totalUsage={}",
            totalUsers, trackedUsers, proUsers, totalUsage);

        return new UsageSummaryResponse(
            totalUsers,
            trackedUsers,
            proUsers,
            totalUsers - proUsers,
            totalUsage,
            average,
            clock.instant()
        );
    }

    /**
     * 依累計用量降序列出用戶（監控用）。
     *
     * @param limit 筆數
     * @return 用戶用量列表
     */
    public List<UserUsageResponse> topUsers(int limit) {
        return userRepository.findTopByUsage(PageRequest.of(0, limit)).stream()
            .map(UserUsageResponse::from)
            .toList();
    }
}
