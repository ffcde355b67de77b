package io.github.samzhu.quotakeeper.service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import io.github.samzhu.quotakeeper.config.CacheConfig;
import io.github.samzhu.quotakeeper.config.QuotaKeeperProperties;
import io.github.samzhu.quotakeeper.config.QuotaKeeperProperties.LimitsConfig;
import io.github.samzhu.quotakeeper.document.QuotaLimits;
import io.github.samzhu.quotakeeper.document.QuotaLimits.TierLimit;
import io.github.samzhu.quotakeeper.document.ResetKind;
import io.github.samzhu.quotakeeper.dto.api.LimitsUpdateRequest;
import io.github.samzhu.quotakeeper.repository.QuotaLimitsRepository;

/**
 * 配額設定服務，{@code config/limits} 文件的唯一寫入者。
 *
 * <p>職責：
 * <ul>
 *   <li>讀取配額設定；文件不存在時使用 {@code quota-keeper.limits} 預設值，
 *       讀取失敗時只有配額檢查退回預設值，重置流程則直接失敗</li>
 *   <li>每日重置時還原匿名配額並記錄 {@code lastReset}</li>
 *   <li>管理員更新配額上限</li>
 * </ul>
 *
 * <p>MongoDB bulk write 以單一集合為單位，因此設定更新在用戶批次全部提交後，
 * 以單一文件 upsert 立即執行。此步驟失敗時，已提交的用戶重置不會回滾。
 */
@Service
public class ConfigUpdater {

    private static final Logger log = LoggerFactory.getLogger(ConfigUpdater.class);

    private final QuotaLimitsRepository quotaLimitsRepository;
    private final MongoTemplate mongoTemplate;
    private final LimitsConfig defaults;
    private final Clock clock;

    public ConfigUpdater(
            QuotaLimitsRepository quotaLimitsRepository,
            MongoTemplate mongoTemplate,
            QuotaKeeperProperties properties,
            Clock clock) {
        this.quotaLimitsRepository = quotaLimitsRepository;
        this.mongoTemplate = mongoTemplate;
        this.defaults = properties.limits();
        this.clock = clock;
    }

    /**
     * 讀取配額設定（不經快取，重置開始時呼叫一次）。
     *
     * <p>讀取失敗時直接拋出，不以預設值覆寫管理員設定的匿名配額。
     *
     * @return 配額設定；文件不存在時為預設值
     * @throws DataAccessException 資料庫無法讀取
     */
    public QuotaLimits readConfig() {
        return quotaLimitsRepository.findById(QuotaLimits.DOCUMENT_ID)
            .orElseGet(() -> {
                log.warn("Config document config/{} not found, using defaults", QuotaLimits.DOCUMENT_ID);
                return defaultConfig();
            });
    }

    /**
     * 讀取配額設定，供配額檢查與查詢 API 使用。
     *
     * @return 配額設定；文件不存在或讀取失敗時為預設值
     */
    public QuotaLimits loadConfig() {
        try {
            return readConfig();
        } catch (DataAccessException e) {
            log.error("Failed to read config/{}, using defaults: {}", QuotaLimits.DOCUMENT_ID, e.getMessage(), e);
            return defaultConfig();
        }
    }

    /**
     * 讀取配額設定（經 Caffeine 快取，供配額檢查使用）。
     *
     * @return 配額設定
     */
    @Cacheable(cacheNames = CacheConfig.LIMITS_CACHE, key = "'limits'")
    public QuotaLimits currentLimits() {
        log.debug("Loading limits config into cache");
        return loadConfig();
    }

    /**
     * 套用每日重置的設定變更：還原匿名配額並記錄重置時間。
     *
     * @param config 重置開始時讀取的設定
     * @param now 重置時間
     * @return 還原後的匿名配額
     */
    @CacheEvict(cacheNames = CacheConfig.LIMITS_CACHE, allEntries = true)
    public int applyDailyReset(QuotaLimits config, Instant now) {
        int anonymousLimit = resolveAnonymousLimit(config);

        Query query = Query.query(Criteria.where("_id").is(QuotaLimits.DOCUMENT_ID));
        Update update = new Update()
            .set("anonymousLimit", anonymousLimit)
            .set("lastReset", now)
            .set("resetType", ResetKind.DAILY.value())
            .setOnInsert("resetHour", config.resetHour());
        mongoTemplate.upsert(query, update, QuotaLimits.class);

        log.info("Config updated: anonymousLimit reset to {}", anonymousLimit);
        return anonymousLimit;
    }

    /**
     * 管理員更新配額設定，只修改請求中提供的欄位。
     *
     * @param request 更新請求
     * @return 更新後的設定
     */
    @CacheEvict(cacheNames = CacheConfig.LIMITS_CACHE, allEntries = true)
    public QuotaLimits updateLimits(LimitsUpdateRequest request) {
        Instant now = clock.instant();
        Update update = new Update().set("lastUpdated", now);
        if (request.anonymousLimit() != null) {
            update.set("anonymousLimit", request.anonymousLimit());
        }
        if (request.resetHour() != null) {
            update.set("resetHour", request.resetHour());
        }
        if (request.tiers() != null) {
            request.tiers().forEach((tier, limits) -> update.set("tiers." + tier,
                new TierLimit(limits.dailyLimit(), limits.weeklyLimit(), limits.monthlyLimit())));
        }

        mongoTemplate.upsert(Query.query(Criteria.where("_id").is(QuotaLimits.DOCUMENT_ID)), update, QuotaLimits.class);
        log.info("Limits config updated: anonymousLimit={}, resetHour={}, tiers={}",
            request.anonymousLimit(), request.resetHour(),
            request.tiers() != null ? request.tiers().keySet() : null);
        return loadConfig();
    }

    /**
     * 取得每日重置時要還原的匿名配額：設定文件中的正值優先，否則使用預設值。
     */
    public int resolveAnonymousLimit(QuotaLimits config) {
        if (config != null && config.anonymousLimit() > 0) {
            return config.anonymousLimit();
        }
        return defaults.anonymousLimit();
    }

    /**
     * 取得指定方案的上限；設定文件缺少時退回 free，再退回預設值。
     *
     * @param config 配額設定
     * @param tier 方案名稱
     * @return 方案上限
     */
    public TierLimit tierLimit(QuotaLimits config, String tier) {
        Map<String, TierLimit> tiers = config.tiers() != null ? config.tiers() : Map.of();
        TierLimit limit = tiers.get(tier);
        if (limit == null) {
            limit = tiers.get("free");
        }
        if (limit == null) {
            QuotaKeeperProperties.TierLimits fallback = defaults.tiers().getOrDefault(tier, defaults.tiers().get("free"));
            limit = new TierLimit(fallback.dailyLimit(), fallback.weeklyLimit(), fallback.monthlyLimit());
        }
        return limit;
    }

    /**
     * 以 {@code quota-keeper.limits} 建立預設設定（不寫入資料庫）。
     */
    QuotaLimits defaultConfig() {
        Map<String, TierLimit> tiers = new LinkedHashMap<>();
        defaults.tiers().forEach((tier, limits) ->
            tiers.put(tier, new TierLimit(limits.dailyLimit(), limits.weeklyLimit(), limits.monthlyLimit())));
        return new QuotaLimits(
            QuotaLimits.DOCUMENT_ID,
            defaults.resetHour(),
            defaults.anonymousLimit(),
            null,
            null,
            tiers,
            null
        );
    }
}
