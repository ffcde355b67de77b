package io.github.samzhu.quotakeeper.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quotakeeper.document.QuotaLimits;

/**
 * 配額設定資料存取介面（單一文件 {@code limits}）。
 *
 * <p>讀取使用 Repository，寫入由 {@link io.github.samzhu.quotakeeper.service.ConfigUpdater}
 * 透過 {@code MongoTemplate} upsert 完成，只更新指定欄位。
 */
public interface QuotaLimitsRepository extends MongoRepository<QuotaLimits, String> {
}
