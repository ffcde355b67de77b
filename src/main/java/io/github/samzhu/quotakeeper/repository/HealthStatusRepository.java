package io.github.samzhu.quotakeeper.repository;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.quotakeeper.document.HealthStatus;

/**
 * 最新健康狀態資料存取介面（單一文件 {@code latest}）。
 */
public interface HealthStatusRepository extends MongoRepository<HealthStatus, String> {
}
