package io.github.samzhu.quotakeeper.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import io.github.samzhu.quotakeeper.document.User;

/**
 * 用戶用量資料存取介面。
 *
 * <p>提供對 {@code users} 集合的查詢操作。寫入策略：
 * <ul>
 *   <li>用量累加透過 {@code MongoTemplate} upsert + {@code $inc} 原子操作</li>
 *   <li>週期重置透過 {@code MongoTemplate} bulk write 分批提交</li>
 * </ul>
 *
 * @see io.github.samzhu.quotakeeper.document.User
 */
public interface UserRepository extends MongoRepository<User, String> {

    /**
     * 統計已啟用追蹤（{@code usageCount} 存在）的用戶數。
     *
     * @return 已啟用追蹤的用戶數
     */
    @Query(value = "{ 'usageCount': { '$exists': true, '$ne': null } }", count = true)
    long countTracked();

    /**
     * 統計 Pro 方案用戶數。
     *
     * @return Pro 用戶數
     */
    @Query(value = "{ 'isPro': true }", count = true)
    long countPro();

    /**
     * 查詢累計用量排行（用於管理介面）。
     *
     * @param pageable 分頁參數
     * @return 依累計用量降序排列的用戶
     */
    @Query(value = "{ 'usageCount': { '$exists': true, '$ne': null } }", sort = "{ 'usageCount': -1 }")
    List<User> findTopByUsage(Pageable pageable);
}
