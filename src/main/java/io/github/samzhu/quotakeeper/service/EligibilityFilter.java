package io.github.samzhu.quotakeeper.service;

import java.util.Collection;
import java.util.List;

import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Component;

import io.github.samzhu.quotakeeper.document.User;

/**
 * 重置資格過濾器，決定哪些用戶參與一次重置。
 *
 * <p>只有 {@code usageCount} 欄位存在的用戶才是已啟用追蹤的帳號；
 * 缺少此欄位的文件若被重置，會在尚未預期出現用量欄位的帳號上寫入欄位。
 *
 * <p>明確存為 {@code null} 的 {@code usageCount} 與缺少欄位一樣視為未啟用追蹤：
 * 對應到 {@link User} 後兩者無法區分，因此查詢條件、快照過濾與批次寫入條件
 * 一律使用「存在且不為 null」。
 *
 * <p>提供兩種形式：
 * <ul>
 *   <li>{@link #criteria()} - 伺服器端查詢條件，分頁掃描時使用</li>
 *   <li>{@link #filter(Collection)} - 對已取得的快照做同樣判斷</li>
 * </ul>
 */
@Component
public class EligibilityFilter {

    static final String TRACKING_FIELD = "usageCount";

    /**
     * 資格查詢條件：{@code usageCount} 存在且不為 null。
     *
     * @return MongoDB 查詢條件
     */
    public Criteria criteria() {
        return trackedCriteria(Criteria.where(TRACKING_FIELD));
    }

    /**
     * 在指定條件上附加追蹤欄位條件，供單一文件的寫入條件使用。
     *
     * @param criteria 以 {@link #TRACKING_FIELD} 開頭的條件
     * @return 附加後的條件
     */
    static Criteria trackedCriteria(Criteria criteria) {
        return criteria.exists(true).ne(null);
    }

    /**
     * 判斷單一用戶是否符合重置資格。
     *
     * @param user 用戶文件
     * @return true 表示參與重置
     */
    public boolean isEligible(User user) {
        return user != null && user.isTracked();
    }

    /**
     * 從快照中挑出符合資格的用戶。空集合回傳空清單。
     *
     * @param snapshot 用戶快照（完整集合或其中一頁）
     * @return 符合資格的用戶，保持原順序
     */
    public List<User> filter(Collection<User> snapshot) {
        return snapshot.stream()
            .filter(this::isEligible)
            .toList();
    }
}
