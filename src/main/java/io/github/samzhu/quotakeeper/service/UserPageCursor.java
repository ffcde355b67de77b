package io.github.samzhu.quotakeeper.service;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import io.github.samzhu.quotakeeper.document.User;

/**
 * 以 {@code _id} keyset 分頁逐頁讀取符合條件的用戶。
 *
 * <p>不一次載入整個集合；每頁以 {@code _id > lastSeenId} 遞增查詢，
 * 可從任一 {@link #lastSeenId()} 重新開始。回傳的頁面未必全部符合資格，
 * 呼叫端仍需以 {@link EligibilityFilter#filter} 過濾。
 *
 * <p>此類別非執行緒安全，每次重置建立一個新的 cursor。
 */
public class UserPageCursor implements Iterator<List<User>> {

    private final MongoTemplate mongoTemplate;
    private final Criteria criteria;
    private final int pageSize;

    private String lastSeenId;
    private List<User> nextPage;
    private boolean exhausted;

    public UserPageCursor(MongoTemplate mongoTemplate, Criteria criteria, int pageSize) {
        this(mongoTemplate, criteria, pageSize, null);
    }

    /**
     * @param mongoTemplate MongoDB 操作
     * @param criteria 伺服器端過濾條件
     * @param pageSize 每頁筆數
     * @param startAfterId 從此 ID 之後開始，null 表示從頭開始
     */
    public UserPageCursor(MongoTemplate mongoTemplate, Criteria criteria, int pageSize, String startAfterId) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.mongoTemplate = mongoTemplate;
        this.criteria = criteria;
        this.pageSize = pageSize;
        this.lastSeenId = startAfterId;
    }

    @Override
    public boolean hasNext() {
        if (nextPage != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        List<User> page = mongoTemplate.find(buildQuery(), User.class);
        if (page.isEmpty()) {
            exhausted = true;
            return false;
        }
        // 不足一頁代表已到最後，不再多查一次
        if (page.size() < pageSize) {
            exhausted = true;
        }
        lastSeenId = page.get(page.size() - 1).id();
        nextPage = page;
        return true;
    }

    @Override
    public List<User> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more user pages after id " + lastSeenId);
        }
        List<User> page = nextPage;
        nextPage = null;
        return page;
    }

    /**
     * 最後一個已讀取的用戶 ID，可用於建立新的 cursor 繼續掃描。
     */
    public String lastSeenId() {
        return lastSeenId;
    }

    private Query buildQuery() {
        Query query = new Query(criteria)
            .with(Sort.by(Sort.Direction.ASC, "_id"))
            .limit(pageSize);
        if (lastSeenId != null) {
            query.addCriteria(Criteria.where("_id").gt(lastSeenId));
        }
        return query;
    }
}
