package dustin.perp.domains.engine.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 내역 조회 조건
 * Trade History Query
 * 
 * - limit: 기본 50, 1 ~ 100 으로 보정
 * - before: 이 시각(epoch millis)보다 이전
 * - after: 이 시각보다 이후
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeHistoryQuery {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 100;

    private Integer limit;
    private Long before;
    private Long after;

    public int resolveLimit() {
        return clampLimit(limit);
    }

    public boolean matchesTime(long timestamp) {
        boolean matchesBefore = before == null || timestamp < before;
        boolean matchesAfter = after == null || timestamp > after;
        return matchesBefore && matchesAfter;
    }

    static int clampLimit(Integer limit) {
        int value = limit == null ? DEFAULT_LIMIT : limit;
        return Math.max(1, Math.min(MAX_LIMIT, value));
    }
}
