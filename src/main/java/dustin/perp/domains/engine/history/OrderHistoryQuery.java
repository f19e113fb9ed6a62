package dustin.perp.domains.engine.history;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 내역 조회 조건
 * Order History Query
 * 
 * - status: null 또는 "all" 이면 전체
 * - symbol: null 이면 전체
 * - limit / before / after: TradeHistoryQuery 와 동일
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderHistoryQuery {

    private String status;
    private String symbol;
    private Integer limit;
    private Long before;
    private Long after;

    public int resolveLimit() {
        return TradeHistoryQuery.clampLimit(limit);
    }

    public boolean matchesStatus(String orderStatus) {
        return status == null || "all".equals(status) || status.equals(orderStatus);
    }

    public boolean matchesSymbol(String orderSymbol) {
        return symbol == null || symbol.equals(orderSymbol);
    }

    public boolean matchesTime(long timestamp) {
        boolean matchesBefore = before == null || timestamp < before;
        boolean matchesAfter = after == null || timestamp > after;
        return matchesBefore && matchesAfter;
    }
}
