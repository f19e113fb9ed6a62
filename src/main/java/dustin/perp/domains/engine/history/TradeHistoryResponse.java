package dustin.perp.domains.engine.history;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 체결 내역 조회 결과
 * totalCount 는 limit 적용 전 조건에 맞는 건수입니다.
 */
@Getter
@AllArgsConstructor
public class TradeHistoryResponse {

    private final List<TradeRecord> trades;
    private final int totalCount;
    private final boolean hasMore;
}
