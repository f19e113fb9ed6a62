package dustin.perp.domains.engine;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 매칭 엔진 통계
 * Engine Stats
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class EngineStats {

    private final int symbolCount;

    /**
     * 전체 오더북의 대기 주문 수
     */
    private final long totalOrders;

    /**
     * 엔진 시작 후 누적 체결 수
     */
    private final long totalTrades;

    /**
     * 심볼별 대기 주문 수
     */
    private final Map<String, Long> ordersBySymbol;

    private final int tradeSubscribers;
    private final int orderbookSubscribers;
}
