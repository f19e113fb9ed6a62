// =====================================================
// MatchResult - 주문 1건의 매칭 결과
// =====================================================
// 역할: submitOrder 가 호출자에게 돌려주는 결과입니다.
// 반환 후에는 호출자가 소유하며 엔진은 참조를 보관하지 않습니다.
//
// 필드:
// - orderId: 주문 ID
// - status: 최종 주문 상태
// - filledAmount: 누적 체결 수량
// - remainingAmount: 미체결 수량 (시장가는 폐기된 수량)
// - averagePrice: 거래량 가중 평균 체결가 (체결 없으면 null)
// - trades: 생성된 체결 목록 (체결 순서)
// =====================================================

package dustin.perp.domains.engine;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 매칭 결과
 * Match Result
 */
public final class MatchResult {

    private final UUID orderId;
    private final OrderStatus status;
    private final BigDecimal filledAmount;
    private final BigDecimal remainingAmount;
    private final BigDecimal averagePrice;
    private final List<TradeExecution> trades;

    public MatchResult(UUID orderId, OrderStatus status, BigDecimal filledAmount, BigDecimal remainingAmount,
                       BigDecimal averagePrice, List<TradeExecution> trades) {
        this.orderId = orderId;
        this.status = status;
        this.filledAmount = filledAmount;
        this.remainingAmount = remainingAmount;
        this.averagePrice = averagePrice;
        this.trades = Collections.unmodifiableList(trades);
    }

    public UUID getOrderId() {
        return orderId;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public BigDecimal getFilledAmount() {
        return filledAmount;
    }

    public BigDecimal getRemainingAmount() {
        return remainingAmount;
    }

    /**
     * @return 평균 체결가, 체결이 없으면 null
     */
    public BigDecimal getAveragePrice() {
        return averagePrice;
    }

    public List<TradeExecution> getTrades() {
        return trades;
    }

    public boolean hasTrades() {
        return !trades.isEmpty();
    }

    @Override
    public String toString() {
        return "MatchResult{orderId=" + orderId + ", status=" + status + ", filled=" + filledAmount
                + ", remaining=" + remainingAmount + ", avgPrice=" + averagePrice + ", trades=" + trades.size() + "}";
    }
}
