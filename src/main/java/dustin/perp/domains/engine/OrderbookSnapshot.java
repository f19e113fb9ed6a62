package dustin.perp.domains.engine;

import java.math.BigDecimal;
import java.util.List;

/**
 * 오더북 스냅샷 (가격 레벨별 집계)
 * Orderbook Snapshot
 * 
 * - bids: 높은 가격부터 (최선 매수호가 먼저)
 * - asks: 낮은 가격부터 (최선 매도호가 먼저)
 * - amount: 해당 가격에 대기 중인 주문 잔량 합계
 * 
 * 조회 시점에 계산되며 저장되지 않습니다.
 */
public final class OrderbookSnapshot {

    private final String symbol;
    private final List<PriceAmount> bids;
    private final List<PriceAmount> asks;
    private final BigDecimal lastPrice;
    private final long timestamp;

    public OrderbookSnapshot(String symbol, List<PriceAmount> bids, List<PriceAmount> asks,
                             BigDecimal lastPrice, long timestamp) {
        this.symbol = symbol;
        this.bids = List.copyOf(bids);
        this.asks = List.copyOf(asks);
        this.lastPrice = lastPrice;
        this.timestamp = timestamp;
    }

    public String getSymbol() {
        return symbol;
    }

    public List<PriceAmount> getBids() {
        return bids;
    }

    public List<PriceAmount> getAsks() {
        return asks;
    }

    /**
     * @return 마지막 체결가, 체결 이력이 없으면 null
     */
    public BigDecimal getLastPrice() {
        return lastPrice;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * 스냅샷을 변경 브로드캐스트용 이벤트로 변환
     */
    public OrderbookUpdate toUpdate() {
        return new OrderbookUpdate(symbol, bids, asks, timestamp);
    }

    /**
     * 가격-수량 쌍
     * Price and aggregated amount of one level
     */
    public static class PriceAmount {
        private final BigDecimal price;
        private final BigDecimal amount;

        public PriceAmount(BigDecimal price, BigDecimal amount) {
            this.price = price;
            this.amount = amount;
        }

        public BigDecimal getPrice() {
            return price;
        }

        public BigDecimal getAmount() {
            return amount;
        }

        @Override
        public String toString() {
            return "[" + price.toPlainString() + ", " + amount.toPlainString() + "]";
        }
    }
}
