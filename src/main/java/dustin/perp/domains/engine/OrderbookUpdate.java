package dustin.perp.domains.engine;

import java.util.List;

import dustin.perp.domains.engine.OrderbookSnapshot.PriceAmount;

/**
 * 오더북 변경 이벤트
 * Orderbook Update
 * 
 * 오더북이 바뀔 때마다 (체결, 등록, 취소) 제한된 깊이의 스냅샷으로 브로드캐스트됩니다.
 */
public final class OrderbookUpdate {

    private final String symbol;
    private final List<PriceAmount> bids;
    private final List<PriceAmount> asks;
    private final long timestamp;

    public OrderbookUpdate(String symbol, List<PriceAmount> bids, List<PriceAmount> asks, long timestamp) {
        this.symbol = symbol;
        this.bids = bids;
        this.asks = asks;
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

    public long getTimestamp() {
        return timestamp;
    }
}
