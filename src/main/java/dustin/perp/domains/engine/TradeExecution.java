package dustin.perp.domains.engine;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * 체결 1건 (매칭 결과)
 * Trade Execution
 * 
 * 매칭 단계마다 정확히 한 번 생성되며 이후 변경되지 않습니다.
 * 체결 가격은 항상 메이커(기존 주문)의 가격입니다.
 */
public final class TradeExecution {

    private final UUID tradeId;
    private final UUID makerOrderId;
    private final UUID takerOrderId;
    private final String makerAddress;
    private final BigDecimal price;
    private final BigDecimal amount;
    private final BigDecimal makerFee;
    private final BigDecimal takerFee;
    private final long timestamp;

    public TradeExecution(UUID tradeId, UUID makerOrderId, UUID takerOrderId, String makerAddress,
                          BigDecimal price, BigDecimal amount, BigDecimal makerFee, BigDecimal takerFee,
                          long timestamp) {
        this.tradeId = tradeId;
        this.makerOrderId = makerOrderId;
        this.takerOrderId = takerOrderId;
        this.makerAddress = makerAddress;
        this.price = price;
        this.amount = amount;
        this.makerFee = makerFee;
        this.takerFee = takerFee;
        this.timestamp = timestamp;
    }

    public UUID getTradeId() {
        return tradeId;
    }

    public UUID getMakerOrderId() {
        return makerOrderId;
    }

    public UUID getTakerOrderId() {
        return takerOrderId;
    }

    public String getMakerAddress() {
        return makerAddress;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public BigDecimal getMakerFee() {
        return makerFee;
    }

    public BigDecimal getTakerFee() {
        return takerFee;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * 체결 금액 (price * amount)
     */
    public BigDecimal getTradeValue() {
        return price.multiply(amount);
    }

    /**
     * 이벤트 변환
     * 
     * @param symbol 심볼
     * @param takerAddress 테이커 주소
     * @param takerSide 테이커 방향 (이벤트의 side)
     */
    public TradeEvent toEvent(String symbol, String takerAddress, Side takerSide) {
        return TradeEvent.builder()
                .symbol(symbol)
                .tradeId(tradeId)
                .makerOrderId(makerOrderId)
                .takerOrderId(takerOrderId)
                .makerAddress(makerAddress)
                .takerAddress(takerAddress)
                .side(takerSide.getValue())
                .price(price)
                .amount(amount)
                .makerFee(makerFee)
                .takerFee(takerFee)
                .timestamp(timestamp)
                .build();
    }
}
