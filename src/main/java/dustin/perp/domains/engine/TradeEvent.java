package dustin.perp.domains.engine;

import java.math.BigDecimal;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 체결 이벤트
 * Trade Event
 * 
 * 역할:
 * - 매칭 엔진이 체결 순서대로 브로드캐스트
 * - 영속화 워커, Kafka 중계 등 하위 구독자가 소비
 * 
 * side 는 테이커 방향 ("buy" / "sell") 입니다.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class TradeEvent {

    private final String symbol;
    private final UUID tradeId;
    private final UUID makerOrderId;
    private final UUID takerOrderId;
    private final String makerAddress;
    private final String takerAddress;
    private final String side;
    private final BigDecimal price;
    private final BigDecimal amount;
    private final BigDecimal makerFee;
    private final BigDecimal takerFee;

    /**
     * 체결 시각 (epoch millis)
     */
    private final long timestamp;

    public BigDecimal getTradeValue() {
        return price.multiply(amount);
    }
}
