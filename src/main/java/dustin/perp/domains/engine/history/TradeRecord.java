package dustin.perp.domains.engine.history;

import java.math.BigDecimal;
import java.util.UUID;

import dustin.perp.domains.engine.TradeEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 체결 내역 레코드 (메모리 보관용)
 * Trade Record
 */
@Getter
@Builder
@AllArgsConstructor
public class TradeRecord {

    private final UUID tradeId;
    private final String symbol;
    private final String side;
    private final BigDecimal price;
    private final BigDecimal amount;
    private final UUID makerOrderId;
    private final UUID takerOrderId;
    private final String makerAddress;
    private final String takerAddress;
    private final BigDecimal makerFee;
    private final BigDecimal takerFee;
    private final long timestamp;

    public static TradeRecord from(TradeEvent event) {
        return TradeRecord.builder()
                .tradeId(event.getTradeId())
                .symbol(event.getSymbol())
                .side(event.getSide())
                .price(event.getPrice())
                .amount(event.getAmount())
                .makerOrderId(event.getMakerOrderId())
                .takerOrderId(event.getTakerOrderId())
                .makerAddress(event.getMakerAddress())
                .takerAddress(event.getTakerAddress())
                .makerFee(event.getMakerFee())
                .takerFee(event.getTakerFee())
                .timestamp(event.getTimestamp())
                .build();
    }
}
