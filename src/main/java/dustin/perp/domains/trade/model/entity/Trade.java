package dustin.perp.domains.trade.model.entity;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.UUID;

import dustin.perp.domains.engine.TradeEvent;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 내역 엔티티
 * Trade Entity
 * 
 * 역할:
 * - 매칭 엔진이 브로드캐스트한 체결 이벤트를 DB에 저장
 * - 체결 ID 는 엔진이 발급한 UUID (같은 체결은 한 번만 저장)
 * 
 * side 는 테이커 기준 방향입니다 ('buy' 면 테이커가 매수, 메이커가 매도).
 */
@Entity
@Table(name = "trades",
       indexes = {
           @Index(name = "idx_trades_symbol", columnList = "symbol"),
           @Index(name = "idx_trades_maker", columnList = "maker_address"),
           @Index(name = "idx_trades_taker", columnList = "taker_address")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    /**
     * 체결 고유 ID (엔진 발급)
     */
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "maker_order_id", nullable = false)
    private UUID makerOrderId;

    @Column(name = "taker_order_id", nullable = false)
    private UUID takerOrderId;

    @Column(name = "maker_address", nullable = false, length = 42)
    private String makerAddress;

    @Column(name = "taker_address", nullable = false, length = 42)
    private String takerAddress;

    /**
     * 테이커 방향 ('buy' / 'sell')
     */
    @Column(name = "side", nullable = false, length = 10)
    private String side;

    /**
     * 체결 가격 (메이커 주문 가격)
     */
    @Column(name = "price", nullable = false, precision = 36, scale = 18)
    private BigDecimal price;

    @Column(name = "amount", nullable = false, precision = 36, scale = 18)
    private BigDecimal amount;

    @Column(name = "maker_fee", nullable = false, precision = 36, scale = 18)
    private BigDecimal makerFee;

    @Column(name = "taker_fee", nullable = false, precision = 36, scale = 18)
    private BigDecimal takerFee;

    /**
     * 체결 시각 (엔진 타임스탬프)
     */
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 체결 이벤트 → 엔티티
     * 수수료는 저장 시점의 수수료 설정으로 다시 계산한 값을 넘겨받습니다.
     */
    public static Trade from(TradeEvent event, BigDecimal makerFee, BigDecimal takerFee) {
        return Trade.builder()
                .id(event.getTradeId())
                .symbol(event.getSymbol())
                .makerOrderId(event.getMakerOrderId())
                .takerOrderId(event.getTakerOrderId())
                .makerAddress(event.getMakerAddress())
                .takerAddress(event.getTakerAddress())
                .side(event.getSide())
                .price(event.getPrice())
                .amount(event.getAmount())
                .makerFee(makerFee)
                .takerFee(takerFee)
                .createdAt(toLocalDateTime(event.getTimestamp()))
                .build();
    }

    public static LocalDateTime toLocalDateTime(long epochMillis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneId.systemDefault());
    }
}
