package dustin.perp.domains.order.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

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
 * 주문 엔티티
 * Order Entity
 * 
 * 역할:
 * - 매칭 엔진이 처리한 주문 결과를 비동기로 저장
 * - 서버 재시작 시 미체결 지정가 주문 복구의 원본
 * 
 * 주문 방향 / 방식:
 * - side: 'buy' 또는 'sell'
 * - orderType: 'limit' 또는 'market'
 * 
 * 주문 상태:
 * - 'pending', 'open', 'partially_filled', 'filled', 'cancelled', 'rejected'
 * 
 * ID 는 매칭 엔진(오케스트레이터)이 발급한 UUID 를 그대로 사용합니다.
 */
@Entity
@Table(name = "orders",
       indexes = {
           @Index(name = "idx_orders_user", columnList = "user_address"),
           @Index(name = "idx_orders_symbol", columnList = "symbol"),
           @Index(name = "idx_orders_status", columnList = "status")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    /**
     * 주문 고유 ID (엔진 발급 UUID)
     */
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    /**
     * 주문자 지갑 주소
     */
    @Column(name = "user_address", nullable = false, length = 42)
    private String userAddress;

    /**
     * 심볼 (예: BTCUSDT)
     */
    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    /**
     * 'buy' / 'sell'
     */
    @Column(name = "side", nullable = false, length = 10)
    private String side;

    /**
     * 'limit' / 'market'
     */
    @Column(name = "order_type", nullable = false, length = 10)
    private String orderType;

    /**
     * 지정가 (시장가는 NULL)
     */
    @Column(name = "price", precision = 36, scale = 18)
    private BigDecimal price;

    /**
     * 주문 수량
     */
    @Column(name = "amount", nullable = false, precision = 36, scale = 18)
    private BigDecimal amount;

    /**
     * 체결 수량
     * filledAmount == amount 면 전량 체결
     */
    @Column(name = "filled_amount", nullable = false, precision = 36, scale = 18)
    @Builder.Default
    private BigDecimal filledAmount = BigDecimal.ZERO;

    /**
     * 레버리지 (1 ~ matching.max-leverage)
     */
    @Column(name = "leverage", nullable = false)
    @Builder.Default
    private Integer leverage = 1;

    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private String status = "pending";

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 미체결 수량 (amount - filledAmount)
     */
    public BigDecimal getRemainingAmount() {
        return amount.subtract(filledAmount);
    }
}
