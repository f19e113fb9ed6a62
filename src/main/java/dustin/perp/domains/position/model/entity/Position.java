package dustin.perp.domains.position.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 포지션 엔티티
 * Position Entity
 * 
 * 역할:
 * - 사용자별 / 심볼별 무기한 선물 포지션
 * - 체결이 저장될 때마다 메이커, 테이커 양쪽 포지션이 늘어남
 * 
 * 계산 예시:
 * - 담보 100 USDT, 레버리지 10 → sizeInUsd 1000
 * - 같은 방향으로 추가 진입 시 진입가는 규모 가중 평균
 * 
 * 청산가 / 펀딩비는 이 서비스에서 계산하지 않습니다.
 */
@Entity
@Table(name = "positions",
       indexes = {
           @Index(name = "idx_positions_user_symbol", columnList = "user_address, symbol"),
           @Index(name = "idx_positions_status", columnList = "status")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_address", nullable = false, length = 42)
    private String userAddress;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    /**
     * 'long' / 'short'
     */
    @Column(name = "side", nullable = false, length = 10)
    private String side;

    /**
     * 포지션 규모 (USD 기준 명목 가치)
     */
    @Column(name = "size_in_usd", nullable = false, precision = 36, scale = 18)
    private BigDecimal sizeInUsd;

    /**
     * 담보 (증거금)
     */
    @Column(name = "collateral", nullable = false, precision = 36, scale = 18)
    private BigDecimal collateral;

    /**
     * 평균 진입가
     */
    @Column(name = "entry_price", nullable = false, precision = 36, scale = 18)
    private BigDecimal entryPrice;

    /**
     * 유효 레버리지 (sizeInUsd / collateral)
     */
    @Column(name = "leverage", nullable = false, precision = 10, scale = 4)
    private BigDecimal leverage;

    /**
     * 'open' / 'closed'
     */
    @Column(name = "status", nullable = false, length = 10)
    @Builder.Default
    private String status = "open";

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public PositionSide getPositionSide() {
        return PositionSide.fromValue(side);
    }
}
