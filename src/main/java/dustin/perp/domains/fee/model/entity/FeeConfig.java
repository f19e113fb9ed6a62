package dustin.perp.domains.fee.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수수료 설정 엔티티
 * Fee Config Entity
 * 
 * 역할:
 * - 심볼별 메이커/테이커 수수료율 관리
 * - symbol 이 NULL 이면 모든 심볼의 기본값
 * - 서버 시작 시 메모리에 로드되어 매칭 경로에서 사용
 */
@Entity
@Table(name = "fee_configs",
       indexes = {
           @Index(name = "idx_fee_configs_symbol", columnList = "symbol,is_active"),
           @Index(name = "idx_fee_configs_active", columnList = "is_active")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 심볼 (NULL 이면 기본 설정)
     */
    @Column(name = "symbol", length = 50)
    private String symbol;

    /**
     * 메이커 수수료율 (예: 0.0002 = 0.02%)
     */
    @Column(name = "maker_fee_rate", nullable = false, precision = 10, scale = 6)
    private BigDecimal makerFeeRate;

    /**
     * 테이커 수수료율 (예: 0.0005 = 0.05%)
     */
    @Column(name = "taker_fee_rate", nullable = false, precision = 10, scale = 6)
    private BigDecimal takerFeeRate;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
