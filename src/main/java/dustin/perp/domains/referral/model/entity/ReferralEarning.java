package dustin.perp.domains.referral.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

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
 * 레퍼럴 수익 엔티티
 * Referral Earning Entity
 * 
 * 피추천인의 체결 한 건당 한 행.
 * - eventType: 'trade'
 * - volume: 체결 금액 (가격 × 수량)
 * - commission: 피추천인 수수료 × 추천인 커미션 비율
 * - status: 'pending' → 'claimed'
 */
@Entity
@Table(name = "referral_earnings",
       indexes = {
           @Index(name = "idx_referral_earnings_referrer", columnList = "referrer_address"),
           @Index(name = "idx_referral_earnings_trade", columnList = "trade_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferralEarning {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "referrer_address", nullable = false, length = 42)
    private String referrerAddress;

    @Column(name = "referee_address", nullable = false, length = 42)
    private String refereeAddress;

    @Column(name = "trade_id")
    private UUID tradeId;

    @Column(name = "event_type", nullable = false, length = 20)
    private String eventType;

    @Column(name = "volume", nullable = false, precision = 36, scale = 18)
    private BigDecimal volume;

    @Column(name = "commission", nullable = false, precision = 36, scale = 18)
    private BigDecimal commission;

    @Column(name = "token", nullable = false, length = 10)
    private String token;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "claimed_at")
    private LocalDateTime claimedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
