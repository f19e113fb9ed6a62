package dustin.perp.domains.referral.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import org.hibernate.annotations.CreationTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 레퍼럴 코드 엔티티
 * Referral Code Entity
 * 
 * 주소당 하나의 코드. commissionRate 는 피추천인 수수료 중 추천인 몫 (기본 0.10 = 10%).
 */
@Entity
@Table(name = "referral_codes")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferralCode {

    public static final BigDecimal DEFAULT_COMMISSION_RATE = new BigDecimal("0.10");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_address", nullable = false, unique = true, length = 42)
    private String ownerAddress;

    @Column(name = "code", nullable = false, unique = true, length = 20)
    private String code;

    @Column(name = "commission_rate", nullable = false, precision = 5, scale = 4)
    @Builder.Default
    private BigDecimal commissionRate = DEFAULT_COMMISSION_RATE;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
