package dustin.perp.domains.referral.model.entity;

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
 * 사용자 엔티티 (레퍼럴 조회용)
 * User Account Entity
 * 
 * 주소는 소문자로 저장합니다.
 * referrerAddress 가 있으면 그 주소의 레퍼럴 코드 소유자가 추천인입니다.
 */
@Entity
@Table(name = "users")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 지갑 주소 (소문자)
     */
    @Column(name = "address", nullable = false, unique = true, length = 42)
    private String address;

    /**
     * 추천인 주소 (없으면 NULL)
     */
    @Column(name = "referrer_address", length = 42)
    private String referrerAddress;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
