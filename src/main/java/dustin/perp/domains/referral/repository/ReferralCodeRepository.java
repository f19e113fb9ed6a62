package dustin.perp.domains.referral.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.perp.domains.referral.model.entity.ReferralCode;

/**
 * 레퍼럴 코드 리포지토리
 * Referral Code Repository
 */
@Repository
public interface ReferralCodeRepository extends JpaRepository<ReferralCode, Long> {
}
