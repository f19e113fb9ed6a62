package dustin.perp.domains.referral.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.perp.domains.referral.model.entity.ReferralEarning;

/**
 * 레퍼럴 수익 리포지토리
 * Referral Earning Repository
 */
@Repository
public interface ReferralEarningRepository extends JpaRepository<ReferralEarning, UUID> {

    List<ReferralEarning> findByTradeId(UUID tradeId);
}
