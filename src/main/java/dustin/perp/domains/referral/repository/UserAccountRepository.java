package dustin.perp.domains.referral.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.perp.domains.referral.model.dto.ReferrerInfo;
import dustin.perp.domains.referral.model.entity.UserAccount;

/**
 * 사용자 리포지토리
 * User Account Repository
 */
@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    /**
     * 추천인 조회
     * users.referrer_address = referral_codes.owner_address
     *
     * @param address 피추천인 주소 (소문자)
     */
    @Query("SELECT new dustin.perp.domains.referral.model.dto.ReferrerInfo(rc.ownerAddress, rc.commissionRate) " +
           "FROM UserAccount u, ReferralCode rc " +
           "WHERE u.referrerAddress = rc.ownerAddress AND u.address = :address")
    Optional<ReferrerInfo> findReferrer(@Param("address") String address);
}
