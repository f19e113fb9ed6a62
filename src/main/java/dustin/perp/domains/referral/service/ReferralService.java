package dustin.perp.domains.referral.service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.perp.domains.referral.model.dto.ReferrerInfo;
import dustin.perp.domains.referral.model.entity.ReferralEarning;
import dustin.perp.domains.referral.repository.ReferralEarningRepository;
import dustin.perp.domains.referral.repository.UserAccountRepository;
import dustin.perp.domains.trade.model.entity.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 레퍼럴 서비스
 * Referral Service
 * 
 * 역할:
 * - 체결 참여자(메이커/테이커)에게 추천인이 있으면 커미션 적립
 * 
 * 커미션 = 참여자 수수료 × 추천인 코드의 커미션 비율
 * 호출자의 트랜잭션에 참여합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferralService {

    public static final String EVENT_TYPE_TRADE = "trade";
    public static final String COMMISSION_TOKEN = "USDT";
    public static final String STATUS_PENDING = "pending";

    private final UserAccountRepository userAccountRepository;
    private final ReferralEarningRepository referralEarningRepository;

    /**
     * 체결 커미션 적립
     * Record trade commission
     * 
     * @param refereeAddress 체결 참여자 주소 (대소문자 무관, 소문자로 조회/저장)
     * @param tradeId 체결 ID
     * @param volume 체결 금액
     * @param fee 참여자 수수료
     * @param tradeTimestamp 체결 시각 (epoch millis)
     * @return 적립된 수익 (추천인이 없으면 empty)
     */
    @Transactional
    public Optional<ReferralEarning> recordTradeCommission(String refereeAddress, UUID tradeId,
                                                           BigDecimal volume, BigDecimal fee,
                                                           long tradeTimestamp) {
        String referee = refereeAddress.toLowerCase(Locale.ROOT);
        Optional<ReferrerInfo> referrer = userAccountRepository.findReferrer(referee);
        if (referrer.isEmpty()) {
            return Optional.empty();
        }

        ReferrerInfo info = referrer.get();
        BigDecimal commission = fee.multiply(info.getCommissionRate());

        ReferralEarning earning = ReferralEarning.builder()
                .id(UUID.randomUUID())
                .referrerAddress(info.getReferrerAddress())
                .refereeAddress(referee)
                .tradeId(tradeId)
                .eventType(EVENT_TYPE_TRADE)
                .volume(volume)
                .commission(commission)
                .token(COMMISSION_TOKEN)
                .status(STATUS_PENDING)
                .createdAt(Trade.toLocalDateTime(tradeTimestamp))
                .build();
        ReferralEarning saved = referralEarningRepository.save(earning);

        log.debug("[ReferralService] 커미션 적립: referee={}, referrer={}, tradeId={}, commission={}",
                referee, info.getReferrerAddress(), tradeId, commission);
        return Optional.of(saved);
    }
}
