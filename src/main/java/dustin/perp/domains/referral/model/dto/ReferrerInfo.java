package dustin.perp.domains.referral.model.dto;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 추천인 정보 (추천인 주소 + 커미션 비율)
 */
@Getter
@ToString
@AllArgsConstructor
public class ReferrerInfo {
    private final String referrerAddress;
    private final BigDecimal commissionRate;
}
