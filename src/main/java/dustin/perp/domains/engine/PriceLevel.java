// =====================================================
// PriceLevel - 고정소수점 가격 키
// =====================================================
// 역할: BigDecimal 가격을 정렬/해시 가능한 정수 키로 변환합니다.
//
// 핵심 설계:
// 1. price × 10^8 을 0 방향으로 절사하여 long 으로 저장
// 2. 가격 비교는 항상 정수 비교 (부동소수점 없음)
// 3. toDecimal() 은 소수점 8자리 이내 가격에 대해 정확한 역변환
//
// 범위:
// - Long.MAX_VALUE / 10^8 ≈ 92,233,720,368 (약 922억)
// - 이를 넘는 가격은 ArithmeticException (엔진에서 INVALID_PRICE 로 변환)
// =====================================================

package dustin.perp.domains.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 가격 레벨 (고정소수점 키)
 * Price Level
 * 
 * 예시:
 * <pre>
 * PriceLevel level = PriceLevel.fromDecimal(new BigDecimal("97500.50"));
 * level.getRaw();      // 9750050000000
 * level.toDecimal();   // 97500.50000000
 * </pre>
 */
public final class PriceLevel implements Comparable<PriceLevel> {

    /**
     * 소수점 자리수 (10^-8 해상도)
     */
    public static final int SCALE = 8;

    private final long raw;

    private PriceLevel(long raw) {
        this.raw = raw;
    }

    /**
     * 가격을 가격 레벨로 변환 (소수점 8자리 초과분은 절사)
     * 
     * @param price 가격
     * @return 가격 레벨
     * @throws ArithmeticException long 범위를 넘는 가격
     */
    public static PriceLevel fromDecimal(BigDecimal price) {
        BigDecimal scaled = price.setScale(SCALE, RoundingMode.DOWN).movePointRight(SCALE);
        return new PriceLevel(scaled.longValueExact());
    }

    public static PriceLevel ofRaw(long raw) {
        return new PriceLevel(raw);
    }

    /**
     * 가격 레벨을 가격으로 복원
     * 
     * @return 소수점 8자리 스케일의 가격
     */
    public BigDecimal toDecimal() {
        return BigDecimal.valueOf(raw, SCALE);
    }

    public long getRaw() {
        return raw;
    }

    @Override
    public int compareTo(PriceLevel other) {
        return Long.compare(raw, other.raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceLevel)) {
            return false;
        }
        return raw == ((PriceLevel) o).raw;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(raw);
    }

    @Override
    public String toString() {
        return toDecimal().toPlainString();
    }
}
