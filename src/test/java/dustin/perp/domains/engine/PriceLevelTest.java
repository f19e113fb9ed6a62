package dustin.perp.domains.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * 고정 소수점 가격 레벨 테스트
 */
class PriceLevelTest {

    @Test
    @DisplayName("소수점 8자리 이하 가격은 변환 후 그대로 복원된다")
    void roundTripWithinScale() {
        for (String value : new String[] {"100", "100.5", "0.00000001", "65432.12345678", "1"}) {
            BigDecimal price = new BigDecimal(value);
            assertThat(PriceLevel.fromDecimal(price).toDecimal()).isEqualByComparingTo(price);
        }
    }

    @Test
    @DisplayName("소수점 8자리를 넘는 부분은 절사된다")
    void truncatesBeyondScale() {
        PriceLevel level = PriceLevel.fromDecimal(new BigDecimal("1.123456789"));

        assertThat(level.getRaw()).isEqualTo(112345678L);
        assertThat(level.toDecimal()).isEqualByComparingTo("1.12345678");
    }

    @Test
    @DisplayName("같은 가격은 표기(scale)가 달라도 같은 레벨이다")
    void equalityIgnoresScale() {
        PriceLevel a = PriceLevel.fromDecimal(new BigDecimal("100.0"));
        PriceLevel b = PriceLevel.fromDecimal(new BigDecimal("100.00000000"));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a.compareTo(PriceLevel.fromDecimal(new BigDecimal("100.00000001")))).isNegative();
    }

    @Test
    @DisplayName("long 범위를 넘는 가격은 ArithmeticException")
    void overflowThrows() {
        assertThatThrownBy(() -> PriceLevel.fromDecimal(new BigDecimal("100000000000")))
                .isInstanceOf(ArithmeticException.class);
    }
}
