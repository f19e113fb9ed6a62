package dustin.perp.domains.engine;

import java.math.BigDecimal;

/**
 * 메이커/테이커 수수료율
 * Maker / Taker Fee Rates
 * 
 * 기본값: 메이커 0.02%, 테이커 0.05%
 */
public final class FeeRates {

    public static final BigDecimal DEFAULT_MAKER_FEE_RATE = new BigDecimal("0.0002");
    public static final BigDecimal DEFAULT_TAKER_FEE_RATE = new BigDecimal("0.0005");

    private static final FeeRates DEFAULTS = new FeeRates(DEFAULT_MAKER_FEE_RATE, DEFAULT_TAKER_FEE_RATE);

    private final BigDecimal makerFeeRate;
    private final BigDecimal takerFeeRate;

    public FeeRates(BigDecimal makerFeeRate, BigDecimal takerFeeRate) {
        this.makerFeeRate = makerFeeRate;
        this.takerFeeRate = takerFeeRate;
    }

    public static FeeRates defaults() {
        return DEFAULTS;
    }

    public BigDecimal getMakerFeeRate() {
        return makerFeeRate;
    }

    public BigDecimal getTakerFeeRate() {
        return takerFeeRate;
    }

    public BigDecimal makerFee(BigDecimal tradeValue) {
        return tradeValue.multiply(makerFeeRate);
    }

    public BigDecimal takerFee(BigDecimal tradeValue) {
        return tradeValue.multiply(takerFeeRate);
    }

    @Override
    public String toString() {
        return "FeeRates{maker=" + makerFeeRate + ", taker=" + takerFeeRate + "}";
    }
}
