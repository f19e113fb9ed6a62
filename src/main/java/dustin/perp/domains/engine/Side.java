package dustin.perp.domains.engine;

/**
 * 주문 방향
 * Order Side
 * 
 * - BUY: 매수 (롱 진입)
 * - SELL: 매도 (숏 진입)
 */
public enum Side {
    BUY("buy"),
    SELL("sell");

    private final String value;

    Side(String value) {
        this.value = value;
    }

    /**
     * DB/이벤트에 저장되는 문자열 값 ("buy" / "sell")
     */
    public String getValue() {
        return value;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static Side fromValue(String value) {
        for (Side side : values()) {
            if (side.value.equalsIgnoreCase(value)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown side: " + value);
    }
}
