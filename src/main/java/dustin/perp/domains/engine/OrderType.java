package dustin.perp.domains.engine;

/**
 * 주문 방식
 * Order Type
 * 
 * - LIMIT: 지정가 (미체결 잔량은 오더북에 등록)
 * - MARKET: 시장가 (미체결 잔량은 폐기, 오더북에 남지 않음)
 */
public enum OrderType {
    LIMIT("limit"),
    MARKET("market");

    private final String value;

    OrderType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OrderType fromValue(String value) {
        for (OrderType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown order type: " + value);
    }
}
