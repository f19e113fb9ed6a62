package dustin.perp.domains.engine;

/**
 * 주문 상태
 * Order Status
 * 
 * 상태 전이:
 * - PENDING → OPEN / PARTIALLY_FILLED / FILLED / REJECTED
 * - OPEN / PARTIALLY_FILLED → PARTIALLY_FILLED / FILLED / CANCELLED
 * - FILLED, CANCELLED, REJECTED 는 종료 상태
 */
public enum OrderStatus {
    PENDING("pending"),
    OPEN("open"),
    PARTIALLY_FILLED("partially_filled"),
    FILLED("filled"),
    CANCELLED("cancelled"),
    REJECTED("rejected");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    /**
     * DB 에 저장되는 문자열 값
     */
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    public static OrderStatus fromValue(String value) {
        for (OrderStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status: " + value);
    }
}
