package dustin.perp.domains.engine;

/**
 * 매칭 엔진 에러 코드
 * Matching Error Code
 */
public enum MatchingErrorCode {
    SYMBOL_NOT_FOUND("Symbol not found"),
    ORDER_NOT_FOUND("Order not found"),
    INVALID_PRICE("Invalid price"),
    INVALID_AMOUNT("Invalid amount"),
    INVALID_SIDE("Invalid side"),
    INSUFFICIENT_LIQUIDITY("Insufficient liquidity"),
    DATABASE_ERROR("Database error"),
    INTERNAL_ERROR("Internal error");

    private final String description;

    MatchingErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
