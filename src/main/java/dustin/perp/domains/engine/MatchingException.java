package dustin.perp.domains.engine;

/**
 * 매칭 엔진 예외
 * Matching Exception
 * 
 * 검증 실패는 오더북 변경 전에 동기적으로 던져집니다 (부작용 없음).
 */
public class MatchingException extends RuntimeException {

    private final MatchingErrorCode errorCode;

    public MatchingException(MatchingErrorCode errorCode, String detail) {
        super(detail == null ? errorCode.getDescription() : errorCode.getDescription() + ": " + detail);
        this.errorCode = errorCode;
    }

    public MatchingException(MatchingErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode.getDescription() + ": " + detail, cause);
        this.errorCode = errorCode;
    }

    public MatchingErrorCode getErrorCode() {
        return errorCode;
    }

    public static MatchingException symbolNotFound(String symbol) {
        return new MatchingException(MatchingErrorCode.SYMBOL_NOT_FOUND, symbol);
    }

    public static MatchingException invalidPrice(String detail) {
        return new MatchingException(MatchingErrorCode.INVALID_PRICE, detail);
    }

    public static MatchingException invalidAmount(String detail) {
        return new MatchingException(MatchingErrorCode.INVALID_AMOUNT, detail);
    }

    public static MatchingException invalidSide(String detail) {
        return new MatchingException(MatchingErrorCode.INVALID_SIDE, detail);
    }
}
