package dustin.perp.domains.engine;

/**
 * 주문 유효 기간
 * Time In Force
 * 
 * 현재 매칭 로직은 GTC 만 처리합니다.
 * IOC / FOK 는 타입만 정의되어 있고 별도 동작은 없습니다 (GTC 와 동일하게 처리됨).
 */
public enum TimeInForce {
    /** Good-Till-Cancelled */
    GTC,
    /** Immediate-Or-Cancel */
    IOC,
    /** Fill-Or-Kill */
    FOK
}
