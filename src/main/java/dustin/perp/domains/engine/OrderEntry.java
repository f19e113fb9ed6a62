// =====================================================
// OrderEntry - 오더북에 대기 중인 주문
// =====================================================
// 역할: 메모리 오더북에 등록된 지정가 주문 한 건입니다.
// DB 모델(Order)과 별도로 관리되며, 매칭에 필요한 필드만 가집니다.
//
// 불변 조건:
// - 오더북에 있는 동안 0 < remainingAmount <= originalAmount
// - remainingAmount 가 0 이 되면 즉시 오더북에서 제거
// - side, price 는 생성 후 변경 불가 (정정 주문 없음, 취소 후 재주문)
// =====================================================

package dustin.perp.domains.engine;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * 오더북 주문 엔트리
 * Resting Order Entry
 * 
 * remainingAmount 는 매칭 알고리즘만 변경합니다 (해당 사이드 쓰기 락 안에서).
 */
public final class OrderEntry {

    private final UUID id;
    private final String userAddress;
    private final BigDecimal price;
    private final BigDecimal originalAmount;
    private BigDecimal remainingAmount;
    private final Side side;
    private final TimeInForce timeInForce;

    /**
     * 주문 접수 시각 (epoch millis, Time Priority 기준)
     */
    private final long timestamp;

    public OrderEntry(UUID id, String userAddress, BigDecimal price, BigDecimal originalAmount,
                      BigDecimal remainingAmount, Side side, TimeInForce timeInForce, long timestamp) {
        this.id = id;
        this.userAddress = userAddress;
        this.price = price;
        this.originalAmount = originalAmount;
        this.remainingAmount = remainingAmount;
        this.side = side;
        this.timeInForce = timeInForce;
        this.timestamp = timestamp;
    }

    /**
     * 신규 GTC 주문 엔트리 생성 (remaining == original)
     */
    public static OrderEntry of(UUID id, String userAddress, Side side, BigDecimal price,
                                BigDecimal amount, long timestamp) {
        return new OrderEntry(id, userAddress, price, amount, amount, side, TimeInForce.GTC, timestamp);
    }

    public UUID getId() {
        return id;
    }

    public String getUserAddress() {
        return userAddress;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public BigDecimal getOriginalAmount() {
        return originalAmount;
    }

    public BigDecimal getRemainingAmount() {
        return remainingAmount;
    }

    void setRemainingAmount(BigDecimal remainingAmount) {
        this.remainingAmount = remainingAmount;
    }

    public Side getSide() {
        return side;
    }

    public TimeInForce getTimeInForce() {
        return timeInForce;
    }

    public long getTimestamp() {
        return timestamp;
    }

    /**
     * 전량 체결 여부
     */
    public boolean isFullyFilled() {
        return remainingAmount.signum() == 0;
    }

    /**
     * 현재 상태의 복사본 (오더북 외부로 노출할 때 사용)
     */
    public OrderEntry copy() {
        return new OrderEntry(id, userAddress, price, originalAmount, remainingAmount, side, timeInForce, timestamp);
    }

    @Override
    public String toString() {
        return "OrderEntry{id=" + id + ", side=" + side + ", price=" + price
                + ", remaining=" + remainingAmount + "/" + originalAmount + "}";
    }
}
