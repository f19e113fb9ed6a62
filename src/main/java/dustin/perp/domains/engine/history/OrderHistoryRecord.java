package dustin.perp.domains.engine.history;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import dustin.perp.domains.engine.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 내역 레코드 (메모리 보관용)
 * Order History Record
 * 
 * 메이커로 체결될 때마다 HistoryManager 가 갱신합니다.
 * 외부로 나갈 때는 copy() 로 복사본을 반환합니다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OrderHistoryRecord {

    private UUID orderId;
    private String userAddress;
    private String symbol;
    private String side;
    private String orderType;

    /**
     * 지정가 (시장가는 null)
     */
    private BigDecimal price;
    private BigDecimal originalAmount;
    private BigDecimal filledAmount;
    private BigDecimal remainingAmount;
    private String status;
    private int leverage;
    private long createdAt;
    private long updatedAt;

    /**
     * 평균 체결가 (체결 없으면 null)
     */
    private BigDecimal avgFillPrice;

    /**
     * 누적 체결 금액 (평균 체결가 계산용)
     */
    @Builder.Default
    private BigDecimal filledValue = BigDecimal.ZERO;

    @Builder.Default
    private List<UUID> tradeIds = new ArrayList<>();

    /**
     * 메이커 체결 반영
     */
    void applyFill(UUID tradeId, BigDecimal price, BigDecimal amount, long timestamp) {
        filledAmount = filledAmount.add(amount);
        remainingAmount = remainingAmount.subtract(amount);
        if (remainingAmount.signum() < 0) {
            remainingAmount = BigDecimal.ZERO;
        }
        filledValue = filledValue.add(price.multiply(amount));
        avgFillPrice = filledValue.divide(filledAmount, 18, RoundingMode.HALF_UP);
        status = remainingAmount.signum() == 0
                ? OrderStatus.FILLED.getValue()
                : OrderStatus.PARTIALLY_FILLED.getValue();
        tradeIds.add(tradeId);
        updatedAt = timestamp;
    }

    OrderHistoryRecord copy() {
        return toBuilder().tradeIds(new ArrayList<>(tradeIds)).build();
    }
}
