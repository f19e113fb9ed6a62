package dustin.perp.domains.order.service;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.List;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import dustin.perp.config.MatchingProperties;
import dustin.perp.domains.engine.MatchingEngine;
import dustin.perp.domains.engine.OrderStatus;
import dustin.perp.domains.engine.OrderType;
import dustin.perp.domains.engine.Side;
import dustin.perp.domains.order.model.entity.Order;
import dustin.perp.domains.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 미체결 주문 복구 서비스
 * Order Recovery Service
 * 
 * 역할:
 * - 서버 시작 시 DB 의 미체결 지정가 주문('open', 'partially_filled')을 오더북에 다시 등록
 * - 접수 시각 순으로 등록해 같은 가격의 시간 우선순위를 유지
 * 
 * matching.recovery.enabled=false 면 건너뜁니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderRecoveryService {

    private static final List<String> RECOVERABLE_STATUSES = List.of(
            OrderStatus.OPEN.getValue(), OrderStatus.PARTIALLY_FILLED.getValue());

    private final MatchingEngine matchingEngine;
    private final OrderRepository orderRepository;
    private final MatchingProperties matchingProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!matchingProperties.getRecovery().isEnabled()) {
            log.info("[OrderRecoveryService] 주문 복구 비활성화");
            return;
        }
        recoverOpenOrders();
    }

    /**
     * 미체결 주문 복구
     *
     * @return 복구한 주문 수
     */
    public int recoverOpenOrders() {
        List<Order> orders = orderRepository.findBySymbolInAndOrderTypeAndStatusInOrderByCreatedAtAsc(
                matchingEngine.getSymbols(), OrderType.LIMIT.getValue(), RECOVERABLE_STATUSES);

        int restored = 0;
        for (Order order : orders) {
            BigDecimal remaining = order.getRemainingAmount();
            if (remaining.signum() <= 0 || order.getPrice() == null) {
                log.warn("[OrderRecoveryService] 복구 불가 주문 건너뜀: id={}, remaining={}, price={}",
                        order.getId(), remaining, order.getPrice());
                continue;
            }
            if (matchingEngine.findOrderbook(order.getSymbol()).hasOrder(order.getId())) {
                continue;
            }
            try {
                matchingEngine.restoreOrder(order.getId(), order.getSymbol(), order.getUserAddress(),
                        Side.fromValue(order.getSide()), order.getPrice(), order.getAmount(), remaining,
                        order.getLeverage(), toEpochMillis(order));
                restored++;
            } catch (RuntimeException e) {
                log.error("[OrderRecoveryService] 주문 복구 실패: id={}", order.getId(), e);
            }
        }

        log.info("[OrderRecoveryService] 주문 복구 완료: restored={}, candidates={}", restored, orders.size());
        return restored;
    }

    private long toEpochMillis(Order order) {
        if (order.getCreatedAt() == null) {
            return System.currentTimeMillis();
        }
        return order.getCreatedAt().atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }
}
