// =====================================================
// HistoryManager - 최근 체결/주문 내역 (메모리)
// =====================================================
// 역할: 매칭 엔진이 만든 체결과 주문 결과를 최근 N 건까지 메모리에 보관하고
//       조회 조건(limit/before/after/status/symbol)으로 필터링합니다.
//
// 자료구조:
// 1. 심볼별 ArrayDeque<TradeRecord> (최신이 앞)
// 2. 사용자별 ArrayDeque<OrderHistoryRecord> (최신이 앞)
// 3. 주문 ID → OrderHistoryRecord (메이커 체결 반영용)
//
// 보관 한도를 넘으면 가장 오래된 것부터 제거합니다.
// 영구 저장은 OrderFlowOrchestrator 가 담당합니다.
// =====================================================

package dustin.perp.domains.engine.history;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import dustin.perp.domains.engine.OrderStatus;
import dustin.perp.domains.engine.TradeEvent;

/**
 * 체결/주문 내역 관리자
 * History Manager
 */
public class HistoryManager {

    private final int maxTradesPerSymbol;
    private final int maxOrdersPerUser;

    private final Map<String, Deque<TradeRecord>> tradesBySymbol = new ConcurrentHashMap<>();
    private final Map<String, Deque<OrderHistoryRecord>> ordersByUser = new ConcurrentHashMap<>();
    private final Map<UUID, OrderHistoryRecord> ordersById = new ConcurrentHashMap<>();

    private final AtomicLong totalTrades = new AtomicLong(0);
    private final AtomicLong totalOrders = new AtomicLong(0);

    public HistoryManager(int maxTradesPerSymbol, int maxOrdersPerUser) {
        this.maxTradesPerSymbol = maxTradesPerSymbol;
        this.maxOrdersPerUser = maxOrdersPerUser;
    }

    /**
     * 체결 기록 + 메이커 주문 내역 갱신
     */
    public void recordTrade(TradeEvent event) {
        Deque<TradeRecord> trades = tradesBySymbol.computeIfAbsent(event.getSymbol(), k -> new ArrayDeque<>());
        synchronized (trades) {
            trades.addFirst(TradeRecord.from(event));
            while (trades.size() > maxTradesPerSymbol) {
                trades.removeLast();
            }
        }
        totalTrades.incrementAndGet();

        OrderHistoryRecord maker = ordersById.get(event.getMakerOrderId());
        if (maker != null) {
            synchronized (maker) {
                maker.applyFill(event.getTradeId(), event.getPrice(), event.getAmount(), event.getTimestamp());
            }
        }
    }

    /**
     * 주문 내역 기록 (접수 결과 또는 복구된 주문)
     */
    public void recordOrder(OrderHistoryRecord record) {
        Deque<OrderHistoryRecord> orders = ordersByUser.computeIfAbsent(record.getUserAddress(), k -> new ArrayDeque<>());
        synchronized (orders) {
            orders.addFirst(record);
            ordersById.put(record.getOrderId(), record);
            while (orders.size() > maxOrdersPerUser) {
                OrderHistoryRecord evicted = orders.removeLast();
                ordersById.remove(evicted.getOrderId());
            }
        }
        totalOrders.incrementAndGet();
    }

    /**
     * 주문 취소 반영
     *
     * @return 내역에 있었으면 true
     */
    public boolean markCancelled(UUID orderId, long timestamp) {
        OrderHistoryRecord record = ordersById.get(orderId);
        if (record == null) {
            return false;
        }
        synchronized (record) {
            record.setStatus(OrderStatus.CANCELLED.getValue());
            record.setUpdatedAt(timestamp);
        }
        return true;
    }

    /**
     * 심볼별 체결 내역 조회 (최신순)
     */
    public TradeHistoryResponse getTrades(String symbol, TradeHistoryQuery query) {
        Deque<TradeRecord> trades = tradesBySymbol.get(symbol);
        if (trades == null) {
            return new TradeHistoryResponse(Collections.emptyList(), 0, false);
        }
        int limit = query.resolveLimit();
        List<TradeRecord> page = new ArrayList<>();
        int totalCount = 0;
        synchronized (trades) {
            for (TradeRecord record : trades) {
                if (!query.matchesTime(record.getTimestamp())) {
                    continue;
                }
                totalCount++;
                if (page.size() < limit) {
                    page.add(record);
                }
            }
        }
        return new TradeHistoryResponse(page, totalCount, totalCount > limit);
    }

    /**
     * 사용자별 주문 내역 조회 (최신순)
     */
    public OrderHistoryResponse getOrders(String userAddress, OrderHistoryQuery query) {
        Deque<OrderHistoryRecord> orders = ordersByUser.get(userAddress);
        if (orders == null) {
            return new OrderHistoryResponse(Collections.emptyList(), 0, false);
        }
        int limit = query.resolveLimit();
        List<OrderHistoryRecord> page = new ArrayList<>();
        int totalCount = 0;
        synchronized (orders) {
            for (OrderHistoryRecord record : orders) {
                OrderHistoryRecord snapshot;
                synchronized (record) {
                    snapshot = record.copy();
                }
                if (!query.matchesStatus(snapshot.getStatus())
                        || !query.matchesSymbol(snapshot.getSymbol())
                        || !query.matchesTime(snapshot.getCreatedAt())) {
                    continue;
                }
                totalCount++;
                if (page.size() < limit) {
                    page.add(snapshot);
                }
            }
        }
        return new OrderHistoryResponse(page, totalCount, totalCount > limit);
    }

    /**
     * 주문 내역 단건 조회 (복사본)
     */
    public OrderHistoryRecord getOrder(UUID orderId) {
        OrderHistoryRecord record = ordersById.get(orderId);
        if (record == null) {
            return null;
        }
        synchronized (record) {
            return record.copy();
        }
    }

    public long getTotalTrades() {
        return totalTrades.get();
    }

    public long getTotalOrders() {
        return totalOrders.get();
    }
}
