// =====================================================
// MatchingEngine - 심볼별 오더북을 소유하는 매칭 엔진
// =====================================================
// 역할:
// 1. 설정된 심볼마다 Orderbook 하나를 생성하고 프로세스 수명 동안 유지
// 2. 주문 검증 → 매칭 → 상태 결정 → 잔량 등록
// 3. 체결(TradeEvent) / 오더북 변경(OrderbookUpdate) 브로드캐스트
// 4. 최근 체결/주문 내역 보관 (HistoryManager)
//
// 핵심 설계:
// - 매칭은 동기, 메모리 전용 (I/O 없음)
// - 같은 심볼의 주문 접수는 submitLock 으로 직렬화
//   → 체결 생성 순서 = 브로드캐스트 순서
// - 심볼 간에는 어떤 락도 공유하지 않음
// - DB 저장, 포지션 갱신, 외부 발행은 모두 브로드캐스트 하위에서 비동기 처리
//
// 주문 상태 결정:
// - 시장가, 체결 없음           → REJECTED
// - 시장가, 일부 체결           → PARTIALLY_FILLED (잔량 폐기, 오더북에 남지 않음)
// - 전량 체결                   → FILLED
// - 지정가, 일부 체결           → PARTIALLY_FILLED (잔량 등록)
// - 지정가, 체결 없음           → OPEN (전량 등록)
// =====================================================

package dustin.perp.domains.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import dustin.perp.domains.engine.Orderbook.MatchOutcome;
import dustin.perp.domains.engine.broadcast.BroadcastChannel;
import dustin.perp.domains.engine.broadcast.BroadcastReceiver;
import dustin.perp.domains.engine.history.HistoryManager;
import dustin.perp.domains.engine.history.OrderHistoryQuery;
import dustin.perp.domains.engine.history.OrderHistoryRecord;
import dustin.perp.domains.engine.history.OrderHistoryResponse;
import dustin.perp.domains.engine.history.TradeHistoryQuery;
import dustin.perp.domains.engine.history.TradeHistoryResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * 매칭 엔진
 * Matching Engine
 *
 * 사용 예시:
 * <pre>
 * MatchingEngine engine = new MatchingEngine(SymbolRegistry.of("BTCUSDT"), symbol -> FeeRates.defaults(),
 *         10000, 1000, 20, 1000, 500);
 * MatchResult result = engine.submitOrder(UUID.randomUUID(), "BTCUSDT", "0xabc", Side.BUY,
 *         OrderType.LIMIT, new BigDecimal("1.5"), new BigDecimal("101.0"), 10);
 * </pre>
 */
@Slf4j
public class MatchingEngine {

    private final SymbolRegistry symbolRegistry;
    private final FeeRateProvider feeRateProvider;
    private final Map<String, SymbolBook> books;

    private final BroadcastChannel<TradeEvent> tradeChannel;
    private final BroadcastChannel<OrderbookUpdate> orderbookChannel;
    private final int orderbookUpdateDepth;

    private final HistoryManager historyManager;
    private final AtomicLong totalTrades = new AtomicLong(0);

    public MatchingEngine(SymbolRegistry symbolRegistry,
                          FeeRateProvider feeRateProvider,
                          int tradeChannelCapacity,
                          int orderbookChannelCapacity,
                          int orderbookUpdateDepth,
                          int tradeHistorySize,
                          int orderHistorySize) {
        this.symbolRegistry = symbolRegistry;
        this.feeRateProvider = feeRateProvider;
        this.orderbookUpdateDepth = orderbookUpdateDepth;
        this.tradeChannel = new BroadcastChannel<>("trades", tradeChannelCapacity);
        this.orderbookChannel = new BroadcastChannel<>("orderbook", orderbookChannelCapacity);
        this.historyManager = new HistoryManager(tradeHistorySize, orderHistorySize);

        Map<String, SymbolBook> created = new LinkedHashMap<>();
        for (String symbol : symbolRegistry.getSymbols()) {
            created.put(symbol, new SymbolBook(new Orderbook(symbol)));
        }
        this.books = Collections.unmodifiableMap(created);

        log.info("[MatchingEngine] 매칭 엔진 초기화: symbols={}", symbolRegistry.getSymbols());
    }

    // =====================================================
    // 주문 접수
    // =====================================================

    /**
     * 주문 접수 및 매칭
     *
     * 검증 실패는 오더북 변경 전에 예외로 반환됩니다.
     *
     * @param orderId 주문 ID
     * @param symbol 심볼 (예: "BTCUSDT")
     * @param userAddress 주문자 주소
     * @param side 매수/매도
     * @param orderType 지정가/시장가
     * @param amount 주문 수량
     * @param price 지정가 (시장가는 무시)
     * @param leverage 레버리지 (내역 기록용, 검증은 호출자 책임)
     * @return 매칭 결과
     * @throws MatchingException SYMBOL_NOT_FOUND, INVALID_SIDE, INVALID_AMOUNT, INVALID_PRICE,
     *         INTERNAL_ERROR (이미 오더북에 있는 주문 ID)
     */
    public MatchResult submitOrder(UUID orderId, String symbol, String userAddress, Side side,
                                   OrderType orderType, BigDecimal amount, BigDecimal price, int leverage) {
        Objects.requireNonNull(orderId, "orderId");
        SymbolBook book = requireBook(symbol);
        validateOrder(side, orderType, amount, price);

        BigDecimal limitPrice = orderType == OrderType.LIMIT ? price : null;
        FeeRates feeRates = feeRateProvider.getFeeRates(symbol);

        MatchResult result;
        book.submitLock.lock();
        try {
            // 같은 ID 가 이미 오더북에 있으면 인덱스와 큐가 어긋나므로 매칭 전에 거부
            requireNewOrderId(book, orderId);
            long acceptedAt = System.currentTimeMillis();
            MatchOutcome outcome = book.orderbook.matchOrder(orderId, userAddress, side, amount, limitPrice, feeRates);
            List<TradeExecution> trades = outcome.getTrades();
            BigDecimal remaining = outcome.getRemainingAmount();
            BigDecimal filled = amount.subtract(remaining);
            BigDecimal averagePrice = averagePrice(trades, filled);

            OrderStatus status;
            boolean rested = false;
            if (remaining.signum() == 0) {
                status = OrderStatus.FILLED;
            } else if (orderType == OrderType.MARKET) {
                status = trades.isEmpty() ? OrderStatus.REJECTED : OrderStatus.PARTIALLY_FILLED;
            } else {
                book.orderbook.addOrder(new OrderEntry(orderId, userAddress, limitPrice, amount, remaining,
                        side, TimeInForce.GTC, acceptedAt));
                rested = true;
                status = trades.isEmpty() ? OrderStatus.OPEN : OrderStatus.PARTIALLY_FILLED;
            }

            result = new MatchResult(orderId, status, filled, remaining, averagePrice, trades);

            historyManager.recordOrder(OrderHistoryRecord.builder()
                    .orderId(orderId)
                    .userAddress(userAddress)
                    .symbol(symbol)
                    .side(side.getValue())
                    .orderType(orderType.getValue())
                    .price(limitPrice)
                    .originalAmount(amount)
                    .filledAmount(filled)
                    .remainingAmount(remaining)
                    .status(status.getValue())
                    .leverage(leverage)
                    .createdAt(acceptedAt)
                    .updatedAt(acceptedAt)
                    .avgFillPrice(averagePrice)
                    .filledValue(filledValue(trades))
                    .tradeIds(tradeIds(trades))
                    .build());

            for (TradeExecution trade : trades) {
                TradeEvent event = trade.toEvent(symbol, userAddress, side);
                historyManager.recordTrade(event);
                totalTrades.incrementAndGet();
                tradeChannel.send(event);
            }

            if (!trades.isEmpty() || rested) {
                orderbookChannel.send(book.orderbook.snapshot(orderbookUpdateDepth).toUpdate());
            }
        } finally {
            book.submitLock.unlock();
        }

        log.debug("[MatchingEngine] 주문 처리: symbol={}, {}", symbol, result);
        return result;
    }

    /**
     * 주문 검증 (오더북 변경 전)
     */
    private void validateOrder(Side side, OrderType orderType, BigDecimal amount, BigDecimal price) {
        if (side == null) {
            throw MatchingException.invalidSide("side is required");
        }
        if (orderType == null) {
            throw new MatchingException(MatchingErrorCode.INTERNAL_ERROR, "order type is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw MatchingException.invalidAmount("amount must be positive: " + amount);
        }
        if (orderType == OrderType.LIMIT) {
            validateLimitPrice(price);
        }
    }

    private void validateLimitPrice(BigDecimal price) {
        if (price == null) {
            throw MatchingException.invalidPrice("limit order requires price");
        }
        if (price.signum() <= 0) {
            throw MatchingException.invalidPrice("price must be positive: " + price);
        }
        if (price.stripTrailingZeros().scale() > PriceLevel.SCALE) {
            throw MatchingException.invalidPrice("price has more than " + PriceLevel.SCALE + " decimals: " + price);
        }
        try {
            PriceLevel.fromDecimal(price);
        } catch (ArithmeticException e) {
            throw MatchingException.invalidPrice("price out of range: " + price);
        }
    }

    /**
     * 거래량 가중 평균 체결가 = Σ(price × amount) / filled
     *
     * @return 평균 체결가, 체결 없으면 null
     */
    static BigDecimal averagePrice(List<TradeExecution> trades, BigDecimal filled) {
        if (trades.isEmpty() || filled.signum() == 0) {
            return null;
        }
        return filledValue(trades).divide(filled, 18, RoundingMode.HALF_UP);
    }

    private static BigDecimal filledValue(List<TradeExecution> trades) {
        BigDecimal value = BigDecimal.ZERO;
        for (TradeExecution trade : trades) {
            value = value.add(trade.getTradeValue());
        }
        return value;
    }

    private static List<UUID> tradeIds(List<TradeExecution> trades) {
        List<UUID> ids = new ArrayList<>(trades.size());
        for (TradeExecution trade : trades) {
            ids.add(trade.getTradeId());
        }
        return ids;
    }

    // =====================================================
    // 주문 복구 / 취소
    // =====================================================

    /**
     * 재시작 시 DB 의 미체결 지정가 주문을 오더북에 다시 등록
     *
     * 매칭이나 브로드캐스트 없이 그대로 등록합니다.
     */
    public void restoreOrder(UUID orderId, String symbol, String userAddress, Side side, BigDecimal price,
                             BigDecimal originalAmount, BigDecimal remainingAmount, int leverage, long timestamp) {
        SymbolBook book = requireBook(symbol);
        book.submitLock.lock();
        try {
            requireNewOrderId(book, orderId);
            book.orderbook.addOrder(new OrderEntry(orderId, userAddress, price, originalAmount, remainingAmount,
                    side, TimeInForce.GTC, timestamp));
            BigDecimal filled = originalAmount.subtract(remainingAmount);
            OrderStatus status = filled.signum() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            historyManager.recordOrder(OrderHistoryRecord.builder()
                    .orderId(orderId)
                    .userAddress(userAddress)
                    .symbol(symbol)
                    .side(side.getValue())
                    .orderType(OrderType.LIMIT.getValue())
                    .price(price)
                    .originalAmount(originalAmount)
                    .filledAmount(filled)
                    .remainingAmount(remainingAmount)
                    .status(status.getValue())
                    .leverage(leverage)
                    .createdAt(timestamp)
                    .updatedAt(timestamp)
                    .build());
        } finally {
            book.submitLock.unlock();
        }
    }

    /**
     * 주문 취소
     *
     * 주문 소유자(userAddress) 검증은 호출자 책임입니다. 엔진은 다시 확인하지 않습니다.
     *
     * @return 취소되었으면 true, 없거나 이미 체결/취소되었으면 false
     * @throws MatchingException SYMBOL_NOT_FOUND
     */
    public boolean cancelOrder(String symbol, UUID orderId, String userAddress) {
        SymbolBook book = requireBook(symbol);
        Optional<OrderEntry> removed = book.orderbook.cancelOrder(orderId);
        if (removed.isEmpty()) {
            log.debug("[MatchingEngine] 취소 대상 없음: symbol={}, orderId={}", symbol, orderId);
            return false;
        }

        historyManager.markCancelled(orderId, System.currentTimeMillis());
        book.submitLock.lock();
        try {
            orderbookChannel.send(book.orderbook.snapshot(orderbookUpdateDepth).toUpdate());
        } finally {
            book.submitLock.unlock();
        }

        log.debug("[MatchingEngine] 주문 취소: symbol={}, orderId={}, user={}, remaining={}",
                symbol, orderId, userAddress, removed.get().getRemainingAmount());
        return true;
    }

    // =====================================================
    // 조회 / 구독
    // =====================================================

    /**
     * 오더북 스냅샷 조회
     *
     * @throws MatchingException SYMBOL_NOT_FOUND
     */
    public OrderbookSnapshot getOrderbook(String symbol, int depth) {
        return requireBook(symbol).orderbook.snapshot(depth);
    }

    /**
     * 심볼의 오더북 (집계 조회용)
     *
     * @throws MatchingException SYMBOL_NOT_FOUND
     */
    public Orderbook findOrderbook(String symbol) {
        return requireBook(symbol).orderbook;
    }

    public BroadcastReceiver<TradeEvent> subscribeTrades() {
        return tradeChannel.subscribe();
    }

    public BroadcastReceiver<OrderbookUpdate> subscribeOrderbook() {
        return orderbookChannel.subscribe();
    }

    /**
     * 외부에서 만든 체결 이벤트를 구독자에게 전달
     *
     * @return 현재 구독자 수
     */
    public int broadcastTrade(TradeEvent event) {
        return tradeChannel.send(event);
    }

    public TradeHistoryResponse getTrades(String symbol, TradeHistoryQuery query) {
        return historyManager.getTrades(symbol, query);
    }

    public OrderHistoryResponse getOrders(String userAddress, OrderHistoryQuery query) {
        return historyManager.getOrders(userAddress, query);
    }

    /**
     * 주문 내역 단건 조회
     *
     * @return 내역 복사본, 보관 한도를 넘어 제거되었거나 없으면 null
     */
    public OrderHistoryRecord getOrderHistory(UUID orderId) {
        return historyManager.getOrder(orderId);
    }

    public boolean isValidSymbol(String symbol) {
        return symbolRegistry.contains(symbol);
    }

    public Set<String> getSymbols() {
        return symbolRegistry.getSymbols();
    }

    public EngineStats getStats() {
        Map<String, Long> ordersBySymbol = new LinkedHashMap<>();
        long totalOrders = 0;
        for (Map.Entry<String, SymbolBook> entry : books.entrySet()) {
            long count = entry.getValue().orderbook.getOrderCount();
            ordersBySymbol.put(entry.getKey(), count);
            totalOrders += count;
        }
        return EngineStats.builder()
                .symbolCount(books.size())
                .totalOrders(totalOrders)
                .totalTrades(totalTrades.get())
                .ordersBySymbol(ordersBySymbol)
                .tradeSubscribers(tradeChannel.getReceiverCount())
                .orderbookSubscribers(orderbookChannel.getReceiverCount())
                .build();
    }

    /**
     * 브로드캐스트 채널 종료 (구독 워커 정지)
     */
    public void shutdown() {
        tradeChannel.close();
        orderbookChannel.close();
        log.info("[MatchingEngine] 매칭 엔진 종료: stats={}", getStats());
    }

    private void requireNewOrderId(SymbolBook book, UUID orderId) {
        if (book.orderbook.hasOrder(orderId)) {
            throw new MatchingException(MatchingErrorCode.INTERNAL_ERROR, "Duplicate order id: " + orderId);
        }
    }

    private SymbolBook requireBook(String symbol) {
        SymbolBook book = symbol == null ? null : books.get(symbol);
        if (book == null) {
            throw MatchingException.symbolNotFound(symbol);
        }
        return book;
    }

    /**
     * 심볼별 오더북 + 주문 접수 락
     */
    private static final class SymbolBook {
        private final Orderbook orderbook;
        private final ReentrantLock submitLock = new ReentrantLock();

        private SymbolBook(Orderbook orderbook) {
            this.orderbook = orderbook;
        }
    }
}
