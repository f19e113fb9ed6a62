// =====================================================
// Orderbook - 심볼별 오더북 및 매칭 알고리즘
// =====================================================
// 역할: 한 심볼의 매수/매도 호가를 관리하고 가격-시간 우선 매칭을 실행합니다.
//
// 핵심 설계:
// 1. 사이드별 TreeMap<PriceLevel, ArrayDeque<OrderEntry>>
//    - bids: 내림차순 (높은 가격이 먼저)
//    - asks: 오름차순 (낮은 가격이 먼저)
//    - 키는 고정소수점 PriceLevel (정수 비교, 부동소수점 없음)
// 2. 사이드별 ReentrantReadWriteLock
//    - 등록/취소/매칭: 해당 사이드 쓰기 락
//    - 스냅샷/최선가 조회: 읽기 락
//    - 심볼 간에는 락을 공유하지 않음
// 3. 주문 인덱스 ConcurrentHashMap<UUID, IndexEntry>
//    - 주문 ID → (사이드, 가격 레벨, 엔트리)
//    - 가격 레벨 락과 별도로 O(1) 조회
//
// 취소와 매칭의 경합:
// - 인덱스에서 먼저 제거한 쪽이 이김
// - 취소가 먼저 인덱스를 제거하면 매칭은 해당 메이커를 건너뜀
// - 매칭이 먼저 전량 체결하면 취소는 빈 결과를 받음
//
// 불변 조건:
// - 인덱스의 모든 ID 는 큐에 정확히 하나 존재 (역도 성립)
// - 빈 큐를 가진 가격 레벨은 남기지 않음
// =====================================================

package dustin.perp.domains.engine;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import dustin.perp.domains.engine.OrderbookSnapshot.PriceAmount;
import lombok.extern.slf4j.Slf4j;

/**
 * 심볼별 오더북
 * Orderbook (one per symbol)
 *
 * 구조:
 * <pre>
 * bids: { 100.5 -> [주문1, 주문2], 100.0 -> [주문3] }   (내림차순)
 * asks: { 101.0 -> [주문4], 101.5 -> [주문5, 주문6] }   (오름차순)
 * </pre>
 *
 * 입력 검증(가격/수량 부호 등)은 하지 않습니다. 상위(MatchingEngine)에서 검증된 값만 들어옵니다.
 */
@Slf4j
public class Orderbook {

    private final String symbol;

    /**
     * 매수 호가 (높은 가격부터)
     */
    private final TreeMap<PriceLevel, ArrayDeque<OrderEntry>> bids = new TreeMap<>(Comparator.reverseOrder());

    /**
     * 매도 호가 (낮은 가격부터)
     */
    private final TreeMap<PriceLevel, ArrayDeque<OrderEntry>> asks = new TreeMap<>();

    private final ReentrantReadWriteLock bidLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock askLock = new ReentrantReadWriteLock();

    /**
     * 주문 ID → 위치 인덱스 (취소용 O(1) 조회)
     */
    private final ConcurrentHashMap<UUID, IndexEntry> orderIndex = new ConcurrentHashMap<>();

    /**
     * 마지막 체결가 (PriceLevel raw 값, 0 이면 체결 이력 없음)
     */
    private final AtomicLong lastTradePrice = new AtomicLong(0);

    /**
     * 오더북에 대기 중인 주문 수
     */
    private final AtomicLong orderCount = new AtomicLong(0);

    public Orderbook(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public long getOrderCount() {
        return orderCount.get();
    }

    /**
     * 마지막 체결가
     *
     * @return 마지막 체결가, 체결 이력이 없으면 null
     */
    public BigDecimal getLastTradePrice() {
        long raw = lastTradePrice.get();
        return raw == 0 ? null : PriceLevel.ofRaw(raw).toDecimal();
    }

    public void setLastTradePrice(BigDecimal price) {
        lastTradePrice.set(PriceLevel.fromDecimal(price).getRaw());
    }

    // =====================================================
    // 주문 등록 / 취소
    // =====================================================

    /**
     * 주문 등록 - 해당 가격 레벨 큐의 맨 뒤에 추가 (Time Priority)
     *
     * @param entry 주문 엔트리 (가격 필수)
     */
    public void addOrder(OrderEntry entry) {
        PriceLevel level = PriceLevel.fromDecimal(entry.getPrice());
        Lock lock = lockFor(entry.getSide()).writeLock();
        lock.lock();
        try {
            sideFor(entry.getSide()).computeIfAbsent(level, k -> new ArrayDeque<>()).addLast(entry);
            orderIndex.put(entry.getId(), new IndexEntry(entry.getSide(), level, entry));
            orderCount.incrementAndGet();
        } finally {
            lock.unlock();
        }
        log.debug("[Orderbook] 주문 등록: symbol={}, id={}, side={}, price={}, amount={}",
                symbol, entry.getId(), entry.getSide(), entry.getPrice(), entry.getRemainingAmount());
    }

    /**
     * 주문 취소
     *
     * 같은 ID 로 두 번 취소하면 두 번째는 빈 결과를 반환합니다.
     *
     * @param orderId 주문 ID
     * @return 제거된 주문, 없거나 이미 전량 체결되었으면 Optional.empty()
     */
    public Optional<OrderEntry> cancelOrder(UUID orderId) {
        IndexEntry indexed = orderIndex.remove(orderId);
        if (indexed == null) {
            return Optional.empty();
        }

        Lock lock = lockFor(indexed.side).writeLock();
        lock.lock();
        try {
            TreeMap<PriceLevel, ArrayDeque<OrderEntry>> book = sideFor(indexed.side);
            ArrayDeque<OrderEntry> queue = book.get(indexed.level);
            if (queue != null && queue.remove(indexed.entry)) {
                orderCount.decrementAndGet();
                if (queue.isEmpty()) {
                    book.remove(indexed.level);
                }
                return Optional.of(indexed.entry);
            }
            // 매칭 쪽에서 이미 큐에서 뺀 경우: 전량 체결이면 매칭이 이긴 것
            if (indexed.entry.isFullyFilled()) {
                return Optional.empty();
            }
            return Optional.of(indexed.entry);
        } finally {
            lock.unlock();
        }
    }

    public boolean hasOrder(UUID orderId) {
        return orderIndex.containsKey(orderId);
    }

    /**
     * 대기 중인 주문 조회 (복사본)
     */
    public Optional<OrderEntry> getOrder(UUID orderId) {
        IndexEntry indexed = orderIndex.get(orderId);
        if (indexed == null) {
            return Optional.empty();
        }
        Lock lock = lockFor(indexed.side).readLock();
        lock.lock();
        try {
            return Optional.of(indexed.entry.copy());
        } finally {
            lock.unlock();
        }
    }

    // =====================================================
    // 매칭
    // =====================================================

    /**
     * 주문 매칭 (가격-시간 우선)
     *
     * 처리 흐름:
     * 1. 매수면 매도 호가를 낮은 가격부터, 매도면 매수 호가를 높은 가격부터 순회
     * 2. 지정가면 한도 가격을 넘는 레벨에서 중단 (시장가는 한도 없음)
     * 3. 같은 가격 안에서는 먼저 들어온 주문부터 (FIFO)
     * 4. 체결 수량 = min(테이커 잔량, 메이커 잔량), 체결 가격 = 메이커 가격
     * 5. 전량 체결된 메이커는 큐와 인덱스에서 제거, 빈 레벨은 제거
     *
     * @param takerId 테이커 주문 ID
     * @param takerAddress 테이커 주소
     * @param side 테이커 방향
     * @param amount 테이커 주문 수량 (0 보다 커야 함)
     * @param limitPrice 지정가, 시장가면 null
     * @param feeRates 수수료율
     * @return 체결 목록과 미체결 잔량
     */
    public MatchOutcome matchOrder(UUID takerId, String takerAddress, Side side, BigDecimal amount,
                                   BigDecimal limitPrice, FeeRates feeRates) {
        List<TradeExecution> trades = new ArrayList<>();
        BigDecimal remaining = amount;
        if (amount.signum() <= 0) {
            return new MatchOutcome(trades, amount);
        }

        PriceLevel limit = limitPrice == null ? null : PriceLevel.fromDecimal(limitPrice);
        TreeMap<PriceLevel, ArrayDeque<OrderEntry>> book = sideFor(side.opposite());
        Lock lock = lockFor(side.opposite()).writeLock();

        lock.lock();
        try {
            Iterator<Map.Entry<PriceLevel, ArrayDeque<OrderEntry>>> levels = book.entrySet().iterator();
            while (remaining.signum() > 0 && levels.hasNext()) {
                Map.Entry<PriceLevel, ArrayDeque<OrderEntry>> level = levels.next();
                if (limit != null && crossesLimit(side, level.getKey(), limit)) {
                    break;
                }

                ArrayDeque<OrderEntry> queue = level.getValue();
                while (remaining.signum() > 0 && !queue.isEmpty()) {
                    OrderEntry maker = queue.peekFirst();

                    // 취소가 먼저 인덱스를 가져간 주문은 건너뜀
                    if (!orderIndex.containsKey(maker.getId())) {
                        queue.pollFirst();
                        orderCount.decrementAndGet();
                        continue;
                    }

                    BigDecimal tradeAmount = remaining.min(maker.getRemainingAmount());
                    BigDecimal tradePrice = maker.getPrice();
                    BigDecimal tradeValue = tradeAmount.multiply(tradePrice);

                    trades.add(new TradeExecution(
                            UUID.randomUUID(),
                            maker.getId(),
                            takerId,
                            maker.getUserAddress(),
                            tradePrice,
                            tradeAmount,
                            feeRates.makerFee(tradeValue),
                            feeRates.takerFee(tradeValue),
                            System.currentTimeMillis()));

                    remaining = remaining.subtract(tradeAmount);
                    maker.setRemainingAmount(maker.getRemainingAmount().subtract(tradeAmount));
                    lastTradePrice.set(PriceLevel.fromDecimal(tradePrice).getRaw());

                    if (maker.isFullyFilled()) {
                        queue.pollFirst();
                        orderIndex.remove(maker.getId());
                        orderCount.decrementAndGet();
                    }
                }

                if (queue.isEmpty()) {
                    levels.remove();
                }
            }
        } finally {
            lock.unlock();
        }

        if (!trades.isEmpty()) {
            log.debug("[Orderbook] 매칭 완료: symbol={}, taker={}, side={}, trades={}, remaining={}",
                    symbol, takerId, side, trades.size(), remaining);
        }
        return new MatchOutcome(trades, remaining);
    }

    /**
     * 매수는 매도 레벨 가격 > 한도, 매도는 매수 레벨 가격 < 한도 이면 중단
     */
    private static boolean crossesLimit(Side takerSide, PriceLevel levelPrice, PriceLevel limit) {
        if (takerSide == Side.BUY) {
            return levelPrice.compareTo(limit) > 0;
        }
        return levelPrice.compareTo(limit) < 0;
    }

    // =====================================================
    // 조회
    // =====================================================

    /**
     * 오더북 스냅샷 (가격 레벨별 잔량 합계)
     *
     * @param depth 사이드별 최대 레벨 수
     */
    public OrderbookSnapshot snapshot(int depth) {
        List<PriceAmount> bidLevels = aggregate(Side.BUY, depth);
        List<PriceAmount> askLevels = aggregate(Side.SELL, depth);
        return new OrderbookSnapshot(symbol, bidLevels, askLevels, getLastTradePrice(), System.currentTimeMillis());
    }

    private List<PriceAmount> aggregate(Side side, int depth) {
        if (depth <= 0) {
            return Collections.emptyList();
        }
        List<PriceAmount> result = new ArrayList<>(Math.min(depth, 64));
        Lock lock = lockFor(side).readLock();
        lock.lock();
        try {
            for (Map.Entry<PriceLevel, ArrayDeque<OrderEntry>> level : sideFor(side).entrySet()) {
                if (result.size() >= depth) {
                    break;
                }
                BigDecimal total = BigDecimal.ZERO;
                for (OrderEntry entry : level.getValue()) {
                    total = total.add(entry.getRemainingAmount());
                }
                result.add(new PriceAmount(level.getKey().toDecimal(), total));
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    /**
     * 최우선 매수호가
     *
     * @return 최고 매수가, 없으면 null
     */
    public BigDecimal getBestBid() {
        return bestPrice(Side.BUY);
    }

    /**
     * 최우선 매도호가
     *
     * @return 최저 매도가, 없으면 null
     */
    public BigDecimal getBestAsk() {
        return bestPrice(Side.SELL);
    }

    /**
     * 스프레드 (최우선 매도호가 - 최우선 매수호가)
     *
     * @return 스프레드, 한쪽이라도 비어 있으면 null
     */
    public BigDecimal getSpread() {
        BigDecimal bid = getBestBid();
        BigDecimal ask = getBestAsk();
        if (bid == null || ask == null) {
            return null;
        }
        return ask.subtract(bid);
    }

    public BigDecimal getBidDepth() {
        return totalAmount(Side.BUY);
    }

    public BigDecimal getAskDepth() {
        return totalAmount(Side.SELL);
    }

    private BigDecimal bestPrice(Side side) {
        Lock lock = lockFor(side).readLock();
        lock.lock();
        try {
            TreeMap<PriceLevel, ArrayDeque<OrderEntry>> book = sideFor(side);
            return book.isEmpty() ? null : book.firstKey().toDecimal();
        } finally {
            lock.unlock();
        }
    }

    private BigDecimal totalAmount(Side side) {
        Lock lock = lockFor(side).readLock();
        lock.lock();
        try {
            BigDecimal total = BigDecimal.ZERO;
            for (ArrayDeque<OrderEntry> queue : sideFor(side).values()) {
                for (OrderEntry entry : queue) {
                    total = total.add(entry.getRemainingAmount());
                }
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    private TreeMap<PriceLevel, ArrayDeque<OrderEntry>> sideFor(Side side) {
        return side == Side.BUY ? bids : asks;
    }

    private ReentrantReadWriteLock lockFor(Side side) {
        return side == Side.BUY ? bidLock : askLock;
    }

    /**
     * 인덱스 값: 사이드, 가격 레벨, 엔트리 참조
     */
    private static final class IndexEntry {
        private final Side side;
        private final PriceLevel level;
        private final OrderEntry entry;

        private IndexEntry(Side side, PriceLevel level, OrderEntry entry) {
            this.side = side;
            this.level = level;
            this.entry = entry;
        }
    }

    /**
     * 매칭 결과 (체결 목록 + 미체결 잔량)
     */
    public static final class MatchOutcome {
        private final List<TradeExecution> trades;
        private final BigDecimal remainingAmount;

        public MatchOutcome(List<TradeExecution> trades, BigDecimal remainingAmount) {
            this.trades = trades;
            this.remainingAmount = remainingAmount;
        }

        public List<TradeExecution> getTrades() {
            return trades;
        }

        public BigDecimal getRemainingAmount() {
            return remainingAmount;
        }
    }
}
