package dustin.perp.domains.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.perp.domains.engine.Orderbook.MatchOutcome;

/**
 * 오더북 매칭 테스트
 * 
 * 테스트 항목:
 * 1. 가격 우선 / 시간 우선 (FIFO)
 * 2. 지정가 한도
 * 3. 수량 보존
 * 4. 취소 멱등성
 * 5. 스냅샷 집계
 * 6. 수수료 계산
 */
class OrderbookTest {

    private static final FeeRates FEES = FeeRates.defaults();

    private Orderbook orderbook;
    private long clock;

    @BeforeEach
    void setUp() {
        orderbook = new Orderbook("BTCUSDT");
        clock = 1_700_000_000_000L;
    }

    private OrderEntry rest(Side side, String price, String amount) {
        OrderEntry entry = OrderEntry.of(UUID.randomUUID(), "0xmaker" + clock, side,
                new BigDecimal(price), new BigDecimal(amount), clock++);
        orderbook.addOrder(entry);
        return entry;
    }

    private MatchOutcome take(Side side, String amount, String limit) {
        return orderbook.matchOrder(UUID.randomUUID(), "0xtaker", side, new BigDecimal(amount),
                limit == null ? null : new BigDecimal(limit), FEES);
    }

    // =====================================================
    // 가격-시간 우선
    // =====================================================

    @Test
    @DisplayName("매도 100 / 101 에 1.5 지정가 매수(101) → 100 에 1.0, 101 에 0.5 체결")
    void limitBuyWalksTwoLevels() {
        // given
        OrderEntry a = rest(Side.SELL, "100.0", "1.0");
        OrderEntry b = rest(Side.SELL, "101.0", "2.0");

        // when
        MatchOutcome outcome = take(Side.BUY, "1.5", "101.0");

        // then
        List<TradeExecution> trades = outcome.getTrades();
        assertThat(trades).hasSize(2);
        assertThat(trades.get(0).getPrice()).isEqualByComparingTo("100.0");
        assertThat(trades.get(0).getAmount()).isEqualByComparingTo("1.0");
        assertThat(trades.get(0).getMakerOrderId()).isEqualTo(a.getId());
        assertThat(trades.get(1).getPrice()).isEqualByComparingTo("101.0");
        assertThat(trades.get(1).getAmount()).isEqualByComparingTo("0.5");
        assertThat(trades.get(1).getMakerOrderId()).isEqualTo(b.getId());
        assertThat(outcome.getRemainingAmount()).isEqualByComparingTo("0");

        assertThat(orderbook.hasOrder(a.getId())).isFalse();
        assertThat(orderbook.getOrder(b.getId()).orElseThrow().getRemainingAmount()).isEqualByComparingTo("1.5");

        BigDecimal average = MatchingEngine.averagePrice(trades, new BigDecimal("1.5"));
        BigDecimal expected = new BigDecimal("100.0").add(new BigDecimal("50.5"))
                .divide(new BigDecimal("1.5"), 18, RoundingMode.HALF_UP);
        assertThat(average).isEqualByComparingTo(expected);
    }

    @Test
    @DisplayName("같은 가격에서는 먼저 들어온 주문이 먼저 체결된다")
    void fifoWithinLevel() {
        OrderEntry first = rest(Side.BUY, "50", "1");
        OrderEntry second = rest(Side.BUY, "50", "1");
        OrderEntry third = rest(Side.BUY, "50", "1");

        MatchOutcome outcome = take(Side.SELL, "2.5", "50");

        assertThat(outcome.getTrades()).extracting(TradeExecution::getMakerOrderId)
                .containsExactly(first.getId(), second.getId(), third.getId());
        assertThat(orderbook.hasOrder(first.getId())).isFalse();
        assertThat(orderbook.hasOrder(second.getId())).isFalse();
        assertThat(orderbook.getOrder(third.getId()).orElseThrow().getRemainingAmount())
                .isEqualByComparingTo("0.5");
    }

    @Test
    @DisplayName("매수 호가는 높은 가격부터 체결된다")
    void bestBidFirst() {
        rest(Side.BUY, "99", "1");
        OrderEntry best = rest(Side.BUY, "101", "1");
        rest(Side.BUY, "100", "1");

        MatchOutcome outcome = take(Side.SELL, "1", null);

        assertThat(outcome.getTrades()).hasSize(1);
        assertThat(outcome.getTrades().get(0).getMakerOrderId()).isEqualTo(best.getId());
        assertThat(orderbook.getBestBid()).isEqualByComparingTo("100");
    }

    // =====================================================
    // 지정가 한도
    // =====================================================

    @Test
    @DisplayName("지정가 매수는 한도보다 비싼 호가와 체결하지 않는다")
    void limitBuyNeverAboveLimit() {
        rest(Side.SELL, "100", "1");
        rest(Side.SELL, "102", "5");

        MatchOutcome outcome = take(Side.BUY, "3", "101");

        assertThat(outcome.getTrades()).allSatisfy(t -> assertThat(t.getPrice()).isLessThanOrEqualTo(new BigDecimal("101")));
        assertThat(outcome.getRemainingAmount()).isEqualByComparingTo("2");
        assertThat(orderbook.getBestAsk()).isEqualByComparingTo("102");
    }

    @Test
    @DisplayName("지정가 매도는 한도보다 싼 호가와 체결하지 않는다")
    void limitSellNeverBelowLimit() {
        rest(Side.BUY, "98", "1");
        rest(Side.BUY, "97", "1");

        MatchOutcome outcome = take(Side.SELL, "2", "98");

        assertThat(outcome.getTrades()).hasSize(1);
        assertThat(outcome.getTrades().get(0).getPrice()).isEqualByComparingTo("98");
        assertThat(outcome.getRemainingAmount()).isEqualByComparingTo("1");
    }

    // =====================================================
    // 수량 보존 / 수수료
    // =====================================================

    @Test
    @DisplayName("체결 수량 합 = 테이커 소진 수량, 메이커 잔량은 공급한 만큼 감소")
    void conservation() {
        OrderEntry a = rest(Side.SELL, "10", "0.3");
        OrderEntry b = rest(Side.SELL, "10", "0.7");
        OrderEntry c = rest(Side.SELL, "11", "4");
        BigDecimal cBefore = c.getRemainingAmount();

        BigDecimal amount = new BigDecimal("2.25");
        MatchOutcome outcome = orderbook.matchOrder(UUID.randomUUID(), "0xtaker", Side.BUY, amount, null, FEES);

        BigDecimal traded = outcome.getTrades().stream()
                .map(TradeExecution::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(traded).isEqualByComparingTo(amount.subtract(outcome.getRemainingAmount()));
        assertThat(traded).isEqualByComparingTo("2.25");

        BigDecimal suppliedByC = outcome.getTrades().stream()
                .filter(t -> t.getMakerOrderId().equals(c.getId()))
                .map(TradeExecution::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(orderbook.getOrder(c.getId()).orElseThrow().getRemainingAmount())
                .isEqualByComparingTo(cBefore.subtract(suppliedByC));
        assertThat(orderbook.hasOrder(a.getId())).isFalse();
        assertThat(orderbook.hasOrder(b.getId())).isFalse();
    }

    @Test
    @DisplayName("100 에 1.0 체결 → 메이커 0.02, 테이커 0.05")
    void feeCalculation() {
        rest(Side.SELL, "100.0", "1.0");

        MatchOutcome outcome = take(Side.BUY, "1.0", "100.0");

        TradeExecution trade = outcome.getTrades().get(0);
        assertThat(trade.getMakerFee()).isEqualByComparingTo("0.02");
        assertThat(trade.getTakerFee()).isEqualByComparingTo("0.05");
    }

    @Test
    @DisplayName("빈 오더북에 시장가 매수 → 체결 없음, 전량 잔여")
    void marketOnEmptyBook() {
        MatchOutcome outcome = take(Side.BUY, "5.0", null);

        assertThat(outcome.getTrades()).isEmpty();
        assertThat(outcome.getRemainingAmount()).isEqualByComparingTo("5.0");
    }

    // =====================================================
    // 취소
    // =====================================================

    @Test
    @DisplayName("같은 주문을 두 번 취소하면 두 번째는 empty")
    void cancelIsIdempotent() {
        OrderEntry entry = rest(Side.BUY, "100", "1");

        Optional<OrderEntry> first = orderbook.cancelOrder(entry.getId());
        Optional<OrderEntry> second = orderbook.cancelOrder(entry.getId());

        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        assertThat(orderbook.getOrderCount()).isZero();
        assertThat(orderbook.getBestBid()).isNull();
    }

    @Test
    @DisplayName("전량 체결된 주문은 취소할 수 없다")
    void cancelAfterFullFill() {
        OrderEntry entry = rest(Side.SELL, "100", "1");
        take(Side.BUY, "1", "100");

        assertThat(orderbook.cancelOrder(entry.getId())).isEmpty();
    }

    @Test
    @DisplayName("취소와 매칭이 동시에 일어나도 한 주문이 취소되면서 체결되지는 않는다")
    void cancelRacesWithMatch() throws Exception {
        int makers = 200;
        List<OrderEntry> entries = new ArrayList<>();
        for (int i = 0; i < makers; i++) {
            entries.add(rest(Side.SELL, "100", "1"));
        }

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<List<UUID>> cancelled = pool.submit(() -> {
                start.await();
                List<UUID> ids = new ArrayList<>();
                for (int i = entries.size() - 1; i >= 0; i--) {
                    UUID id = entries.get(i).getId();
                    if (orderbook.cancelOrder(id).isPresent()) {
                        ids.add(id);
                    }
                }
                return ids;
            });
            Future<MatchOutcome> matched = pool.submit(() -> {
                start.await();
                return take(Side.BUY, String.valueOf(makers), null);
            });
            start.countDown();

            List<UUID> cancelledIds = cancelled.get(10, TimeUnit.SECONDS);
            MatchOutcome outcome = matched.get(10, TimeUnit.SECONDS);

            List<UUID> filledIds = outcome.getTrades().stream().map(TradeExecution::getMakerOrderId).toList();
            assertThat(filledIds).doesNotContainAnyElementsOf(cancelledIds);
            assertThat(cancelledIds.size() + filledIds.size()).isEqualTo(makers);
            assertThat(orderbook.getOrderCount()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    // =====================================================
    // 스냅샷
    // =====================================================

    @Test
    @DisplayName("스냅샷의 레벨 수량은 그 레벨 주문 잔량의 합")
    void snapshotAggregatesLevels() {
        rest(Side.BUY, "99", "1");
        rest(Side.BUY, "99", "2.5");
        rest(Side.BUY, "98", "4");
        rest(Side.SELL, "101", "0.5");
        rest(Side.SELL, "102", "0.25");
        rest(Side.SELL, "103", "1");

        OrderbookSnapshot snapshot = orderbook.snapshot(2);

        assertThat(snapshot.getBids()).hasSize(2);
        assertThat(snapshot.getBids().get(0).getPrice()).isEqualByComparingTo("99");
        assertThat(snapshot.getBids().get(0).getAmount()).isEqualByComparingTo("3.5");
        assertThat(snapshot.getBids().get(1).getAmount()).isEqualByComparingTo("4");
        assertThat(snapshot.getAsks()).hasSize(2);
        assertThat(snapshot.getAsks().get(0).getPrice()).isEqualByComparingTo("101");
        assertThat(snapshot.getAsks().get(1).getPrice()).isEqualByComparingTo("102");
        assertThat(snapshot.getLastPrice()).isNull();

        assertThat(orderbook.getSpread()).isEqualByComparingTo("2");
        assertThat(orderbook.getBidDepth()).isEqualByComparingTo("7.5");
        assertThat(orderbook.getAskDepth()).isEqualByComparingTo("1.75");
    }

    @Test
    @DisplayName("체결 후 마지막 체결가가 기록된다")
    void lastTradePriceUpdated() {
        rest(Side.SELL, "100.5", "1");
        take(Side.BUY, "0.4", null);

        assertThat(orderbook.getLastTradePrice()).isEqualByComparingTo("100.5");
        assertThat(orderbook.snapshot(5).getAsks().get(0).getAmount()).isEqualByComparingTo("0.6");
    }

    @Test
    @DisplayName("마지막 체결가 직접 설정, 소수점 8 자리 아래는 버림")
    void setLastTradePrice() {
        assertThat(orderbook.getLastTradePrice()).isNull();

        orderbook.setLastTradePrice(new BigDecimal("101.123456789"));

        assertThat(orderbook.getLastTradePrice()).isEqualByComparingTo("101.12345678");
        assertThat(orderbook.snapshot(5).getLastPrice()).isEqualByComparingTo("101.12345678");
    }
}
