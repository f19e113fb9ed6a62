package dustin.perp.domains.order;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.lang.reflect.Proxy;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.SimpleTransactionStatus;

import dustin.perp.config.MatchingProperties;
import dustin.perp.domains.engine.FeeRates;
import dustin.perp.domains.engine.MatchResult;
import dustin.perp.domains.engine.MatchingEngine;
import dustin.perp.domains.engine.OrderStatus;
import dustin.perp.domains.engine.OrderType;
import dustin.perp.domains.engine.Side;
import dustin.perp.domains.engine.SymbolRegistry;
import dustin.perp.domains.engine.TradeEvent;
import dustin.perp.domains.engine.broadcast.BroadcastReceiver;
import dustin.perp.domains.fee.repository.FeeConfigRepository;
import dustin.perp.domains.fee.service.FeeConfigService;
import dustin.perp.domains.order.repository.OrderRepository;
import dustin.perp.domains.order.service.OrderFlowOrchestrator;
import dustin.perp.domains.position.repository.PositionRepository;
import dustin.perp.domains.position.service.PositionService;
import dustin.perp.domains.referral.repository.ReferralEarningRepository;
import dustin.perp.domains.referral.repository.UserAccountRepository;
import dustin.perp.domains.referral.service.ReferralService;
import dustin.perp.domains.trade.repository.TradeRepository;

/**
 * DB 장애 시 주문 흐름 테스트
 * 
 * 모든 리포지토리 호출이 실패해도:
 * 1. 매칭 결과와 오더북 상태는 그대로 확정
 * 2. 체결 브로드캐스트는 정상 전달
 * 3. 체결 저장 워커는 실패 후에도 다음 체결을 계속 처리
 */
class OrderFlowFailureTest {

    private static final String SYMBOL = "BTCUSDT";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final AtomicInteger orderRepositoryCalls = new AtomicInteger();
    private final AtomicInteger tradeRepositoryCalls = new AtomicInteger();

    private MatchingEngine engine;
    private OrderFlowOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        engine = new MatchingEngine(SymbolRegistry.of(SYMBOL), symbol -> FeeRates.defaults(),
                1000, 100, 20, 100, 100);

        MatchingProperties properties = new MatchingProperties();
        FeeConfigService feeConfigService = new FeeConfigService(emptyFeeConfigs(), properties);
        feeConfigService.loadFeeConfigs();

        orchestrator = new OrderFlowOrchestrator(
                engine,
                failing(OrderRepository.class, orderRepositoryCalls),
                failing(TradeRepository.class, tradeRepositoryCalls),
                new PositionService(failing(PositionRepository.class, new AtomicInteger())),
                new ReferralService(failing(UserAccountRepository.class, new AtomicInteger()),
                        failing(ReferralEarningRepository.class, new AtomicInteger())),
                feeConfigService,
                properties,
                Runnable::run,
                new NoOpTransactionManager());
    }

    @AfterEach
    void tearDown() {
        orchestrator.stop();
        engine.shutdown();
    }

    // =====================================================
    // 주문 저장 실패
    // =====================================================

    @Test
    @DisplayName("주문 저장이 실패해도 매칭 결과와 오더북 등록은 유지된다")
    void orderPersistenceFailureKeepsMatch() {
        // when
        MatchResult result = orchestrator.processOrder(SYMBOL, "0xmaker", Side.BUY, OrderType.LIMIT,
                new BigDecimal("2"), new BigDecimal("100"), 5);

        // then
        assertThat(orderRepositoryCalls.get()).isPositive();
        assertThat(result.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(result.getRemainingAmount()).isEqualByComparingTo("2");
        assertThat(engine.findOrderbook(SYMBOL).hasOrder(result.getOrderId())).isTrue();
        assertThat(orchestrator.getOrderbook(SYMBOL, 10).getBids()).hasSize(1);
        assertThat(orchestrator.getOrderbook(SYMBOL, 10).getBids().get(0).getAmount())
                .isEqualByComparingTo("2");
    }

    @Test
    @DisplayName("취소 상태 저장이 실패해도 엔진 취소는 확정된다")
    void statusUpdateFailureKeepsCancel() {
        MatchResult result = orchestrator.processOrder(SYMBOL, "0xmaker", Side.SELL, OrderType.LIMIT,
                new BigDecimal("1"), new BigDecimal("101"), 1);
        int callsBeforeCancel = orderRepositoryCalls.get();

        assertThat(orchestrator.cancelOrder(SYMBOL, result.getOrderId(), "0xmaker")).isTrue();

        assertThat(orderRepositoryCalls.get()).isGreaterThan(callsBeforeCancel);
        assertThat(engine.findOrderbook(SYMBOL).hasOrder(result.getOrderId())).isFalse();
        assertThat(orchestrator.cancelOrder(SYMBOL, result.getOrderId(), "0xmaker")).isFalse();
    }

    // =====================================================
    // 체결 저장 실패
    // =====================================================

    @Test
    @DisplayName("체결 저장이 실패해도 브로드캐스트는 전달되고 워커는 다음 체결을 계속 처리한다")
    void tradePersistenceFailureKeepsWorkerRunning() throws Exception {
        // given
        BroadcastReceiver<TradeEvent> observer = engine.subscribeTrades();
        orchestrator.start();
        MatchResult maker = orchestrator.processOrder(SYMBOL, "0xmaker", Side.SELL, OrderType.LIMIT,
                new BigDecimal("2"), new BigDecimal("100"), 5);

        // when
        MatchResult first = orchestrator.processOrder(SYMBOL, "0xtaker", Side.BUY, OrderType.MARKET,
                new BigDecimal("0.5"), null, 10);
        MatchResult second = orchestrator.processOrder(SYMBOL, "0xtaker", Side.BUY, OrderType.MARKET,
                new BigDecimal("0.5"), null, 10);

        // then: 매칭 결과
        assertThat(first.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(second.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(engine.findOrderbook(SYMBOL).hasOrder(maker.getOrderId())).isTrue();
        assertThat(orchestrator.getOrderbook(SYMBOL, 10).getAsks().get(0).getAmount())
                .isEqualByComparingTo("1");

        // then: 브로드캐스트
        TradeEvent firstEvent = observer.recv(1, TimeUnit.SECONDS);
        TradeEvent secondEvent = observer.recv(1, TimeUnit.SECONDS);
        assertThat(List.of(firstEvent.getTradeId(), secondEvent.getTradeId()))
                .containsExactly(first.getTrades().get(0).getTradeId(), second.getTrades().get(0).getTradeId());
        observer.close();

        // then: 첫 체결 저장 실패 후에도 두 번째 체결까지 저장 시도
        await().atMost(TIMEOUT).until(() -> tradeRepositoryCalls.get() >= 2);
    }

    // =====================================================
    // 테스트용 협력 객체
    // =====================================================

    /**
     * 모든 호출에서 실패하는 리포지토리 (호출 횟수 기록)
     */
    @SuppressWarnings("unchecked")
    private static <T> T failing(Class<T> type, AtomicInteger calls) {
        return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[] { type },
                (proxy, method, args) -> {
                    if (method.getDeclaringClass() == Object.class) {
                        switch (method.getName()) {
                            case "equals":
                                return proxy == args[0];
                            case "hashCode":
                                return System.identityHashCode(proxy);
                            default:
                                return type.getSimpleName();
                        }
                    }
                    calls.incrementAndGet();
                    throw new IllegalStateException("database unavailable: " + method.getName());
                });
    }

    private static FeeConfigRepository emptyFeeConfigs() {
        return (FeeConfigRepository) Proxy.newProxyInstance(FeeConfigRepository.class.getClassLoader(),
                new Class<?>[] { FeeConfigRepository.class },
                (proxy, method, args) -> {
                    if (method.getName().equals("findByIsActiveTrue")) {
                        return List.of();
                    }
                    throw new UnsupportedOperationException(method.getName());
                });
    }

    private static final class NoOpTransactionManager implements PlatformTransactionManager {

        @Override
        public TransactionStatus getTransaction(TransactionDefinition definition) {
            return new SimpleTransactionStatus();
        }

        @Override
        public void commit(TransactionStatus status) {
        }

        @Override
        public void rollback(TransactionStatus status) {
        }
    }
}
