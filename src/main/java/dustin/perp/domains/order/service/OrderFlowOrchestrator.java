package dustin.perp.domains.order.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import dustin.perp.config.MatchingProperties;
import dustin.perp.domains.engine.MatchResult;
import dustin.perp.domains.engine.MatchingEngine;
import dustin.perp.domains.engine.OrderStatus;
import dustin.perp.domains.engine.OrderType;
import dustin.perp.domains.engine.OrderbookSnapshot;
import dustin.perp.domains.engine.Side;
import dustin.perp.domains.engine.TradeEvent;
import dustin.perp.domains.engine.TradeExecution;
import dustin.perp.domains.engine.broadcast.BroadcastReceiver;
import dustin.perp.domains.engine.broadcast.ChannelClosedException;
import dustin.perp.domains.engine.broadcast.LaggedException;
import dustin.perp.domains.engine.history.OrderHistoryQuery;
import dustin.perp.domains.engine.history.OrderHistoryResponse;
import dustin.perp.domains.engine.history.TradeHistoryQuery;
import dustin.perp.domains.engine.history.TradeHistoryResponse;
import dustin.perp.domains.fee.service.FeeConfigService;
import dustin.perp.domains.order.model.entity.Order;
import dustin.perp.domains.order.repository.OrderRepository;
import dustin.perp.domains.position.model.entity.PositionSide;
import dustin.perp.domains.position.service.PositionService;
import dustin.perp.domains.referral.service.ReferralService;
import dustin.perp.domains.trade.model.entity.Trade;
import dustin.perp.domains.trade.repository.TradeRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * 주문 흐름 오케스트레이터
 * Order Flow Orchestrator
 * 
 * 역할:
 * - 주문 접수 → 매칭 엔진 (동기, 메모리)
 * - 주문 결과 DB 저장 (비동기, persistenceExecutor)
 * - 체결 이벤트 구독 → 체결 / 포지션 / 레퍼럴 저장 (백그라운드 워커)
 * 
 * 처리 흐름:
 * 1. 레버리지 / 주소 검증
 * 2. 주문 ID(UUID) 발급 후 엔진에 제출
 * 3. 주문 저장 작업을 스레드 풀에 넘기고 즉시 결과 반환
 * 4. 워커가 체결 브로드캐스트를 받아 하나씩 저장
 * 
 * 주의사항:
 * - 매칭 결과는 DB 저장 성공 여부와 무관하게 확정됩니다 (저장 실패는 로그만)
 * - 체결 브로드캐스트는 손실 허용이라 워커가 밀리면 체결 저장이 누락될 수 있습니다 (lagged 경고)
 * - 주문 저장과 체결 저장은 서로 다른 스레드라 순서가 보장되지 않습니다
 *   (레버리지를 못 찾으면 해당 쪽 포지션 반영은 건너뜀)
 */
@Slf4j
@Service
public class OrderFlowOrchestrator {

    private static final long RECEIVE_TIMEOUT_MS = 500;
    private static final long WORKER_JOIN_TIMEOUT_MS = 5000;

    private final MatchingEngine matchingEngine;
    private final OrderRepository orderRepository;
    private final TradeRepository tradeRepository;
    private final PositionService positionService;
    private final ReferralService referralService;
    private final FeeConfigService feeConfigService;
    private final MatchingProperties matchingProperties;
    private final Executor persistenceExecutor;
    private final TransactionTemplate transactionTemplate;

    private volatile boolean running = false;
    private Thread persistenceWorker;

    public OrderFlowOrchestrator(
            MatchingEngine matchingEngine,
            OrderRepository orderRepository,
            TradeRepository tradeRepository,
            PositionService positionService,
            ReferralService referralService,
            FeeConfigService feeConfigService,
            MatchingProperties matchingProperties,
            @Qualifier("persistenceExecutor") Executor persistenceExecutor,
            PlatformTransactionManager transactionManager) {
        this.matchingEngine = matchingEngine;
        this.orderRepository = orderRepository;
        this.tradeRepository = tradeRepository;
        this.positionService = positionService;
        this.referralService = referralService;
        this.feeConfigService = feeConfigService;
        this.matchingProperties = matchingProperties;
        this.persistenceExecutor = persistenceExecutor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // =====================================================
    // 체결 저장 워커
    // =====================================================

    /**
     * 체결 저장 워커 시작
     * Start the trade persistence worker
     */
    @PostConstruct
    public void start() {
        BroadcastReceiver<TradeEvent> receiver = matchingEngine.subscribeTrades();
        running = true;
        persistenceWorker = new Thread(() -> runPersistenceLoop(receiver), "trade-persistence-worker");
        persistenceWorker.setDaemon(true);
        persistenceWorker.start();
        log.info("[OrderFlowOrchestrator] 체결 저장 워커 시작");
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (persistenceWorker != null) {
            persistenceWorker.interrupt();
            try {
                persistenceWorker.join(WORKER_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("[OrderFlowOrchestrator] 체결 저장 워커 종료");
    }

    private void runPersistenceLoop(BroadcastReceiver<TradeEvent> receiver) {
        try (receiver) {
            while (running) {
                TradeEvent event;
                try {
                    event = receiver.recv(RECEIVE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                } catch (LaggedException e) {
                    log.warn("[OrderFlowOrchestrator] 체결 저장 지연: lagged {} messages", e.getSkipped());
                    continue;
                } catch (ChannelClosedException e) {
                    log.info("[OrderFlowOrchestrator] 체결 채널 종료, 워커 정지");
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }

                if (event == null) {
                    continue;
                }
                try {
                    persistTrade(event);
                } catch (Exception e) {
                    log.error("[OrderFlowOrchestrator] 체결 저장 실패: tradeId={}", event.getTradeId(), e);
                }
            }
        }
    }

    // =====================================================
    // 주문 접수 / 취소 / 조회
    // =====================================================

    /**
     * 주문 처리
     * Process order
     * 
     * @param symbol 심볼
     * @param userAddress 주문자 주소
     * @param side 매수/매도
     * @param orderType 지정가/시장가
     * @param amount 수량
     * @param price 지정가 (시장가는 null)
     * @param leverage 레버리지 (1 ~ matching.max-leverage)
     * @return 매칭 결과 (DB 저장 완료 전에 반환)
     * @throws IllegalArgumentException 레버리지 범위 밖이거나 주소가 비어 있을 때
     * @throws dustin.perp.domains.engine.MatchingException 엔진 검증 실패 시
     */
    public MatchResult processOrder(String symbol, String userAddress, Side side, OrderType orderType,
                                    BigDecimal amount, BigDecimal price, int leverage) {
        if (leverage < 1 || leverage > matchingProperties.getMaxLeverage()) {
            throw new IllegalArgumentException(
                    "Leverage must be between 1 and " + matchingProperties.getMaxLeverage() + ": " + leverage);
        }
        if (userAddress == null || userAddress.isBlank()) {
            throw new IllegalArgumentException("User address is required");
        }

        log.debug("[OrderFlowOrchestrator] 주문 처리: symbol={}, user={}, side={}, type={}, amount={}, price={}",
                symbol, userAddress, side, orderType, amount, price);

        UUID orderId = UUID.randomUUID();
        MatchResult result = matchingEngine.submitOrder(
                orderId, symbol, userAddress, side, orderType, amount, price, leverage);

        persistenceExecutor.execute(() -> {
            try {
                persistOrder(symbol, userAddress, result, side, orderType, amount, price, leverage);
            } catch (Exception e) {
                log.error("[OrderFlowOrchestrator] 주문 저장 실패: orderId={}", orderId, e);
            }
        });

        log.info("[OrderFlowOrchestrator] 주문 처리 완료: id={}, status={}, filled={}",
                result.getOrderId(), result.getStatus().getValue(), result.getFilledAmount());
        return result;
    }

    /**
     * 주문 취소
     * Cancel order
     * 
     * @return 취소되었으면 true (DB 상태 변경은 비동기)
     */
    public boolean cancelOrder(String symbol, UUID orderId, String userAddress) {
        boolean cancelled = matchingEngine.cancelOrder(symbol, orderId, userAddress);
        if (cancelled) {
            persistenceExecutor.execute(() -> {
                try {
                    updateOrderStatus(orderId, OrderStatus.CANCELLED.getValue());
                } catch (Exception e) {
                    log.error("[OrderFlowOrchestrator] 주문 상태 변경 실패: orderId={}", orderId, e);
                }
            });
            log.info("[OrderFlowOrchestrator] 주문 취소: id={}", orderId);
        }
        return cancelled;
    }

    public OrderbookSnapshot getOrderbook(String symbol, int depth) {
        return matchingEngine.getOrderbook(symbol, depth);
    }

    public TradeHistoryResponse getTrades(String symbol, TradeHistoryQuery query) {
        return matchingEngine.getTrades(symbol, query);
    }

    public OrderHistoryResponse getOrders(String userAddress, OrderHistoryQuery query) {
        return matchingEngine.getOrders(userAddress, query);
    }

    // =====================================================
    // DB 저장
    // =====================================================

    /**
     * 주문 결과 저장
     * Persist order
     * 
     * 1. 주문 upsert (없으면 생성, 있으면 상태 / 체결 수량 갱신)
     * 2. 이 주문으로 체결된 메이커 주문마다 체결 수량 누적 + 상태 갱신
     */
    public void persistOrder(String symbol, String userAddress, MatchResult result, Side side,
                             OrderType orderType, BigDecimal amount, BigDecimal price, int leverage) {
        transactionTemplate.executeWithoutResult(status -> {
            Optional<Order> existing = orderRepository.findByIdForUpdate(result.getOrderId());
            Order order;
            if (existing.isPresent()) {
                order = existing.get();
                order.setStatus(result.getStatus().getValue());
                order.setFilledAmount(result.getFilledAmount());
            } else {
                order = Order.builder()
                        .id(result.getOrderId())
                        .symbol(symbol)
                        .userAddress(userAddress)
                        .side(side.getValue())
                        .orderType(orderType.getValue())
                        .status(result.getStatus().getValue())
                        .price(orderType == OrderType.LIMIT ? price : null)
                        .amount(amount)
                        .filledAmount(result.getFilledAmount())
                        .leverage(leverage)
                        .build();
            }
            orderRepository.save(order);

            LocalDateTime now = LocalDateTime.now();
            for (TradeExecution trade : result.getTrades()) {
                int updated = orderRepository.applyMakerFill(trade.getMakerOrderId(), trade.getAmount(), now);
                if (updated == 0) {
                    log.warn("[OrderFlowOrchestrator] 메이커 주문 없음: makerOrderId={}", trade.getMakerOrderId());
                }
            }
        });
        log.debug("[OrderFlowOrchestrator] 주문 저장: id={}", result.getOrderId());
    }

    /**
     * 주문 상태 변경
     */
    public void updateOrderStatus(UUID orderId, String status) {
        Integer updated = transactionTemplate.execute(
                tx -> orderRepository.updateStatus(orderId, status, LocalDateTime.now()));
        log.debug("[OrderFlowOrchestrator] 주문 상태 변경: id={}, status={}, rows={}", orderId, status, updated);
    }

    /**
     * 체결 저장 + 포지션 / 레퍼럴 반영
     * Persist a trade and update positions
     * 
     * 1. 수수료 재계산 (수수료 설정 기준), 같은 체결 ID 가 없을 때만 저장
     * 2. 메이커 / 테이커 주문의 레버리지 조회 (없으면 경고 후 해당 쪽 건너뜀)
     * 3. 포지션 증가: 테이커는 체결 방향, 메이커는 반대 방향 (담보 = 체결 금액 / 레버리지)
     * 4. 추천인이 있으면 커미션 적립
     * 
     * 포지션 반영 실패는 로그만 남기고 다음 단계로 진행합니다.
     * 
     * @return 새로 저장했으면 true, 이미 저장된 체결이면 false
     */
    public boolean persistTrade(TradeEvent event) {
        BigDecimal tradeValue = event.getTradeValue();
        BigDecimal makerFee = feeConfigService.calculateMakerFee(event.getSymbol(), tradeValue);
        BigDecimal takerFee = feeConfigService.calculateTakerFee(event.getSymbol(), tradeValue);

        Boolean inserted = transactionTemplate.execute(status -> insertTrade(event, makerFee, takerFee));
        if (!Boolean.TRUE.equals(inserted)) {
            log.debug("[OrderFlowOrchestrator] 이미 저장된 체결: tradeId={}", event.getTradeId());
            return false;
        }

        updatePositions(event);

        transactionTemplate.executeWithoutResult(
                status -> recordReferralCommissions(event, tradeValue, makerFee, takerFee));

        log.debug("[OrderFlowOrchestrator] 체결 저장: tradeId={}", event.getTradeId());
        return true;
    }

    /**
     * 체결 일괄 저장 (단일 트랜잭션)
     * Batch persist trades
     * 
     * 체결 저장과 레퍼럴 적립만 수행합니다 (포지션 반영 없음).
     * 
     * @return 처리한 체결 수
     */
    public int batchPersistTrades(List<TradeEvent> events) {
        if (events == null || events.isEmpty()) {
            return 0;
        }

        Integer count = transactionTemplate.execute(status -> {
            int processed = 0;
            for (TradeEvent event : events) {
                BigDecimal tradeValue = event.getTradeValue();
                BigDecimal makerFee = feeConfigService.calculateMakerFee(event.getSymbol(), tradeValue);
                BigDecimal takerFee = feeConfigService.calculateTakerFee(event.getSymbol(), tradeValue);
                if (insertTrade(event, makerFee, takerFee)) {
                    recordReferralCommissions(event, tradeValue, makerFee, takerFee);
                }
                processed++;
            }
            return processed;
        });

        log.info("[OrderFlowOrchestrator] 체결 일괄 저장: count={}", count);
        return count == null ? 0 : count;
    }

    private boolean insertTrade(TradeEvent event, BigDecimal makerFee, BigDecimal takerFee) {
        if (tradeRepository.existsById(event.getTradeId())) {
            return false;
        }
        tradeRepository.save(Trade.from(event, makerFee, takerFee));
        return true;
    }

    private void updatePositions(TradeEvent event) {
        Optional<Integer> makerLeverage = orderRepository.findLeverageById(event.getMakerOrderId());
        Optional<Integer> takerLeverage = orderRepository.findLeverageById(event.getTakerOrderId());

        log.debug("[OrderFlowOrchestrator] 체결 레버리지: tradeId={}, maker={}, taker={}",
                event.getTradeId(), makerLeverage.orElse(null), takerLeverage.orElse(null));

        Side takerSide = Side.fromValue(event.getSide());
        PositionSide takerPositionSide = takerSide == Side.BUY ? PositionSide.LONG : PositionSide.SHORT;

        if (makerLeverage.isPresent()) {
            increasePosition(event, event.getMakerAddress(), takerPositionSide.opposite(), makerLeverage.get());
        } else {
            log.warn("[OrderFlowOrchestrator] 메이커 주문 레버리지 없음, 포지션 반영 건너뜀: orderId={}",
                    event.getMakerOrderId());
        }

        if (takerLeverage.isPresent()) {
            increasePosition(event, event.getTakerAddress(), takerPositionSide, takerLeverage.get());
        } else {
            log.warn("[OrderFlowOrchestrator] 테이커 주문 레버리지 없음, 포지션 반영 건너뜀: orderId={}",
                    event.getTakerOrderId());
        }
    }

    private void increasePosition(TradeEvent event, String userAddress, PositionSide side, int leverage) {
        BigDecimal collateral = event.getTradeValue()
                .divide(BigDecimal.valueOf(leverage), 18, RoundingMode.HALF_UP);
        try {
            positionService.increasePosition(userAddress, event.getSymbol(), side, collateral, leverage,
                    event.getPrice(), true);
            log.info("[OrderFlowOrchestrator] 포지션 반영: user={}, symbol={}, side={}, collateral={}",
                    userAddress, event.getSymbol(), side.getValue(), collateral);
        } catch (Exception e) {
            log.error("[OrderFlowOrchestrator] 포지션 반영 실패: user={}, symbol={}, side={}",
                    userAddress, event.getSymbol(), side.getValue(), e);
        }
    }

    private void recordReferralCommissions(TradeEvent event, BigDecimal tradeValue,
                                           BigDecimal makerFee, BigDecimal takerFee) {
        referralService.recordTradeCommission(event.getMakerAddress(), event.getTradeId(), tradeValue,
                makerFee, event.getTimestamp());
        referralService.recordTradeCommission(event.getTakerAddress(), event.getTradeId(), tradeValue,
                takerFee, event.getTimestamp());
    }
}
