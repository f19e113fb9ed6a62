package dustin.perp.shared.kafka;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import dustin.perp.domains.engine.MatchingEngine;
import dustin.perp.domains.engine.OrderbookUpdate;
import dustin.perp.domains.engine.TradeEvent;
import dustin.perp.domains.engine.broadcast.BroadcastReceiver;
import dustin.perp.domains.engine.broadcast.ChannelClosedException;
import dustin.perp.domains.engine.broadcast.LaggedException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * 시장 데이터 릴레이
 * Market Event Relay
 * 
 * 역할:
 * - 매칭 엔진의 체결 / 오더북 브로드캐스트를 구독해서 Kafka 로 전달
 * - 토픽: trade-executed-{symbol}, orderbook-updated-{symbol} (소문자)
 * 
 * 작동 방식:
 * 1. 채널마다 워커 스레드 하나
 * 2. 이벤트를 JSON 으로 직렬화해 발행
 * 3. 밀리면(lagged) 경고 후 계속, 채널이 닫히면 종료
 * 
 * kafka.relay.enabled=true 일 때만 등록됩니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "kafka.relay.enabled", havingValue = "true")
public class MarketEventRelay {

    private static final long RECEIVE_TIMEOUT_MS = 500;

    private final MatchingEngine matchingEngine;
    private final KafkaEventProducer kafkaEventProducer;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final List<Thread> workers = new ArrayList<>();
    private volatile boolean running = false;

    public MarketEventRelay(MatchingEngine matchingEngine, KafkaEventProducer kafkaEventProducer) {
        this.matchingEngine = matchingEngine;
        this.kafkaEventProducer = kafkaEventProducer;
    }

    @PostConstruct
    public void start() {
        running = true;
        BroadcastReceiver<TradeEvent> trades = matchingEngine.subscribeTrades();
        BroadcastReceiver<OrderbookUpdate> orderbooks = matchingEngine.subscribeOrderbook();
        startWorker("trade-relay", trades, this::relayTrade);
        startWorker("orderbook-relay", orderbooks, this::relayOrderbook);
        log.info("[MarketEventRelay] 시장 데이터 릴레이 시작");
    }

    @PreDestroy
    public void stop() {
        running = false;
        for (Thread worker : workers) {
            worker.interrupt();
        }
        log.info("[MarketEventRelay] 시장 데이터 릴레이 종료");
    }

    /**
     * 체결 이벤트 → trade-executed-{symbol}
     */
    public void relayTrade(TradeEvent event) {
        String json = toJson(event);
        if (json != null) {
            kafkaEventProducer.publishTradeExecuted(event.getSymbol(), json);
        }
    }

    /**
     * 오더북 변경 → orderbook-updated-{symbol}
     */
    public void relayOrderbook(OrderbookUpdate update) {
        String json = toJson(update);
        if (json != null) {
            kafkaEventProducer.publishOrderbookUpdated(update.getSymbol(), json);
        }
    }

    private <T> void startWorker(String name, BroadcastReceiver<T> receiver, Consumer<T> handler) {
        Thread worker = new Thread(() -> runLoop(name, receiver, handler), name);
        worker.setDaemon(true);
        workers.add(worker);
        worker.start();
    }

    private <T> void runLoop(String name, BroadcastReceiver<T> receiver, Consumer<T> handler) {
        try (receiver) {
            while (running) {
                T message;
                try {
                    message = receiver.recv(RECEIVE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                } catch (LaggedException e) {
                    log.warn("[MarketEventRelay] {} 지연: lagged {} messages", name, e.getSkipped());
                    continue;
                } catch (ChannelClosedException e) {
                    log.info("[MarketEventRelay] {} 채널 종료, 워커 정지", name);
                    break;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (message == null) {
                    continue;
                }
                try {
                    handler.accept(message);
                } catch (Exception e) {
                    log.error("[MarketEventRelay] {} 발행 실패", name, e);
                }
            }
        }
    }

    private String toJson(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[MarketEventRelay] JSON 직렬화 실패: {}", e.getMessage());
            return null;
        }
    }
}
