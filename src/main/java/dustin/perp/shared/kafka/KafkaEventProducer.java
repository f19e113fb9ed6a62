package dustin.perp.shared.kafka;

import java.util.Locale;

import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 이벤트 발행자
 * Kafka Event Producer
 * 
 * 역할:
 * - 체결 / 오더북 변경 이벤트를 심볼별 토픽으로 발행
 * - 심볼을 키로 사용 (같은 심볼은 같은 파티션 → 순서 유지)
 * 
 * 주의사항:
 * - 발행은 비동기 (논블로킹)
 * - 실패해도 매칭에는 영향 없음 (로깅만)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaEventProducer {

    public static final String TRADE_TOPIC_PREFIX = "trade-executed-";
    public static final String ORDERBOOK_TOPIC_PREFIX = "orderbook-updated-";

    private final KafkaTemplate<String, String> kafkaTemplate;

    /**
     * 체결 이벤트 발행
     * Publish trade executed event
     */
    public void publishTradeExecuted(String symbol, String tradeJson) {
        publish(tradeTopic(symbol), symbol, tradeJson);
    }

    /**
     * 오더북 변경 이벤트 발행
     * Publish orderbook updated event
     */
    public void publishOrderbookUpdated(String symbol, String orderbookJson) {
        publish(orderbookTopic(symbol), symbol, orderbookJson);
    }

    public static String tradeTopic(String symbol) {
        return TRADE_TOPIC_PREFIX + symbol.toLowerCase(Locale.ROOT);
    }

    public static String orderbookTopic(String symbol) {
        return ORDERBOOK_TOPIC_PREFIX + symbol.toLowerCase(Locale.ROOT);
    }

    private void publish(String topic, String key, String payload) {
        try {
            kafkaTemplate.send(topic, key, payload).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("[KafkaEventProducer] 이벤트 발행 실패: topic={}, error={}", topic, ex.getMessage());
                }
            });
        } catch (Exception e) {
            log.error("[KafkaEventProducer] 이벤트 발행 실패: topic={}, error={}", topic, e.getMessage());
        }
    }
}
