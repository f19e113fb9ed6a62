package dustin.perp.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * 매칭 엔진 설정
 * Matching Engine Properties
 * 
 * application.yml 의 matching.* 값을 바인딩합니다.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingProperties {

    /**
     * 거래 심볼 목록 (서버 시작 시 고정)
     */
    private List<String> symbols = new ArrayList<>(List.of("BTCUSDT", "ETHUSDT", "SOLUSDT"));

    /**
     * 체결 이벤트 채널 크기 (넘치면 느린 구독자는 메시지 유실)
     */
    private int tradeChannelCapacity = 10000;

    /**
     * 오더북 변경 이벤트 채널 크기
     */
    private int orderbookChannelCapacity = 1000;

    /**
     * 오더북 변경 이벤트에 담는 호가 깊이
     */
    private int orderbookUpdateDepth = 20;

    /**
     * 기본 메이커 수수료율 (0.02%)
     */
    private BigDecimal defaultMakerFeeRate = new BigDecimal("0.0002");

    /**
     * 기본 테이커 수수료율 (0.05%)
     */
    private BigDecimal defaultTakerFeeRate = new BigDecimal("0.0005");

    private int maxLeverage = 50;

    /**
     * 수수료 설정 DB 재조회 주기 (ms)
     */
    private long feeRefreshIntervalMs = 60000;

    /**
     * 심볼별 메모리 체결 내역 보관 개수
     */
    private int tradeHistorySize = 1000;

    /**
     * 사용자별 메모리 주문 내역 보관 개수
     */
    private int orderHistorySize = 500;

    private Recovery recovery = new Recovery();

    @Data
    public static class Recovery {
        /**
         * 서버 시작 시 DB 미체결 주문으로 오더북 복구 여부
         */
        private boolean enabled = true;
    }
}
