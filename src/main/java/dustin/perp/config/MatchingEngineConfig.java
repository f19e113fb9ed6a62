package dustin.perp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dustin.perp.domains.engine.MatchingEngine;
import dustin.perp.domains.engine.SymbolRegistry;
import dustin.perp.domains.fee.service.FeeConfigService;
import lombok.RequiredArgsConstructor;

/**
 * 매칭 엔진 빈 설정
 * Matching Engine Configuration
 * 
 * 역할:
 * - 설정된 심볼로 SymbolRegistry 를 한 번 생성
 * - SymbolRegistry 와 수수료 조회를 주입해 MatchingEngine 생성
 * - 종료 시 브로드캐스트 채널을 닫아 구독 워커를 정지
 */
@Configuration
@RequiredArgsConstructor
public class MatchingEngineConfig {

    private final MatchingProperties matchingProperties;

    @Bean
    public SymbolRegistry symbolRegistry() {
        return new SymbolRegistry(matchingProperties.getSymbols());
    }

    @Bean(destroyMethod = "shutdown")
    public MatchingEngine matchingEngine(SymbolRegistry symbolRegistry, FeeConfigService feeConfigService) {
        return new MatchingEngine(
                symbolRegistry,
                feeConfigService,
                matchingProperties.getTradeChannelCapacity(),
                matchingProperties.getOrderbookChannelCapacity(),
                matchingProperties.getOrderbookUpdateDepth(),
                matchingProperties.getTradeHistorySize(),
                matchingProperties.getOrderHistorySize());
    }
}
