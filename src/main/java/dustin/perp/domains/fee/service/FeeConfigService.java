package dustin.perp.domains.fee.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import dustin.perp.config.MatchingProperties;
import dustin.perp.domains.engine.FeeRateProvider;
import dustin.perp.domains.engine.FeeRates;
import dustin.perp.domains.fee.model.entity.FeeConfig;
import dustin.perp.domains.fee.repository.FeeConfigRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 수수료 설정 서비스
 * Fee Config Service
 * 
 * 역할:
 * - 서버 시작 시 모든 활성 수수료 설정을 메모리에 로드
 * - 매칭 엔진이 체결마다 심볼별 수수료율 조회 (DB 조회 없음)
 * - 영속화 시 수수료 재계산
 * 
 * 우선순위:
 * 1. 심볼이 정확히 일치하는 설정
 * 2. 기본 설정 (symbol = NULL)
 * 3. matching.default-*-fee-rate 설정값
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeeConfigService implements FeeRateProvider {

    private final FeeConfigRepository feeConfigRepository;
    private final MatchingProperties matchingProperties;

    /**
     * 심볼별 수수료율 캐시
     */
    private volatile Map<String, FeeRates> feeRatesCache = new ConcurrentHashMap<>();

    /**
     * 기본 수수료율 (모든 심볼에 적용)
     */
    private volatile FeeRates defaultFeeRates;

    /**
     * 서버 시작 시 수수료 설정 로드
     * Load fee configs on server startup
     */
    @PostConstruct
    public void loadFeeConfigs() {
        log.info("[FeeConfigService] 수수료 설정 로드 시작");

        List<FeeConfig> activeConfigs = feeConfigRepository.findByIsActiveTrue();
        log.info("[FeeConfigService] 활성 수수료 설정 개수: {}", activeConfigs.size());

        Map<String, FeeRates> loaded = new ConcurrentHashMap<>();
        FeeRates loadedDefault = null;

        for (FeeConfig config : activeConfigs) {
            FeeRates rates = new FeeRates(config.getMakerFeeRate(), config.getTakerFeeRate());
            if (config.getSymbol() == null) {
                loadedDefault = rates;
                log.info("[FeeConfigService] 기본 수수료 설정: {}", rates);
            } else {
                loaded.put(config.getSymbol(), rates);
                log.debug("[FeeConfigService] 수수료 설정 로드: symbol={}, {}", config.getSymbol(), rates);
            }
        }

        if (loadedDefault == null) {
            loadedDefault = new FeeRates(matchingProperties.getDefaultMakerFeeRate(),
                    matchingProperties.getDefaultTakerFeeRate());
            log.warn("[FeeConfigService] 기본 수수료 설정이 없습니다. 설정값 사용: {}", loadedDefault);
        }
        // 새로고침 중에도 조회가 빈 캐시를 보지 않도록 통째로 교체
        feeRatesCache = loaded;
        defaultFeeRates = loadedDefault;

        log.info("[FeeConfigService] 수수료 설정 로드 완료: 심볼별 {}개", feeRatesCache.size());
    }

    /**
     * 심볼별 수수료율 조회
     * Get fee rates for symbol
     */
    @Override
    public FeeRates getFeeRates(String symbol) {
        FeeRates rates = symbol == null ? null : feeRatesCache.get(symbol);
        return rates != null ? rates : defaultFeeRates;
    }

    /**
     * 메이커 수수료 계산
     *
     * @param symbol 심볼
     * @param tradeValue 체결 금액 (price * amount)
     */
    public BigDecimal calculateMakerFee(String symbol, BigDecimal tradeValue) {
        return getFeeRates(symbol).makerFee(tradeValue);
    }

    /**
     * 테이커 수수료 계산
     */
    public BigDecimal calculateTakerFee(String symbol, BigDecimal tradeValue) {
        return getFeeRates(symbol).takerFee(tradeValue);
    }

    /**
     * 수수료 설정 새로고침 (런타임에 수수료 변경 시 사용)
     * Refresh fee configs (for runtime updates)
     * 
     * matching.fee-refresh-interval-ms 주기로 자동 실행됩니다.
     */
    @Scheduled(initialDelayString = "${matching.fee-refresh-interval-ms:60000}",
               fixedDelayString = "${matching.fee-refresh-interval-ms:60000}")
    public void refreshFeeConfigs() {
        log.info("[FeeConfigService] 수수료 설정 새로고침");
        loadFeeConfigs();
    }
}
