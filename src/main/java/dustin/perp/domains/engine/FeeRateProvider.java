package dustin.perp.domains.engine;

/**
 * 심볼별 수수료율 조회
 * Fee rate lookup used by the matching path
 * 
 * 매칭 경로에서 호출되므로 구현체는 I/O 없이 메모리에서 응답해야 합니다.
 */
@FunctionalInterface
public interface FeeRateProvider {

    FeeRates getFeeRates(String symbol);
}
