package dustin.perp.domains.position.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.perp.domains.position.model.entity.Position;
import dustin.perp.domains.position.model.entity.PositionSide;
import dustin.perp.domains.position.repository.PositionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 포지션 서비스
 * Position Service
 * 
 * 역할:
 * - 체결 결과로 포지션 증가 (신규 진입 / 같은 방향 추가 진입)
 * - 사용자별 열린 포지션 조회
 * 
 * 반대 방향 포지션 상계(감소/청산)는 이 서비스 범위 밖입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositionService {

    /**
     * 최소 포지션 규모 (USD)
     */
    public static final BigDecimal MIN_POSITION_SIZE_USD = new BigDecimal("10");

    private static final int PRICE_SCALE = 18;
    private static final int LEVERAGE_SCALE = 4;

    private final PositionRepository positionRepository;

    /**
     * 포지션 증가
     * Increase position
     * 
     * 처리 흐름:
     * 1. 담보 / 레버리지 검증
     * 2. 규모 증가분 = 담보 × 레버리지
     * 3. 열린 포지션이 없으면 새로 생성
     * 4. 같은 방향이면 규모 가중 평균으로 진입가 갱신, 담보 합산, 레버리지 재계산
     * 5. 반대 방향이면 IllegalStateException
     * 
     * @param userAddress 사용자 주소
     * @param symbol 심볼
     * @param side 포지션 방향
     * @param collateral 추가 담보
     * @param leverage 레버리지 (1 이상)
     * @param price 체결 가격
     * @param skipMinSize true 면 최소 규모 검사 생략 (이미 체결된 거래 반영 시)
     * @return 갱신된 포지션
     */
    @Transactional
    public Position increasePosition(String userAddress, String symbol, PositionSide side,
                                     BigDecimal collateral, int leverage, BigDecimal price,
                                     boolean skipMinSize) {
        if (collateral == null || collateral.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Collateral must be positive: " + collateral);
        }
        if (leverage < 1) {
            throw new IllegalArgumentException("Leverage must be at least 1: " + leverage);
        }
        if (price == null || price.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }

        BigDecimal sizeDelta = collateral.multiply(BigDecimal.valueOf(leverage));
        if (!skipMinSize && sizeDelta.compareTo(MIN_POSITION_SIZE_USD) < 0) {
            throw new IllegalArgumentException(
                    "Position size below minimum: " + sizeDelta + " < " + MIN_POSITION_SIZE_USD);
        }

        Optional<Position> existing = positionRepository.findOpenForUpdate(userAddress, symbol);

        if (existing.isEmpty()) {
            Position position = Position.builder()
                    .userAddress(userAddress)
                    .symbol(symbol)
                    .side(side.getValue())
                    .sizeInUsd(sizeDelta)
                    .collateral(collateral)
                    .entryPrice(price)
                    .leverage(BigDecimal.valueOf(leverage).setScale(LEVERAGE_SCALE, RoundingMode.HALF_UP))
                    .status("open")
                    .build();
            Position saved = positionRepository.save(position);
            log.debug("[PositionService] 포지션 생성: user={}, symbol={}, side={}, size={}",
                    userAddress, symbol, side.getValue(), sizeDelta);
            return saved;
        }

        Position position = existing.get();
        if (position.getPositionSide() != side) {
            throw new IllegalStateException("Opposite position already open: user=" + userAddress
                    + ", symbol=" + symbol + ", existing=" + position.getSide() + ", requested=" + side.getValue());
        }

        BigDecimal oldSize = position.getSizeInUsd();
        BigDecimal newSize = oldSize.add(sizeDelta);
        // 규모 가중 평균 진입가
        BigDecimal entryPrice = oldSize.multiply(position.getEntryPrice())
                .add(sizeDelta.multiply(price))
                .divide(newSize, PRICE_SCALE, RoundingMode.HALF_UP);
        BigDecimal newCollateral = position.getCollateral().add(collateral);

        position.setSizeInUsd(newSize);
        position.setEntryPrice(entryPrice);
        position.setCollateral(newCollateral);
        position.setLeverage(newSize.divide(newCollateral, LEVERAGE_SCALE, RoundingMode.HALF_UP));

        Position saved = positionRepository.save(position);
        log.debug("[PositionService] 포지션 증가: user={}, symbol={}, side={}, size={}, entryPrice={}",
                userAddress, symbol, side.getValue(), newSize, entryPrice);
        return saved;
    }

    /**
     * 사용자의 열린 포지션 목록
     */
    @Transactional(readOnly = true)
    public List<Position> getOpenPositions(String userAddress) {
        return positionRepository.findByUserAddressAndStatus(userAddress, "open");
    }
}
