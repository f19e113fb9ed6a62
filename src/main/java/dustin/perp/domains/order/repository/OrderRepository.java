package dustin.perp.domains.order.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.perp.domains.order.model.entity.Order;
import jakarta.persistence.LockModeType;

/**
 * 주문 리포지토리
 * Order Repository
 * 
 * 역할:
 * - 주문 결과 upsert (findByIdForUpdate + save)
 * - 메이커 체결 수량 누적 / 상태 변경 (벌크 UPDATE)
 * - 재시작 복구용 미체결 주문 조회
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    /**
     * 주문 ID로 주문 조회 (비관적 락)
     * Find order by ID with pessimistic lock (FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :orderId")
    Optional<Order> findByIdForUpdate(@Param("orderId") UUID orderId);

    /**
     * 메이커 체결 반영
     * filled_amount += amount, 누적이 주문 수량 이상이면 'filled' 아니면 'partially_filled'
     *
     * @return 갱신된 행 수 (주문 행이 아직 없으면 0)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.filledAmount = o.filledAmount + :amount, " +
           "o.status = CASE WHEN o.filledAmount + :amount >= o.amount THEN 'filled' ELSE 'partially_filled' END, " +
           "o.updatedAt = :now WHERE o.id = :orderId")
    int applyMakerFill(@Param("orderId") UUID orderId,
                       @Param("amount") BigDecimal amount,
                       @Param("now") LocalDateTime now);

    /**
     * 주문 상태 변경
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = :status, o.updatedAt = :now WHERE o.id = :orderId")
    int updateStatus(@Param("orderId") UUID orderId,
                     @Param("status") String status,
                     @Param("now") LocalDateTime now);

    /**
     * 주문 레버리지 조회 (포지션 담보 계산용)
     */
    @Query("SELECT o.leverage FROM Order o WHERE o.id = :orderId")
    Optional<Integer> findLeverageById(@Param("orderId") UUID orderId);

    /**
     * 재시작 복구 대상 조회 (접수 순서대로)
     *
     * @param symbols 심볼 목록
     * @param orderType 'limit'
     * @param statuses 'open', 'partially_filled'
     */
    List<Order> findBySymbolInAndOrderTypeAndStatusInOrderByCreatedAtAsc(
            Collection<String> symbols, String orderType, Collection<String> statuses);
}
