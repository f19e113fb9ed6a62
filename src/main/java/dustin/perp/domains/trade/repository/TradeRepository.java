package dustin.perp.domains.trade.repository;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.perp.domains.trade.model.entity.Trade;

/**
 * 체결 내역 리포지토리
 * Trade Repository
 */
@Repository
public interface TradeRepository extends JpaRepository<Trade, UUID> {

    /**
     * 사용자별 체결 내역 조회 (최신순)
     * 메이커 또는 테이커로 참여한 체결 전부
     */
    @Query("SELECT t FROM Trade t WHERE t.makerAddress = :address OR t.takerAddress = :address ORDER BY t.createdAt DESC")
    List<Trade> findByParticipant(@Param("address") String address, Pageable pageable);
}
