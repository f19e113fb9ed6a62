package dustin.perp.domains.position.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.perp.domains.position.model.entity.Position;
import jakarta.persistence.LockModeType;

/**
 * 포지션 리포지토리
 * Position Repository
 */
@Repository
public interface PositionRepository extends JpaRepository<Position, Long> {

    /**
     * 열린 포지션 조회 (비관적 락)
     * 같은 사용자/심볼에 대한 동시 체결 반영을 직렬화
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Position p WHERE p.userAddress = :userAddress AND p.symbol = :symbol AND p.status = 'open'")
    Optional<Position> findOpenForUpdate(@Param("userAddress") String userAddress,
                                         @Param("symbol") String symbol);

    List<Position> findByUserAddressAndStatus(String userAddress, String status);
}
