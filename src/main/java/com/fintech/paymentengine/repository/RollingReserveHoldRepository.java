package com.fintech.paymentengine.repository;

import com.fintech.paymentengine.entity.ReserveStatus;
import com.fintech.paymentengine.entity.RollingReserveHold;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface RollingReserveHoldRepository extends JpaRepository<RollingReserveHold, Long> {

    @Query("SELECT h.id FROM RollingReserveHold h WHERE h.status = :status AND h.holdUntil <= :now ORDER BY h.id ASC")
    List<Long> findIdsDueForRelease(
            @Param("status") ReserveStatus status,
            @Param("now") LocalDateTime now,
            Pageable pageable
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM RollingReserveHold h WHERE h.id = :id")
    Optional<RollingReserveHold> findByIdForUpdate(@Param("id") Long id);

    List<RollingReserveHold> findByWalletIdAndStatus(Long walletId, ReserveStatus status);
}
