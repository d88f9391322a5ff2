package com.ibstrader.repository.jpa;

import com.ibstrader.entity.SignalEntity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the trade_signals table.
 * The table is shared with other processes, so status changes go through guarded updates only.
 */
@Repository
public interface SignalJpaRepository extends JpaRepository<SignalEntity, Long> {

    List<SignalEntity> findByExecutedOrderByIdAsc(int executed);

    List<SignalEntity> findByExecutedAndCreatedAtGreaterThanEqualOrderByIdAsc(int executed, LocalDateTime since);

    List<SignalEntity> findByExecutedAndCreatedAtLessThanOrderByIdAsc(int executed, LocalDateTime before);

    boolean existsBySymbolAndActionAndExecuted(String symbol, String action, int executed);

    Optional<SignalEntity> findFirstBySymbolAndActionOrderByIdDesc(String symbol, String action);

    /**
     * Moves a signal out of {@code fromStatus}. Returns the number of rows changed, which is
     * zero when another caller already performed the transition.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE SignalEntity s SET s.executed = :toStatus WHERE s.id = :id AND s.executed = :fromStatus")
    int transitionStatus(@Param("id") Long id, @Param("fromStatus") int fromStatus, @Param("toStatus") int toStatus);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE SignalEntity s SET s.executed = :toStatus "
            + "WHERE s.symbol = :symbol AND s.action = :action AND s.executed = :fromStatus")
    int transitionAll(
            @Param("symbol") String symbol,
            @Param("action") String action,
            @Param("fromStatus") int fromStatus,
            @Param("toStatus") int toStatus);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM SignalEntity s WHERE s.createdAt < :cutoff")
    int deleteCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
