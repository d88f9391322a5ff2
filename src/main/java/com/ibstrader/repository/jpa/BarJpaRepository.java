package com.ibstrader.repository.jpa;

import com.ibstrader.entity.BarEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** JPA repository for the hourly_candles table. */
@Repository
public interface BarJpaRepository extends JpaRepository<BarEntity, Long> {

    boolean existsByTimestamp(String timestamp);

    Optional<BarEntity> findFirstByIdGreaterThanOrderByIdAsc(Long id);

    Optional<BarEntity> findFirstByOrderByIdDesc();

    /** Timestamps are ISO-8601 UTC strings, so lexical order is chronological order. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("DELETE FROM BarEntity b WHERE b.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") String cutoff);
}
