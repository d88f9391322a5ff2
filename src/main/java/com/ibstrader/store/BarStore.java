package com.ibstrader.store;

import com.ibstrader.domain.model.Bar;
import com.ibstrader.mapper.BarMapper;
import com.ibstrader.repository.jpa.BarJpaRepository;
import java.time.Instant;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Durable store of finished aggregate bars. Inserts are idempotent on the window-end
 * timestamp and readers walk the table by increasing id.
 */
@Component
public class BarStore {

    private static final Logger log = LoggerFactory.getLogger(BarStore.class);

    private final BarJpaRepository barJpaRepository;
    private final BarMapper barMapper = Mappers.getMapper(BarMapper.class);

    public BarStore(BarJpaRepository barJpaRepository) {
        this.barJpaRepository = barJpaRepository;
    }

    /**
     * Inserts the bar unless one with the same timestamp already exists.
     *
     * @return true if a row was written, false for a duplicate
     */
    public boolean insertIfAbsent(Bar bar) {
        if (barJpaRepository.existsByTimestamp(bar.getTimestamp())) {
            log.warn("Bar already stored, skipping: timestamp={}", bar.getTimestamp());
            return false;
        }
        try {
            barJpaRepository.saveAndFlush(barMapper.toEntity(bar));
            log.info(
                    "Bar stored: timestamp={}, open={}, high={}, low={}, close={}, volume={}",
                    bar.getTimestamp(),
                    bar.getOpen(),
                    bar.getHigh(),
                    bar.getLow(),
                    bar.getClose(),
                    bar.getVolume());
            return true;
        } catch (DataIntegrityViolationException e) {
            // another writer got there between the check and the insert
            log.warn("Bar already stored, skipping: timestamp={}", bar.getTimestamp());
            return false;
        }
    }

    /** The next bar after {@code lastId} by increasing id; the first bar when {@code lastId} is null. */
    public Optional<Bar> findNextAfter(Long lastId) {
        return barJpaRepository
                .findFirstByIdGreaterThanOrderByIdAsc(lastId == null ? 0L : lastId)
                .map(barMapper::toDomain);
    }

    public Optional<Long> findLatestId() {
        return barJpaRepository.findFirstByOrderByIdDesc().map(e -> e.getId());
    }

    public int pruneOlderThan(Instant cutoff) {
        return barJpaRepository.deleteOlderThan(cutoff.toString());
    }
}
