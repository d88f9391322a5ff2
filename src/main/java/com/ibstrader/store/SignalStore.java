package com.ibstrader.store;

import com.ibstrader.domain.enums.ExecutionStatus;
import com.ibstrader.domain.enums.SignalAction;
import com.ibstrader.domain.model.Signal;
import com.ibstrader.entity.SignalEntity;
import com.ibstrader.mapper.SignalMapper;
import com.ibstrader.repository.jpa.SignalJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Durable, ordered queue of trade signals shared between the decision process and the
 * execution engine.
 *
 * <p>Producers {@link #append} and consumers read {@link #fetchPending} in ascending id
 * order. Consumption is a guarded status transition ({@code pending -> executed|failed})
 * performed as one conditional UPDATE, so a signal can leave the pending state at most
 * once even when several processes share the table.
 */
@Component
public class SignalStore {

    private static final Logger log = LoggerFactory.getLogger(SignalStore.class);

    private final SignalJpaRepository signalJpaRepository;
    private final SignalMapper signalMapper = Mappers.getMapper(SignalMapper.class);

    public SignalStore(SignalJpaRepository signalJpaRepository) {
        this.signalJpaRepository = signalJpaRepository;
    }

    /** Appends a new pending signal and returns it with its store-assigned id. */
    public Signal append(Signal signal) {
        SignalEntity entity = signalMapper.toEntity(signal);
        entity.setId(null);
        entity.setExecuted(ExecutionStatus.PENDING.getCode());
        entity.setCreatedAt(LocalDateTime.now());
        SignalEntity saved = signalJpaRepository.save(entity);
        log.info(
                "Signal appended: id={}, action={}, symbol={}, side={}, price={}, leverage={}",
                saved.getId(),
                saved.getAction(),
                saved.getSymbol(),
                saved.getSide(),
                saved.getPrice(),
                saved.getLeverage());
        return signalMapper.toDomain(saved);
    }

    /** All pending signals by ascending id. */
    public List<Signal> fetchPending() {
        return signalMapper.toDomainList(signalJpaRepository.findByExecutedOrderByIdAsc(ExecutionStatus.PENDING.getCode()));
    }

    /** Pending signals created at or after {@code since}, by ascending id. */
    public List<Signal> fetchPendingSince(LocalDateTime since) {
        return signalMapper.toDomainList(signalJpaRepository.findByExecutedAndCreatedAtGreaterThanEqualOrderByIdAsc(
                ExecutionStatus.PENDING.getCode(), since));
    }

    /**
     * Marks every signal still pending from before {@code cutoff} as failed and returns
     * those this call transitioned. Signals another caller finished first are left out.
     */
    public List<Signal> failPendingBefore(LocalDateTime cutoff) {
        List<Signal> stale = signalMapper.toDomainList(signalJpaRepository.findByExecutedAndCreatedAtLessThanOrderByIdAsc(
                ExecutionStatus.PENDING.getCode(), cutoff));
        return stale.stream().filter(signal -> markFailed(signal.getId())).toList();
    }

    public Optional<Signal> findById(Long id) {
        return signalJpaRepository.findById(id).map(signalMapper::toDomain);
    }

    /** Returns true only when this call moved the signal from pending to executed. */
    public boolean markExecuted(Long id) {
        return transition(id, ExecutionStatus.EXECUTED);
    }

    /** Returns true only when this call moved the signal from pending to failed. */
    public boolean markFailed(Long id) {
        return transition(id, ExecutionStatus.FAILED);
    }

    public boolean hasPendingOpen(String symbol) {
        return signalJpaRepository.existsBySymbolAndActionAndExecuted(
                symbol, SignalAction.OPEN.getCode(), ExecutionStatus.PENDING.getCode());
    }

    /**
     * Marks every pending open signal for {@code symbol} as executed. Used when the
     * decision process closes a trade so that a stale open is never acted on afterwards.
     */
    public int consumePendingOpens(String symbol) {
        int consumed = signalJpaRepository.transitionAll(
                symbol,
                SignalAction.OPEN.getCode(),
                ExecutionStatus.PENDING.getCode(),
                ExecutionStatus.EXECUTED.getCode());
        if (consumed > 0) {
            log.info("Consumed pending open signals: symbol={}, count={}", symbol, consumed);
        }
        return consumed;
    }

    /** The most recent open signal for {@code symbol} regardless of status. */
    public Optional<Signal> findLatestOpen(String symbol) {
        return signalJpaRepository
                .findFirstBySymbolAndActionOrderByIdDesc(symbol, SignalAction.OPEN.getCode())
                .map(signalMapper::toDomain);
    }

    public int pruneOlderThan(LocalDateTime cutoff) {
        return signalJpaRepository.deleteCreatedBefore(cutoff);
    }

    private boolean transition(Long id, ExecutionStatus target) {
        int updated = signalJpaRepository.transitionStatus(id, ExecutionStatus.PENDING.getCode(), target.getCode());
        if (updated == 0) {
            log.warn("Signal status unchanged, already terminal or missing: id={}, target={}", id, target);
            return false;
        }
        return true;
    }
}
