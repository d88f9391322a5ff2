package com.ibstrader.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.ibstrader.domain.enums.ExecutionStatus;
import com.ibstrader.domain.enums.SignalAction;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.Signal;
import com.ibstrader.entity.SignalEntity;
import com.ibstrader.repository.jpa.SignalJpaRepository;
import com.ibstrader.store.SignalStore;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Signal queue semantics on H2: arrival order, the guarded one-shot status transition and
 * the decision-side helpers.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import(SignalStore.class)
class SignalStoreIntegrationTest {

    @Autowired
    private SignalStore signalStore;

    @Autowired
    private SignalJpaRepository signalJpaRepository;

    private Signal append(SignalAction action, String leverage) {
        return signalStore.append(Signal.builder()
                .timestamp("2024-01-01T10:00:00Z")
                .action(action)
                .symbol("BTC")
                .side(TradeSide.LONG)
                .price(new BigDecimal("50000"))
                .leverage(leverage == null ? null : new BigDecimal(leverage))
                .build());
    }

    @Nested
    @DisplayName("Queue")
    class Queue {

        @Test
        @DisplayName("Append assigns increasing ids and pending status")
        void appendAssignsIds() {
            Signal first = append(SignalAction.OPEN, "3");
            Signal second = append(SignalAction.CLOSE, null);

            assertThat(first.getId()).isNotNull();
            assertThat(second.getId()).isGreaterThan(first.getId());
            assertThat(first.getExecutionStatus()).isEqualTo(ExecutionStatus.PENDING);
            assertThat(first.getCreatedAt()).isNotNull();
            assertThat(first.getLeverage()).isEqualByComparingTo("3");
        }

        @Test
        @DisplayName("Pending signals come back in ascending id order")
        void fetchPendingInOrder() {
            Signal first = append(SignalAction.OPEN, "2");
            Signal second = append(SignalAction.CLOSE, null);
            Signal third = append(SignalAction.OPEN, "1");
            signalStore.markExecuted(second.getId());

            List<Signal> pending = signalStore.fetchPending();

            assertThat(pending).extracting(Signal::getId).containsExactly(first.getId(), third.getId());
            assertThat(pending.get(0).getAction()).isEqualTo(SignalAction.OPEN);
            assertThat(pending.get(0).getRawAction()).isEqualTo("open");
        }

        @Test
        @DisplayName("Signals created before the cut-off are not fetched since it")
        void fetchPendingSince() {
            signalJpaRepository.save(SignalEntity.builder()
                    .timestamp("2024-01-01T09:00:00Z")
                    .action("open")
                    .symbol("BTC")
                    .side("long")
                    .executed(0)
                    .createdAt(LocalDateTime.now().minusHours(2))
                    .build());
            Signal fresh = append(SignalAction.CLOSE, null);

            List<Signal> pending = signalStore.fetchPendingSince(LocalDateTime.now().minusMinutes(5));

            assertThat(pending).extracting(Signal::getId).containsExactly(fresh.getId());
            assertThat(signalStore.fetchPending()).hasSize(2);
        }

        @Test
        @DisplayName("Unrecognized stored action reads as UNKNOWN with the raw text kept")
        void unknownAction() {
            SignalEntity saved = signalJpaRepository.save(SignalEntity.builder()
                    .timestamp("2024-01-01T09:00:00Z")
                    .action("hold")
                    .symbol("BTC")
                    .executed(0)
                    .build());

            Signal signal = signalStore.findById(saved.getId()).orElseThrow();

            assertThat(signal.getAction()).isEqualTo(SignalAction.UNKNOWN);
            assertThat(signal.getRawAction()).isEqualTo("hold");
        }
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("A signal leaves pending exactly once")
        void oneShot() {
            Signal signal = append(SignalAction.OPEN, "2");

            assertThat(signalStore.markExecuted(signal.getId())).isTrue();
            assertThat(signalStore.markExecuted(signal.getId())).isFalse();
            assertThat(signalStore.markFailed(signal.getId())).isFalse();
            assertThat(signalStore.findById(signal.getId()).orElseThrow().getExecutionStatus())
                    .isEqualTo(ExecutionStatus.EXECUTED);
        }

        @Test
        @DisplayName("Failed signals stay failed")
        void failedIsTerminal() {
            Signal signal = append(SignalAction.CLOSE, null);

            assertThat(signalStore.markFailed(signal.getId())).isTrue();
            assertThat(signalStore.markExecuted(signal.getId())).isFalse();
            assertThat(signalStore.findById(signal.getId()).orElseThrow().getExecutionStatus())
                    .isEqualTo(ExecutionStatus.FAILED);
        }

        @Test
        @DisplayName("Missing id is not an error")
        void missingId() {
            assertThat(signalStore.markExecuted(9_999L)).isFalse();
        }
    }

    @Nested
    @DisplayName("Decision support")
    class DecisionSupport {

        @Test
        @DisplayName("Pending opens are detected and consumed")
        void pendingOpens() {
            append(SignalAction.OPEN, "2");
            append(SignalAction.OPEN, "3");
            append(SignalAction.CLOSE, null);

            assertThat(signalStore.hasPendingOpen("BTC")).isTrue();
            assertThat(signalStore.consumePendingOpens("BTC")).isEqualTo(2);
            assertThat(signalStore.hasPendingOpen("BTC")).isFalse();
            assertThat(signalStore.fetchPending()).extracting(Signal::getAction).containsExactly(SignalAction.CLOSE);
        }

        @Test
        @DisplayName("Latest open is found regardless of status")
        void latestOpen() {
            append(SignalAction.OPEN, "2");
            Signal latest = append(SignalAction.OPEN, "4");
            signalStore.markExecuted(latest.getId());

            assertThat(signalStore.findLatestOpen("BTC").orElseThrow().getId()).isEqualTo(latest.getId());
            assertThat(signalStore.findLatestOpen("ETH")).isEmpty();
        }

        @Test
        @DisplayName("Prune removes signals created before the cut-off")
        void prune() {
            signalJpaRepository.save(SignalEntity.builder()
                    .timestamp("2023-01-01T00:00:00Z")
                    .action("close")
                    .symbol("BTC")
                    .executed(1)
                    .createdAt(LocalDateTime.now().minusDays(40))
                    .build());
            append(SignalAction.OPEN, "2");

            int deleted = signalStore.pruneOlderThan(LocalDateTime.now().minusDays(30));

            assertThat(deleted).isEqualTo(1);
            assertThat(signalJpaRepository.count()).isEqualTo(1);
        }
    }
}
