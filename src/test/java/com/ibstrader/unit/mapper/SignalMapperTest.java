package com.ibstrader.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.ibstrader.domain.enums.ExecutionStatus;
import com.ibstrader.domain.enums.SignalAction;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.Signal;
import com.ibstrader.entity.SignalEntity;
import com.ibstrader.mapper.SignalMapper;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class SignalMapperTest {

    private final SignalMapper mapper = Mappers.getMapper(SignalMapper.class);

    @Test
    @DisplayName("Domain enums are stored as lowercase codes and the status as an integer")
    void toEntity() {
        SignalEntity entity = mapper.toEntity(Signal.builder()
                .timestamp("2024-01-01T10:00:00Z")
                .action(SignalAction.OPEN)
                .symbol("BTC")
                .side(TradeSide.LONG)
                .price(new BigDecimal("50000.5"))
                .leverage(new BigDecimal("3"))
                .executionStatus(ExecutionStatus.FAILED)
                .build());

        assertThat(entity.getAction()).isEqualTo("open");
        assertThat(entity.getSide()).isEqualTo("long");
        assertThat(entity.getExecuted()).isEqualTo(2);
        assertThat(entity.getPrice()).isEqualTo(50000.5);
        assertThat(entity.getLeverage()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Unrecognized stored values map to UNKNOWN action and no side")
    void toDomainUnknown() {
        Signal signal = mapper.toDomain(SignalEntity.builder()
                .id(5L)
                .timestamp("2024-01-01T10:00:00Z")
                .action("Flip")
                .symbol("BTC")
                .side("sideways")
                .executed(0)
                .build());

        assertThat(signal.getAction()).isEqualTo(SignalAction.UNKNOWN);
        assertThat(signal.getRawAction()).isEqualTo("Flip");
        assertThat(signal.getSide()).isNull();
        assertThat(signal.getExecutionStatus()).isEqualTo(ExecutionStatus.PENDING);
    }

    @Test
    @DisplayName("Stored action text is matched case-insensitively")
    void caseInsensitive() {
        Signal signal = mapper.toDomain(SignalEntity.builder().action("CLOSE").side("Long").executed(1).build());

        assertThat(signal.getAction()).isEqualTo(SignalAction.CLOSE);
        assertThat(signal.getSide()).isEqualTo(TradeSide.LONG);
        assertThat(signal.getExecutionStatus()).isEqualTo(ExecutionStatus.EXECUTED);
    }
}
