package com.ibstrader.mapper;

import com.ibstrader.domain.enums.ExecutionStatus;
import com.ibstrader.domain.enums.SignalAction;
import com.ibstrader.domain.enums.TradeSide;
import com.ibstrader.domain.model.Signal;
import com.ibstrader.entity.SignalEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between Signal and SignalEntity.
 *
 * <p>Enums are stored by their lowercase wire codes and the status as its integer code.
 * The stored action text is kept on the domain side as {@code rawAction}.
 */
@Mapper
public interface SignalMapper {

    @Mapping(target = "action", source = ".", qualifiedByName = "actionText")
    @Mapping(source = "executionStatus", target = "executed")
    SignalEntity toEntity(Signal signal);

    @Mapping(source = "action", target = "rawAction")
    @Mapping(source = "executed", target = "executionStatus")
    Signal toDomain(SignalEntity entity);

    List<Signal> toDomainList(List<SignalEntity> entities);

    @Named("actionText")
    default String actionText(Signal signal) {
        if (signal.getAction() != null && signal.getAction() != SignalAction.UNKNOWN) {
            return signal.getAction().getCode();
        }
        return signal.getRawAction();
    }

    default SignalAction toAction(String code) {
        return SignalAction.fromCode(code);
    }

    default String sideCode(TradeSide side) {
        return side == null ? null : side.getCode();
    }

    default TradeSide toSide(String code) {
        return TradeSide.fromCode(code);
    }

    default int statusCode(ExecutionStatus status) {
        return status == null ? ExecutionStatus.PENDING.getCode() : status.getCode();
    }

    default ExecutionStatus toStatus(int code) {
        return ExecutionStatus.fromCode(code);
    }
}
