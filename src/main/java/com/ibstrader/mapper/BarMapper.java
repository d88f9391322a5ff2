package com.ibstrader.mapper;

import com.ibstrader.domain.model.Bar;
import com.ibstrader.entity.BarEntity;
import java.math.BigDecimal;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between Bar and BarEntity. Prices are stored as doubles; a stored NaN or
 * infinity maps to null so that readers can reject the bar instead of failing to load it.
 */
@Mapper
public interface BarMapper {

    BarEntity toEntity(Bar bar);

    Bar toDomain(BarEntity entity);

    default BigDecimal toDecimal(Double value) {
        return value == null || !Double.isFinite(value) ? null : BigDecimal.valueOf(value);
    }

    default Double toDouble(BigDecimal value) {
        return value == null ? null : value.doubleValue();
    }
}
