package com.regimetrader.mapper;

import com.regimetrader.domain.model.ClosedTrade;
import com.regimetrader.domain.model.Position;
import com.regimetrader.entity.ClosedPositionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from closed {@link Position}s to the archive entity and back to
 * {@link ClosedTrade} views. The archived size is the original size, since partial closes are
 * already folded into the realized P&L.
 */
@Mapper
public interface ClosedPositionMapper {

    @Mapping(source = "originalSize", target = "size")
    ClosedPositionEntity toEntity(Position position);

    ClosedTrade toDomain(ClosedPositionEntity entity);

    List<ClosedTrade> toDomainList(List<ClosedPositionEntity> entities);
}
