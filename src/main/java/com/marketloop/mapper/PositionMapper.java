package com.marketloop.mapper;

import com.marketloop.domain.model.Position;
import com.marketloop.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface PositionMapper {

    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
