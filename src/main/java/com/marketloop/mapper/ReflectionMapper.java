package com.marketloop.mapper;

import com.marketloop.domain.model.Reflection;
import com.marketloop.entity.ReflectionEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface ReflectionMapper {

    ReflectionEntity toEntity(Reflection reflection);

    Reflection toDomain(ReflectionEntity entity);

    List<Reflection> toDomainList(List<ReflectionEntity> entities);
}
