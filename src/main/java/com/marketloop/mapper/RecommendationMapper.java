package com.marketloop.mapper;

import com.marketloop.domain.model.Recommendation;
import com.marketloop.entity.RecommendationEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface RecommendationMapper {

    RecommendationEntity toEntity(Recommendation recommendation);

    Recommendation toDomain(RecommendationEntity entity);

    List<Recommendation> toDomainList(List<RecommendationEntity> entities);
}
