package com.marketloop.mapper;

import com.marketloop.domain.model.TradeRecord;
import com.marketloop.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;

/** MapStruct mapper between TradeRecord and TradeEntity. 1:1 field mapping. */
@Mapper
public interface TradeMapper {

    TradeEntity toEntity(TradeRecord trade);

    TradeRecord toDomain(TradeEntity entity);

    List<TradeRecord> toDomainList(List<TradeEntity> entities);
}
