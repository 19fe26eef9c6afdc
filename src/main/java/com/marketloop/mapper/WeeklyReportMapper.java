package com.marketloop.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.marketloop.domain.model.WeeklyReport;
import com.marketloop.entity.WeeklyReportEntity;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between WeeklyReport and WeeklyReportEntity.
 * The strategy breakdown map is serialized to its JSON column via {@link JsonHelper}.
 */
@Mapper
public interface WeeklyReportMapper {

    @Mapping(target = "strategyBreakdown", expression = "java(JsonHelper.toJson(report.getStrategyBreakdown()))")
    WeeklyReportEntity toEntity(WeeklyReport report);

    @Mapping(target = "strategyBreakdown", expression = "java(toBreakdown(entity.getStrategyBreakdown()))")
    WeeklyReport toDomain(WeeklyReportEntity entity);

    List<WeeklyReport> toDomainList(List<WeeklyReportEntity> entities);

    default Map<String, BigDecimal> toBreakdown(String json) {
        Map<String, BigDecimal> breakdown = JsonHelper.fromJson(json, new TypeReference<Map<String, BigDecimal>>() {});
        return breakdown != null ? breakdown : Map.of();
    }
}
