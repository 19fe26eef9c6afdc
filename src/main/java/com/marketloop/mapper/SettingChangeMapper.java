package com.marketloop.mapper;

import com.marketloop.domain.model.SettingChange;
import com.marketloop.entity.SettingChangeEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface SettingChangeMapper {

    SettingChangeEntity toEntity(SettingChange change);

    SettingChange toDomain(SettingChangeEntity entity);

    List<SettingChange> toDomainList(List<SettingChangeEntity> entities);
}
