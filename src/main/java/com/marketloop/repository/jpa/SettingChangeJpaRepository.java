package com.marketloop.repository.jpa;

import com.marketloop.entity.SettingChangeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the settings audit trail. */
@Repository
public interface SettingChangeJpaRepository extends JpaRepository<SettingChangeEntity, Long> {

    List<SettingChangeEntity> findAllByOrderByChangedAtDesc();

    List<SettingChangeEntity> findBySettingKeyOrderByChangedAtDesc(String settingKey);
}
