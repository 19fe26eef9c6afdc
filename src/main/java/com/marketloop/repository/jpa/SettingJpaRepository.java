package com.marketloop.repository.jpa;

import com.marketloop.entity.SettingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SettingJpaRepository extends JpaRepository<SettingEntity, String> {}
