package com.marketloop.repository.jpa;

import com.marketloop.entity.WeeklyReportEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WeeklyReportJpaRepository extends JpaRepository<WeeklyReportEntity, Long> {

    boolean existsByWeekStart(LocalDate weekStart);

    List<WeeklyReportEntity> findAllByOrderByWeekStartDesc();
}
