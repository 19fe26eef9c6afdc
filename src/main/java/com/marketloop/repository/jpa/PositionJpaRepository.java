package com.marketloop.repository.jpa;

import com.marketloop.entity.PositionEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for open positions, keyed in practice by market id. */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, Long> {

    Optional<PositionEntity> findByMarketId(String marketId);

    boolean existsByMarketId(String marketId);
}
