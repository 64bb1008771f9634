package com.regimetrader.repository.jpa;

import com.regimetrader.entity.ClosedPositionEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the closed_positions table.
 */
@Repository
public interface ClosedPositionJpaRepository extends JpaRepository<ClosedPositionEntity, String> {

    List<ClosedPositionEntity> findAllByOrderByClosedAtDesc();

    List<ClosedPositionEntity> findByStrategyNameOrderByClosedAtDesc(String strategyName);

    List<ClosedPositionEntity> findByClosedAtGreaterThanEqual(Instant from);
}
