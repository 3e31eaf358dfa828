package com.tripplanner.routing.repo;

import com.tripplanner.routing.model.entity.RouteCacheEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface RouteCacheRepository extends JpaRepository<RouteCacheEntity, String> {

    Optional<RouteCacheEntity> findByCacheKeyAndCreatedAtAfter(String cacheKey, Instant freshAfter);

    @Modifying
    @Transactional
    @Query("delete from RouteCacheEntity e where e.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
