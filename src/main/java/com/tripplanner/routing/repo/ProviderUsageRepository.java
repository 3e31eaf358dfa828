package com.tripplanner.routing.repo;

import com.tripplanner.routing.model.entity.ProviderUsageEntity;
import com.tripplanner.routing.model.entity.ProviderUsageId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface ProviderUsageRepository extends JpaRepository<ProviderUsageEntity, ProviderUsageId> {

    /**
     * Atomic {@code count = count + 1}. Returns the number of rows touched, 0 when the month row does not exist yet.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("update ProviderUsageEntity u set u.callCount = u.callCount + 1 "
            + "where u.id.month = :month and u.id.provider = :provider")
    int increment(@Param("month") String month, @Param("provider") String provider);

    List<ProviderUsageEntity> findByIdMonth(String month);
}
