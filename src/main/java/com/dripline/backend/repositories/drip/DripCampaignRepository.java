package com.dripline.backend.repositories.drip;

import com.dripline.backend.enums.TriggerType;
import com.dripline.backend.models.drip.DripCampaign;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface DripCampaignRepository extends JpaRepository<DripCampaign, Long> {

    @Query("SELECT DISTINCT c FROM DripCampaign c LEFT JOIN FETCH c.steps WHERE c.id = :id")
    Optional<DripCampaign> findWithStepsById(@Param("id") Long id);

    @Query("SELECT c FROM DripCampaign c WHERE c.isActive = true AND c.triggerType = :triggerType ORDER BY c.id ASC")
    List<DripCampaign> findActiveByTriggerType(@Param("triggerType") TriggerType triggerType);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripCampaign c SET c.isActive = :active, c.updatedAt = :now WHERE c.id = :id")
    int updateActive(@Param("id") Long id, @Param("active") boolean active, @Param("now") OffsetDateTime now);
}
