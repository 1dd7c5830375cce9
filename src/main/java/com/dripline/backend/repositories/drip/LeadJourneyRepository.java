package com.dripline.backend.repositories.drip;

import com.dripline.backend.enums.JourneyStatus;
import com.dripline.backend.models.drip.LeadJourney;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Journey reads plus the single-row conditional updates the engine uses to change journey state.
 * Every update returns the number of affected rows; 0 means the guard did not match.
 */
@Repository
public interface LeadJourneyRepository extends JpaRepository<LeadJourney, Long> {

    Optional<LeadJourney> findByLeadIdAndCampaignId(Long leadId, Long campaignId);

    List<LeadJourney> findByLeadIdOrderByIdAsc(Long leadId);

    long countByCampaignIdAndStatus(Long campaignId, JourneyStatus status);

    // Moves current_step from n-1 to n only, so it never skips or goes back
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.currentStep = :toStep, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.currentStep = :fromStep")
    int advanceStep(@Param("id") Long id,
                    @Param("fromStep") int fromStep,
                    @Param("toStep") int toStep,
                    @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.status = :toStatus, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status IN :fromStatuses")
    int transitionStatus(@Param("id") Long id,
                         @Param("fromStatuses") Collection<JourneyStatus> fromStatuses,
                         @Param("toStatus") JourneyStatus toStatus,
                         @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.status = :completed, j.completedAt = :now, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.status IN :fromStatuses")
    int markCompleted(@Param("id") Long id,
                      @Param("fromStatuses") Collection<JourneyStatus> fromStatuses,
                      @Param("completed") JourneyStatus completed,
                      @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.totalSmsSent = j.totalSmsSent + 1, j.updatedAt = :now WHERE j.id = :id")
    int incrementSmsSent(@Param("id") Long id, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.totalEmailsSent = j.totalEmailsSent + 1, j.updatedAt = :now WHERE j.id = :id")
    int incrementEmailsSent(@Param("id") Long id, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.totalDelivered = j.totalDelivered + 1, " +
            "j.lastInteractionAt = :at, j.updatedAt = :at WHERE j.id = :id")
    int recordDelivery(@Param("id") Long id, @Param("at") OffsetDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.totalOpens = j.totalOpens + 1, " +
            "j.lastInteractionAt = :at, j.updatedAt = :at WHERE j.id = :id")
    int recordOpen(@Param("id") Long id, @Param("at") OffsetDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.totalClicks = j.totalClicks + 1, " +
            "j.lastInteractionAt = :at, j.updatedAt = :at WHERE j.id = :id")
    int recordClick(@Param("id") Long id, @Param("at") OffsetDateTime at);

    // First conversion wins; later ones leave the marker untouched
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE LeadJourney j SET j.conversionEvent = :event, j.convertedAt = :at, " +
            "j.status = :completed, j.completedAt = :at, j.updatedAt = :at " +
            "WHERE j.id = :id AND j.convertedAt IS NULL")
    int recordConversion(@Param("id") Long id,
                         @Param("event") String event,
                         @Param("completed") JourneyStatus completed,
                         @Param("at") OffsetDateTime at);
}
