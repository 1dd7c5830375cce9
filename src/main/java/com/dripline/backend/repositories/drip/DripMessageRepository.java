package com.dripline.backend.repositories.drip;

import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.JourneyStatus;
import com.dripline.backend.enums.MessageStatus;
import com.dripline.backend.models.drip.DripMessage;
import org.springframework.data.domain.Pageable;
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

@Repository
public interface DripMessageRepository extends JpaRepository<DripMessage, Long> {

    Optional<DripMessage> findByJourneyIdAndStepNumber(Long journeyId, Integer stepNumber);

    Optional<DripMessage> findByProviderMessageId(String providerMessageId);

    List<DripMessage> findByJourneyIdOrderByStepNumberAsc(Long journeyId);

    long countByJourneyIdAndStatus(Long journeyId, MessageStatus status);

    /**
     * Due messages of one channel whose journey is active and whose campaign is active, oldest first.
     */
    @Query("SELECT m FROM DripMessage m, LeadJourney j, DripCampaign c " +
            "WHERE m.journeyId = j.id AND j.campaignId = c.id " +
            "AND m.channel = :channel AND m.status = :pending AND m.scheduledAt <= :now " +
            "AND j.status = :active AND c.isActive = true " +
            "ORDER BY m.scheduledAt ASC, m.id ASC")
    List<DripMessage> findDueMessages(@Param("channel") Channel channel,
                                      @Param("pending") MessageStatus pending,
                                      @Param("active") JourneyStatus active,
                                      @Param("now") OffsetDateTime now,
                                      Pageable pageable);

    // PENDING -> QUEUED, only while the owning journey is still active
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.status = :queued, m.updatedAt = :now " +
            "WHERE m.id = :id AND m.status = :pending " +
            "AND m.journeyId IN (SELECT j.id FROM LeadJourney j WHERE j.status = :active)")
    int claim(@Param("id") Long id,
              @Param("pending") MessageStatus pending,
              @Param("queued") MessageStatus queued,
              @Param("active") JourneyStatus active,
              @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.status = :sent, m.providerMessageId = :providerMessageId, " +
            "m.sentAt = :sentAt, m.lastError = null, m.updatedAt = :sentAt " +
            "WHERE m.id = :id AND m.status = :queued")
    int markSent(@Param("id") Long id,
                 @Param("providerMessageId") String providerMessageId,
                 @Param("queued") MessageStatus queued,
                 @Param("sent") MessageStatus sent,
                 @Param("sentAt") OffsetDateTime sentAt);

    // Send response arriving after a callback already moved the message on: keep its status
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.providerMessageId = :providerMessageId, m.sentAt = :sentAt, " +
            "m.lastError = null, m.updatedAt = :sentAt " +
            "WHERE m.id = :id AND m.sentAt IS NULL AND m.status IN :statuses")
    int recordAcceptance(@Param("id") Long id,
                         @Param("providerMessageId") String providerMessageId,
                         @Param("statuses") Collection<MessageStatus> statuses,
                         @Param("sentAt") OffsetDateTime sentAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.status = :pending, m.attemptCount = :attemptCount, " +
            "m.scheduledAt = :scheduledAt, m.lastError = :error, m.updatedAt = :now " +
            "WHERE m.id = :id AND m.status = :queued")
    int requeue(@Param("id") Long id,
                @Param("attemptCount") int attemptCount,
                @Param("scheduledAt") OffsetDateTime scheduledAt,
                @Param("error") String error,
                @Param("queued") MessageStatus queued,
                @Param("pending") MessageStatus pending,
                @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.status = :failedStatus, m.attemptCount = :attemptCount, " +
            "m.lastError = :error, m.failedAt = :now, m.updatedAt = :now " +
            "WHERE m.id = :id AND m.status = :queued")
    int markFailed(@Param("id") Long id,
                   @Param("failedStatus") MessageStatus failedStatus,
                   @Param("attemptCount") int attemptCount,
                   @Param("error") String error,
                   @Param("queued") MessageStatus queued,
                   @Param("now") OffsetDateTime now);

    // Provider callbacks. Each only moves a message forward from one of the given statuses.

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.status = :delivered, m.deliveredAt = :at, m.updatedAt = :at " +
            "WHERE m.id = :id AND m.status IN :fromStatuses")
    int reconcileDelivered(@Param("id") Long id,
                           @Param("fromStatuses") Collection<MessageStatus> fromStatuses,
                           @Param("delivered") MessageStatus delivered,
                           @Param("at") OffsetDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.status = :opened, m.openedAt = :at, m.updatedAt = :at " +
            "WHERE m.id = :id AND m.status IN :fromStatuses")
    int reconcileOpened(@Param("id") Long id,
                        @Param("fromStatuses") Collection<MessageStatus> fromStatuses,
                        @Param("opened") MessageStatus opened,
                        @Param("at") OffsetDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.status = :clicked, m.clickedAt = :at, m.updatedAt = :at " +
            "WHERE m.id = :id AND m.status IN :fromStatuses")
    int reconcileClicked(@Param("id") Long id,
                         @Param("fromStatuses") Collection<MessageStatus> fromStatuses,
                         @Param("clicked") MessageStatus clicked,
                         @Param("at") OffsetDateTime at);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE DripMessage m SET m.status = :failedStatus, m.failedAt = :at, m.lastError = :error, m.updatedAt = :at " +
            "WHERE m.id = :id AND m.status IN :fromStatuses")
    int reconcileFailure(@Param("id") Long id,
                         @Param("fromStatuses") Collection<MessageStatus> fromStatuses,
                         @Param("failedStatus") MessageStatus failedStatus,
                         @Param("error") String error,
                         @Param("at") OffsetDateTime at);
}
