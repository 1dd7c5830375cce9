package com.dripline.backend.models.drip;

import com.dripline.backend.enums.JourneyStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * One lead's progress through one drip campaign.
 * <p>
 * {@code currentStep} is the highest step number whose message was sent (or skipped); 0 means
 * nothing has gone out yet. State changes after creation go through the conditional updates on
 * {@code LeadJourneyRepository}, never through a read-modify-save of this entity.
 */
@Entity
@Table(name = "lead_journeys",
        uniqueConstraints = @UniqueConstraint(name = "uk_lead_journeys_lead_campaign", columnNames = {"lead_id", "campaign_id"}),
        indexes = @Index(name = "idx_lead_journeys_status", columnList = "status"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeadJourney {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lead_id", nullable = false)
    private Long leadId;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Min(0)
    @Column(name = "current_step", nullable = false)
    @Builder.Default
    private Integer currentStep = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    @Builder.Default
    private JourneyStatus status = JourneyStatus.ACTIVE;

    @Column(name = "started_at", nullable = false)
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "last_interaction_at")
    private OffsetDateTime lastInteractionAt;

    @Column(name = "total_sms_sent", nullable = false)
    @Builder.Default
    private Integer totalSmsSent = 0;

    @Column(name = "total_emails_sent", nullable = false)
    @Builder.Default
    private Integer totalEmailsSent = 0;

    @Column(name = "total_delivered", nullable = false)
    @Builder.Default
    private Integer totalDelivered = 0;

    @Column(name = "total_opens", nullable = false)
    @Builder.Default
    private Integer totalOpens = 0;

    @Column(name = "total_clicks", nullable = false)
    @Builder.Default
    private Integer totalClicks = 0;

    @Column(name = "conversion_event", length = 100)
    private String conversionEvent;

    @Column(name = "converted_at")
    private OffsetDateTime convertedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isConverted() {
        return convertedAt != null;
    }
}
