package com.dripline.backend.models.drip;

import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.MessageStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * A single scheduled send for one step of one journey. Journey and step are referenced by id only.
 */
@Entity
@Table(name = "drip_messages",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_drip_messages_journey_step", columnNames = {"journey_id", "step_number"}),
                @UniqueConstraint(name = "uk_drip_messages_provider_id", columnNames = {"provider_message_id"})
        },
        indexes = @Index(name = "idx_drip_messages_due", columnList = "channel, status, scheduled_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DripMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "journey_id", nullable = false)
    private Long journeyId;

    @Column(name = "step_id", nullable = false)
    private Long stepId;

    @Min(1)
    @Column(name = "step_number", nullable = false)
    private Integer stepNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 16)
    private Channel channel;

    @Column(name = "recipient", nullable = false)
    private String recipient;

    @Column(name = "subject")
    private String subject;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "template_id", length = 64)
    private String templateId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "template_data")
    private Map<String, String> templateData;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    @Builder.Default
    private MessageStatus status = MessageStatus.PENDING;

    @Column(name = "scheduled_at", nullable = false)
    private OffsetDateTime scheduledAt;

    @Min(0)
    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "provider_message_id")
    private String providerMessageId;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "delivered_at")
    private OffsetDateTime deliveredAt;

    @Column(name = "opened_at")
    private OffsetDateTime openedAt;

    @Column(name = "clicked_at")
    private OffsetDateTime clickedAt;

    @Column(name = "failed_at")
    private OffsetDateTime failedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;
}
