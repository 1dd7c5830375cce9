package com.dripline.backend.models.drip;

import com.dripline.backend.enums.Channel;
import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Duration;
import java.time.OffsetDateTime;

@Entity
@Table(name = "drip_steps",
        uniqueConstraints = @UniqueConstraint(name = "uk_drip_steps_campaign_step", columnNames = {"campaign_id", "step_number"}))
public class DripStep {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false)
    private DripCampaign campaign;

    @NotNull
    @Min(1)
    @Column(name = "step_number", nullable = false)
    private Integer stepNumber;

    @NotNull
    @Min(0)
    @Column(name = "delay_minutes", nullable = false)
    private Integer delayMinutes = 0;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 16)
    private Channel channel;

    @Size(max = 255)
    @Column(name = "subject_template")
    private String subjectTemplate;

    @NotBlank
    @Column(name = "body_template", nullable = false, columnDefinition = "TEXT")
    private String bodyTemplate;

    // SendGrid dynamic template sent instead of the rendered body, email steps only
    @Size(max = 64)
    @Column(name = "sendgrid_template_id", length = 64)
    private String sendgridTemplateId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    // Constructors
    public DripStep() {}

    public DripStep(Integer stepNumber, Integer delayMinutes, Channel channel, String bodyTemplate) {
        this.stepNumber = stepNumber;
        this.delayMinutes = delayMinutes;
        this.channel = channel;
        this.bodyTemplate = bodyTemplate;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public DripCampaign getCampaign() {
        return campaign;
    }

    public void setCampaign(DripCampaign campaign) {
        this.campaign = campaign;
    }

    public Integer getStepNumber() {
        return stepNumber;
    }

    public void setStepNumber(Integer stepNumber) {
        this.stepNumber = stepNumber;
    }

    public Integer getDelayMinutes() {
        return delayMinutes;
    }

    public void setDelayMinutes(Integer delayMinutes) {
        this.delayMinutes = delayMinutes;
    }

    public Channel getChannel() {
        return channel;
    }

    public void setChannel(Channel channel) {
        this.channel = channel;
    }

    public String getSubjectTemplate() {
        return subjectTemplate;
    }

    public void setSubjectTemplate(String subjectTemplate) {
        this.subjectTemplate = subjectTemplate;
    }

    public String getBodyTemplate() {
        return bodyTemplate;
    }

    public void setBodyTemplate(String bodyTemplate) {
        this.bodyTemplate = bodyTemplate;
    }

    public String getSendgridTemplateId() {
        return sendgridTemplateId;
    }

    public void setSendgridTemplateId(String sendgridTemplateId) {
        this.sendgridTemplateId = sendgridTemplateId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    // Helper methods
    public Duration getDelay() {
        return Duration.ofMinutes(delayMinutes != null ? delayMinutes : 0);
    }

    public boolean isEmailStep() {
        return channel == Channel.EMAIL;
    }

    public boolean usesSendgridTemplate() {
        return isEmailStep() && sendgridTemplateId != null && !sendgridTemplateId.isBlank();
    }

    @Override
    public String toString() {
        return "DripStep{" +
                "id=" + id +
                ", stepNumber=" + stepNumber +
                ", delayMinutes=" + delayMinutes +
                ", channel=" + channel +
                '}';
    }
}
