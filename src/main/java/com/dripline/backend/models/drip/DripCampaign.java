package com.dripline.backend.models.drip;

import com.dripline.backend.enums.DeliveryEventType;
import com.dripline.backend.enums.StepFailurePolicy;
import com.dripline.backend.enums.TriggerType;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(name = "drip_campaigns")
public class DripCampaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 255)
    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 32)
    private TriggerType triggerType = TriggerType.LEAD_CAPTURED;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "failure_policy", nullable = false, length = 32)
    private StepFailurePolicy failurePolicy = StepFailurePolicy.FAIL_JOURNEY;

    // Engagement that counts as a conversion for this campaign, if any
    @Enumerated(EnumType.STRING)
    @Column(name = "conversion_trigger", length = 32)
    private DeliveryEventType conversionTrigger;

    @OneToMany(mappedBy = "campaign", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("stepNumber ASC")
    private List<DripStep> steps = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    // Constructors
    public DripCampaign() {}

    public DripCampaign(String name) {
        this.name = name;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
    }

    public TriggerType getTriggerType() {
        return triggerType;
    }

    public void setTriggerType(TriggerType triggerType) {
        this.triggerType = triggerType;
    }

    public StepFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public void setFailurePolicy(StepFailurePolicy failurePolicy) {
        this.failurePolicy = failurePolicy;
    }

    public DeliveryEventType getConversionTrigger() {
        return conversionTrigger;
    }

    public void setConversionTrigger(DeliveryEventType conversionTrigger) {
        this.conversionTrigger = conversionTrigger;
    }

    public List<DripStep> getSteps() {
        return steps;
    }

    public void setSteps(List<DripStep> steps) {
        this.steps = steps;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    // Helper methods
    public void addStep(DripStep step) {
        steps.add(step);
        step.setCampaign(this);
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(isActive);
    }

    public int getStepCount() {
        return steps != null ? steps.size() : 0;
    }

    public Optional<DripStep> findStep(int stepNumber) {
        if (steps == null) {
            return Optional.empty();
        }
        return steps.stream()
                .filter(step -> step.getStepNumber() != null && step.getStepNumber() == stepNumber)
                .findFirst();
    }

    public boolean skipsFailedSteps() {
        return failurePolicy == StepFailurePolicy.SKIP_STEP;
    }

    /**
     * Step numbers must run 1..N without gaps or duplicates.
     *
     * @throws IllegalStateException when the fetched step list is not dense
     */
    public void requireContiguousSteps() {
        List<Integer> numbers = steps == null ? List.of() : steps.stream()
                .map(DripStep::getStepNumber)
                .sorted()
                .toList();

        for (int i = 0; i < numbers.size(); i++) {
            Integer number = numbers.get(i);
            if (number == null || number != i + 1) {
                throw new IllegalStateException("Drip campaign " + id + " has non-contiguous step numbers: " + numbers);
            }
        }
    }

    @Override
    public String toString() {
        return "DripCampaign{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", isActive=" + isActive +
                ", triggerType=" + triggerType +
                ", failurePolicy=" + failurePolicy +
                ", stepCount=" + getStepCount() +
                '}';
    }
}
